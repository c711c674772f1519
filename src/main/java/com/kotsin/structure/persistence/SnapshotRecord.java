package com.kotsin.structure.persistence;

import com.kotsin.structure.dealer.model.DealerMetrics;
import com.kotsin.structure.wyckoff.model.RegimeState;
import com.kotsin.structure.wyckoff.model.WyckoffEvent;
import com.kotsin.structure.wyckoff.model.WyckoffSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The fields this service owns in the per-(symbol, time) snapshot document.
 *
 * Sibling fields written by other jobs (technical indicators, price metrics)
 * are not part of this value and are never touched. No wall-clock fields: two
 * executions over the same inputs produce equal records.
 */
@Value
@Builder
public class SnapshotRecord {

    String symbol;

    Instant time;

    LocalDate tradingDate;

    DealerMetrics dealerMetrics;

    /**
     * Events emitted by this detector pass, in date order
     */
    List<WyckoffEvent> wyckoffEvents;

    RegimeState regimeState;

    WyckoffSummary wyckoffSummary;

    String modelVersion;
}
