package com.kotsin.structure.options.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Option chain of one symbol at the latest options time not after the snapshot time.
 */
@Value
@Builder
public class OptionChainSnapshot {

    String symbol;

    /**
     * Snapshot time the chain was requested for
     */
    Instant snapshotTime;

    /**
     * Time of the options rows actually used; null when no chain exists at or before the snapshot
     */
    Instant optionsTime;

    /**
     * Trading date DTE is measured from
     */
    LocalDate tradingDate;

    @Singular
    List<OptionContract> contracts;

    /**
     * 0..100, null when unknown
     */
    Double ivRank;

    public static OptionChainSnapshot empty(String symbol, Instant snapshotTime, LocalDate tradingDate) {
        return OptionChainSnapshot.builder()
                .symbol(symbol)
                .snapshotTime(snapshotTime)
                .tradingDate(tradingDate)
                .build();
    }

    public boolean isEmpty() {
        return contracts == null || contracts.isEmpty();
    }
}
