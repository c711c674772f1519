package com.kotsin.structure.source;

import com.kotsin.structure.options.model.OptionChainSnapshot;
import com.kotsin.structure.wyckoff.model.OhlcvBar;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the data the ingestion jobs maintain.
 *
 * Implementations throw {@link com.kotsin.structure.exception.SystemicException}
 * when the store cannot be reached at all.
 */
public interface MarketDataSource {

    /**
     * Symbols of the active universe, used when a batch names none.
     */
    List<String> activeSymbols();

    /**
     * Daily bars with {@code from <= date <= to}, in the order the store returns them.
     */
    List<OhlcvBar> loadBars(String symbol, LocalDate from, LocalDate to);

    /**
     * Option chain at the latest options time not after {@code snapshotTime}.
     * Returns an empty snapshot (null options time) when there is none.
     */
    OptionChainSnapshot loadOptionChain(String symbol, Instant snapshotTime, LocalDate tradingDate);

    /**
     * Upstream price metrics of the snapshot record, empty when absent.
     */
    Map<String, Object> loadPriceMetrics(String symbol, Instant snapshotTime);

    /**
     * Latest options time across all symbols, used when a batch gives no snapshot time.
     */
    Optional<Instant> latestOptionsTime();
}
