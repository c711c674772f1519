package com.kotsin.structure.execution.service;

import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.options.model.OptionChainSnapshot;
import com.kotsin.structure.options.model.OptionContract;
import com.kotsin.structure.source.MarketDataSource;
import com.kotsin.structure.wyckoff.model.OhlcvBar;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Market data held in maps. Symbols can be marked to fail, to fail systemically or to hang.
 */
class InMemoryMarketDataSource implements MarketDataSource {

    final AtomicInteger reads = new AtomicInteger();

    private final Map<String, List<OhlcvBar>> bars = new HashMap<>();
    private final Map<String, List<OptionContract>> chains = new HashMap<>();
    private final Map<String, Map<String, Object>> priceMetrics = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final Set<String> unreachable = new HashSet<>();
    private final Set<String> hanging = new HashSet<>();
    private Instant latestOptionsTime;

    InMemoryMarketDataSource withSymbol(String symbol, List<OhlcvBar> history, List<OptionContract> contracts, double spot) {
        bars.put(symbol, history);
        chains.put(symbol, contracts);
        priceMetrics.put(symbol, Map.of("close", spot));
        return this;
    }

    InMemoryMarketDataSource failing(String symbol) {
        failing.add(symbol);
        return this;
    }

    InMemoryMarketDataSource unreachable(String symbol) {
        unreachable.add(symbol);
        return this;
    }

    InMemoryMarketDataSource hanging(String symbol) {
        hanging.add(symbol);
        return this;
    }

    InMemoryMarketDataSource latestOptionsTime(Instant time) {
        latestOptionsTime = time;
        return this;
    }

    @Override
    public List<String> activeSymbols() {
        reads.incrementAndGet();
        return new ArrayList<>(bars.keySet());
    }

    @Override
    public List<OhlcvBar> loadBars(String symbol, LocalDate from, LocalDate to) {
        reads.incrementAndGet();
        if (failing.contains(symbol)) {
            throw new IllegalStateException("corrupt ohlcv rows for " + symbol);
        }
        if (unreachable.contains(symbol)) {
            throw new SystemicException("Market data store unreachable during loadBars:" + symbol, null);
        }
        if (hanging.contains(symbol)) {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
        }
        List<OhlcvBar> result = new ArrayList<>();
        for (OhlcvBar bar : bars.getOrDefault(symbol, List.of())) {
            if (!bar.getDate().isBefore(from) && !bar.getDate().isAfter(to)) {
                result.add(bar);
            }
        }
        return result;
    }

    @Override
    public OptionChainSnapshot loadOptionChain(String symbol, Instant snapshotTime, LocalDate tradingDate) {
        reads.incrementAndGet();
        List<OptionContract> contracts = chains.getOrDefault(symbol, List.of());
        if (contracts.isEmpty()) {
            return OptionChainSnapshot.empty(symbol, snapshotTime, tradingDate);
        }
        return OptionChainSnapshot.builder()
                .symbol(symbol)
                .snapshotTime(snapshotTime)
                .optionsTime(snapshotTime)
                .tradingDate(tradingDate)
                .contracts(contracts)
                .ivRank(40.0)
                .build();
    }

    @Override
    public Map<String, Object> loadPriceMetrics(String symbol, Instant snapshotTime) {
        reads.incrementAndGet();
        return priceMetrics.getOrDefault(symbol, Map.of());
    }

    @Override
    public Optional<Instant> latestOptionsTime() {
        reads.incrementAndGet();
        return Optional.ofNullable(latestOptionsTime);
    }
}
