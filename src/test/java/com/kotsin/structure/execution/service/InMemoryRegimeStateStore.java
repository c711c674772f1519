package com.kotsin.structure.execution.service;

import com.kotsin.structure.persistence.RegimeStateStore;
import com.kotsin.structure.wyckoff.model.RegimeState;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

class InMemoryRegimeStateStore implements RegimeStateStore {

    final Map<String, TreeMap<LocalDate, RegimeState>> versions = new ConcurrentHashMap<>();
    final AtomicInteger writes = new AtomicInteger();

    @Override
    public Optional<RegimeState> findLatestBefore(String symbol, LocalDate date) {
        TreeMap<LocalDate, RegimeState> byDate = versions.get(symbol);
        if (byDate == null) {
            return Optional.empty();
        }
        synchronized (byDate) {
            Map.Entry<LocalDate, RegimeState> entry = byDate.lowerEntry(date);
            return entry == null ? Optional.empty() : Optional.of(entry.getValue());
        }
    }

    @Override
    public void save(RegimeState state) {
        writes.incrementAndGet();
        TreeMap<LocalDate, RegimeState> byDate = versions.computeIfAbsent(state.getSymbol(), k -> new TreeMap<>());
        synchronized (byDate) {
            byDate.put(state.getAsOf(), state);
        }
    }

    int versionCount(String symbol) {
        TreeMap<LocalDate, RegimeState> byDate = versions.get(symbol);
        return byDate == null ? 0 : byDate.size();
    }
}
