package com.kotsin.structure.execution.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-symbol lock around the read-compute-write of regime state, so two
 * overlapping invocations for one symbol cannot lose an update.
 */
@Component
public class SymbolLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(symbol, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for lock on " + symbol, e);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    boolean isLocked(String symbol) {
        ReentrantLock lock = locks.get(symbol);
        return lock != null && lock.isLocked();
    }
}
