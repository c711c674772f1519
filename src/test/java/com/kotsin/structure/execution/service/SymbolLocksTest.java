package com.kotsin.structure.execution.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SymbolLocks")
class SymbolLocksTest {

    @Test
    @DisplayName("Returns the action result and releases the lock")
    void testWithLock_Result() {
        SymbolLocks locks = new SymbolLocks();

        assertEquals("done", locks.withLock("SPY", () -> {
            assertTrue(locks.isLocked("SPY"));
            return "done";
        }));
        assertFalse(locks.isLocked("SPY"));
    }

    @Test
    @DisplayName("Lock is released when the action throws")
    void testWithLock_Exception() {
        SymbolLocks locks = new SymbolLocks();

        assertThrows(IllegalStateException.class, () -> locks.withLock("SPY", () -> {
            throw new IllegalStateException("boom");
        }));
        assertFalse(locks.isLocked("SPY"));
    }

    @Test
    @DisplayName("Same symbol is serialised, other symbols are not blocked")
    void testWithLock_Serialised() throws Exception {
        SymbolLocks locks = new SymbolLocks();
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();

        try {
            Future<?> holder = pool.submit(() -> locks.withLock("SPY", () -> {
                track(concurrent, maxConcurrent);
                entered.countDown();
                await(release);
                concurrent.decrementAndGet();
                return null;
            }));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Future<?> waiter = pool.submit(() -> locks.withLock("SPY", () -> {
                track(concurrent, maxConcurrent);
                concurrent.decrementAndGet();
                return null;
            }));
            Future<String> other = pool.submit(() -> locks.withLock("QQQ", () -> "free"));

            assertEquals("free", other.get(5, TimeUnit.SECONDS));
            assertFalse(waiter.isDone());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            waiter.get(5, TimeUnit.SECONDS);
            assertEquals(1, maxConcurrent.get());
        } finally {
            pool.shutdownNow();
        }
    }

    private static void track(AtomicInteger concurrent, AtomicInteger max) {
        int now = concurrent.incrementAndGet();
        max.accumulateAndGet(now, Math::max);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
