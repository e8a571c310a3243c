package com.kuruswap.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedLocksTest {

    @Test
    @DisplayName("same key is mutually exclusive")
    void sameKeySerialized() throws Exception {
        KeyedLocks<Long> locks = new KeyedLocks<>();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int j = 0; j < 50; j++) {
                    locks.runWithLock(1L, () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        inside.decrementAndGet();
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("different keys do not block each other")
    void differentKeysIndependent() throws Exception {
        KeyedLocks<String> locks = new KeyedLocks<>();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> locks.runWithLock("a", () -> {
            held.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        holder.start();
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        String result = locks.withLock("b", () -> "ran");

        assertThat(result).isEqualTo("ran");
        release.countDown();
        holder.join(5_000);
    }

    @Test
    @DisplayName("lock is reentrant and released after an exception")
    void releasedAfterException() {
        KeyedLocks<Long> locks = new KeyedLocks<>();
        try {
            locks.runWithLock(7L, () -> {
                throw new IllegalStateException("boom");
            });
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("boom");
        }
        assertThat(locks.withLock(7L, () -> locks.withLock(7L, () -> 42))).isEqualTo(42);
    }
}
