package com.kuruswap.common;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per key (user id, wallet address). Locks are weakly held, so keys that are no longer
 * in use are reclaimed; a lock held by a running thread stays reachable.
 */
public class KeyedLocks<K> {

    private final LoadingCache<K, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public <T> T withLock(K key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(K key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }
}
