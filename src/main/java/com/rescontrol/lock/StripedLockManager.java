package com.rescontrol.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantLock} per key. Keys are pool identities, so the map stays bounded by
 * the catalog size and locks are never evicted.
 */
@Component
public class StripedLockManager implements LockManager {

    private static final Logger log = LoggerFactory.getLogger(StripedLockManager.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(String key, Duration timeout, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, ex);
        }
        if (!acquired) {
            log.warn("Lock {} not acquired within {}ms", key, timeout.toMillis());
            throw new LockTimeoutException(key, timeout);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return locks.size();
    }
}
