package com.rescontrol.lock;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Named, timeout-bounded mutual exclusion.
 */
public interface LockManager {

    /**
     * Runs {@code action} while holding the exclusive lock on {@code key}.
     *
     * @throws LockTimeoutException if the lock cannot be acquired within {@code timeout};
     *                              {@code action} is not run in that case
     */
    <T> T withLock(String key, Duration timeout, Supplier<T> action);

    default void runWithLock(String key, Duration timeout, Runnable action) {
        withLock(key, timeout, () -> {
            action.run();
            return null;
        });
    }

    static String resourceKey(String tenant, String poolId) {
        return "res:" + tenant + ":" + poolId;
    }
}
