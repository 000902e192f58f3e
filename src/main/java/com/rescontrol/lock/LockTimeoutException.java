package com.rescontrol.lock;

import java.time.Duration;

/**
 * Raised when a lock could not be acquired in time. No state was mutated, so the
 * caller may retry the whole operation.
 */
public class LockTimeoutException extends RuntimeException {

    private final String key;

    public LockTimeoutException(String key, Duration timeout) {
        super("timed out after " + timeout.toMillis() + "ms waiting for lock " + key);
        this.key = key;
    }

    public LockTimeoutException(String key, Throwable cause) {
        super("interrupted while waiting for lock " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
