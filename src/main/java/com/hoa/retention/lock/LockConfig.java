package com.hoa.retention.lock;

/**
 * Configuration for {@link LocalSweepLock}.
 *
 * @param timeoutMs maximum time to wait for the lock before giving up on the run
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
    }

    /**
     * Default configuration: wait up to 1s.
     */
    public static LockConfig defaults() {
        return new LockConfig(1000);
    }
}
