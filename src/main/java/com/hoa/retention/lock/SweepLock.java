package com.hoa.retention.lock;

/**
 * Advisory lock that keeps retention runs sharing a key from overlapping.
 * Holding it is optional for correctness; it only keeps reported counts exact.
 */
public interface SweepLock {

    /**
     * Attempts to acquire the lock for {@code key}.
     *
     * @return true if acquired, false if another run holds it past the configured wait
     */
    boolean tryAcquire(String key);

    /**
     * Releases the lock for {@code key} if the current thread holds it.
     */
    void release(String key);
}
