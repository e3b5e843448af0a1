package com.hoa.retention.lock;

/**
 * Lock that always succeeds. Overlapping runs are then safe but may double-report counts.
 */
public class NoOpSweepLock implements SweepLock {

    @Override
    public boolean tryAcquire(String key) {
        return true;
    }

    @Override
    public void release(String key) {
        // no-op
    }
}
