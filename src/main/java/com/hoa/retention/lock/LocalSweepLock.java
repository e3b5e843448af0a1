package com.hoa.retention.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process sweep lock using one {@link ReentrantLock} per key.
 * Serializes runs within a single JVM only.
 */
public class LocalSweepLock implements SweepLock {
    private static final Logger log = LoggerFactory.getLogger(LocalSweepLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalSweepLock() {
        this(LockConfig.defaults());
    }

    public LocalSweepLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryAcquire(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (acquired) {
                log.debug("lock.acquired key={}", key);
            } else {
                log.info("lock.busy key={} waitedMs={}", key, config.timeoutMs());
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("lock.interrupted key={}", key);
            return false;
        }
    }

    @Override
    public void release(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("lock.released key={}", key);
        }
    }
}
