package com.hoa.retention.health;

import com.hoa.retention.store.RecordStore;

import java.time.Duration;

/**
 * Reports whether the record store a sweep would run against is reachable,
 * and how long the connectivity probe took.
 */
public class RecordStoreHealthCheck implements HealthCheck {

    private final RecordStore store;

    public RecordStoreHealthCheck(RecordStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "record-store";
    }

    @Override
    public HealthStatus check() {
        long startNanos = System.nanoTime();
        boolean connected;
        try {
            connected = store.isConnected();
        } catch (RuntimeException e) {
            return HealthStatus.probeFailed(store.getName(), e);
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        return connected
                ? HealthStatus.reachable(store.getName(), latency)
                : HealthStatus.unreachable(store.getName(), latency);
    }
}
