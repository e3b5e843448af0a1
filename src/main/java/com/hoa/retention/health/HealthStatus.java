package com.hoa.retention.health;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of probing the record store a sweep would run against.
 *
 * @param status    whether sweeps can currently reach the store
 * @param store     the probed store's name
 * @param message   human-readable reason, {@code OK} when up
 * @param latency   how long the probe took; {@link Duration#ZERO} when it threw before timing
 * @param errorType simple class name of the probe failure, or {@code null}
 */
public record HealthStatus(Status status, String store, String message, Duration latency, String errorType) {

    public enum Status { UP, DOWN }

    public HealthStatus {
        Objects.requireNonNull(status, "status is required");
        latency = latency != null ? latency : Duration.ZERO;
    }

    public static HealthStatus reachable(String store, Duration latency) {
        return new HealthStatus(Status.UP, store, "OK", latency, null);
    }

    public static HealthStatus unreachable(String store, Duration latency) {
        return new HealthStatus(Status.DOWN, store, "Record store unreachable", latency, null);
    }

    public static HealthStatus probeFailed(String store, RuntimeException cause) {
        return new HealthStatus(Status.DOWN, store, "Record store check failed: " + cause.getMessage(),
                Duration.ZERO, cause.getClass().getSimpleName());
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
