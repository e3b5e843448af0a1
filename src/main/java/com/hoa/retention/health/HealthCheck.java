package com.hoa.retention.health;

/**
 * A named check of one component the retention engine depends on.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
