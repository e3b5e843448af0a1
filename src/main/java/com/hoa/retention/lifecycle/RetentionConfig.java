package com.hoa.retention.lifecycle;

import com.hoa.retention.policy.PolicyTable;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Settings for the retention engine and its scheduler.
 *
 * @param zone                  zone used for calendar-day cutoff arithmetic
 * @param gracePeriodDays       how long soft-deleted records stay recoverable before purge
 * @param auditLogRetentionDays retention used by the standalone audit log sweep
 * @param sweepInterval         time between scheduled sweeps
 * @param initialDelay          delay before the first scheduled sweep
 * @param purgeEnabled          whether the scheduler purges after each sweep
 * @param lockEnabled           whether overlapping runs are serialized in-process
 * @param lockTimeoutMs         how long a run waits for the lock before being skipped
 */
public record RetentionConfig(
        ZoneId zone,
        int gracePeriodDays,
        int auditLogRetentionDays,
        Duration sweepInterval,
        Duration initialDelay,
        boolean purgeEnabled,
        boolean lockEnabled,
        long lockTimeoutMs
) {
    public RetentionConfig {
        Objects.requireNonNull(zone, "zone is required");
        Objects.requireNonNull(sweepInterval, "sweepInterval is required");
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        if (gracePeriodDays < 0) {
            throw new IllegalArgumentException("gracePeriodDays must not be negative");
        }
        if (auditLogRetentionDays < 0) {
            throw new IllegalArgumentException("auditLogRetentionDays must not be negative");
        }
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (lockTimeoutMs < 0) {
            throw new IllegalArgumentException("lockTimeoutMs must not be negative");
        }
    }

    /**
     * Defaults: UTC, 30-day grace, 7-year audit log retention, daily sweep after
     * 5 minutes, purge disabled, in-process lock with a 1s wait.
     */
    public static RetentionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ZoneId zone = ZoneOffset.UTC;
        private int gracePeriodDays = PurgeExecutor.DEFAULT_GRACE_PERIOD_DAYS;
        private int auditLogRetentionDays = PolicyTable.SEVEN_YEARS_DAYS;
        private Duration sweepInterval = Duration.ofHours(24);
        private Duration initialDelay = Duration.ofMinutes(5);
        private boolean purgeEnabled = false;
        private boolean lockEnabled = true;
        private long lockTimeoutMs = 1000;

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder gracePeriodDays(int days) {
            this.gracePeriodDays = days;
            return this;
        }

        public Builder auditLogRetentionDays(int days) {
            this.auditLogRetentionDays = days;
            return this;
        }

        public Builder sweepInterval(Duration interval) {
            this.sweepInterval = interval;
            return this;
        }

        public Builder initialDelay(Duration delay) {
            this.initialDelay = delay;
            return this;
        }

        public Builder purgeEnabled(boolean enabled) {
            this.purgeEnabled = enabled;
            return this;
        }

        public Builder lockEnabled(boolean enabled) {
            this.lockEnabled = enabled;
            return this;
        }

        public Builder lockTimeoutMs(long timeoutMs) {
            this.lockTimeoutMs = timeoutMs;
            return this;
        }

        public RetentionConfig build() {
            return new RetentionConfig(zone, gracePeriodDays, auditLogRetentionDays, sweepInterval,
                    initialDelay, purgeEnabled, lockEnabled, lockTimeoutMs);
        }
    }
}
