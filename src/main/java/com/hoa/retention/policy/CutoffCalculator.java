package com.hoa.retention.policy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Computes retention cutoffs with calendar arithmetic in a fixed zone, so a
 * retention of N days lands on the same local time N calendar days earlier,
 * across month, year and daylight-saving boundaries.
 */
public final class CutoffCalculator {

    private final ZoneId zone;

    public CutoffCalculator() {
        this(ZoneOffset.UTC);
    }

    public CutoffCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    /**
     * Returns {@code now} minus {@code days} calendar days.
     *
     * @throws IllegalArgumentException if {@code days} is negative
     */
    public Instant cutoff(Instant now, int days) {
        Objects.requireNonNull(now, "now is required");
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative");
        }
        return now.atZone(zone).minusDays(days).toInstant();
    }

    /**
     * Cutoff for a policy's retention period.
     */
    public Instant cutoff(Instant now, RetentionPolicy policy) {
        return cutoff(now, policy.retentionDays());
    }

    public ZoneId zone() {
        return zone;
    }
}
