package com.hoa.retention.metrics;

import com.hoa.retention.policy.RecordCategory;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSoftDeleted(String policyLabel, long count) {
    }

    @Override
    public void incrementPolicyFailure(String policyLabel) {
    }

    @Override
    public void recordPurged(RecordCategory category, long count) {
    }

    @Override
    public void incrementPurgeFailure(RecordCategory category) {
    }

    @Override
    public void recordSweepDuration(Duration duration) {
    }

    @Override
    public void incrementSweepSkipped() {
    }
}
