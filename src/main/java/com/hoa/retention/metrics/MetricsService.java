package com.hoa.retention.metrics;

import com.hoa.retention.policy.RecordCategory;

import java.time.Duration;

/**
 * Counters and timings for sweeps and purges. Policies are identified by
 * {@link com.hoa.retention.policy.RetentionPolicy#label()}.
 */
public interface MetricsService {

    void recordSoftDeleted(String policyLabel, long count);

    void incrementPolicyFailure(String policyLabel);

    void recordPurged(RecordCategory category, long count);

    void incrementPurgeFailure(RecordCategory category);

    void recordSweepDuration(Duration duration);

    void incrementSweepSkipped();
}
