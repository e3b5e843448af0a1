package com.hoa.retention.metrics;

import com.hoa.retention.policy.RecordCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsService} backed by a Micrometer {@link MeterRegistry}.
 *
 * <p>Meters:</p>
 * <ul>
 *   <li>{@code retention.soft_deleted} - Counter (tag: policy)</li>
 *   <li>{@code retention.policy.failures} - Counter (tag: policy)</li>
 *   <li>{@code retention.purged} - Counter (tag: category)</li>
 *   <li>{@code retention.purge.failures} - Counter (tag: category)</li>
 *   <li>{@code retention.sweep.duration} - Timer</li>
 *   <li>{@code retention.sweep.skipped} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer sweepTimer;
    private final Counter sweepSkippedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.sweepTimer = Timer.builder("retention.sweep.duration")
                .description("Duration of retention sweeps")
                .register(registry);
        this.sweepSkippedCounter = Counter.builder("retention.sweep.skipped")
                .description("Number of sweeps skipped because another sweep held the lock")
                .register(registry);
    }

    @Override
    public void recordSoftDeleted(String policyLabel, long count) {
        counter("retention.soft_deleted", "Number of records soft-deleted by sweeps", "policy", policyLabel)
                .increment(count);
    }

    @Override
    public void incrementPolicyFailure(String policyLabel) {
        counter("retention.policy.failures", "Number of policies that failed during a sweep", "policy", policyLabel)
                .increment();
    }

    @Override
    public void recordPurged(RecordCategory category, long count) {
        counter("retention.purged", "Number of records permanently removed", "category", category.name())
                .increment(count);
    }

    @Override
    public void incrementPurgeFailure(RecordCategory category) {
        counter("retention.purge.failures", "Number of failed purge sub-operations", "category", category.name())
                .increment();
    }

    @Override
    public void recordSweepDuration(Duration duration) {
        sweepTimer.record(duration);
    }

    @Override
    public void incrementSweepSkipped() {
        sweepSkippedCounter.increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
