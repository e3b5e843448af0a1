package com.hoa.retention.lifecycle;

import com.hoa.retention.metrics.MetricsService;
import com.hoa.retention.policy.CutoffCalculator;
import com.hoa.retention.policy.PolicyTable;
import com.hoa.retention.policy.RetentionPolicy;
import com.hoa.retention.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies every policy of a {@link PolicyTable} in order.
 *
 * <p>Policies are isolated from each other: a failing policy is logged,
 * counted and reported in its {@link PolicyOutcome}, and the sweep moves on.
 * Nothing is rolled back across policies. {@link #run(Instant)} does not throw
 * for store failures, including a store that is down before the first policy.</p>
 */
public class RetentionSweep {
    private static final Logger log = LoggerFactory.getLogger(RetentionSweep.class);

    private final PolicyTable policyTable;
    private final SoftDeleteExecutor executor;
    private final CutoffCalculator cutoffCalculator;
    private final RecordStore store;
    private final MetricsService metrics;

    public RetentionSweep(PolicyTable policyTable, SoftDeleteExecutor executor,
                          CutoffCalculator cutoffCalculator, RecordStore store, MetricsService metrics) {
        this.policyTable = Objects.requireNonNull(policyTable, "policyTable is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.cutoffCalculator = Objects.requireNonNull(cutoffCalculator, "cutoffCalculator is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public SweepResult run(Instant now) {
        Objects.requireNonNull(now, "now is required");
        List<RetentionPolicy> policies = policyTable.policies();

        if (!storeReachable()) {
            log.error("retention.storeUnavailable store={} policies={}", store.getName(), policies.size());
            List<PolicyOutcome> outcomes = new ArrayList<>();
            for (RetentionPolicy policy : policies) {
                outcomes.add(PolicyOutcome.failed(policy.label(), null, "store unavailable"));
                metrics.incrementPolicyFailure(policy.label());
            }
            return SweepResult.of(outcomes);
        }

        List<PolicyOutcome> outcomes = new ArrayList<>(policies.size());
        for (RetentionPolicy policy : policies) {
            outcomes.add(apply(policy, now));
        }
        return SweepResult.of(outcomes);
    }

    private PolicyOutcome apply(RetentionPolicy policy, Instant now) {
        Instant cutoff = null;
        try {
            cutoff = cutoffCalculator.cutoff(now, policy);
            long deleted = executor.markExpired(policy, cutoff, now);
            metrics.recordSoftDeleted(policy.label(), deleted);
            log.info("retention.policyApplied policy={} cutoff={} deleted={}", policy.label(), cutoff, deleted);
            return PolicyOutcome.succeeded(policy.label(), cutoff, deleted);
        } catch (RuntimeException e) {
            metrics.incrementPolicyFailure(policy.label());
            log.error("retention.policyFailed policy={} cutoff={} error={}",
                    policy.label(), cutoff, e.getMessage(), e);
            return PolicyOutcome.failed(policy.label(), cutoff, describe(e));
        }
    }

    private boolean storeReachable() {
        try {
            return store.isConnected();
        } catch (RuntimeException e) {
            log.warn("retention.connectivityCheckFailed store={} error={}", store.getName(), e.getMessage());
            return false;
        }
    }

    static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }
}
