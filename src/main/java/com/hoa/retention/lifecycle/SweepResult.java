package com.hoa.retention.lifecycle;

import java.util.List;

/**
 * Summary of a retention sweep.
 *
 * @param totalDeleted records soft-deleted across all policies
 * @param errorCount   number of policies that failed
 * @param outcomes     per-policy results, in policy-table order
 * @param skipped      true when the sweep did not run because another sweep held the lock
 */
public record SweepResult(long totalDeleted, int errorCount, List<PolicyOutcome> outcomes, boolean skipped) {

    public SweepResult {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public static SweepResult of(List<PolicyOutcome> outcomes) {
        long deleted = 0;
        int errors = 0;
        for (PolicyOutcome outcome : outcomes) {
            deleted += outcome.deleted();
            if (!outcome.succeeded()) {
                errors++;
            }
        }
        return new SweepResult(deleted, errors, outcomes, false);
    }

    public static SweepResult skippedRun() {
        return new SweepResult(0, 0, List.of(), true);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    @Override
    public String toString() {
        return "SweepResult{deleted=" + totalDeleted +
                ", errors=" + errorCount +
                ", policies=" + outcomes.size() +
                (skipped ? ", skipped" : "") + '}';
    }
}
