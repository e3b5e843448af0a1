package com.hoa.retention.lifecycle;

import java.time.Instant;

/**
 * Result of applying one policy during a sweep.
 *
 * @param policy  the policy label, e.g. {@code arb_requests[approved]}
 * @param cutoff  the cutoff the policy was applied with, or {@code null} if it was never computed
 * @param deleted records transitioned to soft-deleted (0 on failure)
 * @param error   failure description, or {@code null} on success
 */
public record PolicyOutcome(String policy, Instant cutoff, long deleted, String error) {

    public static PolicyOutcome succeeded(String policy, Instant cutoff, long deleted) {
        return new PolicyOutcome(policy, cutoff, deleted, null);
    }

    public static PolicyOutcome failed(String policy, Instant cutoff, String error) {
        return new PolicyOutcome(policy, cutoff, 0, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
