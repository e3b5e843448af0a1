package com.hoa.retention.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered set of retention policies. The single source of truth for
 * which records a sweep visits and how their age is measured.
 *
 * <p>Each category is covered either by one category-wide entry or by
 * per-status entries, never both, so every record matches at most one policy.</p>
 */
public final class PolicyTable {

    /** Seven years, kept for decided requests and audit entries (legal/audit). */
    public static final int SEVEN_YEARS_DAYS = 7 * 365;

    /** One year, for requests that never reached a decision. */
    public static final int ONE_YEAR_DAYS = 365;

    public static final String APPROVED = "approved";
    public static final String REJECTED = "rejected";
    public static final String CANCELLED = "cancelled";
    public static final String PENDING = "pending";
    public static final String IN_REVIEW = "in_review";

    private final List<RetentionPolicy> policies;

    private PolicyTable(List<RetentionPolicy> policies) {
        validate(policies);
        this.policies = List.copyOf(policies);
    }

    /**
     * The portal's standard table.
     * <ul>
     *   <li>approved / rejected requests: 7 years from decision (or creation)</li>
     *   <li>cancelled / pending / in_review requests: 1 year from creation</li>
     *   <li>audit log entries: 7 years from creation</li>
     * </ul>
     */
    public static PolicyTable defaults() {
        return builder()
                .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, APPROVED, SEVEN_YEARS_DAYS,
                        AgeReference.DECIDED_OR_CREATED))
                .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, REJECTED, SEVEN_YEARS_DAYS,
                        AgeReference.DECIDED_OR_CREATED))
                .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, CANCELLED, ONE_YEAR_DAYS,
                        AgeReference.CREATED))
                .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, PENDING, ONE_YEAR_DAYS,
                        AgeReference.CREATED))
                .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, IN_REVIEW, ONE_YEAR_DAYS,
                        AgeReference.CREATED))
                .add(RetentionPolicy.forCategory(RecordCategory.AUDIT_LOG, SEVEN_YEARS_DAYS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<RetentionPolicy> policies() {
        return policies;
    }

    public int size() {
        return policies.size();
    }

    /**
     * Finds the policy governing records of {@code category} with {@code status}:
     * the status-specific entry if present, else the category-wide entry.
     */
    public Optional<RetentionPolicy> find(RecordCategory category, String status) {
        RetentionPolicy categoryWide = null;
        for (RetentionPolicy policy : policies) {
            if (policy.category() != category) {
                continue;
            }
            if (policy.isCategoryWide()) {
                categoryWide = policy;
            } else if (policy.status().equals(status)) {
                return Optional.of(policy);
            }
        }
        return Optional.ofNullable(categoryWide);
    }

    public List<RetentionPolicy> forCategory(RecordCategory category) {
        return policies.stream().filter(p -> p.category() == category).toList();
    }

    private static void validate(List<RetentionPolicy> policies) {
        Set<String> keys = new HashSet<>();
        Set<RecordCategory> categoryWide = new HashSet<>();
        Set<RecordCategory> statusSpecific = new HashSet<>();
        for (RetentionPolicy policy : policies) {
            Objects.requireNonNull(policy, "policy must not be null");
            if (!keys.add(policy.label())) {
                throw new IllegalArgumentException("Duplicate retention policy for " + policy.label());
            }
            (policy.isCategoryWide() ? categoryWide : statusSpecific).add(policy.category());
        }
        Set<RecordCategory> overlap = new HashSet<>(categoryWide);
        overlap.retainAll(statusSpecific);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException(
                    "Categories mix category-wide and per-status policies: " + overlap);
        }
    }

    @Override
    public String toString() {
        return "PolicyTable" + policies.stream().map(RetentionPolicy::label).toList();
    }

    public static class Builder {
        private final List<RetentionPolicy> policies = new ArrayList<>();

        public Builder add(RetentionPolicy policy) {
            policies.add(policy);
            return this;
        }

        public Builder addAll(List<RetentionPolicy> policies) {
            this.policies.addAll(policies);
            return this;
        }

        public PolicyTable build() {
            return new PolicyTable(Collections.unmodifiableList(policies));
        }
    }
}
