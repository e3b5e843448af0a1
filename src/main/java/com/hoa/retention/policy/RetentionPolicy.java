package com.hoa.retention.policy;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the {@link PolicyTable}: how long records of a category (and,
 * optionally, a single status) stay active, and which timestamp their age is
 * measured from.
 *
 * @param category      the record category
 * @param status        the status this entry applies to, or {@code null} for every record of the category
 * @param retentionDays maximum age in days before soft deletion
 * @param ageReference  the timestamp selector used to measure age
 */
public record RetentionPolicy(
        RecordCategory category,
        String status,
        int retentionDays,
        AgeReference ageReference
) {
    public RetentionPolicy {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(ageReference, "ageReference is required");
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must not be negative");
        }
        if (status != null && status.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        if (status != null && !category.hasStatus()) {
            throw new IllegalArgumentException(category + " records have no status");
        }
        // fails fast for selectors the category cannot support
        ageReference.columns(category);
    }

    public static RetentionPolicy forStatus(RecordCategory category, String status, int retentionDays,
                                            AgeReference ageReference) {
        return new RetentionPolicy(category, Objects.requireNonNull(status, "status is required"),
                retentionDays, ageReference);
    }

    public static RetentionPolicy forCategory(RecordCategory category, int retentionDays) {
        return new RetentionPolicy(category, null, retentionDays, AgeReference.CREATED);
    }

    public boolean isCategoryWide() {
        return status == null;
    }

    /**
     * Columns compared against the cutoff, in order of preference.
     */
    public List<String> referenceColumns() {
        return ageReference.columns(category);
    }

    /**
     * Short label used in logs, metrics and sweep reports, e.g. {@code arb_requests[approved]}.
     */
    public String label() {
        return category.table() + "[" + (status == null ? "*" : status) + "]";
    }
}
