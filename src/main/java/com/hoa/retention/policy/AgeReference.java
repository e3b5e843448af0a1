package com.hoa.retention.policy;

import java.util.List;

/**
 * Selects the timestamp a policy measures a record's age from.
 */
public enum AgeReference {
    /** Age from creation time. */
    CREATED {
        @Override
        public List<String> columns(RecordCategory category) {
            return List.of(category.createdColumn());
        }
    },
    /** Age from the decision time when one is recorded, otherwise from creation time. */
    DECIDED_OR_CREATED {
        @Override
        public List<String> columns(RecordCategory category) {
            if (!category.hasDecision()) {
                throw new IllegalArgumentException(category + " records have no decision timestamp");
            }
            return List.of(category.decidedColumn(), category.createdColumn());
        }
    };

    /**
     * Returns the columns to compare, in order of preference. The first non-null value wins.
     *
     * @throws IllegalArgumentException if the category lacks a required column
     */
    public abstract List<String> columns(RecordCategory category);
}
