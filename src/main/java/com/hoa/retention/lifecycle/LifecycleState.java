package com.hoa.retention.lifecycle;

/**
 * Retention lifecycle of a record. Transitions only move forward:
 * {@code ACTIVE -> SOFT_DELETED -> PURGED}.
 */
public enum LifecycleState {
    /** {@code deleted_at} is null. */
    ACTIVE,
    /** {@code deleted_at} is set; data is retained. */
    SOFT_DELETED,
    /** The row no longer exists. */
    PURGED;

    public boolean isTerminal() {
        return this == PURGED;
    }

    /**
     * Whether a single retention step may move a record from this state to {@code next}.
     */
    public boolean canTransitionTo(LifecycleState next) {
        return next.ordinal() == ordinal() + 1;
    }
}
