package com.hoa.retention.policy;

/**
 * Record categories subject to staged deletion, with the table and columns
 * each one is stored under.
 */
public enum RecordCategory {
    /** Architectural-review requests. Decision time is the e-signature timestamp. */
    ARB_REQUEST("arb_requests", "status", "created", "esign_timestamp"),
    /** ARB audit log entries. No status and no decision time. */
    AUDIT_LOG("arb_audit_log", null, "created", null);

    public static final String ID_COLUMN = "id";
    public static final String DELETED_AT_COLUMN = "deleted_at";

    private final String table;
    private final String statusColumn;
    private final String createdColumn;
    private final String decidedColumn;

    RecordCategory(String table, String statusColumn, String createdColumn, String decidedColumn) {
        this.table = table;
        this.statusColumn = statusColumn;
        this.createdColumn = createdColumn;
        this.decidedColumn = decidedColumn;
    }

    public String table() {
        return table;
    }

    /**
     * Column holding the category's status, or {@code null} when the category has none.
     */
    public String statusColumn() {
        return statusColumn;
    }

    public String createdColumn() {
        return createdColumn;
    }

    /**
     * Column holding the decision timestamp, or {@code null} when the category has none.
     */
    public String decidedColumn() {
        return decidedColumn;
    }

    public boolean hasStatus() {
        return statusColumn != null;
    }

    public boolean hasDecision() {
        return decidedColumn != null;
    }
}
