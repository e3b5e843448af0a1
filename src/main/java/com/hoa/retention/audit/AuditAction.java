package com.hoa.retention.audit;

/**
 * Retention operations recorded in the audit trail.
 */
public enum AuditAction {
    RETENTION_SWEEP,
    RETENTION_SWEEP_SKIPPED,
    AUDIT_LOG_SWEEP,
    RECORD_SOFT_DELETED,
    RECORDS_PURGED
}
