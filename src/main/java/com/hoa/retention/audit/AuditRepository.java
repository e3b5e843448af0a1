package com.hoa.retention.audit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store for the retention audit trail, queried the way operators
 * investigate retention: by action window, by the record or table acted on,
 * and by the most recent run of an action.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    /**
     * Gets entries of {@code action} whose timestamp lies in {@code [from, to]}, oldest first.
     */
    List<AuditEntry> findByAction(AuditAction action, Instant from, Instant to);

    /**
     * Gets every entry about one record id or table name, oldest first.
     */
    List<AuditEntry> findBySubject(String subject);

    List<AuditEntry> findByActorId(String actorId);

    /**
     * Gets the entry of {@code action} with the latest timestamp, e.g. the last completed sweep.
     */
    Optional<AuditEntry> findLatest(AuditAction action);

    int count();
}
