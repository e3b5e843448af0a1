package com.hoa.retention.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Records retention operations in an append-only audit trail.
 * Audit failures are logged and never fail the retention operation being recorded.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
    }

    public AuditEntry record(AuditAction action, String subject, String actorId,
                             Map<String, Object> details, Instant timestamp) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .subject(subject)
                .actorId(actorId)
                .details(details)
                .timestamp(timestamp)
                .build();
        try {
            repository.save(entry);
            log.debug("audit.recorded action={} subject={} actor={}", action, subject, actorId);
        } catch (RuntimeException e) {
            log.warn("audit.recordFailed action={} subject={} error={}", action, subject, e.getMessage(), e);
        }
        return entry;
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action, Instant.MIN, Instant.MAX);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action, Instant from, Instant to) {
        return repository.findByAction(action, from, to);
    }

    /**
     * Gets the history of one record id or table, oldest first.
     */
    public List<AuditEntry> getEntriesBySubject(String subject) {
        return repository.findBySubject(subject);
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return repository.findByActorId(actorId);
    }

    public Optional<AuditEntry> getLastEntry(AuditAction action) {
        return repository.findLatest(action);
    }

    public int size() {
        return repository.count();
    }
}
