package com.hoa.retention.audit;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Audit trail held in memory, partitioned by {@link AuditAction}. Entries are lost on restart.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private static final Comparator<AuditEntry> BY_TIMESTAMP = Comparator.comparing(AuditEntry::timestamp);

    private final Map<AuditAction, List<AuditEntry>> byAction = new EnumMap<>(AuditAction.class);

    public InMemoryAuditRepository() {
        for (AuditAction action : AuditAction.values()) {
            byAction.put(action, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        byAction.get(entry.action()).add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return all().sorted(BY_TIMESTAMP).toList();
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action, Instant from, Instant to) {
        return byAction.get(action).stream()
                .filter(e -> !e.timestamp().isBefore(from) && !e.timestamp().isAfter(to))
                .sorted(BY_TIMESTAMP)
                .toList();
    }

    @Override
    public List<AuditEntry> findBySubject(String subject) {
        return all().filter(e -> subject.equals(e.subject())).sorted(BY_TIMESTAMP).toList();
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return all().filter(e -> actorId.equals(e.actorId())).sorted(BY_TIMESTAMP).toList();
    }

    @Override
    public Optional<AuditEntry> findLatest(AuditAction action) {
        return byAction.get(action).stream().max(BY_TIMESTAMP);
    }

    @Override
    public int count() {
        return byAction.values().stream().mapToInt(List::size).sum();
    }

    private Stream<AuditEntry> all() {
        return byAction.values().stream().flatMap(List::stream);
    }
}
