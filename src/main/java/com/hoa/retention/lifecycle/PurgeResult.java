package com.hoa.retention.lifecycle;

import com.hoa.retention.policy.RecordCategory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Summary of a purge run. Each category is purged independently, so counts
 * and failures are reported per category.
 *
 * @param purged rows removed per category; failed categories report 0
 * @param failed categories whose purge failed
 */
public record PurgeResult(Map<RecordCategory, Long> purged, Set<RecordCategory> failed) {

    public PurgeResult {
        purged = purged.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(purged));
        failed = failed.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(failed));
    }

    public long requestsPurged() {
        return purgedFor(RecordCategory.ARB_REQUEST);
    }

    public long auditLogsPurged() {
        return purgedFor(RecordCategory.AUDIT_LOG);
    }

    public long purgedFor(RecordCategory category) {
        return purged.getOrDefault(category, 0L);
    }

    public long totalPurged() {
        return purged.values().stream().mapToLong(Long::longValue).sum();
    }

    public int errorCount() {
        return failed.size();
    }

    public boolean hasFailed(RecordCategory category) {
        return failed.contains(category);
    }

    @Override
    public String toString() {
        return "PurgeResult{requests=" + requestsPurged() +
                ", auditLogs=" + auditLogsPurged() +
                ", errors=" + errorCount() + '}';
    }
}
