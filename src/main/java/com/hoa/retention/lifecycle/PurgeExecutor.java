package com.hoa.retention.lifecycle;

import com.hoa.retention.metrics.MetricsService;
import com.hoa.retention.policy.CutoffCalculator;
import com.hoa.retention.policy.RecordCategory;
import com.hoa.retention.store.RecordFilter;
import com.hoa.retention.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Permanently removes records that have been soft-deleted for longer than a
 * grace period. Irreversible.
 *
 * <p>Each category is purged by its own statement; a failure in one category
 * is logged and reported without stopping the others. Rows still active, or
 * soft-deleted within the grace period, never match.</p>
 */
public class PurgeExecutor {
    private static final Logger log = LoggerFactory.getLogger(PurgeExecutor.class);

    public static final int DEFAULT_GRACE_PERIOD_DAYS = 30;

    private final RecordStore store;
    private final CutoffCalculator cutoffCalculator;
    private final MetricsService metrics;

    public PurgeExecutor(RecordStore store, CutoffCalculator cutoffCalculator, MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.cutoffCalculator = Objects.requireNonNull(cutoffCalculator, "cutoffCalculator is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Removes every record whose {@code deleted_at} is strictly before {@code now - gracePeriodDays}.
     *
     * @throws IllegalArgumentException if {@code gracePeriodDays} is negative
     */
    public PurgeResult purge(Instant now, int gracePeriodDays) {
        Instant cutoff = cutoffCalculator.cutoff(now, gracePeriodDays);

        Map<RecordCategory, Long> purged = new EnumMap<>(RecordCategory.class);
        Set<RecordCategory> failed = EnumSet.noneOf(RecordCategory.class);
        for (RecordCategory category : RecordCategory.values()) {
            try {
                long removed = purgeCategory(category, cutoff);
                purged.put(category, removed);
                metrics.recordPurged(category, removed);
                log.info("retention.purged category={} cutoff={} count={}", category, cutoff, removed);
            } catch (RuntimeException e) {
                purged.put(category, 0L);
                failed.add(category);
                metrics.incrementPurgeFailure(category);
                log.error("retention.purgeFailed category={} cutoff={} error={}",
                        category, cutoff, e.getMessage(), e);
            }
        }
        return new PurgeResult(purged, failed);
    }

    private long purgeCategory(RecordCategory category, Instant cutoff) {
        RecordFilter filter = RecordFilter.builder()
                .isNotNull(RecordCategory.DELETED_AT_COLUMN)
                .olderThan(cutoff, RecordCategory.DELETED_AT_COLUMN)
                .build();
        return store.delete(category.table(), filter);
    }
}
