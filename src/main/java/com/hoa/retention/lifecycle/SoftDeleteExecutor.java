package com.hoa.retention.lifecycle;

import com.hoa.retention.policy.RecordCategory;
import com.hoa.retention.policy.RetentionPolicy;
import com.hoa.retention.store.RecordFilter;
import com.hoa.retention.store.RecordStore;
import com.hoa.retention.store.RecordStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Moves active records to soft-deleted by stamping {@code deleted_at}.
 * Only {@code deleted_at} is ever written. Rows that already carry a
 * {@code deleted_at} never match, which makes every call idempotent.
 */
public class SoftDeleteExecutor {
    private static final Logger log = LoggerFactory.getLogger(SoftDeleteExecutor.class);

    private final RecordStore store;

    public SoftDeleteExecutor(RecordStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * Soft-deletes, in one conditional batch, every active record governed by
     * {@code policy} whose reference timestamp is strictly before {@code cutoff}.
     *
     * @param policy the policy selecting category, status and reference timestamp
     * @param cutoff records strictly older than this are expired
     * @param now    the value written to {@code deleted_at}
     * @return the number of records transitioned
     * @throws RecordStoreException if the batch fails; callers isolate the failure
     */
    public long markExpired(RetentionPolicy policy, Instant cutoff, Instant now) {
        Objects.requireNonNull(policy, "policy is required");
        RecordCategory category = policy.category();

        RecordFilter.Builder filter = RecordFilter.builder();
        if (!policy.isCategoryWide()) {
            filter.equalTo(category.statusColumn(), policy.status());
        }
        filter.olderThan(cutoff, policy.referenceColumns())
                .isNull(RecordCategory.DELETED_AT_COLUMN);

        long deleted = store.update(category.table(), filter.build(), deletedAt(now));
        if (deleted > 0) {
            log.debug("retention.markedExpired policy={} cutoff={} count={}", policy.label(), cutoff, deleted);
        }
        return deleted;
    }

    /**
     * Soft-deletes a single record, e.g. a resident withdrawing a request.
     *
     * @return true if the record was active and is now soft-deleted; false if it
     *         does not exist, was already soft-deleted, or the store failed
     */
    public boolean softDelete(RecordCategory category, String recordId, Instant now) {
        Objects.requireNonNull(category, "category is required");
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId must not be blank");
        }
        RecordFilter filter = RecordFilter.builder()
                .equalTo(RecordCategory.ID_COLUMN, recordId)
                .isNull(RecordCategory.DELETED_AT_COLUMN)
                .build();
        try {
            return store.update(category.table(), filter, deletedAt(now)) > 0;
        } catch (RecordStoreException e) {
            log.error("retention.softDeleteFailed category={} recordId={} error={}",
                    category, recordId, e.getMessage(), e);
            return false;
        }
    }

    private static Map<String, Object> deletedAt(Instant now) {
        return Map.of(RecordCategory.DELETED_AT_COLUMN, Objects.requireNonNull(now, "now is required"));
    }
}
