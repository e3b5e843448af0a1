package com.hoa.retention.lifecycle;

import com.hoa.retention.audit.AuditAction;
import com.hoa.retention.audit.AuditService;
import com.hoa.retention.lock.LocalSweepLock;
import com.hoa.retention.lock.LockConfig;
import com.hoa.retention.lock.NoOpSweepLock;
import com.hoa.retention.lock.SweepLock;
import com.hoa.retention.logging.LogContext;
import com.hoa.retention.metrics.MetricsService;
import com.hoa.retention.metrics.NoOpMetricsService;
import com.hoa.retention.policy.CutoffCalculator;
import com.hoa.retention.policy.PolicyTable;
import com.hoa.retention.policy.RecordCategory;
import com.hoa.retention.policy.RetentionPolicy;
import com.hoa.retention.store.RecordFilter;
import com.hoa.retention.store.RecordStore;
import com.hoa.retention.store.RecordStoreException;
import com.hoa.retention.tracing.NoOpTracingService;
import com.hoa.retention.tracing.Span;
import com.hoa.retention.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for the staged-deletion lifecycle of portal records.
 *
 * <p>Records move {@code ACTIVE -> SOFT_DELETED -> PURGED}. Sweeps soft-delete
 * records that outlived their policy; purges remove records soft-deleted for
 * longer than the grace period. Both are idempotent and report failures as
 * counts rather than exceptions. All operations are recorded in the audit trail.</p>
 *
 * <p>The service holds no state between runs other than its collaborators.</p>
 */
public class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    static final String SWEEP_LOCK_KEY = "retention-sweep";
    static final String SYSTEM_ACTOR = "system:retention";

    private final RecordStore store;
    private final PolicyTable policyTable;
    private final RetentionConfig config;
    private final CutoffCalculator cutoffCalculator;
    private final SoftDeleteExecutor softDeleteExecutor;
    private final RetentionSweep sweep;
    private final PurgeExecutor purgeExecutor;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final SweepLock lock;
    private final Clock clock;

    private RetentionService(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.policyTable = builder.policyTable;
        this.config = builder.config;
        this.auditService = builder.auditService;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.clock = builder.clock;
        this.lock = builder.lock != null ? builder.lock
                : config.lockEnabled() ? new LocalSweepLock(new LockConfig(config.lockTimeoutMs()))
                : new NoOpSweepLock();
        this.cutoffCalculator = new CutoffCalculator(config.zone());
        this.softDeleteExecutor = new SoftDeleteExecutor(store);
        this.sweep = new RetentionSweep(policyTable, softDeleteExecutor, cutoffCalculator, store, metrics);
        this.purgeExecutor = new PurgeExecutor(store, cutoffCalculator, metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs one sweep over every policy of the policy table.
     *
     * @return the sweep summary; {@link SweepResult#skippedRun()} if another sweep is running
     */
    public SweepResult applyRetentionPolicies() {
        if (!lock.tryAcquire(SWEEP_LOCK_KEY)) {
            metrics.incrementSweepSkipped();
            auditService.record(AuditAction.RETENTION_SWEEP_SKIPPED, "RETENTION", SYSTEM_ACTOR,
                    Map.of("reason", "sweep already running"), clock.instant());
            log.warn("retention.sweepSkipped reason=lockHeld");
            return SweepResult.skippedRun();
        }
        String sweepId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forSweep(sweepId);
             Span span = tracing.startRun("retention.sweep", Map.of("sweepId", sweepId))) {
            try {
                Instant now = clock.instant();
                log.info("retention.sweepStarting policies={} store={}", policyTable.size(), store.getName());

                SweepResult result = sweep.run(now);

                metrics.recordSweepDuration(Duration.between(now, clock.instant()));
                span.recordCount("deleted", result.totalDeleted());
                span.recordCount("errors", result.errorCount());
                auditService.record(AuditAction.RETENTION_SWEEP, "RETENTION", SYSTEM_ACTOR, Map.of(
                        "sweepId", sweepId,
                        "totalDeleted", result.totalDeleted(),
                        "errorCount", result.errorCount(),
                        "policies", result.outcomes().size()
                ), now);
                span.succeed();
                log.info("retention.sweepCompleted result={}", result);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("retention.sweepAborted sweepId={} error={}", sweepId, e.getMessage(), e);
                throw e;
            }
        } finally {
            lock.release(SWEEP_LOCK_KEY);
        }
    }

    /**
     * Soft-deletes audit log entries older than the configured audit retention.
     */
    public long softDeleteOldAuditLogs() {
        return softDeleteOldAuditLogs(config.auditLogRetentionDays());
    }

    /**
     * Soft-deletes audit log entries created more than {@code retentionDays} ago.
     *
     * @return the number of entries soft-deleted, or 0 if the store failed
     * @throws IllegalArgumentException if {@code retentionDays} is negative
     */
    public long softDeleteOldAuditLogs(int retentionDays) {
        RetentionPolicy policy = RetentionPolicy.forCategory(RecordCategory.AUDIT_LOG, retentionDays);
        Instant now = clock.instant();
        Instant cutoff = cutoffCalculator.cutoff(now, policy);
        try {
            long deleted = softDeleteExecutor.markExpired(policy, cutoff, now);
            metrics.recordSoftDeleted(policy.label(), deleted);
            auditService.record(AuditAction.AUDIT_LOG_SWEEP, RecordCategory.AUDIT_LOG.table(), SYSTEM_ACTOR,
                    Map.of("retentionDays", retentionDays, "deleted", deleted), now);
            log.info("retention.auditLogsSoftDeleted retentionDays={} deleted={}", retentionDays, deleted);
            return deleted;
        } catch (RuntimeException e) {
            metrics.incrementPolicyFailure(policy.label());
            log.error("retention.auditLogSweepFailed retentionDays={} error={}", retentionDays, e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Soft-deletes one review request, e.g. when the resident withdraws it.
     *
     * @return true if the request was active and is now soft-deleted
     */
    public boolean softDeleteRequest(String requestId, String actorId) {
        return softDelete(RecordCategory.ARB_REQUEST, requestId, actorId);
    }

    /**
     * Soft-deletes one record of any category.
     *
     * @return true if the record was active and is now soft-deleted; false if it
     *         was missing, already soft-deleted, or the store failed
     */
    public boolean softDelete(RecordCategory category, String recordId, String actorId) {
        Instant now = clock.instant();
        try (LogContext ctx = LogContext.forSoftDelete(category.name(), recordId)) {
            boolean deleted = softDeleteExecutor.softDelete(category, recordId, now);
            if (deleted) {
                auditService.record(AuditAction.RECORD_SOFT_DELETED, recordId, actorId,
                        Map.of("category", category.name()), now);
                log.info("retention.softDeleted category={} recordId={} actor={}", category, recordId, actorId);
            } else {
                log.info("retention.softDeleteNoop category={} recordId={}", category, recordId);
            }
            return deleted;
        }
    }

    /**
     * Permanently removes records soft-deleted longer than the configured grace period.
     *
     * @see #purgeSoftDeleted(String, int)
     */
    public PurgeResult purgeSoftDeleted(String actorId) {
        return purgeSoftDeleted(actorId, config.gracePeriodDays());
    }

    /**
     * Permanently removes every record soft-deleted more than {@code gracePeriodDays} ago.
     * Irreversible; intended only for privileged, scheduled invocation.
     *
     * @param actorId the privileged actor requesting the purge, recorded in the audit trail
     * @throws IllegalArgumentException if {@code actorId} is blank or the grace period is negative
     */
    public PurgeResult purgeSoftDeleted(String actorId, int gracePeriodDays) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("purge requires an actorId");
        }
        if (gracePeriodDays < 0) {
            throw new IllegalArgumentException("gracePeriodDays must not be negative");
        }
        String purgeId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forPurge(purgeId, actorId);
             Span span = tracing.startRun("retention.purge", Map.of("purgeId", purgeId, "actorId", actorId))) {
            try {
                Instant now = clock.instant();
                log.warn("retention.purgeStarting gracePeriodDays={} actor={}", gracePeriodDays, actorId);

                PurgeResult result = purgeExecutor.purge(now, gracePeriodDays);

                span.recordCount("purged", result.totalPurged());
                span.recordCount("errors", result.errorCount());
                auditService.record(AuditAction.RECORDS_PURGED, "RETENTION", actorId, Map.of(
                        "purgeId", purgeId,
                        "gracePeriodDays", gracePeriodDays,
                        "requestsPurged", result.requestsPurged(),
                        "auditLogsPurged", result.auditLogsPurged(),
                        "errorCount", result.errorCount()
                ), now);
                span.succeed();
                log.info("retention.purgeCompleted result={}", result);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("retention.purgeAborted purgeId={} error={}", purgeId, e.getMessage(), e);
                throw e;
            }
        }
    }

    /**
     * Counts soft-deleted records of a category still awaiting purge.
     *
     * @throws RecordStoreException if the store fails
     */
    public long countSoftDeleted(RecordCategory category) {
        return store.count(category.table(), RecordFilter.builder()
                .isNotNull(RecordCategory.DELETED_AT_COLUMN)
                .build());
    }

    /**
     * Reports where a record is in its lifecycle. A record that no longer exists
     * is reported as {@link LifecycleState#PURGED}.
     *
     * @throws RecordStoreException if the store fails
     */
    public LifecycleState lifecycleState(RecordCategory category, String recordId) {
        RecordFilter byId = RecordFilter.builder().equalTo(RecordCategory.ID_COLUMN, recordId).build();
        if (store.count(category.table(), byId) == 0) {
            return LifecycleState.PURGED;
        }
        RecordFilter softDeleted = RecordFilter.builder()
                .equalTo(RecordCategory.ID_COLUMN, recordId)
                .isNotNull(RecordCategory.DELETED_AT_COLUMN)
                .build();
        return store.count(category.table(), softDeleted) > 0
                ? LifecycleState.SOFT_DELETED
                : LifecycleState.ACTIVE;
    }

    public PolicyTable getPolicyTable() {
        return policyTable;
    }

    public RetentionConfig getConfig() {
        return config;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static class Builder {
        private RecordStore store;
        private PolicyTable policyTable = PolicyTable.defaults();
        private RetentionConfig config = RetentionConfig.defaults();
        private AuditService auditService = new AuditService();
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();
        private SweepLock lock;
        private Clock clock = Clock.systemUTC();

        public Builder store(RecordStore store) {
            this.store = store;
            return this;
        }

        public Builder policyTable(PolicyTable policyTable) {
            this.policyTable = Objects.requireNonNull(policyTable);
            return this;
        }

        public Builder config(RetentionConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = Objects.requireNonNull(auditService);
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics);
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = Objects.requireNonNull(tracing);
            return this;
        }

        /**
         * Overrides the lock chosen from {@link RetentionConfig#lockEnabled()}.
         */
        public Builder lock(SweepLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public RetentionService build() {
            return new RetentionService(this);
        }
    }
}
