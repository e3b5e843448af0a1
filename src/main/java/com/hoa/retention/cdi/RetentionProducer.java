package com.hoa.retention.cdi;

import com.hoa.retention.health.RecordStoreHealthCheck;
import com.hoa.retention.lifecycle.RetentionConfig;
import com.hoa.retention.lifecycle.RetentionService;
import com.hoa.retention.metrics.MetricsService;
import com.hoa.retention.metrics.MicrometerMetricsService;
import com.hoa.retention.metrics.NoOpMetricsService;
import com.hoa.retention.schedule.RetentionScheduler;
import com.hoa.retention.store.JdbcRecordStore;
import com.hoa.retention.store.RecordStore;
import com.hoa.retention.tracing.NoOpTracingService;
import com.hoa.retention.tracing.OpenTelemetryTracingService;
import com.hoa.retention.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.ZoneId;

/**
 * CDI producer that wires the retention engine from MicroProfile Config properties.
 *
 * <p>The container must provide a {@link DataSource} for the portal database.
 * A {@link MeterRegistry} or OpenTelemetry {@link Tracer}, when resolvable,
 * are picked up automatically.</p>
 *
 * <pre>
 * hoa-retention:
 *   zone: America/Chicago
 *   grace-period-days: 30
 *   purge-enabled: true
 * </pre>
 */
@ApplicationScoped
public class RetentionProducer {

    private static final Logger log = LoggerFactory.getLogger(RetentionProducer.class);

    // ── Engine ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "hoa-retention.zone", defaultValue = "UTC")
    String zone;

    @Inject
    @ConfigProperty(name = "hoa-retention.grace-period-days", defaultValue = "30")
    int gracePeriodDays;

    @Inject
    @ConfigProperty(name = "hoa-retention.audit-log-retention-days", defaultValue = "2555")
    int auditLogRetentionDays;

    // ── Schedule ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "hoa-retention.sweep-interval-hours", defaultValue = "24")
    long sweepIntervalHours;

    @Inject
    @ConfigProperty(name = "hoa-retention.initial-delay-minutes", defaultValue = "5")
    long initialDelayMinutes;

    @Inject
    @ConfigProperty(name = "hoa-retention.purge-enabled", defaultValue = "false")
    boolean purgeEnabled;

    // ── Lock ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "hoa-retention.lock.enabled", defaultValue = "true")
    boolean lockEnabled;

    @Inject
    @ConfigProperty(name = "hoa-retention.lock.timeout-ms", defaultValue = "1000")
    long lockTimeoutMs;

    @Inject
    DataSource dataSource;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public RetentionConfig retentionConfig() {
        RetentionConfig config = RetentionConfig.builder()
                .zone(ZoneId.of(zone))
                .gracePeriodDays(gracePeriodDays)
                .auditLogRetentionDays(auditLogRetentionDays)
                .sweepInterval(Duration.ofHours(sweepIntervalHours))
                .initialDelay(Duration.ofMinutes(initialDelayMinutes))
                .purgeEnabled(purgeEnabled)
                .lockEnabled(lockEnabled)
                .lockTimeoutMs(lockTimeoutMs)
                .build();
        log.info("Retention config: zone={} graceDays={} interval={} purgeEnabled={}",
                config.zone(), config.gracePeriodDays(), config.sweepInterval(), config.purgeEnabled());
        return config;
    }

    @Produces
    @ApplicationScoped
    public RecordStore recordStore() {
        return new JdbcRecordStore(dataSource, "portal-db");
    }

    @Produces
    @ApplicationScoped
    public RetentionService retentionService(RecordStore store, RetentionConfig config) {
        return RetentionService.builder()
                .store(store)
                .config(config)
                .metrics(createMetrics())
                .tracing(createTracing())
                .build();
    }

    @Produces
    @ApplicationScoped
    public RetentionScheduler retentionScheduler(RetentionService service, RetentionConfig config) {
        RetentionScheduler scheduler = new RetentionScheduler(service, config);
        scheduler.start();
        return scheduler;
    }

    public void closeScheduler(@Disposes RetentionScheduler scheduler) {
        log.info("Stopping retention scheduler");
        scheduler.close();
    }

    @Produces
    @ApplicationScoped
    public RecordStoreHealthCheck recordStoreHealthCheck(RecordStore store) {
        return new RecordStoreHealthCheck(store);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private MetricsService createMetrics() {
        if (meterRegistry.isResolvable()) {
            log.info("Retention metrics enabled: micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    private TracingService createTracing() {
        if (tracer.isResolvable()) {
            log.info("Retention tracing enabled: opentelemetry");
            return new OpenTelemetryTracingService(tracer.get());
        }
        return new NoOpTracingService();
    }
}
