package com.hoa.retention.schedule;

import com.hoa.retention.lifecycle.PurgeResult;
import com.hoa.retention.lifecycle.RetentionConfig;
import com.hoa.retention.lifecycle.RetentionService;
import com.hoa.retention.lifecycle.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs retention on a fixed schedule: a sweep every
 * {@link RetentionConfig#sweepInterval()}, followed by a purge when
 * {@link RetentionConfig#purgeEnabled()} is set. The purge path runs under
 * {@link #SCHEDULER_ACTOR}, which is the only non-interactive actor allowed
 * to trigger it.
 *
 * <p>A failing run is logged and the schedule keeps going.</p>
 */
public class RetentionScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetentionScheduler.class);

    public static final String SCHEDULER_ACTOR = "system:retention-scheduler";

    private final RetentionService retentionService;
    private final RetentionConfig config;
    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> scheduled;

    public RetentionScheduler(RetentionService retentionService) {
        this(retentionService, retentionService.getConfig());
    }

    public RetentionScheduler(RetentionService retentionService, RetentionConfig config) {
        this.retentionService = Objects.requireNonNull(retentionService, "retentionService is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retention-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the schedule. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (scheduled != null) {
            return;
        }
        scheduled = executor.scheduleWithFixedDelay(this::runOnce,
                config.initialDelay().toMillis(), config.sweepInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("retention.schedulerStarted interval={} initialDelay={} purgeEnabled={}",
                config.sweepInterval(), config.initialDelay(), config.purgeEnabled());
    }

    public synchronized boolean isRunning() {
        return scheduled != null && !scheduled.isDone();
    }

    /**
     * Runs one scheduled cycle on the calling thread. Never throws.
     */
    public void runOnce() {
        try {
            SweepResult sweep = retentionService.applyRetentionPolicies();
            log.info("retention.scheduledSweep result={}", sweep);
        } catch (RuntimeException e) {
            log.error("retention.scheduledSweepFailed error={}", e.getMessage(), e);
        }
        if (!config.purgeEnabled()) {
            return;
        }
        try {
            PurgeResult purge = retentionService.purgeSoftDeleted(SCHEDULER_ACTOR, config.gracePeriodDays());
            log.info("retention.scheduledPurge result={}", purge);
        } catch (RuntimeException e) {
            log.error("retention.scheduledPurgeFailed error={}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduled = null;
        log.info("retention.schedulerStopped");
    }
}
