package com.hoa.retention.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for one retention run. Only the keys this context
 * added are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSweep(sweepId)) {
 *     sweep.run(now);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a retention sweep.
     */
    public static LogContext forSweep(String sweepId) {
        LogContext ctx = new LogContext();
        ctx.put("sweepId", sweepId);
        ctx.put("operation", "sweep");
        return ctx;
    }

    /**
     * Creates a log context for a purge run.
     */
    public static LogContext forPurge(String purgeId, String actorId) {
        LogContext ctx = new LogContext();
        ctx.put("purgeId", purgeId);
        ctx.put("actorId", actorId);
        ctx.put("operation", "purge");
        return ctx;
    }

    /**
     * Creates a log context for a single-record soft delete.
     */
    public static LogContext forSoftDelete(String category, String recordId) {
        LogContext ctx = new LogContext();
        ctx.put("category", category);
        ctx.put("recordId", recordId);
        ctx.put("operation", "softDelete");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
