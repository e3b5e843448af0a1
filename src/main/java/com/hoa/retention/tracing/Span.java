package com.hoa.retention.tracing;

/**
 * A traced retention run (a sweep, a purge, or one policy within a sweep).
 * Ends when closed; use in try-with-resources.
 */
public interface Span extends AutoCloseable {

    /**
     * Attaches a count such as {@code deleted} or {@code errors} to the span.
     */
    void recordCount(String key, long value);

    /**
     * Marks the run as completed. A run that also recorded failures is still
     * completed: failures there are isolated, not fatal.
     */
    void succeed();

    /**
     * Marks the run as failed and attaches the cause.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
