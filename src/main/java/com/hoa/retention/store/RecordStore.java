package com.hoa.retention.store;

import java.util.Map;

/**
 * Generic tabular store the retention engine issues conditional batches against.
 * Each call is a single statement; implementations must apply it atomically.
 */
public interface RecordStore {

    /** Row identity column. Never reassigned by an update. */
    String ID_COLUMN = "id";

    /**
     * Sets the given columns on every row of {@code table} matching {@code filter}.
     *
     * @param table     the table name
     * @param filter    the row predicate, must not be empty
     * @param setFields column assignments, must not be empty or assign {@link #ID_COLUMN}
     * @return the number of rows changed
     * @throws RecordStoreException if the statement fails
     */
    long update(String table, RecordFilter filter, Map<String, Object> setFields);

    /**
     * Removes every row of {@code table} matching {@code filter}.
     *
     * @param table  the table name
     * @param filter the row predicate, must not be empty
     * @return the number of rows removed
     * @throws RecordStoreException if the statement fails
     */
    long delete(String table, RecordFilter filter);

    /**
     * Counts rows of {@code table} matching {@code filter}. An empty filter counts all rows.
     *
     * @throws RecordStoreException if the statement fails
     */
    long count(String table, RecordFilter filter);

    /**
     * Checks whether the store is reachable.
     */
    boolean isConnected();

    /**
     * Gets a short name identifying this store in logs and health reports.
     */
    String getName();
}
