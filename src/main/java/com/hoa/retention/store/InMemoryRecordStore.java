package com.hoa.retention.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of {@link RecordStore}.
 * Rows are column maps keyed by their {@code id} column. Every statement runs
 * under the store's monitor, so each update or delete is atomic.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Map<Object, Map<String, Object>>> tables = new HashMap<>();
    private final String name;

    public InMemoryRecordStore() {
        this("in-memory");
    }

    public InMemoryRecordStore(String name) {
        this.name = name;
    }

    /**
     * Inserts or replaces a row. The row must contain an {@code id} column.
     */
    public synchronized void insert(String table, Map<String, Object> row) {
        Identifiers.requireValid(table);
        Identifiers.requireValid(row.keySet());
        Object id = row.get(ID_COLUMN);
        if (id == null) {
            throw new ConstraintViolationException("Row for table '" + table + "' has no id");
        }
        tables.computeIfAbsent(table, t -> new LinkedHashMap<>()).put(id, new HashMap<>(row));
    }

    /**
     * Gets a copy of a row by id.
     */
    public synchronized Optional<Map<String, Object>> find(String table, Object id) {
        Map<String, Object> row = rows(table).get(id);
        return row == null ? Optional.empty() : Optional.of(Collections.unmodifiableMap(new HashMap<>(row)));
    }

    /**
     * Gets copies of all rows in a table, in insertion order.
     */
    public synchronized List<Map<String, Object>> findAll(String table) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rows(table).values()) {
            result.add(Collections.unmodifiableMap(new HashMap<>(row)));
        }
        return result;
    }

    @Override
    public synchronized long update(String table, RecordFilter filter, Map<String, Object> setFields) {
        Identifiers.requireValid(table, filter, setFields.keySet());
        requireConditional(filter, "update");
        Identifiers.requireAssignable(table, setFields);
        long changed = 0;
        for (Map<String, Object> row : rows(table).values()) {
            if (matches(row, filter)) {
                row.putAll(setFields);
                changed++;
            }
        }
        return changed;
    }

    @Override
    public synchronized long delete(String table, RecordFilter filter) {
        Identifiers.requireValid(table, filter, Set.of());
        requireConditional(filter, "delete");
        long removed = 0;
        Iterator<Map<String, Object>> it = rows(table).values().iterator();
        while (it.hasNext()) {
            if (matches(it.next(), filter)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized long count(String table, RecordFilter filter) {
        Identifiers.requireValid(table, filter, Set.of());
        return rows(table).values().stream().filter(row -> matches(row, filter)).count();
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public String getName() {
        return name;
    }

    private Map<Object, Map<String, Object>> rows(String table) {
        return tables.getOrDefault(table, Map.of());
    }

    private static void requireConditional(RecordFilter filter, String statement) {
        if (filter.isEmpty()) {
            throw new ConstraintViolationException("Refusing unconditional " + statement);
        }
    }

    static boolean matches(Map<String, Object> row, RecordFilter filter) {
        for (RecordFilter.Condition condition : filter.conditions()) {
            if (!matches(row, condition)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matches(Map<String, Object> row, RecordFilter.Condition condition) {
        return switch (condition.operator()) {
            case EQUALS -> Objects.equals(row.get(condition.column()), condition.value());
            case IS_NULL -> row.get(condition.column()) == null;
            case IS_NOT_NULL -> row.get(condition.column()) != null;
            case OLDER_THAN -> isOlderThan(firstNonNull(row, condition.columns()), (Instant) condition.value());
        };
    }

    /**
     * SQL semantics: a null reference never compares.
     */
    private static boolean isOlderThan(Object reference, Instant cutoff) {
        if (reference == null) {
            return false;
        }
        if (!(reference instanceof Instant instant)) {
            throw new ConstraintViolationException(
                    "Cannot compare " + reference.getClass().getSimpleName() + " with a timestamp cutoff");
        }
        return instant.isBefore(cutoff);
    }

    private static Object firstNonNull(Map<String, Object> row, List<String> columns) {
        for (String column : columns) {
            Object value = row.get(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
