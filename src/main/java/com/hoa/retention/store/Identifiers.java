package com.hoa.retention.store;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validation for table and column names interpolated into store statements.
 * Values are always bound as parameters; only identifiers pass through here.
 */
public final class Identifiers {

    /** Maximum allowed length for a table or column name. */
    public static final int MAX_IDENTIFIER_LENGTH = 64;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private Identifiers() {
        // utility class
    }

    /**
     * Validates a single identifier.
     *
     * @throws ConstraintViolationException if the name is null, too long, or has illegal characters
     */
    public static String requireValid(String name) {
        if (name == null || name.isEmpty()) {
            throw new ConstraintViolationException("Identifier must not be null or empty");
        }
        if (name.length() > MAX_IDENTIFIER_LENGTH) {
            throw new ConstraintViolationException(
                    "Identifier exceeds maximum length of " + MAX_IDENTIFIER_LENGTH + ": '" + name + "'");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new ConstraintViolationException(
                    "Identifier must contain only letters, digits and underscores, got: '" + name + "'");
        }
        return name;
    }

    public static void requireValid(Collection<String> names) {
        for (String name : names) {
            requireValid(name);
        }
    }

    /**
     * Validates every table and column name referenced by a statement.
     */
    static void requireValid(String table, RecordFilter filter, Collection<String> assignedColumns) {
        requireValid(table);
        for (RecordFilter.Condition condition : filter.conditions()) {
            requireValid(condition.columns());
        }
        requireValid(assignedColumns);
    }

    /**
     * Rejects an update that assigns nothing or reassigns row identity.
     */
    static void requireAssignable(String table, Map<String, Object> setFields) {
        if (setFields.isEmpty()) {
            throw new ConstraintViolationException("Update on '" + table + "' has no assignments");
        }
        if (setFields.containsKey(RecordStore.ID_COLUMN)) {
            throw new ConstraintViolationException(
                    "Update on '" + table + "' must not assign the " + RecordStore.ID_COLUMN + " column");
        }
    }
}
