package com.hoa.retention.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable conjunction of row conditions understood by every {@link RecordStore}.
 *
 * <pre>
 * RecordFilter filter = RecordFilter.builder()
 *         .equalTo("status", "approved")
 *         .olderThan(cutoff, "esign_timestamp", "created")
 *         .isNull("deleted_at")
 *         .build();
 * </pre>
 */
public final class RecordFilter {

    private static final RecordFilter EMPTY = new RecordFilter(List.of());

    private final List<Condition> conditions;

    private RecordFilter(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static RecordFilter empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordFilter other)) return false;
        return conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return "RecordFilter" + conditions;
    }

    public enum Operator {
        /** Column equals the value. */
        EQUALS,
        /** First non-null column is strictly before the instant. */
        OLDER_THAN,
        IS_NULL,
        IS_NOT_NULL
    }

    /**
     * A single predicate. {@code columns} holds more than one name only for
     * {@link Operator#OLDER_THAN}, where the first non-null column is compared.
     */
    public record Condition(Operator operator, List<String> columns, Object value) {
        public Condition {
            Objects.requireNonNull(operator, "operator is required");
            Objects.requireNonNull(columns, "columns are required");
            columns = List.copyOf(columns);
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("at least one column is required");
            }
            if (operator != Operator.OLDER_THAN && columns.size() != 1) {
                throw new IllegalArgumentException(operator + " takes exactly one column");
            }
            if (operator == Operator.OLDER_THAN && !(value instanceof Instant)) {
                throw new IllegalArgumentException("OLDER_THAN requires an Instant value");
            }
        }

        public String column() {
            return columns.get(0);
        }
    }

    public static class Builder {
        private final List<Condition> conditions = new ArrayList<>();

        public Builder equalTo(String column, Object value) {
            Objects.requireNonNull(value, "value is required, use isNull() for null checks");
            conditions.add(new Condition(Operator.EQUALS, List.of(column), value));
            return this;
        }

        public Builder olderThan(Instant cutoff, String... columns) {
            Objects.requireNonNull(cutoff, "cutoff is required");
            conditions.add(new Condition(Operator.OLDER_THAN, List.of(columns), cutoff));
            return this;
        }

        public Builder olderThan(Instant cutoff, List<String> columns) {
            return olderThan(cutoff, columns.toArray(new String[0]));
        }

        public Builder isNull(String column) {
            conditions.add(new Condition(Operator.IS_NULL, List.of(column), null));
            return this;
        }

        public Builder isNotNull(String column) {
            conditions.add(new Condition(Operator.IS_NOT_NULL, List.of(column), null));
            return this;
        }

        public RecordFilter build() {
            return conditions.isEmpty() ? EMPTY : new RecordFilter(conditions);
        }
    }
}
