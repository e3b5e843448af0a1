package com.hoa.retention.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransientConnectionException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * JDBC implementation of {@link RecordStore}.
 * Every call is one parameterized statement in auto-commit mode. Instants are
 * bound as UTC {@link OffsetDateTime} values so that the database's native
 * timestamp ordering applies.
 */
public class JdbcRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final String name;

    public JdbcRecordStore(DataSource dataSource) {
        this(dataSource, "jdbc");
    }

    public JdbcRecordStore(DataSource dataSource, String name) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource is required");
        this.name = name;
    }

    @Override
    public long update(String table, RecordFilter filter, Map<String, Object> setFields) {
        Identifiers.requireValid(table, filter, setFields.keySet());
        requireConditional(filter, "update");
        Identifiers.requireAssignable(table, setFields);

        List<Object> params = new ArrayList<>();
        StringJoiner assignments = new StringJoiner(", ");
        for (Map.Entry<String, Object> field : setFields.entrySet()) {
            assignments.add(field.getKey() + " = ?");
            params.add(field.getValue());
        }
        String sql = "UPDATE " + table + " SET " + assignments + whereClause(filter, params);
        return executeUpdate(sql, params);
    }

    @Override
    public long delete(String table, RecordFilter filter) {
        Identifiers.requireValid(table, filter, Set.of());
        requireConditional(filter, "delete");

        List<Object> params = new ArrayList<>();
        String sql = "DELETE FROM " + table + whereClause(filter, params);
        return executeUpdate(sql, params);
    }

    @Override
    public long count(String table, RecordFilter filter) {
        Identifiers.requireValid(table, filter, Set.of());

        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM " + table + whereClause(filter, params);
        log.debug("Querying: {}", sql);
        try (Connection connection = openConnection();
             PreparedStatement statement = prepare(connection, sql, params);
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw translate(sql, e);
        }
    }

    @Override
    public boolean isConnected() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    private long executeUpdate(String sql, List<Object> params) {
        log.debug("Executing: {}", sql);
        try (Connection connection = openConnection();
             PreparedStatement statement = prepare(connection, sql, params)) {
            long affected = statement.executeUpdate();
            log.debug("Statement affected {} rows", affected);
            return affected;
        } catch (SQLException e) {
            throw translate(sql, e);
        }
    }

    private Connection openConnection() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Unable to obtain connection for store '" + name + "'", e);
        }
    }

    private static PreparedStatement prepare(Connection connection, String sql, List<Object> params)
            throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, toJdbcValue(params.get(i)));
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    /**
     * Builds the WHERE clause for a filter, appending bound values to {@code params}.
     */
    static String whereClause(RecordFilter filter, List<Object> params) {
        if (filter.isEmpty()) {
            return "";
        }
        StringJoiner where = new StringJoiner(" AND ", " WHERE ", "");
        for (RecordFilter.Condition condition : filter.conditions()) {
            switch (condition.operator()) {
                case EQUALS -> {
                    where.add(condition.column() + " = ?");
                    params.add(condition.value());
                }
                case OLDER_THAN -> {
                    String reference = condition.columns().size() == 1
                            ? condition.column()
                            : "COALESCE(" + String.join(", ", condition.columns()) + ")";
                    where.add(reference + " < ?");
                    params.add(condition.value());
                }
                case IS_NULL -> where.add(condition.column() + " IS NULL");
                case IS_NOT_NULL -> where.add(condition.column() + " IS NOT NULL");
            }
        }
        return where.toString();
    }

    private static Object toJdbcValue(Object value) {
        if (value instanceof Instant instant) {
            return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        return value;
    }

    private static void requireConditional(RecordFilter filter, String statement) {
        if (filter.isEmpty()) {
            throw new ConstraintViolationException("Refusing unconditional " + statement);
        }
    }

    /**
     * Maps a driver exception onto the store error taxonomy using the exception
     * type first and the SQLState class second.
     */
    static RecordStoreException translate(String sql, SQLException e) {
        String state = e.getSQLState();
        if (e instanceof SQLTransientConnectionException
                || e instanceof SQLNonTransientConnectionException
                || (state != null && state.startsWith("08"))) {
            return new StoreUnavailableException("Store unavailable while executing: " + sql, e);
        }
        if (e instanceof SQLIntegrityConstraintViolationException
                || e instanceof SQLSyntaxErrorException
                || (state != null && (state.startsWith("23") || state.startsWith("42")))) {
            return new ConstraintViolationException("Statement rejected: " + sql, e);
        }
        return new PartialBatchFailureException("Batch failed while executing: " + sql, e);
    }
}
