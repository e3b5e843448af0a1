package com.hoa.retention.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static com.hoa.retention.testutil.PortalRecords.NOW;
import static com.hoa.retention.testutil.PortalRecords.daysAgo;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcRecordStoreTest {

    private JdbcDataSource dataSource;
    private JdbcRecordStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:retention-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection c = dataSource.getConnection(); Statement s = c.createStatement()) {
            s.executeUpdate("""
                    CREATE TABLE arb_requests (
                        id VARCHAR(64) PRIMARY KEY,
                        status VARCHAR(32) NOT NULL,
                        description VARCHAR(255),
                        created TIMESTAMP WITH TIME ZONE NOT NULL,
                        esign_timestamp TIMESTAMP WITH TIME ZONE,
                        deleted_at TIMESTAMP WITH TIME ZONE
                    )
                    """);
        }
        store = new JdbcRecordStore(dataSource, "h2");

        insert("r1", "approved", daysAgo(100), daysAgo(50), null);
        insert("r2", "approved", daysAgo(100), null, null);
        insert("r3", "pending", daysAgo(10), null, null);
        insert("r4", "pending", daysAgo(400), null, daysAgo(5));
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Should soft-delete using coalesced reference and null guard")
        void conditionalUpdate() throws SQLException {
            RecordFilter filter = RecordFilter.builder()
                    .equalTo("status", "approved")
                    .olderThan(daysAgo(60), "esign_timestamp", "created")
                    .isNull("deleted_at")
                    .build();

            assertEquals(1, store.update("arb_requests", filter, Map.of("deleted_at", NOW)));
            assertEquals(NOW, deletedAt("r2"));
            assertNull(deletedAt("r1"));

            // second run finds nothing left to mark
            assertEquals(0, store.update("arb_requests", filter, Map.of("deleted_at", NOW)));
        }

        @Test
        @DisplayName("Should leave business columns untouched")
        void businessColumnsUntouched() throws SQLException {
            store.update("arb_requests", RecordFilter.builder().equalTo("id", "r3").build(),
                    Map.of("deleted_at", NOW));

            try (Connection c = dataSource.getConnection();
                 PreparedStatement ps = c.prepareStatement("SELECT status, description FROM arb_requests WHERE id = ?")) {
                ps.setString(1, "r3");
                try (ResultSet rs = ps.executeQuery()) {
                    assertTrue(rs.next());
                    assertEquals("pending", rs.getString(1));
                    assertEquals("Fence for r3", rs.getString(2));
                }
            }
        }

        @Test
        @DisplayName("Should delete only rows soft-deleted before the cutoff")
        void conditionalDelete() {
            RecordFilter filter = RecordFilter.builder()
                    .isNotNull("deleted_at")
                    .olderThan(daysAgo(3), "deleted_at")
                    .build();

            assertEquals(1, store.delete("arb_requests", filter));
            assertEquals(3, store.count("arb_requests", RecordFilter.empty()));
            assertEquals(0, store.delete("arb_requests", filter));
        }

        @Test
        @DisplayName("Should count with and without filters")
        void count() {
            assertEquals(4, store.count("arb_requests", RecordFilter.empty()));
            assertEquals(2, store.count("arb_requests", RecordFilter.builder().equalTo("status", "pending").build()));
        }

        @Test
        @DisplayName("Should refuse unconditional statements before touching the database")
        void refuseUnconditional() {
            assertThrows(ConstraintViolationException.class,
                    () -> store.delete("arb_requests", RecordFilter.empty()));
            assertEquals(4, store.count("arb_requests", RecordFilter.empty()));
        }

        @Test
        @DisplayName("Should reject empty assignments and id reassignment like the in-memory store")
        void refuseIdReassignment() {
            RecordFilter byId = RecordFilter.builder().equalTo("id", "r1").build();

            assertThrows(ConstraintViolationException.class,
                    () -> store.update("arb_requests", byId, Map.of("id", "r99")));
            assertThrows(ConstraintViolationException.class,
                    () -> store.update("arb_requests", byId, Map.of()));
            assertEquals(1, store.count("arb_requests", byId));
            assertEquals(0, store.count("arb_requests", RecordFilter.builder().equalTo("id", "r99").build()));
        }
    }

    @Nested
    @DisplayName("Error translation")
    class ErrorTranslation {

        @Test
        @DisplayName("Unknown table should be a constraint violation")
        void unknownTable() {
            RecordFilter filter = RecordFilter.builder().isNull("deleted_at").build();
            assertThrows(ConstraintViolationException.class,
                    () -> store.update("missing_table", filter, Map.of("deleted_at", NOW)));
        }

        @Test
        @DisplayName("Connection failure should be store unavailable")
        void connectionFailure() throws SQLException {
            DataSource broken = mock(DataSource.class);
            when(broken.getConnection()).thenThrow(new SQLTransientConnectionException("refused", "08001"));
            JdbcRecordStore brokenStore = new JdbcRecordStore(broken);

            RecordFilter filter = RecordFilter.builder().isNull("deleted_at").build();
            assertThrows(StoreUnavailableException.class,
                    () -> brokenStore.update("arb_requests", filter, Map.of("deleted_at", NOW)));
            assertFalse(brokenStore.isConnected());
        }

        @Test
        @DisplayName("Should classify SQL states")
        void classifySqlStates() {
            assertInstanceOf(StoreUnavailableException.class,
                    JdbcRecordStore.translate("q", new SQLException("gone", "08S01")));
            assertInstanceOf(ConstraintViolationException.class,
                    JdbcRecordStore.translate("q", new SQLException("dup", "23505")));
            assertInstanceOf(PartialBatchFailureException.class,
                    JdbcRecordStore.translate("q", new SQLException("disk full", "HY000")));
            assertInstanceOf(PartialBatchFailureException.class,
                    JdbcRecordStore.translate("q", new SQLException("no state")));
        }
    }

    @Test
    @DisplayName("Should report connected for a live database")
    void connected() {
        assertTrue(store.isConnected());
        assertEquals("h2", store.getName());
    }

    private void insert(String id, String status, Instant created, Instant decided, Instant deletedAt)
            throws SQLException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO arb_requests (id, status, description, created, esign_timestamp, deleted_at) "
                             + "VALUES (?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, id);
            ps.setString(2, status);
            ps.setString(3, "Fence for " + id);
            ps.setObject(4, utc(created));
            ps.setObject(5, utc(decided));
            ps.setObject(6, utc(deletedAt));
            ps.executeUpdate();
        }
    }

    private Instant deletedAt(String id) throws SQLException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT deleted_at FROM arb_requests WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                OffsetDateTime value = rs.getObject(1, OffsetDateTime.class);
                return value == null ? null : value.toInstant();
            }
        }
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
