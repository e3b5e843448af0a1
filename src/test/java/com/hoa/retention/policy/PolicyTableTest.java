package com.hoa.retention.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PolicyTableTest {

    @Nested
    @DisplayName("Default table")
    class Defaults {

        private final PolicyTable table = PolicyTable.defaults();

        @Test
        @DisplayName("Should hold five request policies and one audit log policy")
        void shape() {
            assertEquals(6, table.size());
            assertEquals(5, table.forCategory(RecordCategory.ARB_REQUEST).size());
            assertEquals(1, table.forCategory(RecordCategory.AUDIT_LOG).size());
        }

        @Test
        @DisplayName("Decided requests keep seven years from decision")
        void decidedRequests() {
            for (String status : List.of(PolicyTable.APPROVED, PolicyTable.REJECTED)) {
                RetentionPolicy policy = table.find(RecordCategory.ARB_REQUEST, status).orElseThrow();
                assertEquals(2555, policy.retentionDays());
                assertEquals(AgeReference.DECIDED_OR_CREATED, policy.ageReference());
            }
        }

        @Test
        @DisplayName("Undecided requests keep one year from creation")
        void undecidedRequests() {
            for (String status : List.of(PolicyTable.CANCELLED, PolicyTable.PENDING, PolicyTable.IN_REVIEW)) {
                RetentionPolicy policy = table.find(RecordCategory.ARB_REQUEST, status).orElseThrow();
                assertEquals(365, policy.retentionDays());
                assertEquals(AgeReference.CREATED, policy.ageReference());
            }
        }

        @Test
        @DisplayName("Unknown request status has no policy")
        void unknownStatus() {
            assertEquals(Optional.empty(), table.find(RecordCategory.ARB_REQUEST, "draft"));
        }

        @Test
        @DisplayName("Audit log entries match the category-wide policy")
        void auditLog() {
            RetentionPolicy policy = table.find(RecordCategory.AUDIT_LOG, null).orElseThrow();
            assertTrue(policy.isCategoryWide());
            assertEquals(2555, policy.retentionDays());
        }

        @Test
        @DisplayName("Policies should be immutable")
        void immutable() {
            assertThrows(UnsupportedOperationException.class, () -> table.policies().clear());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject duplicate policies for one status")
        void duplicates() {
            PolicyTable.Builder builder = PolicyTable.builder()
                    .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, "pending", 365, AgeReference.CREATED))
                    .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, "pending", 30, AgeReference.CREATED));
            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("Should reject mixing category-wide and per-status policies")
        void overlapping() {
            PolicyTable.Builder builder = PolicyTable.builder()
                    .add(RetentionPolicy.forCategory(RecordCategory.ARB_REQUEST, 365))
                    .add(RetentionPolicy.forStatus(RecordCategory.ARB_REQUEST, "pending", 30, AgeReference.CREATED));
            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("Should extend the defaults with extra categories")
        void extendDefaults() {
            PolicyTable custom = PolicyTable.builder()
                    .addAll(PolicyTable.defaults().forCategory(RecordCategory.ARB_REQUEST))
                    .add(RetentionPolicy.forCategory(RecordCategory.AUDIT_LOG, 3650))
                    .build();

            assertEquals(6, custom.size());
            assertEquals(3650, custom.find(RecordCategory.AUDIT_LOG, null).orElseThrow().retentionDays());
            assertTrue(custom.toString().startsWith("PolicyTable[arb_requests[approved]"));
        }

        @Test
        @DisplayName("An empty table is allowed")
        void empty() {
            assertEquals(0, PolicyTable.builder().build().size());
        }
    }
}
