package com.hoa.retention.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forSweep should set sweepId and operation")
    void forSweep() {
        try (LogContext ctx = LogContext.forSweep("sweep-1")) {
            assertEquals("sweep-1", MDC.get("sweepId"));
            assertEquals("sweep", MDC.get("operation"));
        }
        assertNull(MDC.get("sweepId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forPurge should set purgeId, actorId and operation")
    void forPurge() {
        try (LogContext ctx = LogContext.forPurge("purge-1", "admin")) {
            assertEquals("purge-1", MDC.get("purgeId"));
            assertEquals("admin", MDC.get("actorId"));
            assertEquals("purge", MDC.get("operation"));
        }
        assertNull(MDC.get("actorId"));
    }

    @Test
    @DisplayName("forSoftDelete should set category and recordId")
    void forSoftDelete() {
        try (LogContext ctx = LogContext.forSoftDelete("ARB_REQUEST", "r-1").with("actorId", "resident-7")) {
            assertEquals("ARB_REQUEST", MDC.get("category"));
            assertEquals("r-1", MDC.get("recordId"));
            assertEquals("resident-7", MDC.get("actorId"));
            assertEquals("softDelete", MDC.get("operation"));
        }
        assertNull(MDC.get("recordId"));
        assertNull(MDC.get("actorId"));
    }

    @Test
    @DisplayName("Should leave unrelated MDC keys in place")
    void unrelatedKeysKept() {
        MDC.put("requestPath", "/admin/retention");
        try (LogContext ctx = LogContext.forSweep("sweep-2")) {
            assertEquals("/admin/retention", MDC.get("requestPath"));
        }
        assertEquals("/admin/retention", MDC.get("requestPath"));
    }

    @Test
    @DisplayName("Run ids should be unique")
    void uniqueRunIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
