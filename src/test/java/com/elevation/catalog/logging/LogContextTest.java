package com.elevation.catalog.logging;

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
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-1", "buildTree")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("buildTree", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forPartition should set batchId, collection and partition in MDC")
    void forPartitionSetsMDC() {
        try (LogContext ctx = LogContext.forPartition("batch-2", "arcticdem-strips-s2s041-2m", "n67w132")) {
            assertEquals("batch-2", MDC.get("batchId"));
            assertEquals("arcticdem-strips-s2s041-2m", MDC.get("collection"));
            assertEquals("n67w132", MDC.get("partition"));
        }
        assertNull(MDC.get("collection"));
        assertNull(MDC.get("partition"));
    }

    @Test
    @DisplayName("forIdentity should set the logical identity in MDC")
    void forIdentitySetsMDC() {
        try (LogContext ctx = LogContext.forIdentity("batch-3", "WV01_20200101_A_B_2m")) {
            assertEquals("WV01_20200101_A_B_2m", MDC.get("logicalIdentity"));
        }
        assertNull(MDC.get("logicalIdentity"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forCollection("batch-4", "arcticdem-mosaics-v4.1-2m")
                .with("source", "on-hand")) {
            assertEquals("on-hand", MDC.get("source"));
        }
        assertNull(MDC.get("source"));
        assertNull(MDC.get("batchId"));
    }

    @Test
    @DisplayName("Nested contexts should not interfere with each other")
    void nestedContexts() {
        try (LogContext outer = LogContext.forBatch("outer", "rebuildCollections")) {
            try (LogContext inner = LogContext.forIdentity("outer", "X_2m")) {
                assertEquals("X_2m", MDC.get("logicalIdentity"));
                assertEquals("rebuildCollections", MDC.get("operation"));
            }
            assertNull(MDC.get("logicalIdentity"));
            assertEquals("rebuildCollections", MDC.get("operation"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("generateBatchId should return unique ids")
    void generateBatchIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateBatchId());
        }
        assertEquals(100, ids.size(), "All generated IDs should be unique");
    }
}
