package com.elevation.catalog.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Should record audit entries")
    void testRecordEntry() {
        AuditEntry entry = auditService.record(
                AuditAction.RECORD_REJECTED,
                "SETSM_s2s041_X_2m_seg1",
                "union",
                Map.of("reason", "missing version")
        );

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals(AuditAction.RECORD_REJECTED, entry.action());
        assertEquals("SETSM_s2s041_X_2m_seg1", entry.subjectId());
        assertEquals("union", entry.component());
        assertEquals("missing version", entry.details().get("reason"));
    }

    @Test
    @DisplayName("Should default to empty details")
    void testEmptyDetails() {
        AuditEntry entry = auditService.record(AuditAction.NODE_WRITTEN, "arcticdem", "tree-builder");

        assertTrue(entry.details().isEmpty());
    }

    @Test
    @DisplayName("Should filter by action")
    void testFilters() {
        auditService.record(AuditAction.ITEM_BUILT, "item-1", "item-builder");
        auditService.record(AuditAction.ITEM_FAILED, "item-2", "item-builder");
        auditService.record(AuditAction.NODE_WRITTEN, "item-1", "tree-builder");

        assertEquals(3, auditService.size());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.ITEM_FAILED).size());
        assertTrue(auditService.getEntriesByAction(AuditAction.IDENTITY_DEPRECATED).isEmpty());
    }

    @Test
    @DisplayName("Should return immutable lists")
    void testImmutableLists() {
        auditService.record(AuditAction.ITEM_BUILT, "item-1", "item-builder");

        var entries = auditService.getAllEntries();
        assertThrows(UnsupportedOperationException.class, () ->
                entries.add(AuditEntry.builder()
                        .action(AuditAction.ITEM_BUILT)
                        .build())
        );
    }
}
