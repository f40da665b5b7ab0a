package com.elevation.catalog.source;

import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.SourcePool;
import com.elevation.catalog.testutil.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordSourceTest {

    @Test
    @DisplayName("Should filter records by product class")
    void testFilterByClass() {
        InMemoryRecordSource source = new InMemoryRecordSource("inventory", SourcePool.ARCHIVE, List.of(
                TestRecords.strip(TestRecords.SEG1, "4.1").build(),
                TestRecords.mosaicTile().build()));

        assertEquals(1, source.read(ProductClass.STRIP).size());
        assertEquals(1, source.read(ProductClass.MOSAIC).size());
        assertTrue(source.read(ProductClass.SCENE).isEmpty());
    }

    @Test
    @DisplayName("Should use the pool priority unless overridden")
    void testPriority() {
        InMemoryRecordSource standard = new InMemoryRecordSource("a", SourcePool.STAGING, List.of());
        InMemoryRecordSource boosted = new InMemoryRecordSource("b", SourcePool.STAGING, 50, List.of());

        assertEquals(SourcePool.STAGING.getDefaultPriority(), standard.priority());
        assertEquals(50, boosted.priority());
        assertEquals("b", boosted.name());
    }
}
