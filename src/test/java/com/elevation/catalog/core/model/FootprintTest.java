package com.elevation.catalog.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FootprintTest {

    @Test
    @DisplayName("Should close a box ring")
    void testBox() {
        Footprint box = Footprint.box(Footprint.WGS84, -1, -2, 3, 4);

        List<Coordinate> ring = box.polygons().get(0);
        assertEquals(5, ring.size());
        assertEquals(ring.get(0), ring.get(4));
        assertTrue(box.isGeographic());
    }

    @Test
    @DisplayName("Should compute the extent over every ring")
    void testBbox() {
        Footprint footprint = new Footprint("EPSG:3413", List.of(
                Footprint.box("EPSG:3413", 0, 0, 10, 10).polygons().get(0),
                Footprint.box("EPSG:3413", -5, 20, 2, 30).polygons().get(0)));

        assertEquals(List.of(-5.0, 0.0, 10.0, 30.0), footprint.bbox());
        assertFalse(footprint.isGeographic());
    }

    @Test
    @DisplayName("Should reject empty footprints and short rings")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Footprint(Footprint.WGS84, List.of()));
        assertThrows(IllegalArgumentException.class, () -> Footprint.polygon(Footprint.WGS84,
                List.of(Coordinate.of(0, 0), Coordinate.of(1, 0), Coordinate.of(0, 0))));
        assertThrows(NullPointerException.class, () -> new Footprint(null, List.of()));
    }
}
