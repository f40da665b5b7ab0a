package com.elevation.catalog.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Spatial footprint of a product: one or more polygon exterior rings in a named CRS.
 * Rings are closed (first coordinate repeated at the end).
 */
public record Footprint(String crs, List<List<Coordinate>> polygons) {

    public static final String WGS84 = "EPSG:4326";

    public Footprint {
        Objects.requireNonNull(crs, "crs is required");
        Objects.requireNonNull(polygons, "polygons is required");
        if (polygons.isEmpty()) {
            throw new IllegalArgumentException("footprint must contain at least one polygon");
        }
        List<List<Coordinate>> copy = new ArrayList<>(polygons.size());
        for (List<Coordinate> ring : polygons) {
            if (ring.size() < 4) {
                throw new IllegalArgumentException("polygon ring needs at least 4 coordinates, got " + ring.size());
            }
            copy.add(List.copyOf(ring));
        }
        polygons = List.copyOf(copy);
    }

    /**
     * Creates a single-polygon footprint from a ring.
     */
    public static Footprint polygon(String crs, List<Coordinate> ring) {
        return new Footprint(crs, List.of(ring));
    }

    /**
     * Creates an axis-aligned rectangular footprint.
     */
    public static Footprint box(String crs, double minX, double minY, double maxX, double maxY) {
        return polygon(crs, List.of(
                Coordinate.of(minX, minY),
                Coordinate.of(maxX, minY),
                Coordinate.of(maxX, maxY),
                Coordinate.of(minX, maxY),
                Coordinate.of(minX, minY)));
    }

    public boolean isGeographic() {
        return WGS84.equalsIgnoreCase(crs);
    }

    /**
     * Extent of all rings as [minX, minY, maxX, maxY].
     */
    public List<Double> bbox() {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (List<Coordinate> ring : polygons) {
            for (Coordinate c : ring) {
                minX = Math.min(minX, c.x());
                minY = Math.min(minY, c.y());
                maxX = Math.max(maxX, c.x());
                maxY = Math.max(maxY, c.y());
            }
        }
        return List.of(minX, minY, maxX, maxY);
    }
}
