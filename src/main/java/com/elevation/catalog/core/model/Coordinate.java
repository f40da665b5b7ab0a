package com.elevation.catalog.core.model;

/**
 * A planar or geographic coordinate pair (x = easting/longitude, y = northing/latitude).
 */
public record Coordinate(double x, double y) {

    public static Coordinate of(double x, double y) {
        return new Coordinate(x, y);
    }
}
