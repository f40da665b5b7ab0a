package com.elevation.catalog.document;

import com.elevation.catalog.core.model.Coordinate;
import com.elevation.catalog.core.model.Footprint;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * GeoJSON geometry of a footprint: a {@code Polygon} for a single ring, a {@code MultiPolygon} otherwise.
 * The CRS is not part of the document.
 */
@JsonPropertyOrder({"type", "coordinates"})
public record Geometry(String type, Object coordinates) {

    public static Geometry of(Footprint footprint) {
        List<List<List<List<Double>>>> polygons = new ArrayList<>(footprint.polygons().size());
        for (List<Coordinate> ring : footprint.polygons()) {
            List<List<Double>> positions = new ArrayList<>(ring.size());
            for (Coordinate c : ring) {
                positions.add(List.of(c.x(), c.y()));
            }
            polygons.add(List.of(positions));
        }
        if (polygons.size() == 1) {
            return new Geometry("Polygon", polygons.get(0));
        }
        return new Geometry("MultiPolygon", polygons);
    }
}
