package com.elevation.catalog.document;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Arrays;
import java.util.List;

/**
 * Spatial and temporal extent of a collection node: one merged bounding box and one
 * open-ended interval starting at the earliest item datetime.
 */
public record Extent(Spatial spatial, Temporal temporal) {

    public static Extent of(List<Double> bbox, String start) {
        return new Extent(new Spatial(List.of(List.copyOf(bbox))),
                new Temporal(List.of(Arrays.asList(start, null))));
    }

    @JsonIgnore
    public List<Double> bbox() {
        return spatial.bbox().get(0);
    }

    @JsonIgnore
    public String start() {
        return temporal.interval().get(0).get(0);
    }

    public record Spatial(List<List<Double>> bbox) {}

    public record Temporal(List<List<String>> interval) {}
}
