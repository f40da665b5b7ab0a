package com.elevation.catalog.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Projection metadata of one raster asset, supplied by an external raster-introspection step.
 *
 * @param projCentroid centroid as [lat, lon]
 */
public record RasterAssetInfo(
        String collection,
        String itemId,
        String assetKey,
        Double gsd,
        String projCode,
        List<Integer> projShape,
        List<Double> projTransform,
        List<Double> projBbox,
        Footprint projGeometry,
        List<Double> projCentroid
) {
    public RasterAssetInfo {
        Objects.requireNonNull(collection, "collection is required");
        Objects.requireNonNull(itemId, "itemId is required");
        Objects.requireNonNull(assetKey, "assetKey is required");
        projShape = projShape != null ? List.copyOf(projShape) : null;
        projTransform = projTransform != null ? List.copyOf(projTransform) : null;
        projBbox = projBbox != null ? List.copyOf(projBbox) : null;
        projCentroid = projCentroid != null ? List.copyOf(projCentroid) : null;
    }

    public Key key() {
        return new Key(collection, itemId, assetKey);
    }

    /**
     * Natural key of an asset info row.
     */
    public record Key(String collection, String itemId, String assetKey) {}
}
