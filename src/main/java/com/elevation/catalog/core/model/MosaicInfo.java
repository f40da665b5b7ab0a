package com.elevation.catalog.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Auxiliary metadata for a mosaic tile: the strips it is composed of and their time span.
 */
public record MosaicInfo(
        String collection,
        String itemId,
        List<String> pairnameIds,
        Instant startDatetime,
        Instant endDatetime
) {
    public MosaicInfo {
        Objects.requireNonNull(collection, "collection is required");
        Objects.requireNonNull(itemId, "itemId is required");
        pairnameIds = pairnameIds != null ? List.copyOf(pairnameIds) : List.of();
    }
}
