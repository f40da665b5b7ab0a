package com.elevation.catalog.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Marks one canonical item for public catalog exposure.
 *
 * @param itemId          scene, strip segment or mosaic tile id exposed as the catalog item id
 * @param logicalIdentity identity of the canonical record the item belongs to
 * @param productClass    product class of the item
 * @param project         catalog domain, e.g. {@code arcticdem}
 * @param releaseVersion  release token, e.g. {@code s2s041} or {@code 4.1}
 * @param licenseClass    license class; only configured public classes are published
 * @param releaseDate     publication date
 */
public record ReleasePublication(
        String itemId,
        String logicalIdentity,
        ProductClass productClass,
        String project,
        String releaseVersion,
        String licenseClass,
        Instant releaseDate
) {
    public ReleasePublication {
        Objects.requireNonNull(itemId, "itemId is required");
        Objects.requireNonNull(productClass, "productClass is required");
    }
}
