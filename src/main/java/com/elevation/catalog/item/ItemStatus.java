package com.elevation.catalog.item;

/**
 * Outcome of building one catalog item.
 */
public enum ItemStatus {
    /** Fully built with all joined metadata present. */
    BUILT,
    /** Built, but auxiliary raster or mosaic metadata was missing and surfaces as nulls. */
    INCOMPLETE,
    /** Not built: dangling publication or missing critical field. */
    FAILED,
    /** Not built: license not public or identity deprecated. */
    SUPPRESSED;

    public boolean isWritable() {
        return this == BUILT || this == INCOMPLETE;
    }
}
