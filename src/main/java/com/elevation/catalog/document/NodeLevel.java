package com.elevation.catalog.document;

/**
 * Depth of a node in the catalog tree, from the top catalog down to the spatial partition.
 */
public enum NodeLevel {
    ROOT,
    DOMAIN,
    KIND,
    RELEASE,
    RESOLUTION,
    PARTITION;

    public boolean hasExtent() {
        return this != ROOT && this != PARTITION;
    }

    /**
     * Catalog-typed levels carry no extent, license or providers.
     */
    public String documentType() {
        return hasExtent() ? "Collection" : "Catalog";
    }
}
