package com.elevation.catalog.core.model;

/**
 * Inventories that metadata records are read from, most trusted first.
 * Records from a higher-priority pool shadow records with the same key in lower ones.
 */
public enum SourcePool {
    /**
     * Live filesystem index of products on hand.
     */
    ON_HAND(40),

    /**
     * Tape archive index.
     */
    ARCHIVE(30),

    /**
     * Index of products delivered to cloud object storage.
     */
    CLOUD_DELIVERY(20),

    /**
     * Incoming records that have not been shelved yet.
     */
    STAGING(10),

    /**
     * Records synthesized from file names when no indexed record exists.
     */
    PSEUDO(0);

    private final int defaultPriority;

    SourcePool(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }
}
