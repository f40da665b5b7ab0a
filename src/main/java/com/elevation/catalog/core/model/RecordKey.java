package com.elevation.catalog.core.model;

import java.util.Comparator;

/**
 * Deduplication key of a record: at most one unified record exists per key.
 */
public record RecordKey(String sceneOrStripId, String logicalIdentity, boolean alternateVariant)
        implements Comparable<RecordKey> {

    private static final Comparator<RecordKey> ORDER = Comparator
            .comparing(RecordKey::sceneOrStripId)
            .thenComparing(RecordKey::logicalIdentity)
            .thenComparing(RecordKey::alternateVariant);

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sceneOrStripId + "|" + logicalIdentity + "|" + (alternateVariant ? "alt" : "std");
    }
}
