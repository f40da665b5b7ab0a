package com.elevation.catalog.core.model;

import java.util.Objects;

/**
 * Survivor of deduplication. At most one exists per {@link RecordKey}.
 *
 * @param source              the surviving source record
 * @param collapsedDuplicates number of same-key records it absorbed inside its pool
 */
public record UnifiedRecord(SourceRecord source, int collapsedDuplicates) {

    public UnifiedRecord {
        Objects.requireNonNull(source, "source is required");
        if (collapsedDuplicates < 0) {
            throw new IllegalArgumentException("collapsedDuplicates must be >= 0");
        }
    }

    public static UnifiedRecord of(SourceRecord source) {
        return new UnifiedRecord(source, 0);
    }

    public RecordKey key() {
        return source.key();
    }

    public String sceneOrStripId() {
        return source.sceneOrStripId();
    }

    public String logicalIdentity() {
        return source.logicalIdentity();
    }

    public String version() {
        return source.version();
    }

    public boolean alternateVariant() {
        return source.alternateVariant();
    }

    public ProductClass productClass() {
        return source.productClass();
    }
}
