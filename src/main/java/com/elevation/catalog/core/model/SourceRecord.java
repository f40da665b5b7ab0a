package com.elevation.catalog.core.model;

import java.time.Instant;

/**
 * One raw metadata record read from a single source pool.
 * Identity fields are not validated here: malformed records must reach the
 * union engine so they can be rejected and reported.
 */
public record SourceRecord(
        ProductClass productClass,
        String sceneOrStripId,
        String logicalIdentity,
        String version,
        boolean alternateVariant,
        String resolution,
        String location,
        Instant indexedAt,
        SourcePool pool,
        int sourcePriority,
        String spatialPartition,
        Footprint footprint,
        Instant acquisitionStart,
        Instant acquisitionEnd,
        ProcessingMetadata metadata
) {
    public SourceRecord {
        metadata = metadata != null ? metadata : ProcessingMetadata.empty();
    }

    public RecordKey key() {
        return new RecordKey(sceneOrStripId, logicalIdentity, alternateVariant);
    }

    /**
     * Identity including the processing version, e.g. {@code W1W1_20200101_1010_1020_2m_v4.1}.
     */
    public String versionedIdentity() {
        return logicalIdentity + "_v" + version;
    }

    public Builder toBuilder() {
        return new Builder()
                .productClass(productClass)
                .sceneOrStripId(sceneOrStripId)
                .logicalIdentity(logicalIdentity)
                .version(version)
                .alternateVariant(alternateVariant)
                .resolution(resolution)
                .location(location)
                .indexedAt(indexedAt)
                .pool(pool)
                .sourcePriority(sourcePriority)
                .spatialPartition(spatialPartition)
                .footprint(footprint)
                .acquisition(acquisitionStart, acquisitionEnd)
                .metadata(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProductClass productClass = ProductClass.STRIP;
        private String sceneOrStripId;
        private String logicalIdentity;
        private String version;
        private boolean alternateVariant;
        private String resolution;
        private String location;
        private Instant indexedAt;
        private SourcePool pool = SourcePool.ON_HAND;
        private Integer sourcePriority;
        private String spatialPartition;
        private Footprint footprint;
        private Instant acquisitionStart;
        private Instant acquisitionEnd;
        private ProcessingMetadata metadata;

        public Builder productClass(ProductClass productClass) {
            this.productClass = productClass;
            return this;
        }

        public Builder sceneOrStripId(String sceneOrStripId) {
            this.sceneOrStripId = sceneOrStripId;
            return this;
        }

        public Builder logicalIdentity(String logicalIdentity) {
            this.logicalIdentity = logicalIdentity;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder alternateVariant(boolean alternateVariant) {
            this.alternateVariant = alternateVariant;
            return this;
        }

        public Builder resolution(String resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder indexedAt(Instant indexedAt) {
            this.indexedAt = indexedAt;
            return this;
        }

        public Builder pool(SourcePool pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Overrides the pool's default priority.
         */
        public Builder sourcePriority(int sourcePriority) {
            this.sourcePriority = sourcePriority;
            return this;
        }

        public Builder spatialPartition(String spatialPartition) {
            this.spatialPartition = spatialPartition;
            return this;
        }

        public Builder footprint(Footprint footprint) {
            this.footprint = footprint;
            return this;
        }

        public Builder acquisition(Instant start, Instant end) {
            this.acquisitionStart = start;
            this.acquisitionEnd = end;
            return this;
        }

        public Builder metadata(ProcessingMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public SourceRecord build() {
            int priority = sourcePriority != null
                    ? sourcePriority
                    : (pool != null ? pool.getDefaultPriority() : 0);
            return new SourceRecord(productClass, sceneOrStripId, logicalIdentity, version,
                    alternateVariant, resolution, location, indexedAt, pool, priority,
                    spatialPartition, footprint, acquisitionStart, acquisitionEnd, metadata);
        }
    }
}
