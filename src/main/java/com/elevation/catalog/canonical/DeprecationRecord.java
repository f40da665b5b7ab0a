package com.elevation.catalog.canonical;

import java.time.Instant;
import java.util.Objects;

/**
 * Lineage entry: a versioned identity that is no longer canonical, and what replaced it.
 *
 * @param deprecatedIdentity  the superseded versioned identity
 * @param canonicalIdentity   the versioned identity that is canonical for the same logical identity
 * @param logicalIdentity     the shared logical identity
 * @param reason              why the identity was deprecated
 * @param timestamp           when the deprecation was recorded
 */
public record DeprecationRecord(
        String deprecatedIdentity,
        String canonicalIdentity,
        String logicalIdentity,
        String reason,
        Instant timestamp
) {
    public DeprecationRecord {
        Objects.requireNonNull(deprecatedIdentity, "deprecatedIdentity is required");
        Objects.requireNonNull(logicalIdentity, "logicalIdentity is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
