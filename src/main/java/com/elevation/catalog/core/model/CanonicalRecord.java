package com.elevation.catalog.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The record set chosen to represent one logical identity.
 * Members are the scene or segment granules at the winning version and variant,
 * ordered by {@code sceneOrStripId}.
 */
public record CanonicalRecord(
        ProductClass productClass,
        String logicalIdentity,
        String canonicalIdentity,
        String version,
        boolean alternateVariant,
        List<UnifiedRecord> members,
        boolean deprecated,
        List<String> supersededIdentities
) {
    public CanonicalRecord {
        Objects.requireNonNull(productClass, "productClass is required");
        Objects.requireNonNull(logicalIdentity, "logicalIdentity is required");
        Objects.requireNonNull(canonicalIdentity, "canonicalIdentity is required");
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("canonical record needs at least one member: " + logicalIdentity);
        }
        supersededIdentities = supersededIdentities != null ? List.copyOf(supersededIdentities) : List.of();
    }

    public Optional<UnifiedRecord> member(String sceneOrStripId) {
        return members.stream()
                .filter(m -> m.sceneOrStripId().equals(sceneOrStripId))
                .findFirst();
    }

    public UnifiedRecord representative() {
        return members.get(0);
    }
}
