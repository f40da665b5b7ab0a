package com.elevation.catalog.document;

import java.util.Objects;

/**
 * The four parts of a resolution collection id such as {@code arcticdem-strips-s2s041-2m}
 * or {@code arcticdem-mosaics-v4.1-2m}.
 */
public record CollectionKey(String domain, String kind, String release, String resolution) {

    public CollectionKey {
        requirePart(domain, "domain");
        requirePart(kind, "kind");
        requirePart(release, "release");
        requirePart(resolution, "resolution");
    }

    private static void requirePart(String value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isBlank() || value.contains("-") || value.contains("/")) {
            throw new IllegalArgumentException("Invalid collection " + name + ": '" + value + "'");
        }
    }

    /**
     * Parses a collection id of exactly four dash-separated parts.
     */
    public static CollectionKey parse(String collectionId) {
        if (collectionId == null) {
            throw new IllegalArgumentException("collectionId is required");
        }
        String[] parts = collectionId.split("-", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Collection id must have 4 parts: " + collectionId);
        }
        return new CollectionKey(parts[0], parts[1], parts[2], parts[3]);
    }

    /**
     * Expands a template such as {@code {project}-mosaics-v{release}-{resolution}}.
     */
    public static CollectionKey fromTemplate(String template, String project, String release, String resolution) {
        return parse(template
                .replace("{project}", Objects.requireNonNull(project, "project is required"))
                .replace("{release}", Objects.requireNonNull(release, "release is required"))
                .replace("{resolution}", Objects.requireNonNull(resolution, "resolution is required")));
    }

    public String id() {
        return domain + "-" + kind + "-" + release + "-" + resolution;
    }

    public NodePath nodePath() {
        return NodePath.ROOT.child(domain).child(kind).child(release).child(resolution);
    }

    @Override
    public String toString() {
        return id();
    }
}
