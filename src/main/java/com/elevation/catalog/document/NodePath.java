package com.elevation.catalog.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Position of a catalog node: the path segments below the catalog root, e.g.
 * {@code [arcticdem, strips, s2s041, 2m, n67w132]}. The node document of a path lives at
 * {@code {segments joined by /}.json}; its children live in the directory of the same name.
 */
public record NodePath(List<String> segments) implements Comparable<NodePath> {

    public static final NodePath ROOT = new NodePath(List.of());

    public NodePath {
        segments = List.copyOf(segments);
        if (segments.size() >= NodeLevel.values().length) {
            throw new IllegalArgumentException("Node path too deep: " + segments);
        }
        for (String segment : segments) {
            if (segment.isBlank() || segment.contains("/")) {
                throw new IllegalArgumentException("Invalid node path segment: '" + segment + "'");
            }
        }
    }

    public static NodePath partition(CollectionKey key, String partition) {
        return key.nodePath().child(Objects.requireNonNull(partition, "partition is required"));
    }

    public NodePath child(String segment) {
        List<String> child = new ArrayList<>(segments);
        child.add(segment);
        return new NodePath(child);
    }

    public NodePath parent() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("The root node has no parent");
        }
        return new NodePath(segments.subList(0, segments.size() - 1));
    }

    public NodeLevel level() {
        return NodeLevel.values()[segments.size()];
    }

    public String segment(NodeLevel level) {
        return level.ordinal() > 0 && level.ordinal() <= segments.size()
                ? segments.get(level.ordinal() - 1)
                : null;
    }

    public String name() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * Node id: the domain name, then dash-joined prefixes of the collection id, then the
     * collection id with the partition appended. The root has no derived id.
     */
    public String id() {
        return segments.isEmpty() ? null : String.join("-", segments);
    }

    /**
     * Relative path of this node's document. The root document uses the configured file name.
     */
    public String documentPath(String rootCatalogFile) {
        return segments.isEmpty() ? rootCatalogFile : directory() + ".json";
    }

    /**
     * Relative directory holding this node's children.
     */
    public String directory() {
        return String.join("/", segments);
    }

    /**
     * Relative path of an item document inside this partition node.
     */
    public String itemPath(String itemId) {
        if (level() != NodeLevel.PARTITION) {
            throw new IllegalStateException("Items live only under partition nodes: " + this);
        }
        return directory() + "/" + itemId + ".json";
    }

    public CollectionKey collectionKey() {
        if (segments.size() < NodeLevel.RESOLUTION.ordinal()) {
            throw new IllegalStateException("Node above the resolution level has no collection: " + this);
        }
        return new CollectionKey(segments.get(0), segments.get(1), segments.get(2), segments.get(3));
    }

    @Override
    public int compareTo(NodePath other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public String toString() {
        return segments.isEmpty() ? "/" : directory();
    }
}
