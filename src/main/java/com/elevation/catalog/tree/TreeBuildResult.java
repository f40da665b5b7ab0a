package com.elevation.catalog.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a tree build: every node the build touched, children before parents,
 * plus the documents that could not be placed.
 */
public record TreeBuildResult(List<NodeDocument> nodes, List<ScanFailure> failures, int itemCount) {

    public TreeBuildResult {
        nodes = List.copyOf(nodes);
        failures = List.copyOf(failures);
    }

    public List<NodeDocument> writtenNodes() {
        return nodes.stream().filter(NodeDocument::written).collect(Collectors.toList());
    }

    public List<NodeDocument> keptNodes() {
        return nodes.stream().filter(n -> !n.written()).collect(Collectors.toList());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "TreeBuildResult{items=" + itemCount +
                ", nodes=" + nodes.size() +
                ", written=" + writtenNodes().size() +
                ", failures=" + failures.size() + '}';
    }
}
