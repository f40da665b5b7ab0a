package com.elevation.catalog.item;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Per-item results of a batch build, in publication order.
 */
public record ItemBatchReport(List<ItemBuildResult> results) {

    public ItemBatchReport {
        results = List.copyOf(results);
    }

    public long count(ItemStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public List<ItemBuildResult> writable() {
        return results.stream().filter(ItemBuildResult::isWritable).collect(Collectors.toList());
    }

    public List<ItemBuildResult> failures() {
        return results.stream().filter(r -> r.status() == ItemStatus.FAILED).collect(Collectors.toList());
    }

    /**
     * Collections that received at least one writable item.
     */
    public Set<String> touchedCollections() {
        return results.stream()
                .filter(ItemBuildResult::isWritable)
                .map(ItemBuildResult::collectionId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> r.status() == ItemStatus.FAILED);
    }

    public int size() {
        return results.size();
    }

    @Override
    public String toString() {
        return "ItemBatchReport{total=" + results.size() +
                ", built=" + count(ItemStatus.BUILT) +
                ", incomplete=" + count(ItemStatus.INCOMPLETE) +
                ", failed=" + count(ItemStatus.FAILED) +
                ", suppressed=" + count(ItemStatus.SUPPRESSED) + '}';
    }
}
