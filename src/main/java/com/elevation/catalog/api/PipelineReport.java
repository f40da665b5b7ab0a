package com.elevation.catalog.api;

import com.elevation.catalog.canonical.ResolutionResult;
import com.elevation.catalog.dedup.UnionResult;
import com.elevation.catalog.item.ItemBatchReport;
import com.elevation.catalog.tree.TreeBuildResult;

import java.util.List;

/**
 * Per-stage results of one pipeline run.
 *
 * @param unions       union result per product class
 * @param resolution   canonical records across all product classes
 * @param items        per-item build results
 * @param itemsWritten number of item documents written
 * @param tree         nodes rebuilt above the written items
 */
public record PipelineReport(
        List<UnionResult> unions,
        ResolutionResult resolution,
        ItemBatchReport items,
        int itemsWritten,
        TreeBuildResult tree
) {
    public PipelineReport {
        unions = List.copyOf(unions);
    }

    public long rejectedRecords() {
        return unions.stream().mapToLong(u -> u.rejections().size()).sum();
    }

    /**
     * Returns true if no record was rejected and no item or tree document failed.
     */
    public boolean isClean() {
        return rejectedRecords() == 0 && !items.hasFailures() && !tree.hasFailures();
    }

    @Override
    public String toString() {
        return "PipelineReport{unified=" + unions.stream().mapToInt(UnionResult::size).sum() +
                ", rejected=" + rejectedRecords() +
                ", canonical=" + resolution.size() +
                ", deprecated=" + resolution.deprecatedIdentities().size() +
                ", items=" + items +
                ", written=" + itemsWritten +
                ", tree=" + tree + '}';
    }
}
