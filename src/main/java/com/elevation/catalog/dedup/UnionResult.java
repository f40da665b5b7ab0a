package com.elevation.catalog.dedup;

import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.UnifiedRecord;

import java.util.List;
import java.util.Map;

/**
 * Result of unifying all record sources for one product class.
 *
 * @param productClass     product class that was unified
 * @param records          unified records, sorted by key
 * @param rejections       malformed records that were excluded
 * @param contributed      number of unified records contributed by each source, by source name
 * @param shadowedCount    records excluded because a higher-priority pool held the same key
 * @param supersededCount  records dropped by a supersession rule
 * @param collapsedCount   same-key duplicates collapsed inside a pool
 */
public record UnionResult(
        ProductClass productClass,
        List<UnifiedRecord> records,
        List<RecordRejection> rejections,
        Map<String, Integer> contributed,
        long shadowedCount,
        long supersededCount,
        long collapsedCount
) {
    public UnionResult {
        records = List.copyOf(records);
        rejections = rejections != null ? List.copyOf(rejections) : List.of();
        contributed = contributed != null ? Map.copyOf(contributed) : Map.of();
    }

    public int size() {
        return records.size();
    }

    public boolean hasRejections() {
        return !rejections.isEmpty();
    }

    @Override
    public String toString() {
        return "UnionResult{productClass=" + productClass +
                ", unified=" + records.size() +
                ", rejected=" + rejections.size() +
                ", shadowed=" + shadowedCount +
                ", superseded=" + supersededCount +
                ", collapsed=" + collapsedCount + '}';
    }
}
