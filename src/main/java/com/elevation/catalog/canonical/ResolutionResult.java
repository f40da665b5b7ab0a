package com.elevation.catalog.canonical;

import com.elevation.catalog.core.model.CanonicalRecord;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.UnifiedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Canonical records chosen for every logical identity group, plus what was not chosen.
 * Canonical records are ordered by product class, then logical identity.
 */
public final class ResolutionResult {

    private static final Comparator<CanonicalRecord> ORDER = Comparator
            .comparing(CanonicalRecord::productClass)
            .thenComparing(CanonicalRecord::logicalIdentity);

    private final List<CanonicalRecord> canonicalRecords;
    private final SortedSet<String> deprecatedIdentities;
    private final List<UnifiedRecord> nonCanonical;
    private final List<SelectionConflict> conflicts;
    private final Map<String, CanonicalRecord> index;

    public ResolutionResult(List<CanonicalRecord> canonicalRecords,
                            SortedSet<String> deprecatedIdentities,
                            List<UnifiedRecord> nonCanonical,
                            List<SelectionConflict> conflicts) {
        List<CanonicalRecord> sorted = new ArrayList<>(canonicalRecords);
        sorted.sort(ORDER);
        this.canonicalRecords = List.copyOf(sorted);
        this.deprecatedIdentities = Collections.unmodifiableSortedSet(new TreeSet<>(deprecatedIdentities));
        this.nonCanonical = List.copyOf(nonCanonical);
        this.conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        this.index = new HashMap<>();
        for (CanonicalRecord record : this.canonicalRecords) {
            index.put(indexKey(record.productClass(), record.logicalIdentity()), record);
        }
    }

    public static ResolutionResult empty() {
        return new ResolutionResult(List.of(), new TreeSet<>(), List.of(), List.of());
    }

    /**
     * Combines shard results; shards never share a logical identity.
     */
    public static ResolutionResult merge(List<ResolutionResult> shards) {
        List<CanonicalRecord> records = new ArrayList<>();
        SortedSet<String> deprecated = new TreeSet<>();
        List<UnifiedRecord> nonCanonical = new ArrayList<>();
        List<SelectionConflict> conflicts = new ArrayList<>();
        for (ResolutionResult shard : shards) {
            records.addAll(shard.canonicalRecords);
            deprecated.addAll(shard.deprecatedIdentities);
            nonCanonical.addAll(shard.nonCanonical);
            conflicts.addAll(shard.conflicts);
        }
        return new ResolutionResult(records, deprecated, nonCanonical, conflicts);
    }

    public List<CanonicalRecord> canonicalRecords() {
        return canonicalRecords;
    }

    /**
     * Versioned identities superseded by a newer version of the same logical identity.
     */
    public SortedSet<String> deprecatedIdentities() {
        return deprecatedIdentities;
    }

    /**
     * Unified records that were not selected as members of any canonical record.
     */
    public List<UnifiedRecord> nonCanonical() {
        return nonCanonical;
    }

    public List<SelectionConflict> conflicts() {
        return conflicts;
    }

    public Optional<CanonicalRecord> find(ProductClass productClass, String logicalIdentity) {
        return Optional.ofNullable(index.get(indexKey(productClass, logicalIdentity)));
    }

    public boolean isDeprecated(String versionedIdentity) {
        return deprecatedIdentities.contains(versionedIdentity);
    }

    public int size() {
        return canonicalRecords.size();
    }

    private static String indexKey(ProductClass productClass, String logicalIdentity) {
        return productClass.name() + "|" + logicalIdentity;
    }

    @Override
    public String toString() {
        return "ResolutionResult{canonical=" + canonicalRecords.size() +
                ", deprecated=" + deprecatedIdentities.size() +
                ", nonCanonical=" + nonCanonical.size() +
                ", conflicts=" + conflicts.size() + '}';
    }
}
