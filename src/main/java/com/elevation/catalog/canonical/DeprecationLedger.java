package com.elevation.catalog.canonical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of deprecated identities with their replacement, kept for lineage audit.
 * Entries are never modified or deleted.
 */
public class DeprecationLedger {
    private static final Logger log = LoggerFactory.getLogger(DeprecationLedger.class);

    private final List<DeprecationRecord> records = new CopyOnWriteArrayList<>();

    public DeprecationRecord record(DeprecationRecord record) {
        records.add(record);
        log.debug("deprecation.recorded deprecated={} canonical={} reason={}",
                record.deprecatedIdentity(), record.canonicalIdentity(), record.reason());
        return record;
    }

    public DeprecationRecord record(String deprecatedIdentity, String canonicalIdentity,
                                    String logicalIdentity, String reason) {
        return record(new DeprecationRecord(deprecatedIdentity, canonicalIdentity, logicalIdentity,
                reason, Instant.now()));
    }

    public List<DeprecationRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<DeprecationRecord> getRecordsForLogicalIdentity(String logicalIdentity) {
        return records.stream()
                .filter(r -> r.logicalIdentity().equals(logicalIdentity))
                .collect(Collectors.toList());
    }

    public boolean isDeprecated(String versionedIdentity) {
        return records.stream().anyMatch(r -> r.deprecatedIdentity().equals(versionedIdentity));
    }

    /**
     * Identities that were deprecated in favour of the given canonical identity, directly or
     * through an earlier replacement.
     */
    public List<String> getLineage(String canonicalIdentity) {
        List<String> lineage = new ArrayList<>();
        collectLineage(canonicalIdentity, lineage);
        return lineage;
    }

    private void collectLineage(String identity, List<String> lineage) {
        for (DeprecationRecord record : records) {
            if (identity.equals(record.canonicalIdentity())
                    && !record.deprecatedIdentity().equals(identity)
                    && !lineage.contains(record.deprecatedIdentity())) {
                lineage.add(record.deprecatedIdentity());
                collectLineage(record.deprecatedIdentity(), lineage);
            }
        }
    }

    public int size() {
        return records.size();
    }
}
