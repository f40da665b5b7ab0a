package com.elevation.catalog.dedup;

import com.elevation.catalog.audit.AuditAction;
import com.elevation.catalog.audit.AuditService;
import com.elevation.catalog.canonical.VersionString;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.RecordKey;
import com.elevation.catalog.core.model.SourceRecord;
import com.elevation.catalog.core.model.UnifiedRecord;
import com.elevation.catalog.metrics.MetricsService;
import com.elevation.catalog.metrics.NoOpMetricsService;
import com.elevation.catalog.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges the records of several sources into one unified pool per product class.
 *
 * <ol>
 *   <li>Malformed records (blank ids, missing index time) are rejected and reported.</li>
 *   <li>Supersession rules drop legacy-resolution records whose id the superseding pool also holds.</li>
 *   <li>Same-key duplicates inside a pool collapse to the record with the smallest
 *       {@code location + indexedAt} string, then the highest source priority, then the lowest version.</li>
 *   <li>Pools overlay highest priority first; a key held by a higher pool hides every lower record.</li>
 * </ol>
 *
 * Sources are never mutated and the output is sorted by {@link RecordKey}, so repeated runs over the
 * same sources produce equal pools.
 */
public class UnionDeduplicationEngine {
    private static final Logger log = LoggerFactory.getLogger(UnionDeduplicationEngine.class);
    private static final String COMPONENT = "union";

    static final Comparator<SourceRecord> TIE_BREAK = Comparator
            .comparing(UnionDeduplicationEngine::tieBreakText)
            .thenComparing(SourceRecord::sourcePriority, Comparator.reverseOrder())
            .thenComparing(r -> VersionString.parse(r.version()));

    private final DedupOptions options;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public UnionDeduplicationEngine() {
        this(DedupOptions.defaults(), new AuditService(), new NoOpMetricsService());
    }

    public UnionDeduplicationEngine(DedupOptions options, AuditService auditService, MetricsService metricsService) {
        this.options = options != null ? options : DedupOptions.defaults();
        this.auditService = auditService != null ? auditService : new AuditService();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public UnionResult unify(ProductClass productClass, List<? extends RecordSource> sources) {
        long start = System.nanoTime();
        List<RecordRejection> rejections = new ArrayList<>();
        Map<RecordSource, List<SourceRecord>> accepted = new LinkedHashMap<>();

        for (RecordSource source : sources) {
            List<SourceRecord> valid = new ArrayList<>();
            for (SourceRecord record : source.read(productClass)) {
                String reason = validate(record, productClass);
                if (reason != null) {
                    reject(rejections, source.name(), record, reason);
                } else {
                    valid.add(record);
                }
            }
            accepted.put(source, valid);
        }

        long superseded = applySupersession(accepted);

        long collapsed = 0;
        List<LayeredRecordLookup.Layer> layers = new ArrayList<>();
        for (Map.Entry<RecordSource, List<SourceRecord>> entry : accepted.entrySet()) {
            RecordSource source = entry.getKey();
            Map<RecordKey, List<SourceRecord>> byKey = new TreeMap<>();
            for (SourceRecord record : entry.getValue()) {
                byKey.computeIfAbsent(record.key(), k -> new ArrayList<>()).add(record);
            }
            Map<RecordKey, UnifiedRecord> survivors = new LinkedHashMap<>();
            for (Map.Entry<RecordKey, List<SourceRecord>> group : byKey.entrySet()) {
                List<SourceRecord> duplicates = group.getValue();
                if (duplicates.size() > 1) {
                    duplicates.sort(TIE_BREAK);
                    collapsed += duplicates.size() - 1;
                    if (TIE_BREAK.compare(duplicates.get(0), duplicates.get(1)) == 0) {
                        log.debug("union.tie source={} key={} candidates={}",
                                source.name(), group.getKey(), duplicates.size());
                    }
                    if (!options.isCollapseWithinPools()) {
                        for (SourceRecord loser : duplicates.subList(1, duplicates.size())) {
                            reject(rejections, source.name(), loser, "duplicate key within pool");
                        }
                    }
                }
                survivors.put(group.getKey(), new UnifiedRecord(duplicates.get(0), duplicates.size() - 1));
            }
            layers.add(new LayeredRecordLookup.Layer(source.name(), source.priority(), survivors));
        }

        LayeredRecordLookup lookup = new LayeredRecordLookup(layers);
        List<UnifiedRecord> unified = new ArrayList<>();
        Map<String, Integer> contributed = new LinkedHashMap<>();
        for (LayeredRecordLookup.Layer layer : lookup.layers()) {
            contributed.putIfAbsent(layer.name(), 0);
        }
        for (RecordKey key : lookup.keys()) {
            lookup.lookup(key).ifPresent(hit -> {
                unified.add(hit.record());
                contributed.merge(hit.layerName(), 1, Integer::sum);
            });
        }
        long shadowed = lookup.shadowedCount();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordUnifyDuration(productClass, elapsed);
        metricsService.incrementRecordsRejected(productClass, rejections.size());
        metricsService.incrementRecordsShadowed(productClass, shadowed);

        UnionResult result = new UnionResult(productClass, unified, rejections, contributed,
                shadowed, superseded, collapsed);
        log.info("union.completed productClass={} sources={} unified={} rejected={} shadowed={} superseded={} collapsed={} durationMs={}",
                productClass, sources.size(), unified.size(), rejections.size(), shadowed, superseded,
                collapsed, elapsed.toMillis());
        return result;
    }

    private long applySupersession(Map<RecordSource, List<SourceRecord>> accepted) {
        long dropped = 0;
        for (SupersessionRule rule : options.getSupersessionRules()) {
            Set<String> supersedingIds = new HashSet<>();
            accepted.forEach((source, records) -> {
                if (source.pool() == rule.supersedingPool()) {
                    records.stream()
                            .filter(r -> rule.resolution().equals(r.resolution()))
                            .forEach(r -> supersedingIds.add(r.sceneOrStripId()));
                }
            });
            if (supersedingIds.isEmpty()) {
                continue;
            }
            for (Map.Entry<RecordSource, List<SourceRecord>> entry : accepted.entrySet()) {
                if (entry.getKey().pool() == rule.supersedingPool()) {
                    continue;
                }
                int before = entry.getValue().size();
                entry.getValue().removeIf(r -> rule.resolution().equals(r.resolution())
                        && supersedingIds.contains(r.sceneOrStripId()));
                int removed = before - entry.getValue().size();
                if (removed > 0) {
                    log.debug("union.superseded source={} resolution={} by={} records={}",
                            entry.getKey().name(), rule.resolution(), rule.supersedingPool(), removed);
                }
                dropped += removed;
            }
        }
        return dropped;
    }

    private void reject(List<RecordRejection> rejections, String sourceName, SourceRecord record, String reason) {
        rejections.add(new RecordRejection(sourceName, record, reason));
        log.warn("union.rejected source={} sceneOrStripId={} logicalIdentity={} reason={}",
                sourceName, record.sceneOrStripId(), record.logicalIdentity(), reason);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", sourceName);
        details.put("reason", reason);
        if (record.location() != null) {
            details.put("location", record.location());
        }
        auditService.record(AuditAction.RECORD_REJECTED,
                record.sceneOrStripId() != null ? record.sceneOrStripId() : String.valueOf(record.location()),
                COMPONENT, details);
    }

    private static String validate(SourceRecord record, ProductClass productClass) {
        if (isBlank(record.sceneOrStripId())) {
            return "missing sceneOrStripId";
        }
        if (isBlank(record.logicalIdentity())) {
            return "missing logicalIdentity";
        }
        if (record.indexedAt() == null) {
            return "missing indexedAt";
        }
        if (record.productClass() != productClass) {
            return "product class " + record.productClass() + " read as " + productClass;
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Concatenation of location (empty when null) and the ISO-8601 index time.
     */
    static String tieBreakText(SourceRecord record) {
        return (record.location() != null ? record.location() : "") + record.indexedAt();
    }
}
