package com.elevation.catalog.canonical;

import com.elevation.catalog.audit.AuditAction;
import com.elevation.catalog.audit.AuditService;
import com.elevation.catalog.core.model.CanonicalRecord;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.UnifiedRecord;
import com.elevation.catalog.logging.LogContext;
import com.elevation.catalog.metrics.MetricsService;
import com.elevation.catalog.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Selects one canonical record per logical identity from the unified pool.
 *
 * <p>Within each (product class, logical identity) group the highest version wins, compared as an
 * integer tuple. At the winning version, standard-variant records are canonical whenever at least one
 * exists; alternate-variant records are canonical only when every record at that version is alternate.
 * Every other version of the group is recorded as deprecated. Nothing is ever removed: unselected
 * records are reported in {@link ResolutionResult#nonCanonical()}.</p>
 *
 * <p>Groups are independent, so the pool can be resolved in shards keyed by the identity hash
 * without cross-shard coordination.</p>
 */
public class CanonicalVersionResolver {
    private static final Logger log = LoggerFactory.getLogger(CanonicalVersionResolver.class);
    private static final String COMPONENT = "resolver";

    private static final Comparator<UnifiedRecord> MEMBER_ORDER = Comparator
            .comparing(UnifiedRecord::sceneOrStripId)
            .thenComparing(r -> r.source().location(), Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(r -> r.source().indexedAt(), Comparator.nullsFirst(Comparator.naturalOrder()));

    private final DeprecationLedger ledger;
    private final Set<String> deprecationList;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public CanonicalVersionResolver() {
        this(new DeprecationLedger(), Set.of(), new AuditService(), new NoOpMetricsService());
    }

    /**
     * @param ledger          lineage ledger that deprecations are appended to
     * @param deprecationList versioned identities withdrawn externally; their canonical records are
     *                        flagged deprecated even when they win their group
     */
    public CanonicalVersionResolver(DeprecationLedger ledger, Set<String> deprecationList,
                                    AuditService auditService, MetricsService metricsService) {
        this.ledger = ledger != null ? ledger : new DeprecationLedger();
        this.deprecationList = deprecationList != null ? Set.copyOf(deprecationList) : Set.of();
        this.auditService = auditService != null ? auditService : new AuditService();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public DeprecationLedger getLedger() {
        return ledger;
    }

    public ResolutionResult resolve(Collection<UnifiedRecord> records) {
        return resolveShard(records, 1, 0);
    }

    /**
     * Resolves only the groups whose logical identity hashes into the given shard.
     */
    public ResolutionResult resolveShard(Collection<UnifiedRecord> records, int shardCount, int shardIndex) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be > 0");
        }
        if (shardIndex < 0 || shardIndex >= shardCount) {
            throw new IllegalArgumentException("shardIndex must be in [0, " + shardCount + ")");
        }

        Map<ProductClass, Map<String, List<UnifiedRecord>>> groups = new TreeMap<>();
        for (UnifiedRecord record : records) {
            if (shardOf(record.logicalIdentity(), shardCount) != shardIndex) {
                continue;
            }
            groups.computeIfAbsent(record.productClass(), k -> new TreeMap<>())
                    .computeIfAbsent(record.logicalIdentity(), k -> new ArrayList<>())
                    .add(record);
        }

        List<CanonicalRecord> canonical = new ArrayList<>();
        SortedSet<String> deprecated = new TreeSet<>();
        List<UnifiedRecord> nonCanonical = new ArrayList<>();
        List<SelectionConflict> conflicts = new ArrayList<>();
        String batchId = LogContext.generateBatchId();

        for (Map.Entry<ProductClass, Map<String, List<UnifiedRecord>>> byClass : groups.entrySet()) {
            long start = System.nanoTime();
            int deprecatedBefore = deprecated.size();
            for (Map.Entry<String, List<UnifiedRecord>> group : byClass.getValue().entrySet()) {
                try (LogContext ctx = LogContext.forIdentity(batchId, group.getKey())) {
                    CanonicalRecord selected = resolveGroup(group.getValue(), deprecated, nonCanonical, conflicts);
                    if (selected != null) {
                        canonical.add(selected);
                    }
                }
            }
            metricsService.recordResolveDuration(byClass.getKey(), Duration.ofNanos(System.nanoTime() - start));
            metricsService.incrementIdentitiesDeprecated(byClass.getKey(), deprecated.size() - deprecatedBefore);
        }

        ResolutionResult result = new ResolutionResult(canonical, deprecated, nonCanonical, conflicts);
        log.info("resolve.completed shard={}/{} canonical={} deprecated={} nonCanonical={} conflicts={}",
                shardIndex, shardCount, canonical.size(), deprecated.size(), nonCanonical.size(), conflicts.size());
        return result;
    }

    /**
     * Shard of a logical identity; stable across processes.
     */
    public static int shardOf(String logicalIdentity, int shardCount) {
        return Math.floorMod(logicalIdentity.hashCode(), shardCount);
    }

    private CanonicalRecord resolveGroup(List<UnifiedRecord> group, SortedSet<String> deprecated,
                                         List<UnifiedRecord> nonCanonical, List<SelectionConflict> conflicts) {
        if (group.isEmpty()) {
            return null;
        }
        String logicalIdentity = group.get(0).logicalIdentity();

        Map<VersionString, List<UnifiedRecord>> byVersion = new TreeMap<>(Comparator.reverseOrder());
        for (UnifiedRecord record : group) {
            VersionString version = VersionString.parse(record.version());
            if (!version.isParseable()) {
                log.warn("resolve.version.unparseable logicalIdentity={} sceneOrStripId={} version='{}'",
                        logicalIdentity, record.sceneOrStripId(), record.version());
            }
            byVersion.computeIfAbsent(version, k -> new ArrayList<>()).add(record);
        }

        List<VersionString> ranked = new ArrayList<>(byVersion.keySet());
        VersionString winner = ranked.get(0);
        if (ranked.size() > 1 && winner.compareNumeric(ranked.get(1)) == 0) {
            VersionString runnerUp = ranked.get(1);
            SelectionConflict conflict = new SelectionConflict(logicalIdentity, winner.raw(),
                    runnerUp.raw(), "greatest version string");
            conflicts.add(conflict);
            log.warn("resolve.version.tie logicalIdentity={} kept={} discarded={}",
                    logicalIdentity, winner.raw(), runnerUp.raw());
            auditConflict(conflict);
        }

        List<UnifiedRecord> atWinner = byVersion.get(winner);
        boolean allAlternate = atWinner.stream().allMatch(UnifiedRecord::alternateVariant);
        List<UnifiedRecord> candidates = new ArrayList<>();
        for (UnifiedRecord record : atWinner) {
            if (record.alternateVariant() == allAlternate) {
                candidates.add(record);
            }
        }
        candidates.sort(MEMBER_ORDER);

        Map<String, UnifiedRecord> members = new LinkedHashMap<>();
        for (UnifiedRecord candidate : candidates) {
            UnifiedRecord kept = members.putIfAbsent(candidate.sceneOrStripId(), candidate);
            if (kept != null) {
                SelectionConflict conflict = new SelectionConflict(logicalIdentity,
                        describe(kept), describe(candidate), "location and index time");
                conflicts.add(conflict);
                log.warn("resolve.member.conflict logicalIdentity={} sceneOrStripId={} kept={} discarded={}",
                        logicalIdentity, candidate.sceneOrStripId(), conflict.kept(), conflict.discarded());
                auditConflict(conflict);
            }
        }

        for (UnifiedRecord record : group) {
            if (!members.containsValue(record)) {
                nonCanonical.add(record);
            }
        }

        UnifiedRecord representative = members.values().iterator().next();
        String canonicalIdentity = representative.source().versionedIdentity();

        List<String> superseded = new ArrayList<>();
        for (VersionString version : ranked.subList(1, ranked.size())) {
            String identity = byVersion.get(version).get(0).source().versionedIdentity();
            if (!identity.equals(canonicalIdentity) && !superseded.contains(identity)) {
                superseded.add(identity);
                deprecated.add(identity);
                ledger.record(identity, canonicalIdentity, logicalIdentity,
                        "superseded by version " + winner.raw());
                auditService.record(AuditAction.IDENTITY_DEPRECATED, identity, COMPONENT,
                        Map.of("canonicalIdentity", canonicalIdentity, "logicalIdentity", logicalIdentity));
            }
        }

        boolean withdrawn = deprecationList.contains(canonicalIdentity);
        if (withdrawn) {
            ledger.record(canonicalIdentity, null, logicalIdentity, "listed as deprecated");
            log.info("resolve.withdrawn logicalIdentity={} canonicalIdentity={}", logicalIdentity, canonicalIdentity);
        }

        CanonicalRecord record = new CanonicalRecord(
                representative.productClass(),
                logicalIdentity,
                canonicalIdentity,
                winner.raw(),
                allAlternate,
                new ArrayList<>(members.values()),
                withdrawn,
                superseded);
        auditService.record(AuditAction.CANONICAL_SELECTED, logicalIdentity, COMPONENT,
                Map.of("canonicalIdentity", canonicalIdentity,
                        "members", members.size(),
                        "alternateVariant", allAlternate,
                        "deprecated", withdrawn));
        log.debug("resolve.selected logicalIdentity={} canonicalIdentity={} members={} alternate={}",
                logicalIdentity, canonicalIdentity, members.size(), allAlternate);
        return record;
    }

    private void auditConflict(SelectionConflict conflict) {
        auditService.record(AuditAction.SELECTION_CONFLICT, conflict.logicalIdentity(), COMPONENT,
                Map.of("kept", conflict.kept(),
                        "discarded", conflict.discarded(),
                        "criterion", conflict.criterion()));
    }

    private static String describe(UnifiedRecord record) {
        return record.sceneOrStripId() + "@" + record.source().location() + "@" + record.source().indexedAt();
    }
}
