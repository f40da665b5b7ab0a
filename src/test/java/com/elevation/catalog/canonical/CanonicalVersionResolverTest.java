package com.elevation.catalog.canonical;

import com.elevation.catalog.audit.AuditAction;
import com.elevation.catalog.audit.AuditService;
import com.elevation.catalog.core.model.CanonicalRecord;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.UnifiedRecord;
import com.elevation.catalog.metrics.MetricsService;
import com.elevation.catalog.testutil.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.elevation.catalog.testutil.TestRecords.STRIP_IDENTITY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Canonical Version Resolver Tests")
class CanonicalVersionResolverTest {

    @Mock
    private MetricsService metricsService;

    private DeprecationLedger ledger;
    private AuditService auditService;
    private CanonicalVersionResolver resolver;

    @BeforeEach
    void setUp() {
        ledger = new DeprecationLedger();
        auditService = new AuditService();
        resolver = new CanonicalVersionResolver(ledger, Set.of(), auditService, null);
    }

    private static UnifiedRecord record(String id, String version, boolean alternate) {
        return UnifiedRecord.of(TestRecords.strip(id, version).alternateVariant(alternate).build());
    }

    private static UnifiedRecord record(String identity, String id, String version, boolean alternate) {
        return UnifiedRecord.of(TestRecords.strip(id, version)
                .logicalIdentity(identity)
                .alternateVariant(alternate)
                .build());
    }

    @Nested
    @DisplayName("Version selection")
    class VersionSelection {

        @Test
        @DisplayName("Should select 4.10 over 4.2 and 4.1")
        void testNumericVersionWins() {
            ResolutionResult result = resolver.resolve(List.of(
                    record("seg1_v0401", "4.1", false),
                    record("seg1_v0410", "4.10", false),
                    record("seg1_v0402", "4.2", false)));

            assertEquals(1, result.size());
            CanonicalRecord canonical = result.canonicalRecords().get(0);
            assertEquals("4.10", canonical.version());
            assertEquals(STRIP_IDENTITY + "_v4.10", canonical.canonicalIdentity());
            assertEquals(Set.of(STRIP_IDENTITY + "_v4.1", STRIP_IDENTITY + "_v4.2"), result.deprecatedIdentities());
            assertEquals(List.of(STRIP_IDENTITY + "_v4.2", STRIP_IDENTITY + "_v4.1"), canonical.supersededIdentities());
        }

        @Test
        @DisplayName("Should select a newer alternate-only version over an older standard one")
        void testNewerAlternateVersionWins() {
            ResolutionResult result = resolver.resolve(List.of(
                    record("seg1_v41", "41", false),
                    record("seg1_v50", "50", true)));

            CanonicalRecord canonical = result.find(ProductClass.STRIP, STRIP_IDENTITY).orElseThrow();
            assertEquals("50", canonical.version());
            assertTrue(canonical.alternateVariant());
            assertEquals(STRIP_IDENTITY + "_v50", canonical.canonicalIdentity());
            assertTrue(result.isDeprecated(STRIP_IDENTITY + "_v41"));
            assertFalse(result.isDeprecated(STRIP_IDENTITY + "_v50"));
        }

        @Test
        @DisplayName("Should rank an unparseable version below a parseable one")
        void testUnparseableVersionLoses() {
            ResolutionResult result = resolver.resolve(List.of(
                    record("seg1_a", "beta", false),
                    record("seg1_b", "1.0", false)));

            assertEquals("1.0", result.canonicalRecords().get(0).version());
            assertTrue(result.isDeprecated(STRIP_IDENTITY + "_vbeta"));
        }

        @Test
        @DisplayName("Should report a conflict when two versions are numerically equal")
        void testNumericTieIsConflict() {
            ResolutionResult result = resolver.resolve(List.of(
                    record("seg1_a", "4.1", false),
                    record("seg1_b", "4.1.0", false)));

            assertEquals(1, result.conflicts().size());
            SelectionConflict conflict = result.conflicts().get(0);
            assertEquals("greatest version string", conflict.criterion());
            assertEquals("4.1.0", conflict.kept());
            assertEquals("4.1", conflict.discarded());
            assertEquals("4.1.0", result.canonicalRecords().get(0).version());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.SELECTION_CONFLICT).size());
        }
    }

    @Nested
    @DisplayName("Variant preference")
    class VariantPreference {

        @Test
        @DisplayName("Should prefer standard variant records at the winning version")
        void testStandardPreferred() {
            UnifiedRecord standard = record("seg1", "4.1", false);
            UnifiedRecord alternate = record("seg1_lsf", "4.1", true);

            ResolutionResult result = resolver.resolve(List.of(alternate, standard));

            CanonicalRecord canonical = result.canonicalRecords().get(0);
            assertFalse(canonical.alternateVariant());
            assertEquals(List.of(standard), canonical.members());
            assertEquals(List.of(alternate), result.nonCanonical());
        }

        @Test
        @DisplayName("Should select alternate records only when every record at the version is alternate")
        void testAllAlternate() {
            ResolutionResult result = resolver.resolve(List.of(
                    record("seg2_lsf", "4.1", true),
                    record("seg1_lsf", "4.1", true)));

            CanonicalRecord canonical = result.canonicalRecords().get(0);
            assertTrue(canonical.alternateVariant());
            assertEquals(List.of("seg1_lsf", "seg2_lsf"),
                    canonical.members().stream().map(UnifiedRecord::sceneOrStripId).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should ignore variants of losing versions")
        void testLosingVersionVariantsIgnored() {
            ResolutionResult result = resolver.resolve(List.of(
                    record("seg1_old", "3.0", false),
                    record("seg1_lsf", "4.1", true)));

            assertTrue(result.canonicalRecords().get(0).alternateVariant());
        }
    }

    @Nested
    @DisplayName("Members and uniqueness")
    class Members {

        @Test
        @DisplayName("Should produce exactly one canonical record per logical identity")
        void testOnePerIdentity() {
            ResolutionResult result = resolver.resolve(List.of(
                    record("A_2m", "A_2m_seg1", "4.1", false),
                    record("A_2m", "A_2m_seg2", "4.1", false),
                    record("B_2m", "B_2m_seg1", "4.1", false),
                    record("B_2m", "B_2m_seg1_old", "3.0", false)));

            assertEquals(2, result.size());
            assertEquals(List.of("A_2m", "B_2m"),
                    result.canonicalRecords().stream().map(CanonicalRecord::logicalIdentity).collect(Collectors.toList()));
            assertEquals(2, result.find(ProductClass.STRIP, "A_2m").orElseThrow().members().size());
        }

        @Test
        @DisplayName("Should resolve product classes independently")
        void testProductClassesIndependent() {
            UnifiedRecord strip = record("X_2m", "X_2m_seg1", "4.1", false);
            UnifiedRecord scene = UnifiedRecord.of(strip.source().toBuilder()
                    .productClass(ProductClass.SCENE)
                    .version("1.0")
                    .build());

            ResolutionResult result = resolver.resolve(List.of(strip, scene));

            assertEquals(2, result.size());
            assertEquals("4.1", result.find(ProductClass.STRIP, "X_2m").orElseThrow().version());
            assertEquals("1.0", result.find(ProductClass.SCENE, "X_2m").orElseThrow().version());
            assertTrue(result.deprecatedIdentities().isEmpty());
        }

        @Test
        @DisplayName("Should keep the smallest location when two members share an id")
        void testMemberConflict() {
            UnifiedRecord first = UnifiedRecord.of(TestRecords.strip("seg1", "4.1").location("/a/seg1_dem.tif").build());
            UnifiedRecord second = UnifiedRecord.of(TestRecords.strip("seg1", "4.1").location("/b/seg1_dem.tif").build());

            ResolutionResult result = resolver.resolve(List.of(second, first));

            CanonicalRecord canonical = result.canonicalRecords().get(0);
            assertEquals(List.of(first), canonical.members());
            assertEquals(List.of(second), result.nonCanonical());
            assertEquals("location and index time", result.conflicts().get(0).criterion());
        }

        @Test
        @DisplayName("Should never drop a record: members plus non-canonical equals the input")
        void testNothingRemoved() {
            List<UnifiedRecord> input = List.of(
                    record("seg1", "4.1", false),
                    record("seg1_lsf", "4.1", true),
                    record("seg1_old", "3.0", false),
                    record("seg2", "4.1", false));

            ResolutionResult result = resolver.resolve(input);

            int members = result.canonicalRecords().stream().mapToInt(c -> c.members().size()).sum();
            assertEquals(input.size(), members + result.nonCanonical().size());
        }

        @Test
        @DisplayName("Should return an empty result for an empty pool")
        void testEmptyPool() {
            ResolutionResult result = resolver.resolve(List.of());

            assertEquals(0, result.size());
            assertTrue(result.nonCanonical().isEmpty());
        }
    }

    @Nested
    @DisplayName("Deprecation")
    class Deprecation {

        @Test
        @DisplayName("Should record superseded identities in the ledger")
        void testLedger() {
            resolver.resolve(List.of(
                    record("seg1_a", "3.0", false),
                    record("seg1_b", "4.1", false)));

            List<DeprecationRecord> records = ledger.getRecordsForLogicalIdentity(STRIP_IDENTITY);
            assertEquals(1, records.size());
            assertEquals(STRIP_IDENTITY + "_v3.0", records.get(0).deprecatedIdentity());
            assertEquals(STRIP_IDENTITY + "_v4.1", records.get(0).canonicalIdentity());
            assertEquals(List.of(STRIP_IDENTITY + "_v3.0"), ledger.getLineage(STRIP_IDENTITY + "_v4.1"));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.IDENTITY_DEPRECATED).size());
        }

        @Test
        @DisplayName("Should flag a canonical record whose identity is on the deprecation list")
        void testDeprecationList() {
            CanonicalVersionResolver withList = new CanonicalVersionResolver(ledger,
                    Set.of(STRIP_IDENTITY + "_v4.1"), auditService, null);

            ResolutionResult result = withList.resolve(List.of(record("seg1", "4.1", false)));

            CanonicalRecord canonical = result.canonicalRecords().get(0);
            assertTrue(canonical.deprecated());
            assertTrue(ledger.isDeprecated(STRIP_IDENTITY + "_v4.1"));
            assertNull(ledger.getAllRecords().get(0).canonicalIdentity());
        }
    }

    @Nested
    @DisplayName("Sharding")
    class Sharding {

        private List<UnifiedRecord> pool() {
            List<UnifiedRecord> records = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String identity = "PAIR" + i + "_2m";
                records.add(record(identity, identity + "_seg1", "4.1", false));
                records.add(record(identity, identity + "_seg1_old", "3.0", false));
            }
            return records;
        }

        @Test
        @DisplayName("Should give the same result when shards are merged")
        void testShardsMerge() {
            List<UnifiedRecord> pool = pool();
            ResolutionResult whole = new CanonicalVersionResolver().resolve(pool);

            List<ResolutionResult> shards = new ArrayList<>();
            CanonicalVersionResolver sharded = new CanonicalVersionResolver();
            for (int shard = 0; shard < 4; shard++) {
                shards.add(sharded.resolveShard(pool, 4, shard));
            }
            ResolutionResult merged = ResolutionResult.merge(shards);

            assertEquals(whole.canonicalRecords(), merged.canonicalRecords());
            assertEquals(whole.deprecatedIdentities(), merged.deprecatedIdentities());
            assertEquals(whole.nonCanonical().size(), merged.nonCanonical().size());
        }

        @Test
        @DisplayName("Should place each identity in exactly one shard")
        void testShardOfStable() {
            int shard = CanonicalVersionResolver.shardOf(STRIP_IDENTITY, 8);

            assertTrue(shard >= 0 && shard < 8);
            assertEquals(shard, CanonicalVersionResolver.shardOf(STRIP_IDENTITY, 8));
            assertEquals(0, CanonicalVersionResolver.shardOf(STRIP_IDENTITY, 1));
        }

        @Test
        @DisplayName("Should reject invalid shard arguments")
        void testInvalidShard() {
            assertThrows(IllegalArgumentException.class, () -> resolver.resolveShard(List.of(), 0, 0));
            assertThrows(IllegalArgumentException.class, () -> resolver.resolveShard(List.of(), 2, 2));
            assertThrows(IllegalArgumentException.class, () -> resolver.resolveShard(List.of(), 2, -1));
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("Should record duration and deprecations per product class")
        void testMetricsRecorded() {
            CanonicalVersionResolver measured = new CanonicalVersionResolver(ledger, Set.of(),
                    auditService, metricsService);

            measured.resolve(List.of(
                    record("seg1_a", "3.0", false),
                    record("seg1_b", "4.1", false)));

            verify(metricsService).recordResolveDuration(eq(ProductClass.STRIP), any(Duration.class));
            verify(metricsService).incrementIdentitiesDeprecated(ProductClass.STRIP, 1L);
        }
    }
}
