package com.elevation.catalog.tree;

import com.elevation.catalog.audit.AuditAction;
import com.elevation.catalog.audit.AuditService;
import com.elevation.catalog.canonical.CanonicalVersionResolver;
import com.elevation.catalog.canonical.ResolutionResult;
import com.elevation.catalog.config.CatalogOptions;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.ReleasePublication;
import com.elevation.catalog.core.model.SourceRecord;
import com.elevation.catalog.core.model.UnifiedRecord;
import com.elevation.catalog.document.CatalogDocumentStore;
import com.elevation.catalog.document.CatalogJson;
import com.elevation.catalog.item.CatalogItemBuilder;
import com.elevation.catalog.item.InMemoryAssetMetadata;
import com.elevation.catalog.item.ItemBatchReport;
import com.elevation.catalog.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.elevation.catalog.testutil.TestRecords.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogTreeBuilder Tests")
class CatalogTreeBuilderTest {

    private static final String BASE = CatalogOptions.DEFAULT_BASE_URL;
    private static final String STRIPS = "arcticdem-strips-s2s041-2m";
    private static final String MOSAICS = "arcticdem-mosaics-v4.1-2m";
    private static final String PARTITION_FILE = "arcticdem/strips/s2s041/2m/n67w132.json";

    @TempDir
    Path root;

    private AuditService auditService;
    private CatalogTreeBuilder treeBuilder;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
        treeBuilder = new CatalogTreeBuilder(auditService, new NoOpMetricsService());
    }

    private void writeItems(List<SourceRecord> records, List<ReleasePublication> publications) {
        List<UnifiedRecord> unified = records.stream().map(UnifiedRecord::of).collect(Collectors.toList());
        ResolutionResult resolution = new CanonicalVersionResolver().resolve(unified);
        CatalogItemBuilder itemBuilder = CatalogItemBuilder.builder()
                .assetInfo(new InMemoryAssetMetadata())
                .build();
        ItemBatchReport report = itemBuilder.buildAll(resolution, publications);
        itemBuilder.writeAll(report, new CatalogDocumentStore(root), true);
    }

    private void writeStrips(String... itemIds) {
        List<SourceRecord> records = new ArrayList<>();
        List<ReleasePublication> publications = new ArrayList<>();
        for (String itemId : itemIds) {
            records.add(strip(itemId, "4.1").build());
            publications.add(stripPublication(itemId));
        }
        writeItems(records, publications);
    }

    private void writeMosaic() {
        writeItems(List.of(mosaicTile().build()), List.of(mosaicPublication()));
    }

    private void writeScene(String sceneId) {
        SourceRecord scene = strip(sceneId, "4.1").productClass(ProductClass.SCENE).build();
        writeItems(List.of(scene), List.of(new ReleasePublication(sceneId, STRIP_IDENTITY, ProductClass.SCENE,
                "arcticdem", "s2s041", "public", Instant.parse("2024-02-01T00:00:00Z"))));
    }

    private JsonNode read(String relativePath) throws IOException {
        return CatalogJson.mapper().readTree(root.resolve(relativePath).toFile());
    }

    private static List<String> rels(JsonNode node) {
        List<String> rels = new ArrayList<>();
        node.path("links").forEach(l -> rels.add(l.path("rel").asText()));
        return rels;
    }

    private static List<String> childHrefs(JsonNode node) {
        List<String> hrefs = new ArrayList<>();
        node.path("links").forEach(l -> {
            if ("child".equals(l.path("rel").asText())) {
                hrefs.add(l.path("href").asText());
            }
        });
        return hrefs;
    }

    private Map<String, byte[]> snapshot(TreeBuildResult result) throws IOException {
        Map<String, byte[]> files = new LinkedHashMap<>();
        for (NodeDocument node : result.nodes()) {
            files.put(node.relativePath(), Files.readAllBytes(root.resolve(node.relativePath())));
        }
        return files;
    }

    @Nested
    @DisplayName("Full Build")
    class FullBuild {

        @Test
        @DisplayName("Should write one node per level up to the top catalog")
        void testNodeFiles() {
            writeStrips(SEG1, SEG2);

            TreeBuildResult result = treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertEquals(2, result.itemCount());
            assertFalse(result.hasFailures());
            assertEquals(List.of(PARTITION_FILE, "arcticdem/strips/s2s041/2m.json", "arcticdem/strips/s2s041.json",
                            "arcticdem/strips.json", "arcticdem.json", "pgc-data-stac.json"),
                    result.nodes().stream().map(NodeDocument::relativePath).collect(Collectors.toList()));
            for (NodeDocument node : result.nodes()) {
                assertTrue(Files.exists(root.resolve(node.relativePath())), node.relativePath());
            }
        }

        @Test
        @DisplayName("Should link a partition to its release, its collection and its items")
        void testPartitionNode() throws IOException {
            writeStrips(SEG2, SEG1);
            treeBuilder.build(root, TreeBuildOptions.overwriting());

            JsonNode partition = read(PARTITION_FILE);

            assertEquals("Catalog", partition.get("type").asText());
            assertEquals("arcticdem-strips-s2s041-2m-n67w132", partition.get("id").asText());
            assertEquals("Geocell n67w132", partition.get("title").asText());
            assertFalse(partition.has("extent"));
            assertFalse(partition.has("providers"));
            assertEquals(List.of("self", "root", "parent", "child", "child"), rels(partition));
            assertEquals(BASE + "/" + PARTITION_FILE, partition.get("links").get(0).get("href").asText());
            assertEquals(BASE + "/arcticdem/strips/s2s041.json", partition.get("links").get(1).get("href").asText());
            assertEquals(BASE + "/arcticdem/strips/s2s041/2m.json", partition.get("links").get(2).get("href").asText());
            assertEquals(List.of(
                    BASE + "/arcticdem/strips/s2s041/2m/n67w132/" + SEG1 + ".json",
                    BASE + "/arcticdem/strips/s2s041/2m/n67w132/" + SEG2 + ".json"), childHrefs(partition));
            assertEquals("application/geo+json", partition.get("links").get(3).get("type").asText());
        }

        @Test
        @DisplayName("Should give collections an extent merged from their items")
        void testCollectionExtent() throws IOException {
            writeStrips(SEG1);
            treeBuilder.build(root, TreeBuildOptions.overwriting());

            JsonNode collection = read("arcticdem/strips/s2s041/2m.json");

            assertEquals("Collection", collection.get("type").asText());
            assertEquals(STRIPS, collection.get("id").asText());
            assertEquals("ArcticDEM 2m DEM Strips, version s2s041", collection.get("title").asText());
            JsonNode bbox = collection.get("extent").get("spatial").get("bbox").get(0);
            assertEquals(-131.8, bbox.get(0).asDouble());
            assertEquals(67.2, bbox.get(1).asDouble());
            assertEquals(-131.4, bbox.get(2).asDouble());
            assertEquals(67.6, bbox.get(3).asDouble());
            JsonNode interval = collection.get("extent").get("temporal").get("interval").get(0);
            assertEquals("2020-01-01T21:35:10Z", interval.get(0).asText());
            assertTrue(interval.get(1).isNull());
            assertEquals(2, collection.get("providers").size());
            assertFalse(collection.has("license"));
        }

        @Test
        @DisplayName("Should carry the license on the domain node and no parent on the top catalog")
        void testUpperLevels() throws IOException {
            writeStrips(SEG1);
            writeMosaic();
            treeBuilder.build(root, TreeBuildOptions.overwriting());

            JsonNode domain = read("arcticdem.json");
            JsonNode top = read("pgc-data-stac.json");

            assertEquals("CC-BY-4.0", domain.get("license").asText());
            assertEquals("ArcticDEM", domain.get("title").asText());
            assertEquals(List.of(BASE + "/arcticdem/mosaics.json", BASE + "/arcticdem/strips.json"),
                    childHrefs(domain));
            assertEquals("pgc-data-stac", top.get("id").asText());
            assertEquals("Catalog", top.get("type").asText());
            assertEquals(List.of("self", "root", "child"), rels(top));
            assertFalse(top.has("extent"));
        }

        @Test
        @DisplayName("Should recognise scene items by document type rather than file name")
        void testSceneCollection() throws IOException {
            String sceneId = PAIR + "_P1_2m";
            writeScene(sceneId);

            TreeBuildResult result = treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertEquals(1, result.itemCount());
            assertFalse(result.hasFailures());
            assertEquals(List.of(BASE + "/arcticdem/scenes/s2s041/2m/n67w132/" + sceneId + ".json"),
                    childHrefs(read("arcticdem/scenes/s2s041/2m/n67w132.json")));
            assertEquals("arcticdem-scenes-s2s041-2m", read("arcticdem/scenes/s2s041/2m.json").get("id").asText());
            assertEquals(List.of(BASE + "/arcticdem/scenes.json"), childHrefs(read("arcticdem.json")));
        }

        @Test
        @DisplayName("Should pass over node documents and stray JSON files that are not items")
        void testIgnoresNonItemDocuments() throws IOException {
            writeStrips(SEG1);
            treeBuilder.build(root, TreeBuildOptions.overwriting());
            Files.writeString(root.resolve("arcticdem/strips/s2s041/2m/n67w132/notes.json"), "{\"type\":\"Note\"}");

            TreeBuildResult result = treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertEquals(1, result.itemCount());
            assertFalse(result.hasFailures());
            assertEquals(1, childHrefs(read(PARTITION_FILE)).size());
        }

        @Test
        @DisplayName("Should write only the top catalog for an empty root")
        void testEmptyRoot() throws IOException {
            TreeBuildResult result = treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertEquals(1, result.nodes().size());
            assertEquals(0, result.itemCount());
            assertTrue(childHrefs(read("pgc-data-stac.json")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Overwrite")
    class Overwrite {

        @Test
        @DisplayName("Should produce byte-identical documents when rebuilt from unchanged items")
        void testDeterministic() throws IOException {
            writeStrips(SEG1, SEG2);
            writeMosaic();
            Map<String, byte[]> first = snapshot(treeBuilder.build(root, TreeBuildOptions.overwriting()));

            Map<String, byte[]> second = snapshot(treeBuilder.build(root, TreeBuildOptions.overwriting()));

            assertEquals(first.keySet(), second.keySet());
            for (String path : first.keySet()) {
                assertTrue(Arrays.equals(first.get(path), second.get(path)), path);
            }
        }

        @Test
        @DisplayName("Should keep existing nodes, even stale ones, unless overwrite is requested")
        void testKeepsStaleNodes() throws IOException {
            writeStrips(SEG1);
            treeBuilder.build(root, TreeBuildOptions.defaults());
            writeStrips(SEG2);

            TreeBuildResult kept = treeBuilder.build(root, TreeBuildOptions.defaults());

            assertTrue(kept.writtenNodes().isEmpty());
            assertEquals(6, kept.keptNodes().size());
            assertEquals(1, childHrefs(read(PARTITION_FILE)).size());
            assertEquals(6, auditService.getEntriesByAction(AuditAction.NODE_SKIPPED).size());

            TreeBuildResult replaced = treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertEquals(6, replaced.writtenNodes().size());
            assertEquals(2, childHrefs(read(PARTITION_FILE)).size());
        }
    }

    @Nested
    @DisplayName("Layout Checks")
    class LayoutChecks {

        @Test
        @DisplayName("Should report an item outside its expected directory and build the rest")
        void testMisplacedItem() throws IOException {
            writeStrips(SEG1);
            Path misplaced = root.resolve("arcticdem/strips/s2s099/2m/n67w132/" + SEG1 + ".json");
            Files.createDirectories(misplaced.getParent());
            Files.copy(root.resolve("arcticdem/strips/s2s041/2m/n67w132/" + SEG1 + ".json"), misplaced);

            TreeBuildResult result = treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertEquals(1, result.itemCount());
            assertEquals(1, result.failures().size());
            assertEquals("arcticdem/strips/s2s099/2m/n67w132/" + SEG1 + ".json", result.failures().get(0).relativePath());
            assertTrue(result.failures().get(0).reason().startsWith("Directory tree not as expected"));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.ITEM_FAILED).size());
            assertFalse(Files.exists(root.resolve("arcticdem/strips/s2s099.json")));
        }

        @Test
        @DisplayName("Should report an item nested too deep")
        void testTooDeep() throws IOException {
            writeStrips(SEG1);
            Path nested = root.resolve("arcticdem/strips/s2s041/2m/n67w132/extra/" + SEG1 + ".json");
            Files.createDirectories(nested.getParent());
            Files.copy(root.resolve("arcticdem/strips/s2s041/2m/n67w132/" + SEG1 + ".json"), nested);

            TreeBuildResult result = treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertEquals(1, result.failures().size());
            assertEquals("Directory tree not as expected for " + STRIPS, result.failures().get(0).reason());
        }
    }

    @Nested
    @DisplayName("Incremental Builds")
    class IncrementalBuilds {

        @Test
        @DisplayName("Should rebuild one partition node from its directory")
        void testBuildPartition() throws IOException {
            writeStrips(SEG1);
            treeBuilder.build(root, TreeBuildOptions.overwriting());
            writeStrips(SEG2);

            TreeBuildResult result = treeBuilder.buildPartition(root, STRIPS, GEOCELL, TreeBuildOptions.overwriting());

            assertEquals(1, result.nodes().size());
            assertEquals(2, result.itemCount());
            assertEquals(2, childHrefs(read(PARTITION_FILE)).size());
        }

        @Test
        @DisplayName("Should add a new collection and re-aggregate its ancestors from disk")
        void testRebuildCollections() throws IOException {
            writeStrips(SEG1);
            treeBuilder.build(root, TreeBuildOptions.overwriting());
            byte[] stripCollection = Files.readAllBytes(root.resolve("arcticdem/strips/s2s041/2m.json"));
            writeMosaic();

            TreeBuildResult result = treeBuilder.rebuildCollections(root, Set.of(MOSAICS), TreeBuildOptions.overwriting());

            assertEquals(1, result.itemCount());
            assertTrue(Files.exists(root.resolve("arcticdem/mosaics/v4.1/2m/44_74.json")));
            assertTrue(Files.exists(root.resolve("arcticdem/mosaics/v4.1.json")));
            assertEquals(List.of(BASE + "/arcticdem/mosaics.json", BASE + "/arcticdem/strips.json"),
                    childHrefs(read("arcticdem.json")));
            assertEquals(List.of(BASE + "/arcticdem.json"), childHrefs(read("pgc-data-stac.json")));
            assertArrayEquals(stripCollection, Files.readAllBytes(root.resolve("arcticdem/strips/s2s041/2m.json")));
            assertEquals("Tile Catalog 44_74", read("arcticdem/mosaics/v4.1/2m/44_74.json").get("title").asText());
        }

        @Test
        @DisplayName("Should match a full build after an incremental one")
        void testIncrementalMatchesFull() throws IOException {
            writeStrips(SEG1);
            treeBuilder.build(root, TreeBuildOptions.overwriting());
            writeMosaic();
            treeBuilder.rebuildCollections(root, Set.of(MOSAICS), TreeBuildOptions.overwriting());
            byte[] domain = Files.readAllBytes(root.resolve("arcticdem.json"));

            treeBuilder.build(root, TreeBuildOptions.overwriting());

            assertArrayEquals(domain, Files.readAllBytes(root.resolve("arcticdem.json")));
        }
    }
}
