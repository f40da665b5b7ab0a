package com.elevation.catalog.document;

import com.elevation.catalog.config.CatalogTables;
import com.elevation.catalog.core.model.Coordinate;
import com.elevation.catalog.core.model.Footprint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CatalogDocumentSerializationTest {

    private static JsonNode toTree(Object document) throws JsonProcessingException {
        return CatalogJson.mapper().readTree(CatalogJson.lineWriter().writeValueAsString(document));
    }

    @Test
    @DisplayName("Should omit the title of an untitled link")
    void testLinkWithoutTitle() throws JsonProcessingException {
        JsonNode link = toTree(Link.self(null, "https://example.org/x.json", Link.GEO_JSON));

        assertFalse(link.has("title"));
        assertEquals("self", link.get("rel").asText());
        assertEquals("application/geo+json", link.get("type").asText());
    }

    @Test
    @DisplayName("Should write item properties in order and keep null values")
    void testItemProperties() throws JsonProcessingException {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("title", "X_2m_seg1");
        properties.put("gsd", null);
        properties.put("proj:code", null);
        CatalogItem item = new CatalogItem("X_2m_seg1", List.of(-1.0, -1.0, 1.0, 1.0),
                List.of(Link.self(null, "https://example.org/x.json", Link.GEO_JSON)), Map.of(),
                Geometry.of(Footprint.box(Footprint.WGS84, -1, -1, 1, 1)), "arcticdem-strips-s2s041-2m",
                properties, "1.1.0", List.of());

        String json = CatalogJson.lineWriter().writeValueAsString(item);
        JsonNode tree = CatalogJson.mapper().readTree(json);

        assertEquals("Feature", tree.get("type").asText());
        assertEquals("1.1.0", tree.get("stac_version").asText());
        assertTrue(tree.get("properties").has("gsd"));
        assertTrue(tree.get("properties").get("gsd").isNull());
        assertTrue(json.indexOf("\"gsd\"") < json.indexOf("\"proj:code\""));
        assertTrue(json.startsWith("{\"id\":\"X_2m_seg1\",\"bbox\""));
        assertEquals("Polygon", tree.get("geometry").get("type").asText());
    }

    @Test
    @DisplayName("Should write a MultiPolygon for several rings")
    void testMultiPolygon() throws JsonProcessingException {
        Footprint footprint = new Footprint(Footprint.WGS84, List.of(
                Footprint.box(Footprint.WGS84, 0, 0, 1, 1).polygons().get(0),
                List.of(Coordinate.of(2, 2), Coordinate.of(3, 2), Coordinate.of(3, 3), Coordinate.of(2, 2))));

        JsonNode geometry = toTree(Geometry.of(footprint));

        assertEquals("MultiPolygon", geometry.get("type").asText());
        assertEquals(2, geometry.get("coordinates").size());
        assertEquals(5, geometry.get("coordinates").get(0).get(0).size());
    }

    @Test
    @DisplayName("Should write asset projection fields and the s3 alternate")
    void testAsset() throws JsonProcessingException {
        Map<String, Object> projection = new LinkedHashMap<>();
        projection.put("gsd", 2.0);
        projection.put("proj:code", null);
        Asset asset = Asset.builder()
                .title("2m DEM")
                .href("https://example.org/a_dem.tif", "s3://bucket/a_dem.tif")
                .type("image/tiff")
                .roles(List.of("data"))
                .nodata(-9999)
                .projection(projection)
                .build();

        JsonNode tree = toTree(asset);

        assertEquals("s3://bucket/a_dem.tif", tree.get("alternate").get("s3").get("href").asText());
        assertEquals(-9999, tree.get("nodata").asInt());
        assertFalse(tree.has("unit"));
        assertFalse(tree.has("data_type"));
        assertFalse(tree.has("projection"));
        assertEquals(2.0, tree.get("gsd").asDouble());
        assertTrue(tree.get("proj:code").isNull());
    }

    @Test
    @DisplayName("Should write collection extents with an open-ended interval")
    void testNodeExtent() throws JsonProcessingException {
        CatalogNode node = new CatalogNode("Collection", "1.1.0", "arcticdem", "ArcticDEM", "ArcticDEM digital elevation models",
                "CC-BY-4.0", CatalogTables.defaults().providers(),
                Extent.of(List.of(-1.0, -2.0, 3.0, 4.0), "2020-01-01T00:00:00Z"),
                List.of(Link.self("ArcticDEM", "https://example.org/arcticdem.json", Link.JSON)));

        JsonNode tree = toTree(node);

        assertEquals(-2.0, tree.get("extent").get("spatial").get("bbox").get(0).get(1).asDouble());
        JsonNode interval = tree.get("extent").get("temporal").get("interval").get(0);
        assertEquals("2020-01-01T00:00:00Z", interval.get(0).asText());
        assertTrue(interval.get(1).isNull());
        assertEquals("maxar", tree.get("providers").get(0).get("name").asText());
        assertFalse(tree.has("children"));
    }

    @Test
    @DisplayName("Should omit license, providers and extent of plain catalogs")
    void testCatalogNode() throws JsonProcessingException {
        CatalogNode node = new CatalogNode("Catalog", "1.1.0", "pgc-data-stac", "PGC Data Catalog", "d",
                null, null, null, List.of());

        JsonNode tree = toTree(node);

        assertFalse(tree.has("license"));
        assertFalse(tree.has("providers"));
        assertFalse(tree.has("extent"));
        assertTrue(tree.get("links").isArray());
        assertTrue(toTree(node.withoutLinks()).get("links").isEmpty());
    }
}
