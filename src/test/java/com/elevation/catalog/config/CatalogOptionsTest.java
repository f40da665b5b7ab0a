package com.elevation.catalog.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CatalogOptionsTest {

    @Test
    @DisplayName("Should have sensible defaults")
    void testDefaults() {
        CatalogOptions options = CatalogOptions.defaults();

        assertEquals(CatalogOptions.DEFAULT_BASE_URL, options.getBaseUrl());
        assertEquals(CatalogOptions.DEFAULT_S3_BASE_URL, options.getS3BaseUrl());
        assertEquals("pgc-data-stac.json", options.getRootCatalogFile());
        assertEquals("pgc-data-stac", options.getRootCatalogId());
        assertEquals("CC-BY-4.0", options.getLicense());
        assertTrue(options.isPublic("public"));
        assertFalse(options.isPublic("restricted"));
        assertFalse(options.isPublic(null));
    }

    @Test
    @DisplayName("Should trim a trailing slash from base urls")
    void testTrimSlash() {
        CatalogOptions options = CatalogOptions.builder()
                .baseUrl("https://example.org/dems/")
                .s3BaseUrl("s3://bucket/")
                .build();

        assertEquals("https://example.org/dems", options.getBaseUrl());
        assertEquals("s3://bucket", options.getS3BaseUrl());
    }

    @Test
    @DisplayName("Should accept custom publication classes")
    void testPublicClasses() {
        CatalogOptions options = CatalogOptions.builder()
                .publicLicenseClasses(Set.of("public", "academic"))
                .build();

        assertTrue(options.isPublic("academic"));
    }

    @Test
    @DisplayName("Should reject invalid values")
    void testValidation() {
        CatalogOptions.Builder builder = CatalogOptions.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.baseUrl(" "));
        assertThrows(IllegalArgumentException.class, () -> builder.rootCatalogFile("catalog.xml"));
        assertThrows(IllegalArgumentException.class, () -> builder.rootCatalogFile("dir/catalog.json"));
        assertThrows(IllegalArgumentException.class, () -> builder.publicLicenseClasses(Set.of()));
        assertThrows(IllegalArgumentException.class, () -> builder.rootCatalog("", "Title"));
    }

    @Test
    @DisplayName("Should substitute asset file and title templates")
    void testAssetDefinitionTemplates() {
        AssetDefinition definition = new AssetDefinition("metadata", "{resolution} metadata",
                "{partition}_{resolution}_{release}_dem_meta.txt", "text/plain", List.of("metadata"),
                null, null, null, null, null);

        assertEquals("44_74_2m_v3.0_dem_meta.txt", definition.fileName("tile", "44_74", "2m", "v3.0"));
        assertEquals("2m metadata", definition.title("2m"));
        assertTrue(definition.appliesTo("rema"));
        assertThrows(IllegalArgumentException.class, () -> new AssetDefinition("dem", null, " ",
                null, null, null, null, null, null, null));
    }
}
