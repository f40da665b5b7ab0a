package com.elevation.catalog.document;

import com.elevation.catalog.core.CatalogWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CatalogDocumentStoreTest {

    @TempDir
    Path root;

    private CatalogDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new CatalogDocumentStore(root);
    }

    @Test
    @DisplayName("Should create directories and write the document")
    void testWrite() throws IOException {
        boolean written = store.write("arcticdem/strips.json", Map.of("id", "arcticdem-strips"), false);

        assertTrue(written);
        assertTrue(store.exists("arcticdem/strips.json"));
        String content = Files.readString(root.resolve("arcticdem/strips.json"), StandardCharsets.UTF_8);
        assertTrue(content.contains("\"id\" : \"arcticdem-strips\""));
    }

    @Test
    @DisplayName("Should keep an existing document unless overwrite is requested")
    void testNoOverwrite() throws IOException {
        Path file = root.resolve("arcticdem.json");
        Files.writeString(file, "stale", StandardCharsets.UTF_8);

        assertFalse(store.write("arcticdem.json", Map.of("id", "arcticdem"), false));
        assertEquals("stale", Files.readString(file, StandardCharsets.UTF_8));

        assertTrue(store.write("arcticdem.json", Map.of("id", "arcticdem"), true));
        assertNotEquals("stale", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should leave no temporary files behind")
    void testNoTempFiles() throws IOException {
        store.write("a/b.json", Map.of("id", "b"), true);
        store.write("a/b.json", Map.of("id", "b2"), true);

        try (Stream<Path> files = Files.list(root.resolve("a"))) {
            assertEquals(List.of("b.json"), files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    @DisplayName("Should fail without touching the target when serialization fails")
    void testSerializationFailure() throws IOException {
        Path file = root.resolve("broken.json");
        Files.writeString(file, "previous", StandardCharsets.UTF_8);
        Object unserializable = new Object() {
            @SuppressWarnings("unused")
            public Object getSelf() {
                return this;
            }
        };

        assertThrows(CatalogWriteException.class, () -> store.write("broken.json", unserializable, true));
        assertEquals("previous", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should reject paths that escape the catalog root")
    void testEscape() {
        assertThrows(IllegalArgumentException.class, () -> store.write("../outside.json", Map.of(), true));
    }
}
