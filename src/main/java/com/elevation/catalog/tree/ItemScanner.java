package com.elevation.catalog.tree;

import com.elevation.catalog.core.CatalogWriteException;
import com.elevation.catalog.document.CatalogItem;
import com.elevation.catalog.document.CatalogJson;
import com.elevation.catalog.document.CollectionKey;
import com.elevation.catalog.document.HrefBuilder;
import com.elevation.catalog.document.NodeLevel;
import com.elevation.catalog.document.NodePath;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds item documents below a catalog root and checks that each one sits at
 * {@code {domain}/{kind}/{release}/{resolution}/{partition}/{id}.json} matching its collection id.
 * Any {@code .json} document of type {@value CatalogItem#TYPE} is an item; node documents are passed over.
 */
public class ItemScanner {
    private static final Logger log = LoggerFactory.getLogger(ItemScanner.class);

    private final HrefBuilder hrefs;

    public ItemScanner(HrefBuilder hrefs) {
        this.hrefs = hrefs;
    }

    public record ScanResult(List<ScannedItem> items, List<ScanFailure> failures) {
        public ScanResult {
            items = List.copyOf(items);
            failures = List.copyOf(failures);
        }
    }

    /**
     * Scans the subtree of {@code under}; a missing directory yields an empty result.
     *
     * @throws CatalogWriteException if the directory cannot be walked
     */
    public ScanResult scan(Path root, NodePath under) {
        Path start = under.segments().isEmpty() ? root : root.resolve(under.directory());
        List<ScannedItem> items = new ArrayList<>();
        List<ScanFailure> failures = new ArrayList<>();
        if (!Files.isDirectory(start)) {
            return new ScanResult(items, failures);
        }
        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(start)) {
            candidates = walk
                    .filter(Files::isRegularFile)
                    .filter(ItemScanner::isJsonFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CatalogWriteException("Failed to scan catalog directory", start, e);
        }
        for (Path file : candidates) {
            String relative = relativize(root, file);
            try {
                JsonNode doc = CatalogJson.mapper().readTree(file.toFile());
                if (isItem(doc)) {
                    items.add(read(doc, relative));
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("scan.skipped path={} reason={}", relative, e.getMessage());
                failures.add(new ScanFailure(relative, e.getMessage()));
            }
        }
        log.debug("scan.completed root={} under={} items={} failures={}", root, under, items.size(), failures.size());
        return new ScanResult(items, failures);
    }

    static boolean isJsonFile(Path file) {
        return file.getFileName().toString().endsWith(".json");
    }

    static boolean isItem(JsonNode doc) {
        return CatalogItem.TYPE.equals(text(doc, "type"));
    }

    private ScannedItem read(JsonNode doc, String relative) {
        String id = text(doc, "id");
        String collectionId = text(doc, "collection");
        if (id == null || collectionId == null) {
            throw new IllegalArgumentException("item document lacks id or collection");
        }
        CollectionKey key = CollectionKey.parse(collectionId);

        String[] segments = relative.split("/");
        if (segments.length != NodeLevel.PARTITION.ordinal() + 1) {
            throw new IllegalArgumentException("Directory tree not as expected for " + collectionId);
        }
        NodePath partition = NodePath.partition(key, segments[NodeLevel.PARTITION.ordinal() - 1]);
        String expected = partition.itemPath(id);
        if (!expected.equals(relative)) {
            throw new IllegalArgumentException("Directory tree not as expected: item belongs at " + expected);
        }

        JsonNode properties = doc.path("properties");
        String title = properties.hasNonNull("title") ? properties.get("title").asText() : id;
        return new ScannedItem(partition, id, collectionId, title, selfHref(doc, partition, id),
                bbox(doc.path("bbox")), text(properties, "datetime"));
    }

    private String selfHref(JsonNode doc, NodePath partition, String id) {
        for (JsonNode link : doc.path("links")) {
            if ("self".equals(link.path("rel").asText()) && link.hasNonNull("href")) {
                return link.get("href").asText();
            }
        }
        return hrefs.item(partition, id);
    }

    static List<Double> bbox(JsonNode node) {
        if (!node.isArray() || node.size() != 4) {
            return null;
        }
        List<Double> bbox = new ArrayList<>(4);
        for (JsonNode value : node) {
            if (!value.isNumber()) {
                return null;
            }
            bbox.add(value.asDouble());
        }
        return bbox;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
