package com.elevation.catalog.source;

import com.elevation.catalog.core.CatalogWriteException;
import com.elevation.catalog.core.model.Coordinate;
import com.elevation.catalog.core.model.Footprint;
import com.elevation.catalog.core.model.ProcessingMetadata;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.SourcePool;
import com.elevation.catalog.core.model.SourceRecord;
import com.elevation.catalog.geo.GeographicReprojector;
import com.elevation.catalog.geo.Geocells;
import com.elevation.catalog.document.CatalogJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON Lines (NDJSON) record source: one record object per line.
 *
 * <pre>
 * {"productClass": "strips", "sceneOrStripId": "WV01_20200101_..._2m_seg1", "logicalIdentity": "WV01_20200101_..._2m",
 *  "version": "4.1", "alternateVariant": false, "resolution": "2m", "location": "/mnt/...", "indexedAt": "2024-01-01T00:00:00Z",
 *  "spatialPartition": "n67w132", "footprint": {"crs": "EPSG:3413", "coordinates": [[[x, y], ...]]},
 *  "acquisitionStart": "...", "acquisitionEnd": "...", "metadata": {"sensor1": "WV01", ...}}
 * </pre>
 *
 * <p>Lines that are not valid JSON are logged and counted but never abort the read.
 * Missing or malformed identity fields are left null so the union engine rejects and reports them.
 * When {@code spatialPartition} is absent it is derived as the geocell of the footprint center.</p>
 */
public class JsonLinesRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordSource.class);

    private final String name;
    private final SourcePool pool;
    private final Path path;
    private final GeographicReprojector reprojector;
    private final List<String> parseErrors = Collections.synchronizedList(new ArrayList<>());

    public JsonLinesRecordSource(String name, SourcePool pool, Path path) {
        this(name, pool, path, new GeographicReprojector());
    }

    public JsonLinesRecordSource(String name, SourcePool pool, Path path, GeographicReprojector reprojector) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.pool = Objects.requireNonNull(pool, "pool is required");
        this.path = Objects.requireNonNull(path, "path is required");
        this.reprojector = reprojector;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourcePool pool() {
        return pool;
    }

    @Override
    public List<SourceRecord> read(ProductClass productClass) {
        List<SourceRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                JsonNode node;
                try {
                    node = CatalogJson.mapper().readTree(line);
                } catch (JsonProcessingException e) {
                    parseErrors.add(path + ":" + lineNumber + " " + e.getOriginalMessage());
                    log.warn("source.parse.error source={} line={} error={}", name, lineNumber, e.getOriginalMessage());
                    continue;
                }
                ProductClass recordClass = productClassOf(node);
                if (recordClass == productClass) {
                    records.add(toRecord(node, recordClass, lineNumber));
                }
            }
        } catch (IOException e) {
            throw new CatalogWriteException("Failed to read record source", path, e);
        }
        log.debug("source.read source={} productClass={} records={}", name, productClass, records.size());
        return records;
    }

    /**
     * Lines that could not be parsed during previous reads.
     */
    public List<String> getParseErrors() {
        return List.copyOf(parseErrors);
    }

    private ProductClass productClassOf(JsonNode node) {
        String kind = text(node, "productClass");
        if (kind == null) {
            return ProductClass.STRIP;
        }
        for (ProductClass candidate : ProductClass.values()) {
            if (candidate.getKind().equalsIgnoreCase(kind) || candidate.name().equalsIgnoreCase(kind)) {
                return candidate;
            }
        }
        log.warn("source.productClass.unknown source={} productClass='{}'", name, kind);
        return null;
    }

    private SourceRecord toRecord(JsonNode node, ProductClass productClass, long lineNumber) {
        Footprint footprint = footprint(node.get("footprint"), lineNumber);
        String partition = text(node, "spatialPartition");
        if (partition == null && footprint != null) {
            partition = geocellOf(footprint, lineNumber);
        }
        SourceRecord.Builder builder = SourceRecord.builder()
                .productClass(productClass)
                .sceneOrStripId(text(node, "sceneOrStripId"))
                .logicalIdentity(text(node, "logicalIdentity"))
                .version(text(node, "version"))
                .alternateVariant(node.path("alternateVariant").asBoolean(false))
                .resolution(text(node, "resolution"))
                .location(text(node, "location"))
                .indexedAt(instant(node, "indexedAt"))
                .pool(pool)
                .spatialPartition(partition)
                .footprint(footprint)
                .acquisition(instant(node, "acquisitionStart"), instant(node, "acquisitionEnd"))
                .metadata(metadata(node.path("metadata")));
        if (node.hasNonNull("sourcePriority")) {
            builder.sourcePriority(node.get("sourcePriority").asInt());
        }
        return builder.build();
    }

    /**
     * Geocell of the footprint center, or null when the footprint cannot be reprojected.
     */
    private String geocellOf(Footprint footprint, long lineNumber) {
        try {
            Coordinate center = reprojector.geographicCenter(footprint);
            return Geocells.of(center.y(), center.x());
        } catch (IllegalArgumentException e) {
            parseErrors.add(path + ":" + lineNumber + " " + e.getMessage());
            log.warn("source.partition.underivable source={} line={} error={}", name, lineNumber, e.getMessage());
            return null;
        }
    }

    private Footprint footprint(JsonNode node, long lineNumber) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            String crs = node.path("crs").asText(Footprint.WGS84);
            List<List<Coordinate>> polygons = new ArrayList<>();
            for (JsonNode ring : node.path("coordinates")) {
                List<Coordinate> coordinates = new ArrayList<>();
                for (JsonNode point : ring) {
                    coordinates.add(coordinate(point));
                }
                polygons.add(coordinates);
            }
            return new Footprint(crs, polygons);
        } catch (IllegalArgumentException e) {
            parseErrors.add(path + ":" + lineNumber + " " + e.getMessage());
            log.warn("source.footprint.invalid source={} line={} error={}", name, lineNumber, e.getMessage());
            return null;
        }
    }

    private static Coordinate coordinate(JsonNode point) {
        if (!point.isArray() || point.size() < 2 || !point.get(0).isNumber() || !point.get(1).isNumber()) {
            throw new IllegalArgumentException("coordinate must be an array of two numbers: " + point);
        }
        return Coordinate.of(point.get(0).asDouble(), point.get(1).asDouble());
    }

    private ProcessingMetadata metadata(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return ProcessingMetadata.empty();
        }
        Map<String, Long> fileSizes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> sizes = node.path("fileSizes").fields();
        while (sizes.hasNext()) {
            Map.Entry<String, JsonNode> entry = sizes.next();
            fileSizes.put(entry.getKey(), entry.getValue().asLong());
        }
        return ProcessingMetadata.builder()
                .pairname(text(node, "pairname"))
                .sensors(text(node, "sensor1"), text(node, "sensor2"))
                .catalogIds(text(node, "catalogId1"), text(node, "catalogId2"))
                .algorithmVersion(text(node, "algorithmVersion"))
                .s2sVersion(text(node, "s2sVersion"))
                .crossTrack(node.hasNonNull("crossTrack") ? node.get("crossTrack").asBoolean() : null)
                .rmse(number(node, "rmse"))
                .avgConvergenceAngle(number(node, "avgConvergenceAngle"))
                .avgExpectedHeightAccuracy(number(node, "avgExpectedHeightAccuracy"))
                .avgSunElevations(number(node, "avgSunElevation1"), number(node, "avgSunElevation2"))
                .densities(number(node, "maskedDensity"), number(node, "validDensity"))
                .validArea(number(node, "validAreaSqkm"), number(node, "validAreaPercent"))
                .waterArea(number(node, "waterAreaSqkm"), number(node, "waterAreaPercent"))
                .cloudArea(number(node, "cloudAreaSqkm"), number(node, "cloudAreaPercent"))
                .creationDate(instant(node, "creationDate"))
                .tile(text(node, "tile"))
                .dataPercent(number(node, "dataPercent"))
                .fileSizes(fileSizes)
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || !value.isNumber() ? null : value.asDouble();
    }

    private Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("source.timestamp.invalid source={} field={} value='{}'", name, field, value);
            return null;
        }
    }
}
