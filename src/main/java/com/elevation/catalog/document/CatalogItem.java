package com.elevation.catalog.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable item document of one published product.
 * Properties keep their insertion order and may hold null values.
 */
@JsonPropertyOrder({"id", "bbox", "type", "links", "assets", "geometry", "collection", "properties",
        "stac_version", "stac_extensions"})
public record CatalogItem(
        String id,
        List<Double> bbox,
        List<Link> links,
        Map<String, Asset> assets,
        Geometry geometry,
        String collection,
        Map<String, Object> properties,
        @JsonProperty("stac_version") String stacVersion,
        @JsonProperty("stac_extensions") List<String> stacExtensions
) {
    public static final String TYPE = "Feature";

    public CatalogItem {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(geometry, "geometry is required");
        Objects.requireNonNull(collection, "collection is required");
        bbox = List.copyOf(bbox);
        links = List.copyOf(links);
        assets = Collections.unmodifiableMap(new LinkedHashMap<>(assets));
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        stacExtensions = stacExtensions != null ? List.copyOf(stacExtensions) : List.of();
    }

    @JsonProperty("type")
    public String type() {
        return TYPE;
    }

    public Optional<Link> link(String rel) {
        return links.stream().filter(l -> l.rel().equals(rel)).findFirst();
    }

    public Object property(String key) {
        return properties.get(key);
    }
}
