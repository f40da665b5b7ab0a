package com.elevation.catalog.document;

import com.elevation.catalog.config.CatalogTables;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable catalog or collection document of one tree level.
 * Links are self, root and parent (absent on the top catalog) followed by child links.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "stac_version", "id", "title", "description", "license", "providers",
        "extent", "links"})
public record CatalogNode(
        String type,
        @JsonProperty("stac_version") String stacVersion,
        String id,
        String title,
        String description,
        String license,
        List<CatalogTables.Provider> providers,
        Extent extent,
        List<Link> links
) {
    public CatalogNode {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(id, "id is required");
        providers = providers != null ? List.copyOf(providers) : null;
        links = List.copyOf(links);
    }

    public Optional<Link> link(String rel) {
        return links.stream().filter(l -> l.rel().equals(rel)).findFirst();
    }

    @JsonIgnore
    public List<Link> children() {
        return links.stream().filter(l -> l.rel().equals("child")).collect(Collectors.toList());
    }

    /**
     * Copy without links, as projected into the lookup feed.
     */
    public CatalogNode withoutLinks() {
        return new CatalogNode(type, stacVersion, id, title, description, license, providers, extent, List.of());
    }
}
