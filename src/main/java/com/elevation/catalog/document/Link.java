package com.elevation.catalog.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A typed link between catalog documents.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"rel", "title", "href", "type"})
public record Link(String rel, String title, String href, String type) {

    public static final String JSON = "application/json";
    public static final String GEO_JSON = "application/geo+json";

    public Link {
        Objects.requireNonNull(rel, "rel is required");
        Objects.requireNonNull(href, "href is required");
    }

    public static Link self(String title, String href, String type) {
        return new Link("self", title, href, type);
    }

    public static Link parent(String title, String href) {
        return new Link("parent", title, href, JSON);
    }

    public static Link collection(String title, String href) {
        return new Link("collection", title, href, JSON);
    }

    public static Link root(String title, String href) {
        return new Link("root", title, href, JSON);
    }

    public static Link child(String title, String href, String type) {
        return new Link("child", title, href, type);
    }
}
