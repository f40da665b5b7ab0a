package com.elevation.catalog.document;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One file of a catalog item. Unit, nodata and data type are omitted when absent;
 * projection fields, when the asset carries them, are written even when null.
 */
@JsonPropertyOrder({"title", "href", "type", "roles", "alternate", "unit", "nodata", "data_type"})
public final class Asset {

    private final String title;
    private final String href;
    private final String type;
    private final List<String> roles;
    private final Map<String, Map<String, String>> alternate;
    private final String unit;
    private final Number nodata;
    private final String dataType;
    private final Map<String, Object> projection;

    private Asset(Builder builder) {
        this.title = builder.title;
        this.href = Objects.requireNonNull(builder.href, "href is required");
        this.type = builder.type;
        this.roles = List.copyOf(builder.roles);
        this.alternate = builder.s3Href != null
                ? Map.of("s3", Map.of("href", builder.s3Href))
                : Map.of();
        this.unit = builder.unit;
        this.nodata = builder.nodata;
        this.dataType = builder.dataType;
        this.projection = Collections.unmodifiableMap(new LinkedHashMap<>(builder.projection));
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("href")
    public String getHref() {
        return href;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("roles")
    public List<String> getRoles() {
        return roles;
    }

    @JsonProperty("alternate")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Map<String, String>> getAlternate() {
        return alternate;
    }

    @JsonProperty("unit")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getUnit() {
        return unit;
    }

    @JsonProperty("nodata")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Number getNodata() {
        return nodata;
    }

    @JsonProperty("data_type")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getDataType() {
        return dataType;
    }

    /**
     * Asset-level {@code gsd} and {@code proj:*} fields, in insertion order.
     */
    @JsonAnyGetter
    public Map<String, Object> getProjection() {
        return projection;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String href;
        private String type;
        private List<String> roles = List.of();
        private String s3Href;
        private String unit;
        private Number nodata;
        private String dataType;
        private final Map<String, Object> projection = new LinkedHashMap<>();

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder href(String href, String s3Href) {
            this.href = href;
            this.s3Href = s3Href;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder roles(List<String> roles) {
            this.roles = roles != null ? roles : List.of();
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder nodata(Number nodata) {
            this.nodata = nodata;
            return this;
        }

        public Builder dataType(String dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder projection(Map<String, Object> fields) {
            this.projection.putAll(fields);
            return this;
        }

        public Asset build() {
            return new Asset(this);
        }
    }
}
