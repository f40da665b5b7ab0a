package com.elevation.catalog.tree;

import com.elevation.catalog.config.CatalogOptions;
import com.elevation.catalog.config.CatalogTables;

/**
 * Options for catalog tree builds. Overwriting existing node documents must be requested explicitly.
 */
public class TreeBuildOptions {

    private final boolean overwrite;
    private final CatalogOptions catalogOptions;
    private final CatalogTables tables;

    private TreeBuildOptions(Builder builder) {
        this.overwrite = builder.overwrite;
        this.catalogOptions = builder.catalogOptions;
        this.tables = builder.tables;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public CatalogOptions getCatalogOptions() {
        return catalogOptions;
    }

    public CatalogTables getTables() {
        return tables;
    }

    /**
     * Default options: existing node documents are kept.
     */
    public static TreeBuildOptions defaults() {
        return builder().build();
    }

    /**
     * Options that replace every node document the build touches.
     */
    public static TreeBuildOptions overwriting() {
        return builder().overwrite(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean overwrite = false;
        private CatalogOptions catalogOptions = CatalogOptions.defaults();
        private CatalogTables tables;

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder catalogOptions(CatalogOptions catalogOptions) {
            if (catalogOptions == null) {
                throw new IllegalArgumentException("catalogOptions must not be null");
            }
            this.catalogOptions = catalogOptions;
            return this;
        }

        public Builder tables(CatalogTables tables) {
            this.tables = tables;
            return this;
        }

        public TreeBuildOptions build() {
            if (tables == null) {
                tables = CatalogTables.defaults();
            }
            return new TreeBuildOptions(this);
        }
    }
}
