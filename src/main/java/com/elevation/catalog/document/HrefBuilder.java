package com.elevation.catalog.document;

import com.elevation.catalog.config.CatalogOptions;

/**
 * Absolute hrefs of catalog documents and asset files, mirrored under the https and
 * object-storage bases: {@code {base}/{domain}/{kind}/{release}/{resolution}/{partition}/{file}}.
 */
public class HrefBuilder {

    private final CatalogOptions options;

    public HrefBuilder(CatalogOptions options) {
        this.options = options;
    }

    public String https(String relativePath) {
        return options.getBaseUrl() + "/" + relativePath;
    }

    public String s3(String relativePath) {
        return options.getS3BaseUrl() + "/" + relativePath;
    }

    public String node(NodePath path) {
        return https(path.documentPath(options.getRootCatalogFile()));
    }

    public String item(NodePath partition, String itemId) {
        return https(partition.itemPath(itemId));
    }

    /**
     * Relative path of an asset file stored next to the item document.
     */
    public String assetPath(NodePath partition, String fileName) {
        return partition.directory() + "/" + fileName;
    }
}
