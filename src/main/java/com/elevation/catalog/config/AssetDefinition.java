package com.elevation.catalog.config;

import java.util.List;

/**
 * Static description of one asset role in an item: where the file lives and how it is typed.
 *
 * @param key              asset key in the item's asset map
 * @param title            asset title; {@code {resolution}} is substituted
 * @param file             file name template relative to the partition directory;
 *                         {@code {itemId}}, {@code {partition}}, {@code {resolution}}, {@code {release}} are substituted
 * @param mediaType        media type of the file
 * @param roles            semantic role tags
 * @param nodata           nodata value, or null for non-raster files
 * @param dataType         raster data type, or null for non-raster files
 * @param unit             measurement unit, or null
 * @param projectionSource asset key of the raster asset info row whose projection fields are
 *                         copied onto this asset, or null when the asset carries none
 * @param projects         projects this asset exists for; null or empty means all
 */
public record AssetDefinition(
        String key,
        String title,
        String file,
        String mediaType,
        List<String> roles,
        Number nodata,
        String dataType,
        String unit,
        String projectionSource,
        List<String> projects
) {
    public AssetDefinition {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("asset key is required");
        }
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("asset file template is required: " + key);
        }
        roles = roles != null ? List.copyOf(roles) : List.of();
        projects = projects != null ? List.copyOf(projects) : List.of();
    }

    public boolean appliesTo(String project) {
        return projects.isEmpty() || projects.contains(project);
    }

    public String title(String resolution) {
        return title != null ? title.replace("{resolution}", resolution) : null;
    }

    public String fileName(String itemId, String partition, String resolution, String release) {
        return file.replace("{itemId}", itemId)
                .replace("{partition}", partition)
                .replace("{resolution}", resolution)
                .replace("{release}", release);
    }
}
