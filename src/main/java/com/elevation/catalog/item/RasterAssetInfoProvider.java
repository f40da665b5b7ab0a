package com.elevation.catalog.item;

import com.elevation.catalog.core.model.RasterAssetInfo;

import java.util.Optional;

/**
 * Lookup of per-asset projection metadata produced by raster introspection.
 * An absent row is a normal outcome, never an error.
 */
@FunctionalInterface
public interface RasterAssetInfoProvider {

    Optional<RasterAssetInfo> find(String collection, String itemId, String assetKey);

    /**
     * Provider with no rows at all.
     */
    RasterAssetInfoProvider EMPTY = (collection, itemId, assetKey) -> Optional.empty();
}
