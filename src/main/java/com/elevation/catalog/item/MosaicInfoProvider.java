package com.elevation.catalog.item;

import com.elevation.catalog.core.model.MosaicInfo;

import java.util.Optional;

/**
 * Lookup of auxiliary mosaic tile metadata.
 */
@FunctionalInterface
public interface MosaicInfoProvider {

    Optional<MosaicInfo> find(String collection, String itemId);

    MosaicInfoProvider EMPTY = (collection, itemId) -> Optional.empty();
}
