package com.elevation.catalog.item;

import com.elevation.catalog.core.model.MosaicInfo;
import com.elevation.catalog.core.model.RasterAssetInfo;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store of raster asset info and mosaic info rows, keyed by natural identity.
 * Adding a row with an existing key replaces it.
 */
public class InMemoryAssetMetadata implements RasterAssetInfoProvider, MosaicInfoProvider {

    private final Map<RasterAssetInfo.Key, RasterAssetInfo> assetInfo = new ConcurrentHashMap<>();
    private final Map<String, MosaicInfo> mosaicInfo = new ConcurrentHashMap<>();

    public InMemoryAssetMetadata addAssetInfo(RasterAssetInfo info) {
        assetInfo.put(info.key(), info);
        return this;
    }

    public InMemoryAssetMetadata addAssetInfo(Collection<RasterAssetInfo> infos) {
        infos.forEach(this::addAssetInfo);
        return this;
    }

    public InMemoryAssetMetadata addMosaicInfo(MosaicInfo info) {
        mosaicInfo.put(mosaicKey(info.collection(), info.itemId()), info);
        return this;
    }

    @Override
    public Optional<RasterAssetInfo> find(String collection, String itemId, String assetKey) {
        return Optional.ofNullable(assetInfo.get(new RasterAssetInfo.Key(collection, itemId, assetKey)));
    }

    @Override
    public Optional<MosaicInfo> find(String collection, String itemId) {
        return Optional.ofNullable(mosaicInfo.get(mosaicKey(collection, itemId)));
    }

    public int assetInfoCount() {
        return assetInfo.size();
    }

    private static String mosaicKey(String collection, String itemId) {
        return collection + "/" + itemId;
    }
}
