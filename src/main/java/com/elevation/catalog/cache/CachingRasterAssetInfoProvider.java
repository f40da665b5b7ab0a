package com.elevation.catalog.cache;

import com.elevation.catalog.core.model.RasterAssetInfo;
import com.elevation.catalog.item.RasterAssetInfoProvider;
import com.elevation.catalog.metrics.MetricsService;
import com.elevation.catalog.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed cache in front of a raster asset info provider.
 * Misses are cached too, so repeated lookups of an absent row do not reach the delegate.
 */
public class CachingRasterAssetInfoProvider implements RasterAssetInfoProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingRasterAssetInfoProvider.class);

    private final RasterAssetInfoProvider delegate;
    private final MetricsService metrics;
    private final Cache<RasterAssetInfo.Key, Optional<RasterAssetInfo>> cache;
    private final boolean enabled;

    public CachingRasterAssetInfoProvider(RasterAssetInfoProvider delegate, CacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingRasterAssetInfoProvider(RasterAssetInfoProvider delegate, CacheConfig config,
                                          MetricsService metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingRasterAssetInfoProvider initialized: enabled={}, maxSize={}, ttl={}s",
                config.enabled(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<RasterAssetInfo> find(String collection, String itemId, String assetKey) {
        if (!enabled) {
            return delegate.find(collection, itemId, assetKey);
        }
        RasterAssetInfo.Key key = new RasterAssetInfo.Key(collection, itemId, assetKey);
        Optional<RasterAssetInfo> cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        Optional<RasterAssetInfo> loaded = delegate.find(collection, itemId, assetKey);
        cache.put(key, loaded);
        return loaded;
    }

    /**
     * Drops every cached row of one item, e.g. after its rasters were re-introspected.
     */
    public void invalidateItem(String collection, String itemId) {
        cache.asMap().keySet().removeIf(k -> k.collection().equals(collection) && k.itemId().equals(itemId));
        log.debug("Invalidated cached asset info for {}/{}", collection, itemId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
