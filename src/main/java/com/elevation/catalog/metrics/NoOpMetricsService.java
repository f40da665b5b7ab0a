package com.elevation.catalog.metrics;

import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.item.ItemStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordUnifyDuration(ProductClass productClass, Duration duration) {
    }

    @Override
    public void incrementRecordsRejected(ProductClass productClass, long count) {
    }

    @Override
    public void incrementRecordsShadowed(ProductClass productClass, long count) {
    }

    @Override
    public void recordResolveDuration(ProductClass productClass, Duration duration) {
    }

    @Override
    public void incrementIdentitiesDeprecated(ProductClass productClass, long count) {
    }

    @Override
    public void incrementItems(ProductClass productClass, ItemStatus status) {
    }

    @Override
    public void incrementNodes(boolean written) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
