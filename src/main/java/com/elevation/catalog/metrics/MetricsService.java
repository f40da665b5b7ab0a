package com.elevation.catalog.metrics;

import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.item.ItemStatus;

import java.time.Duration;

/**
 * Interface for recording catalog pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordUnifyDuration(ProductClass productClass, Duration duration);

    void incrementRecordsRejected(ProductClass productClass, long count);

    void incrementRecordsShadowed(ProductClass productClass, long count);

    void recordResolveDuration(ProductClass productClass, Duration duration);

    void incrementIdentitiesDeprecated(ProductClass productClass, long count);

    void incrementItems(ProductClass productClass, ItemStatus status);

    void incrementNodes(boolean written);

    void recordCacheHit();

    void recordCacheMiss();
}
