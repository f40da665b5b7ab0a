package com.elevation.catalog.metrics;

import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.item.ItemStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.unify.duration} Timer (tag: productClass)</li>
 *   <li>{@code catalog.records.rejected} Counter (tag: productClass)</li>
 *   <li>{@code catalog.records.shadowed} Counter (tag: productClass)</li>
 *   <li>{@code catalog.resolve.duration} Timer (tag: productClass)</li>
 *   <li>{@code catalog.identities.deprecated} Counter (tag: productClass)</li>
 *   <li>{@code catalog.items} Counter (tags: productClass, status)</li>
 *   <li>{@code catalog.nodes} Counter (tag: outcome)</li>
 *   <li>{@code catalog.cache.hit} / {@code catalog.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("catalog.cache.hit")
                .description("Number of raster asset info cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("catalog.cache.miss")
                .description("Number of raster asset info cache misses")
                .register(registry);
    }

    @Override
    public void recordUnifyDuration(ProductClass productClass, Duration duration) {
        timer("catalog.unify.duration", "Duration of union and deduplication", productClass).record(duration);
    }

    @Override
    public void incrementRecordsRejected(ProductClass productClass, long count) {
        counter("catalog.records.rejected", "Malformed source records rejected", productClass).increment(count);
    }

    @Override
    public void incrementRecordsShadowed(ProductClass productClass, long count) {
        counter("catalog.records.shadowed", "Records excluded by a higher-priority pool", productClass)
                .increment(count);
    }

    @Override
    public void recordResolveDuration(ProductClass productClass, Duration duration) {
        timer("catalog.resolve.duration", "Duration of canonical version resolution", productClass)
                .record(duration);
    }

    @Override
    public void incrementIdentitiesDeprecated(ProductClass productClass, long count) {
        counter("catalog.identities.deprecated", "Versioned identities marked deprecated", productClass)
                .increment(count);
    }

    @Override
    public void incrementItems(ProductClass productClass, ItemStatus status) {
        String key = "items:" + productClass.name() + ":" + status.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("catalog.items")
                        .description("Catalog items by build status")
                        .tag("productClass", productClass.name())
                        .tag("status", status.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementNodes(boolean written) {
        String outcome = written ? "written" : "skipped";
        counterCache.computeIfAbsent("nodes:" + outcome, k ->
                Counter.builder("catalog.nodes")
                        .description("Catalog node documents written or left untouched")
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Timer timer(String name, String description, ProductClass productClass) {
        return timerCache.computeIfAbsent(name + ":" + productClass.name(), k ->
                Timer.builder(name)
                        .description(description)
                        .tag("productClass", productClass.name())
                        .register(registry));
    }

    private Counter counter(String name, String description, ProductClass productClass) {
        return counterCache.computeIfAbsent(name + ":" + productClass.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("productClass", productClass.name())
                        .register(registry));
    }
}
