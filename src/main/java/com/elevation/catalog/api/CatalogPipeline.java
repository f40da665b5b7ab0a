package com.elevation.catalog.api;

import com.elevation.catalog.audit.AuditService;
import com.elevation.catalog.cache.CacheConfig;
import com.elevation.catalog.cache.CachingRasterAssetInfoProvider;
import com.elevation.catalog.canonical.CanonicalVersionResolver;
import com.elevation.catalog.canonical.DeprecationLedger;
import com.elevation.catalog.canonical.ResolutionResult;
import com.elevation.catalog.config.CatalogOptions;
import com.elevation.catalog.config.CatalogTables;
import com.elevation.catalog.core.ProgressCallback;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.ReleasePublication;
import com.elevation.catalog.core.model.UnifiedRecord;
import com.elevation.catalog.dedup.DedupOptions;
import com.elevation.catalog.dedup.UnionDeduplicationEngine;
import com.elevation.catalog.dedup.UnionResult;
import com.elevation.catalog.document.CatalogDocumentStore;
import com.elevation.catalog.item.CatalogItemBuilder;
import com.elevation.catalog.item.ItemBatchReport;
import com.elevation.catalog.item.MosaicInfoProvider;
import com.elevation.catalog.item.RasterAssetInfoProvider;
import com.elevation.catalog.logging.LogContext;
import com.elevation.catalog.metrics.MetricsService;
import com.elevation.catalog.metrics.NoOpMetricsService;
import com.elevation.catalog.source.RecordSource;
import com.elevation.catalog.tree.CatalogTreeBuilder;
import com.elevation.catalog.tree.TreeBuildOptions;
import com.elevation.catalog.tree.TreeBuildResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Main entry point of the library: wires record sources, deduplication, canonical resolution,
 * item building and tree building.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CatalogPipeline pipeline = CatalogPipeline.builder()
 *     .source(new JsonLinesRecordSource("on-hand", SourcePool.ON_HAND, onHandIndex))
 *     .source(new JsonLinesRecordSource("archive", SourcePool.ARCHIVE, archiveIndex))
 *     .assetInfo(rasterMetadata)
 *     .build();
 *
 * PipelineReport report = pipeline.run(publications, catalogRoot, true);
 * </pre>
 *
 * <p>Each stage is also exposed on its own so external drivers can run them per partition or
 * per identity shard.</p>
 */
public class CatalogPipeline {
    private static final Logger log = LoggerFactory.getLogger(CatalogPipeline.class);

    private final List<RecordSource> sources;
    private final UnionDeduplicationEngine unionEngine;
    private final CanonicalVersionResolver resolver;
    private final CatalogItemBuilder itemBuilder;
    private final CatalogTreeBuilder treeBuilder;
    private final CatalogOptions catalogOptions;
    private final CatalogTables tables;
    private final AuditService auditService;
    private final MetricsService metricsService;

    private CatalogPipeline(Builder builder) {
        this.sources = List.copyOf(builder.sources);
        this.catalogOptions = builder.catalogOptions;
        this.tables = builder.tables;
        this.auditService = builder.auditService;
        this.metricsService = builder.metricsService;
        this.unionEngine = new UnionDeduplicationEngine(builder.dedupOptions, auditService, metricsService);
        this.resolver = new CanonicalVersionResolver(builder.ledger, builder.deprecationList,
                auditService, metricsService);

        RasterAssetInfoProvider assetInfo = builder.assetInfo;
        if (builder.cacheConfig.enabled()) {
            assetInfo = new CachingRasterAssetInfoProvider(assetInfo, builder.cacheConfig, metricsService);
        }
        this.itemBuilder = CatalogItemBuilder.builder()
                .options(catalogOptions)
                .tables(tables)
                .assetInfo(assetInfo)
                .mosaicInfo(builder.mosaicInfo)
                .auditService(auditService)
                .metricsService(metricsService)
                .build();
        this.treeBuilder = new CatalogTreeBuilder(auditService, metricsService);
    }

    /**
     * Unions and deduplicates the records of one product class across all sources.
     */
    public UnionResult unify(ProductClass productClass) {
        return unionEngine.unify(productClass, sources);
    }

    public ResolutionResult resolve(List<UnifiedRecord> records) {
        return resolver.resolve(records);
    }

    public ResolutionResult resolveShard(List<UnifiedRecord> records, int shardCount, int shardIndex) {
        return resolver.resolveShard(records, shardCount, shardIndex);
    }

    public ItemBatchReport buildItems(ResolutionResult resolution, List<ReleasePublication> publications,
                                      ProgressCallback progress) {
        return itemBuilder.buildAll(resolution, publications, progress);
    }

    public int writeItems(ItemBatchReport report, Path catalogRoot, boolean overwrite) {
        return itemBuilder.writeAll(report, new CatalogDocumentStore(catalogRoot), overwrite);
    }

    public TreeBuildResult buildTree(Path catalogRoot, boolean overwrite) {
        return treeBuilder.build(catalogRoot, treeOptions(overwrite));
    }

    public TreeBuildResult rebuildCollections(Path catalogRoot, Set<String> collectionIds, boolean overwrite) {
        return treeBuilder.rebuildCollections(catalogRoot, collectionIds, treeOptions(overwrite));
    }

    public TreeBuildResult buildPartition(Path catalogRoot, String collectionId, String partition, boolean overwrite) {
        return treeBuilder.buildPartition(catalogRoot, collectionId, partition, treeOptions(overwrite));
    }

    public PipelineReport run(List<ReleasePublication> publications, Path catalogRoot, boolean overwrite) {
        return run(publications, catalogRoot, overwrite, ProgressCallback.NOOP);
    }

    /**
     * Runs every stage: unify each product class, resolve, build and write items, then rebuild
     * the tree above the collections that received items.
     */
    public PipelineReport run(List<ReleasePublication> publications, Path catalogRoot, boolean overwrite,
                              ProgressCallback progress) {
        String batchId = LogContext.generateBatchId();
        try (LogContext ctx = LogContext.forBatch(batchId, "pipeline")) {
            List<UnionResult> unions = new ArrayList<>();
            List<UnifiedRecord> unified = new ArrayList<>();
            for (ProductClass productClass : ProductClass.values()) {
                UnionResult union = unify(productClass);
                unions.add(union);
                unified.addAll(union.records());
            }
            ResolutionResult resolution = resolve(unified);
            ItemBatchReport items = buildItems(resolution, publications, progress);
            int written = writeItems(items, catalogRoot, overwrite);
            TreeBuildResult tree = rebuildCollections(catalogRoot, items.touchedCollections(), overwrite);

            PipelineReport report = new PipelineReport(unions, resolution, items, written, tree);
            log.info("pipeline.completed {}", report);
            return report;
        }
    }

    private TreeBuildOptions treeOptions(boolean overwrite) {
        return TreeBuildOptions.builder()
                .overwrite(overwrite)
                .catalogOptions(catalogOptions)
                .tables(tables)
                .build();
    }

    public DeprecationLedger getLedger() {
        return resolver.getLedger();
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<RecordSource> sources = new ArrayList<>();
        private DedupOptions dedupOptions = DedupOptions.defaults();
        private CatalogOptions catalogOptions = CatalogOptions.defaults();
        private CatalogTables tables;
        private RasterAssetInfoProvider assetInfo = RasterAssetInfoProvider.EMPTY;
        private MosaicInfoProvider mosaicInfo = MosaicInfoProvider.EMPTY;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private DeprecationLedger ledger;
        private Set<String> deprecationList = Set.of();
        private AuditService auditService;
        private MetricsService metricsService;

        public Builder source(RecordSource source) {
            this.sources.add(source);
            return this;
        }

        public Builder sources(List<? extends RecordSource> sources) {
            this.sources.addAll(sources);
            return this;
        }

        public Builder dedupOptions(DedupOptions dedupOptions) {
            this.dedupOptions = dedupOptions;
            return this;
        }

        public Builder catalogOptions(CatalogOptions catalogOptions) {
            this.catalogOptions = catalogOptions;
            return this;
        }

        public Builder tables(CatalogTables tables) {
            this.tables = tables;
            return this;
        }

        public Builder assetInfo(RasterAssetInfoProvider assetInfo) {
            this.assetInfo = assetInfo;
            return this;
        }

        public Builder mosaicInfo(MosaicInfoProvider mosaicInfo) {
            this.mosaicInfo = mosaicInfo;
            return this;
        }

        /**
         * Configures the cache in front of the raster asset info provider.
         */
        public Builder cache(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder ledger(DeprecationLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        /**
         * Versioned identities withdrawn from publication.
         */
        public Builder deprecationList(Set<String> deprecationList) {
            this.deprecationList = deprecationList;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public CatalogPipeline build() {
            if (sources.isEmpty()) {
                throw new IllegalStateException("At least one record source is required");
            }
            if (tables == null) {
                tables = CatalogTables.defaults();
            }
            if (ledger == null) {
                ledger = new DeprecationLedger();
            }
            if (auditService == null) {
                auditService = new AuditService();
            }
            if (metricsService == null) {
                metricsService = new NoOpMetricsService();
            }
            if (cacheConfig == null) {
                cacheConfig = CacheConfig.disabled();
            }
            return new CatalogPipeline(this);
        }
    }
}
