package com.elevation.catalog.item;

import com.elevation.catalog.audit.AuditAction;
import com.elevation.catalog.audit.AuditService;
import com.elevation.catalog.canonical.ResolutionResult;
import com.elevation.catalog.config.AssetDefinition;
import com.elevation.catalog.config.CatalogOptions;
import com.elevation.catalog.config.CatalogTables;
import com.elevation.catalog.core.ProgressCallback;
import com.elevation.catalog.core.model.CanonicalRecord;
import com.elevation.catalog.core.model.Footprint;
import com.elevation.catalog.core.model.MosaicInfo;
import com.elevation.catalog.core.model.ProductClass;
import com.elevation.catalog.core.model.RasterAssetInfo;
import com.elevation.catalog.core.model.ReleasePublication;
import com.elevation.catalog.core.model.SourceRecord;
import com.elevation.catalog.core.model.UnifiedRecord;
import com.elevation.catalog.document.Asset;
import com.elevation.catalog.document.CatalogDocumentStore;
import com.elevation.catalog.document.CatalogItem;
import com.elevation.catalog.document.CollectionKey;
import com.elevation.catalog.document.Geometry;
import com.elevation.catalog.document.HrefBuilder;
import com.elevation.catalog.document.Link;
import com.elevation.catalog.document.NodePath;
import com.elevation.catalog.geo.GeographicReprojector;
import com.elevation.catalog.logging.LogContext;
import com.elevation.catalog.metrics.MetricsService;
import com.elevation.catalog.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds self-describing item documents for published canonical records.
 *
 * <p>Every item carries exactly four links (self, parent, collection, root) whose hrefs are the
 * item path truncated one segment at a time. Failures are reported per item; a batch never aborts.</p>
 */
public class CatalogItemBuilder {
    private static final Logger log = LoggerFactory.getLogger(CatalogItemBuilder.class);
    private static final String COMPONENT = "item-builder";
    private static final String PRIMARY_ASSET = "dem";
    private static final String MOSAIC_INFO = "mosaic-info";

    private final CatalogOptions options;
    private final CatalogTables tables;
    private final RasterAssetInfoProvider assetInfo;
    private final MosaicInfoProvider mosaicInfo;
    private final GeographicReprojector reprojector;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final HrefBuilder hrefs;
    private final PropertiesAssembler properties;

    private CatalogItemBuilder(Builder builder) {
        this.options = builder.options;
        this.tables = builder.tables;
        this.assetInfo = builder.assetInfo;
        this.mosaicInfo = builder.mosaicInfo;
        this.reprojector = builder.reprojector;
        this.auditService = builder.auditService;
        this.metricsService = builder.metricsService;
        this.hrefs = new HrefBuilder(options);
        this.properties = new PropertiesAssembler(options, tables);
    }

    /**
     * Builds the item of one publication.
     *
     * @param canonical the canonical record of the publication's logical identity, or null when none exists
     */
    public ItemBuildResult build(ReleasePublication publication, CanonicalRecord canonical) {
        ItemBuildResult result;
        try {
            result = buildItem(publication, canonical);
        } catch (RuntimeException e) {
            log.warn("item.error itemId={}: {}", publication.itemId(), e.getMessage());
            result = ItemBuildResult.failed(publication.itemId(), null, e.getMessage());
        }
        report(publication.productClass(), result);
        return result;
    }

    public ItemBatchReport buildAll(ResolutionResult resolution, List<ReleasePublication> publications) {
        return buildAll(resolution, publications, ProgressCallback.NOOP);
    }

    /**
     * Builds the items of all publications, joining each to its canonical record.
     */
    public ItemBatchReport buildAll(ResolutionResult resolution, List<ReleasePublication> publications,
                                    ProgressCallback progress) {
        String batchId = LogContext.generateBatchId();
        List<ItemBuildResult> results = new ArrayList<>(publications.size());
        try (LogContext ctx = LogContext.forBatch(batchId, "buildItems")) {
            long processed = 0;
            for (ReleasePublication publication : publications) {
                CanonicalRecord canonical = resolution
                        .find(publication.productClass(), publication.logicalIdentity())
                        .orElse(null);
                results.add(build(publication, canonical));
                progress.onProgress(++processed, publications.size(), publication.itemId());
            }
            ItemBatchReport report = new ItemBatchReport(results);
            log.info("items.completed {}", report);
            return report;
        }
    }

    /**
     * Writes every writable item of a report at its document path.
     *
     * @return the number of documents written
     */
    public int writeAll(ItemBatchReport report, CatalogDocumentStore store, boolean overwrite) {
        int written = 0;
        for (ItemBuildResult result : report.writable()) {
            if (store.write(result.relativePath(), result.item(), overwrite)) {
                written++;
            }
        }
        log.info("items.written written={} kept={}", written, report.writable().size() - written);
        return written;
    }

    private ItemBuildResult buildItem(ReleasePublication publication, CanonicalRecord canonical) {
        String itemId = publication.itemId();
        if (!options.isPublic(publication.licenseClass())) {
            return ItemBuildResult.suppressed(itemId, null,
                    "license class '" + publication.licenseClass() + "' is not public");
        }
        if (canonical == null) {
            return ItemBuildResult.failed(itemId, null,
                    "no canonical record for logical identity " + publication.logicalIdentity());
        }
        if (canonical.deprecated()) {
            return ItemBuildResult.suppressed(itemId, null,
                    "canonical identity " + canonical.canonicalIdentity() + " is deprecated");
        }
        UnifiedRecord member = canonical.member(itemId).orElse(null);
        if (member == null) {
            return ItemBuildResult.failed(itemId, null,
                    "canonical record " + canonical.canonicalIdentity() + " has no member " + itemId);
        }
        SourceRecord record = member.source();
        if (publication.project() == null || publication.releaseVersion() == null || record.resolution() == null) {
            return ItemBuildResult.failed(itemId, null, "missing project, release or resolution");
        }

        String kind = publication.productClass().getKind();
        CollectionKey key = CollectionKey.fromTemplate(tables.collectionTemplate(kind),
                publication.project(), publication.releaseVersion(), record.resolution());
        String collectionId = key.id();
        if (record.footprint() == null) {
            return ItemBuildResult.failed(itemId, collectionId, "missing footprint");
        }
        String partitionName = record.spatialPartition();
        if (partitionName == null || partitionName.isBlank()) {
            return ItemBuildResult.failed(itemId, collectionId, "missing spatial partition");
        }

        Footprint geographic = reprojector.toGeographic(record.footprint());
        NodePath partition = NodePath.partition(key, partitionName);
        List<String> missing = new ArrayList<>();

        RasterAssetInfo dem = lookup(collectionId, itemId, PRIMARY_ASSET, missing);
        Map<String, Object> props = switch (publication.productClass()) {
            case STRIP -> properties.strip(publication, record, dem);
            case SCENE -> properties.scene(publication, record, dem);
            case MOSAIC -> {
                MosaicInfo info = mosaicInfo.find(collectionId, itemId).orElse(null);
                if (info == null) {
                    missing.add(MOSAIC_INFO);
                }
                yield properties.mosaic(publication, record, dem, info);
            }
        };

        CatalogItem item = new CatalogItem(
                itemId,
                geographic.bbox(),
                links(key, partition, itemId),
                assets(publication.project(), key, partition, itemId, missing),
                Geometry.of(geographic),
                collectionId,
                props,
                options.getItemStacVersion(),
                tables.stacExtensions());
        return ItemBuildResult.built(item, partition.itemPath(itemId), missing);
    }

    // Each href is one segment shorter than the previous one, so root is the release node.
    private List<Link> links(CollectionKey key, NodePath partition, String itemId) {
        NodePath collection = key.nodePath();
        NodePath release = collection.parent();
        return List.of(
                Link.self(null, hrefs.item(partition, itemId), Link.GEO_JSON),
                Link.parent(tables.partitionTitle(key.kind(), partition.name()), hrefs.node(partition)),
                Link.collection(tables.collectionTitle(key.id(), key.domain(), key.kind(), key.release(),
                        key.resolution()), hrefs.node(collection)),
                Link.root(tables.releaseTitle(key.domain(), key.kind(), key.release()), hrefs.node(release)));
    }

    private Map<String, Asset> assets(String project, CollectionKey key, NodePath partition, String itemId,
                                      List<String> missing) {
        Map<String, Asset> assets = new LinkedHashMap<>();
        for (AssetDefinition definition : tables.assetsFor(project, key.kind(), key.release(), key.resolution())) {
            String path = hrefs.assetPath(partition,
                    definition.fileName(itemId, partition.name(), key.resolution(), key.release()));
            Asset.Builder asset = Asset.builder()
                    .title(definition.title(key.resolution()))
                    .href(hrefs.https(path), hrefs.s3(path))
                    .type(definition.mediaType())
                    .roles(definition.roles())
                    .unit(definition.unit())
                    .nodata(definition.nodata())
                    .dataType(definition.dataType());
            if (definition.projectionSource() != null) {
                RasterAssetInfo info = lookup(key.id(), itemId, definition.projectionSource(), missing);
                asset.projection(PropertiesAssembler.projectionFields(info));
            }
            assets.put(definition.key(), asset.build());
        }
        return assets;
    }

    private RasterAssetInfo lookup(String collectionId, String itemId, String assetKey, List<String> missing) {
        RasterAssetInfo info = assetInfo.find(collectionId, itemId, assetKey).orElse(null);
        if (info == null && !missing.contains(assetKey)) {
            missing.add(assetKey);
        }
        return info;
    }

    private void report(ProductClass productClass, ItemBuildResult result) {
        metricsService.incrementItems(productClass, result.status());
        switch (result.status()) {
            case BUILT, INCOMPLETE -> {
                log.debug("item.built itemId={} collection={} status={}",
                        result.itemId(), result.collectionId(), result.status());
                auditService.record(AuditAction.ITEM_BUILT, result.itemId(), COMPONENT,
                        Map.of("collection", result.collectionId(),
                                "status", result.status().name(),
                                "missing", String.join(",", result.missing())));
            }
            case FAILED -> {
                log.warn("item.failed itemId={} reason={}", result.itemId(), result.message());
                auditService.record(AuditAction.ITEM_FAILED, result.itemId(), COMPONENT,
                        Map.of("reason", result.message() != null ? result.message() : "unknown"));
            }
            case SUPPRESSED -> log.debug("item.suppressed itemId={} reason={}", result.itemId(), result.message());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogOptions options = CatalogOptions.defaults();
        private CatalogTables tables;
        private RasterAssetInfoProvider assetInfo = RasterAssetInfoProvider.EMPTY;
        private MosaicInfoProvider mosaicInfo = MosaicInfoProvider.EMPTY;
        private GeographicReprojector reprojector;
        private AuditService auditService;
        private MetricsService metricsService;

        public Builder options(CatalogOptions options) {
            this.options = options;
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

        public Builder reprojector(GeographicReprojector reprojector) {
            this.reprojector = reprojector;
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

        public CatalogItemBuilder build() {
            if (options == null) {
                throw new IllegalStateException("options is required");
            }
            if (assetInfo == null || mosaicInfo == null) {
                throw new IllegalStateException("asset and mosaic info providers are required");
            }
            if (tables == null) {
                tables = CatalogTables.defaults();
            }
            if (reprojector == null) {
                reprojector = new GeographicReprojector();
            }
            if (auditService == null) {
                auditService = new AuditService();
            }
            if (metricsService == null) {
                metricsService = new NoOpMetricsService();
            }
            return new CatalogItemBuilder(this);
        }
    }
}
