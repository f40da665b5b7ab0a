package com.elevation.catalog.tree;

import com.elevation.catalog.audit.AuditAction;
import com.elevation.catalog.audit.AuditService;
import com.elevation.catalog.config.CatalogOptions;
import com.elevation.catalog.config.CatalogTables;
import com.elevation.catalog.core.CatalogWriteException;
import com.elevation.catalog.document.CatalogDocumentStore;
import com.elevation.catalog.document.CatalogJson;
import com.elevation.catalog.document.CatalogNode;
import com.elevation.catalog.document.CollectionKey;
import com.elevation.catalog.document.Extent;
import com.elevation.catalog.document.HrefBuilder;
import com.elevation.catalog.document.Link;
import com.elevation.catalog.document.NodeLevel;
import com.elevation.catalog.document.NodePath;
import com.elevation.catalog.logging.LogContext;
import com.elevation.catalog.metrics.MetricsService;
import com.elevation.catalog.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the catalog and collection documents above the item documents of a catalog directory.
 *
 * <p>Node layout below the root: {@code {domain}.json}, {@code {domain}/{kind}.json},
 * {@code {domain}/{kind}/{release}.json}, {@code .../{resolution}.json} and
 * {@code .../{partition}.json}, plus the top catalog file. Child links list the current members
 * ordered by id; children are always written before their parents.</p>
 *
 * <p>Without overwrite an existing node file is left as it is, even when stale. With overwrite every
 * node is built completely in memory and then replaced atomically, so unchanged inputs produce
 * byte-identical documents.</p>
 */
public class CatalogTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(CatalogTreeBuilder.class);
    private static final String COMPONENT = "tree-builder";
    private static final List<Double> WORLD = List.of(-180.0, -90.0, 180.0, 90.0);

    private final AuditService auditService;
    private final MetricsService metricsService;

    public CatalogTreeBuilder() {
        this(new AuditService(), new NoOpMetricsService());
    }

    public CatalogTreeBuilder(AuditService auditService, MetricsService metricsService) {
        this.auditService = auditService != null ? auditService : new AuditService();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Full build: scans every item below {@code root} and writes all nodes up to the top catalog.
     */
    public TreeBuildResult build(Path root, TreeBuildOptions options) {
        Session session = new Session(root, options);
        try (LogContext ctx = LogContext.forBatch(session.batchId, "buildTree")) {
            ItemScanner.ScanResult scan = session.scanner.scan(root, NodePath.ROOT);
            session.failures.addAll(scan.failures());
            reportFailures(scan.failures());

            Map<NodePath, List<ChildSummary>> pending = groupByPartition(scan.items());
            while (true) {
                Map<NodePath, List<ChildSummary>> parents = new TreeMap<>();
                for (Map.Entry<NodePath, List<ChildSummary>> entry : pending.entrySet()) {
                    ChildSummary summary = session.writeNode(entry.getKey(), entry.getValue());
                    if (entry.getKey().level() != NodeLevel.ROOT) {
                        parents.computeIfAbsent(entry.getKey().parent(), k -> new ArrayList<>()).add(summary);
                    }
                }
                if (parents.isEmpty()) {
                    if (!pending.containsKey(NodePath.ROOT)) {
                        session.writeNode(NodePath.ROOT, List.of());
                    }
                    break;
                }
                pending = parents;
            }
            TreeBuildResult result = session.result(scan.items().size());
            log.info("tree.completed root={} {}", root, result);
            return result;
        }
    }

    /**
     * Rebuilds the node of one spatial partition from the items in its directory.
     */
    public TreeBuildResult buildPartition(Path root, String collectionId, String partition, TreeBuildOptions options) {
        Session session = new Session(root, options);
        NodePath path = NodePath.partition(CollectionKey.parse(collectionId), partition);
        try (LogContext ctx = LogContext.forPartition(session.batchId, collectionId, partition)) {
            ItemScanner.ScanResult scan = session.scanner.scan(root, path);
            session.failures.addAll(scan.failures());
            reportFailures(scan.failures());
            List<ChildSummary> items = scan.items().stream()
                    .filter(i -> i.partition().equals(path))
                    .map(ScannedItem::toSummary)
                    .collect(Collectors.toList());
            session.writeNode(path, items);
            TreeBuildResult result = session.result(items.size());
            log.info("tree.partition.completed collection={} partition={} {}", collectionId, partition, result);
            return result;
        }
    }

    /**
     * Incremental build: rebuilds the partition and resolution nodes of the given collections from
     * their items, then re-aggregates each ancestor from the child documents currently on disk.
     */
    public TreeBuildResult rebuildCollections(Path root, Set<String> collectionIds, TreeBuildOptions options) {
        Session session = new Session(root, options);
        int itemCount = 0;
        SortedSet<NodePath> ancestors = new TreeSet<>(Comparator
                .comparing((NodePath p) -> -p.segments().size())
                .thenComparing(Comparator.naturalOrder()));
        try (LogContext ctx = LogContext.forBatch(session.batchId, "rebuildCollections")) {
            for (String collectionId : new TreeSet<>(collectionIds)) {
                NodePath collection = CollectionKey.parse(collectionId).nodePath();
                try (LogContext collectionCtx = LogContext.forCollection(session.batchId, collectionId)) {
                    ItemScanner.ScanResult scan = session.scanner.scan(root, collection);
                    session.failures.addAll(scan.failures());
                    reportFailures(scan.failures());
                    itemCount += scan.items().size();

                    List<ChildSummary> partitions = new ArrayList<>();
                    for (Map.Entry<NodePath, List<ChildSummary>> entry : groupByPartition(scan.items()).entrySet()) {
                        partitions.add(session.writeNode(entry.getKey(), entry.getValue()));
                    }
                    session.writeNode(collection, partitions);
                }
                for (NodePath p = collection.parent(); ; p = p.parent()) {
                    ancestors.add(p);
                    if (p.level() == NodeLevel.ROOT) {
                        break;
                    }
                }
            }
            for (NodePath ancestor : ancestors) {
                session.writeNode(ancestor, session.readChildren(ancestor));
            }
            TreeBuildResult result = session.result(itemCount);
            log.info("tree.rebuild.completed collections={} {}", collectionIds.size(), result);
            return result;
        }
    }

    private static Map<NodePath, List<ChildSummary>> groupByPartition(List<ScannedItem> items) {
        Map<NodePath, List<ChildSummary>> byPartition = new TreeMap<>();
        for (ScannedItem item : items) {
            byPartition.computeIfAbsent(item.partition(), k -> new ArrayList<>()).add(item.toSummary());
        }
        return byPartition;
    }

    private void reportFailures(List<ScanFailure> failures) {
        for (ScanFailure failure : failures) {
            auditService.record(AuditAction.ITEM_FAILED, failure.relativePath(), COMPONENT,
                    Map.of("reason", String.valueOf(failure.reason())));
        }
    }

    /**
     * State of one build invocation.
     */
    private final class Session {
        private final String batchId = LogContext.generateBatchId();
        private final Path root;
        private final boolean overwrite;
        private final CatalogOptions catalogOptions;
        private final CatalogTables tables;
        private final HrefBuilder hrefs;
        private final ItemScanner scanner;
        private final CatalogDocumentStore store;
        private final List<NodeDocument> nodes = new ArrayList<>();
        private final List<ScanFailure> failures = new ArrayList<>();

        Session(Path root, TreeBuildOptions options) {
            this.root = root;
            this.overwrite = options.isOverwrite();
            this.catalogOptions = options.getCatalogOptions();
            this.tables = options.getTables();
            this.hrefs = new HrefBuilder(catalogOptions);
            this.scanner = new ItemScanner(hrefs);
            this.store = new CatalogDocumentStore(root);
        }

        ChildSummary writeNode(NodePath path, List<ChildSummary> children) {
            CatalogNode node = node(path, children);
            String relativePath = path.documentPath(catalogOptions.getRootCatalogFile());
            boolean written = store.write(relativePath, node, overwrite);
            nodes.add(new NodeDocument(path, relativePath, node, written));
            metricsService.incrementNodes(written);
            auditService.record(written ? AuditAction.NODE_WRITTEN : AuditAction.NODE_SKIPPED,
                    node.id(), COMPONENT, Map.of("path", relativePath, "children", node.children().size()));
            if (written) {
                log.debug("node.written path={} children={}", relativePath, node.children().size());
            } else {
                log.info("node.kept path={} (exists, overwrite not requested)", relativePath);
            }
            Extent extent = node.extent();
            return new ChildSummary(node.id(), node.title(), hrefs.node(path), Link.JSON,
                    extent != null ? extent.bbox() : mergeBbox(children),
                    extent != null ? extent.start() : minDatetime(children));
        }

        CatalogNode node(NodePath path, List<ChildSummary> children) {
            NodeLevel level = path.level();
            String title = title(path);
            List<Link> links = new ArrayList<>();
            links.add(Link.self(title, hrefs.node(path), Link.JSON));
            // Nodes inside a collection share their items' root, the release node.
            NodePath rootPath = level.compareTo(NodeLevel.RESOLUTION) >= 0
                    ? path.collectionKey().nodePath().parent()
                    : NodePath.ROOT;
            links.add(Link.root(title(rootPath), hrefs.node(rootPath)));
            if (level != NodeLevel.ROOT) {
                links.add(Link.parent(title(path.parent()), hrefs.node(path.parent())));
            }
            children.stream()
                    .sorted(Comparator.comparing(ChildSummary::id))
                    .forEach(c -> links.add(Link.child(c.title(), c.href(), c.type())));

            return new CatalogNode(
                    level.documentType(),
                    catalogOptions.getNodeStacVersion(),
                    level == NodeLevel.ROOT ? catalogOptions.getRootCatalogId() : path.id(),
                    title,
                    description(path, title),
                    level == NodeLevel.DOMAIN ? catalogOptions.getLicense() : null,
                    level.hasExtent() ? tables.providers() : null,
                    level.hasExtent() ? extent(children) : null,
                    links);
        }

        String title(NodePath path) {
            String domain = path.segment(NodeLevel.DOMAIN);
            String kind = path.segment(NodeLevel.KIND);
            String release = path.segment(NodeLevel.RELEASE);
            return switch (path.level()) {
                case ROOT -> catalogOptions.getRootCatalogTitle();
                case DOMAIN -> tables.domainTitle(domain);
                case KIND -> tables.kindTitle(domain, kind);
                case RELEASE -> tables.releaseTitle(domain, kind, release);
                case RESOLUTION -> tables.collectionTitle(path.id(), domain, kind, release,
                        path.segment(NodeLevel.RESOLUTION));
                case PARTITION -> tables.partitionTitle(kind, path.name());
            };
        }

        String description(NodePath path, String title) {
            if (path.level() == NodeLevel.ROOT) {
                return title + " of open digital elevation models";
            }
            if (path.level() == NodeLevel.RESOLUTION) {
                String description = tables.description(path.segment(NodeLevel.KIND));
                if (description != null) {
                    return description;
                }
            }
            return title + " digital elevation models";
        }

        /**
         * Children of an ancestor node as currently written on disk.
         */
        List<ChildSummary> readChildren(NodePath parent) {
            Path directory = parent.segments().isEmpty() ? root : root.resolve(parent.directory());
            List<ChildSummary> children = new ArrayList<>();
            if (!Files.isDirectory(directory)) {
                return children;
            }
            List<Path> files;
            try (Stream<Path> list = Files.list(directory)) {
                files = list
                        .filter(Files::isRegularFile)
                        .filter(f -> f.getFileName().toString().endsWith(".json"))
                        .filter(f -> !f.getFileName().toString().equals(catalogOptions.getRootCatalogFile()))
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new CatalogWriteException("Failed to list catalog directory", directory, e);
            }
            for (Path file : files) {
                String name = file.getFileName().toString();
                NodePath child = parent.child(name.substring(0, name.length() - ".json".length()));
                String relative = ItemScanner.relativize(root, file);
                try {
                    children.add(readSummary(file, child));
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("node.unreadable path={} reason={}", relative, e.getMessage());
                    failures.add(new ScanFailure(relative, e.getMessage()));
                }
            }
            return children;
        }

        private ChildSummary readSummary(Path file, NodePath path) throws IOException {
            JsonNode doc = CatalogJson.mapper().readTree(file.toFile());
            String id = ItemScanner.text(doc, "id");
            if (id == null) {
                throw new IllegalArgumentException("node document lacks an id");
            }
            JsonNode extent = doc.path("extent");
            List<Double> bbox = ItemScanner.bbox(extent.path("spatial").path("bbox").path(0));
            JsonNode start = extent.path("temporal").path("interval").path(0).path(0);
            String title = ItemScanner.text(doc, "title");
            return new ChildSummary(id, title != null ? title : id, hrefs.node(path), Link.JSON, bbox,
                    start.isTextual() ? start.asText() : null);
        }

        TreeBuildResult result(int itemCount) {
            return new TreeBuildResult(nodes, failures, itemCount);
        }
    }

    static Extent extent(List<ChildSummary> children) {
        List<Double> bbox = mergeBbox(children);
        return Extent.of(bbox != null ? bbox : WORLD, minDatetime(children));
    }

    /**
     * Union of the children's boxes; both corners are compared on each axis.
     */
    static List<Double> mergeBbox(List<ChildSummary> children) {
        List<Double> merged = null;
        for (ChildSummary child : children) {
            List<Double> b = child.bbox();
            if (b == null) {
                continue;
            }
            if (merged == null) {
                merged = List.of(Math.min(b.get(0), b.get(2)), Math.min(b.get(1), b.get(3)),
                        Math.max(b.get(0), b.get(2)), Math.max(b.get(1), b.get(3)));
            } else {
                merged = List.of(
                        Math.min(Math.min(merged.get(0), merged.get(2)), Math.min(b.get(0), b.get(2))),
                        Math.min(Math.min(merged.get(1), merged.get(3)), Math.min(b.get(1), b.get(3))),
                        Math.max(Math.max(merged.get(0), merged.get(2)), Math.max(b.get(0), b.get(2))),
                        Math.max(Math.max(merged.get(1), merged.get(3)), Math.max(b.get(1), b.get(3))));
            }
        }
        return merged;
    }

    static String minDatetime(List<ChildSummary> children) {
        return children.stream()
                .map(ChildSummary::datetime)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
    }
}
