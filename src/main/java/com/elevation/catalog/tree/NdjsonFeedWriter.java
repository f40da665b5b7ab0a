package com.elevation.catalog.tree;

import com.elevation.catalog.core.CatalogWriteException;
import com.elevation.catalog.document.CatalogItem;
import com.elevation.catalog.document.CatalogJson;
import com.elevation.catalog.document.CatalogNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Writes newline-delimited JSON feeds for the dynamic lookup service: one compact document per line.
 * Node lines are projections of the documents a tree build produced, never recomputed.
 */
public class NdjsonFeedWriter {
    private static final Logger log = LoggerFactory.getLogger(NdjsonFeedWriter.class);

    private final ObjectWriter writer = CatalogJson.lineWriter();

    /**
     * Writes the nodes a build wrote to disk, children first. Kept nodes are left out,
     * since their files still hold the earlier document.
     *
     * @param stripLinks whether to drop the links of each node
     * @return the number of lines written
     */
    public int writeNodes(Path target, TreeBuildResult result, boolean stripLinks) {
        try (BufferedWriter out = open(target)) {
            int lines = writeNodes(out, result.writtenNodes().stream().map(NodeDocument::node)
                    .collect(Collectors.toList()), stripLinks);
            log.info("feed.nodes.written path={} lines={} stripLinks={}", target, lines, stripLinks);
            return lines;
        } catch (IOException e) {
            throw new CatalogWriteException("Failed to write node feed", target, e);
        }
    }

    public int writeNodes(Writer out, Collection<CatalogNode> nodes, boolean stripLinks) throws IOException {
        int lines = 0;
        for (CatalogNode node : nodes) {
            writeLine(out, stripLinks ? node.withoutLinks() : node);
            lines++;
        }
        return lines;
    }

    /**
     * @return the number of lines written
     */
    public int writeItems(Path target, Collection<CatalogItem> items) {
        try (BufferedWriter out = open(target)) {
            int lines = writeItems(out, items);
            log.info("feed.items.written path={} lines={}", target, lines);
            return lines;
        } catch (IOException e) {
            throw new CatalogWriteException("Failed to write item feed", target, e);
        }
    }

    public int writeItems(Writer out, Collection<CatalogItem> items) throws IOException {
        int lines = 0;
        for (CatalogItem item : items) {
            writeLine(out, item);
            lines++;
        }
        return lines;
    }

    private void writeLine(Writer out, Object document) throws IOException {
        out.write(writer.writeValueAsString(document));
        out.write('\n');
    }

    private static BufferedWriter open(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(target, StandardCharsets.UTF_8);
    }
}
