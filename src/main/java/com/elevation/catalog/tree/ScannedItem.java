package com.elevation.catalog.tree;

import com.elevation.catalog.document.Link;
import com.elevation.catalog.document.NodePath;

import java.util.List;

/**
 * An item document found on disk, reduced to what its partition node needs.
 */
public record ScannedItem(
        NodePath partition,
        String id,
        String collectionId,
        String title,
        String href,
        List<Double> bbox,
        String datetime
) {
    ChildSummary toSummary() {
        return new ChildSummary(id, title, href, Link.GEO_JSON, bbox, datetime);
    }
}
