package com.elevation.catalog.item;

import com.elevation.catalog.document.CatalogItem;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of building one item.
 *
 * @param itemId       id of the publication the item was built for
 * @param collectionId collection of the item, or null when it could not be derived
 * @param status       build outcome
 * @param item         the item document; present only when the status is writable
 * @param relativePath document path below the catalog root; present only with the item
 * @param message      failure or suppression reason, or a note on missing metadata
 * @param missing      joined metadata rows that were absent (e.g. {@code dem}, {@code mosaic-info})
 */
public record ItemBuildResult(
        String itemId,
        String collectionId,
        ItemStatus status,
        CatalogItem item,
        String relativePath,
        String message,
        List<String> missing
) {
    public ItemBuildResult {
        Objects.requireNonNull(itemId, "itemId is required");
        Objects.requireNonNull(status, "status is required");
        missing = missing != null ? List.copyOf(missing) : List.of();
        if (status.isWritable() && (item == null || relativePath == null)) {
            throw new IllegalArgumentException("A built result needs an item and a path: " + itemId);
        }
    }

    public static ItemBuildResult built(CatalogItem item, String relativePath, List<String> missing) {
        if (missing.isEmpty()) {
            return new ItemBuildResult(item.id(), item.collection(), ItemStatus.BUILT, item, relativePath, null, missing);
        }
        return new ItemBuildResult(item.id(), item.collection(), ItemStatus.INCOMPLETE, item, relativePath,
                "missing metadata: " + String.join(", ", missing), missing);
    }

    public static ItemBuildResult failed(String itemId, String collectionId, String message) {
        return new ItemBuildResult(itemId, collectionId, ItemStatus.FAILED, null, null, message, List.of());
    }

    public static ItemBuildResult suppressed(String itemId, String collectionId, String reason) {
        return new ItemBuildResult(itemId, collectionId, ItemStatus.SUPPRESSED, null, null, reason, List.of());
    }

    public boolean isWritable() {
        return status.isWritable();
    }
}
