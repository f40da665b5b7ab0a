package com.elevation.catalog.audit;

/**
 * Types of auditable actions in the catalog pipeline.
 */
public enum AuditAction {
    RECORD_REJECTED,
    IDENTITY_DEPRECATED,
    CANONICAL_SELECTED,
    SELECTION_CONFLICT,
    ITEM_BUILT,
    ITEM_FAILED,
    NODE_WRITTEN,
    NODE_SKIPPED
}
