package com.elevation.catalog.tree;

/**
 * A document found during a scan that could not be placed in the tree.
 *
 * @param relativePath path of the document below the catalog root
 * @param reason       why it was skipped
 */
public record ScanFailure(String relativePath, String reason) {}
