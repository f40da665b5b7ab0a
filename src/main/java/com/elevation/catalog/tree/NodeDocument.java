package com.elevation.catalog.tree;

import com.elevation.catalog.document.CatalogNode;
import com.elevation.catalog.document.NodePath;

/**
 * A node document produced by a tree build.
 *
 * @param path         position of the node in the tree
 * @param relativePath document path below the catalog root
 * @param node         the document
 * @param written      whether the file was written; false when an existing file was kept
 */
public record NodeDocument(NodePath path, String relativePath, CatalogNode node, boolean written) {}
