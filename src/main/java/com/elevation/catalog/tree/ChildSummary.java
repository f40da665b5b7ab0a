package com.elevation.catalog.tree;

import java.util.List;

/**
 * What a parent node needs from one child: its link fields and its extent contribution.
 *
 * @param bbox     [minX, minY, maxX, maxY], or null when unknown
 * @param datetime earliest datetime, or null when unknown
 */
record ChildSummary(String id, String title, String href, String type, List<Double> bbox, String datetime) {}
