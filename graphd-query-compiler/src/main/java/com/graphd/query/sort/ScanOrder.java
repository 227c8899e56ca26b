package com.graphd.query.sort;

/**
 * How to scan a constraint: a direction and, for sorted scans, the
 * ordering path of the sort root that the scan must follow.
 *
 * @param direction the scan direction
 * @param ordering the sort root's ordering path, or null
 */
public record ScanOrder(IteratorDirection direction, String ordering) {
}
