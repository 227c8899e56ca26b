package com.graphd.query.guid;

/**
 * Where a primitive sits in its lineage.
 *
 * @param lineageId local id of the lineage's original
 * @param generation 0 for the original, counting up with each version
 */
public record LineagePosition(long lineageId, long generation) {
}
