package com.graphd.query.guid;

/**
 * The newest member of a lineage and the lineage's length.
 *
 * @param lastId local id of the newest generation
 * @param generationCount number of generations; 0 if the primitive was
 *     never versioned
 */
public record LineageInfo(long lastId, long generationCount) {
}
