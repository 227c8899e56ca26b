package com.graphd.query.sort;

/**
 * The order in which an executor should produce the candidates of a
 * constraint.
 */
public enum IteratorDirection {
    /** Ascending local id. */
    FORWARD,
    /** Descending local id. */
    BACKWARD,
    /** The order named by a sort root's ordering path. */
    ORDERING,
    /** Any order will do. */
    ANY
}
