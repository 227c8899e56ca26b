package com.graphd.query.constraint;

/**
 * The structural kind of primitive a constraint matches: a node, or a
 * link seen from one of its ends ({@code ->} / {@code <-}).
 */
public enum Meta {
    /** Not specified. */
    UNSPECIFIED,
    /** A node (no left or right). */
    NODE,
    /** {@code <-}: the parent is the right side of the link. */
    LINK_TO,
    /** {@code ->}: the parent is the left side of the link. */
    LINK_FROM,
    /** Any kind of primitive. */
    ANY
}
