package com.graphd.query.constraint;

/**
 * Tri-state (plus inferred) value of a boolean constraint such as
 * {@code live=}, {@code archival=} or {@code anchor=}.
 */
public enum Flag {
    /** Not mentioned in the request. */
    UNSPECIFIED,
    /** Must be false. */
    FALSE,
    /** Must be true. */
    TRUE,
    /** Either value matches. */
    DONTCARE,
    /** True, inferred from a neighbouring constraint. */
    TRUE_LOCAL
}
