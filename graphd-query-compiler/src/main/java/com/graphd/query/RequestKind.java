package com.graphd.query;

/**
 * The request verbs whose constraints this compiler handles.
 */
public enum RequestKind {
    /** Return matching primitives. */
    READ,
    /** Return matching primitives, resumable with a cursor. */
    ITERATE,
    /** Create primitives. */
    WRITE;

    /**
     * Does the request look up existing primitives?
     *
     * @return true for {@link #READ} and {@link #ITERATE}
     */
    public boolean isRead() {
        return this == READ || this == ITERATE;
    }
}
