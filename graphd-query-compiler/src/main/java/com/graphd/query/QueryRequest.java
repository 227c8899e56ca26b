package com.graphd.query;

import com.graphd.query.constraint.Constraint;
import com.graphd.query.guid.StorageOracle;

/**
 * One request's constraint tree and the context it is compiled in.
 *
 * @param kind the request verb
 * @param root the outermost constraint
 * @param oracle the storage the request runs against
 * @param asOf null, or the version horizon of a read
 * @param softTimeout does the request carry a soft timeout?
 * @param config the compiler tunables
 */
public record QueryRequest(RequestKind kind, Constraint root,
        StorageOracle oracle, Long asOf, boolean softTimeout,
        CompilerConfig config) {

    /**
     * Validates the required parts.
     *
     * @param kind the request verb
     * @param root the outermost constraint
     * @param oracle the storage the request runs against
     * @param asOf null, or the version horizon of a read
     * @param softTimeout does the request carry a soft timeout?
     * @param config the compiler tunables
     */
    public QueryRequest {
        if (kind == null || root == null || oracle == null) {
            throw new IllegalArgumentException(
                "kind, root and oracle are required");
        }
        if (config == null) {
            config = CompilerConfig.defaults();
        }
    }

    /**
     * A request with no horizon, no soft timeout and the default
     * configuration.
     *
     * @param kind the request verb
     * @param root the outermost constraint
     * @param oracle the storage
     * @return the request
     */
    public static QueryRequest of(final RequestKind kind,
            final Constraint root, final StorageOracle oracle) {
        return new QueryRequest(kind, root, oracle, null, false,
            CompilerConfig.defaults());
    }
}
