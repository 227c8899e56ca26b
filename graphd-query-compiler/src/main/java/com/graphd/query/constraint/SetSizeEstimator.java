package com.graphd.query.constraint;

import com.graphd.query.guid.Guid;
import com.graphd.query.guid.GuidConstraint;
import com.graphd.query.guid.GuidSet;
import com.graphd.query.guid.StorageException;
import com.graphd.query.guid.StorageOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upper bounds on the number of primitives that can match a
 * constraint, given one fixed parent.
 */
public final class SetSizeEstimator {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SetSizeEstimator.class);

    /** Private constructor to prevent instantiation. */
    private SetSizeEstimator() {
        // Utility class
    }

    /**
     * Start from the id range: a false constraint matches nothing, an
     * "I am" constraint matches the one primitive its parent points to,
     * anything else at most every primitive in {@code [low, high)}.
     *
     * @param oracle the storage
     * @param con the constraint
     * @throws StorageException if the primitive count is unavailable
     */
    public static void initialize(final StorageOracle oracle,
            final Constraint con) throws StorageException {
        if (con.isFalse()) {
            con.setSetSize(0);
        } else if (con.getLinkage().isIAm()) {
            con.setSetSize(1);
        } else {
            long n = Math.min(oracle.totalPrimitiveCount(), con.getHigh());
            con.setSetSize(Math.max(0, n - con.getLow()));
        }
    }

    /**
     * Narrow the bound with the storage's estimate for each linkage
     * that is pinned to a single GUID.
     *
     * @param oracle the storage
     * @param con the constraint, initialized
     * @throws StorageException on storage failure
     */
    public static void refine(final StorageOracle oracle,
            final Constraint con) throws StorageException {
        if (con.isFalse()) {
            con.setSetSize(0);
            return;
        }
        if (con.getLinkage().isIAm()) {
            con.setSetSize(1);
            return;
        }
        long n = con.getSetSize();
        for (Linkage linkage : Linkage.values()) {
            Guid endpoint = pinned(con.getLinkcon(linkage));
            if (endpoint == null) {
                continue;
            }
            long est = oracle.estimateSetSize(linkage, endpoint,
                con.getLow(), con.getHigh());
            if (est < n) {
                n = est;
            }
        }
        if (n < con.getSetSize()) {
            LOGGER.debug("set size of {}: {} -> {}", con, con.getSetSize(), n);
            con.setSetSize(n);
        }
    }

    private static Guid pinned(final GuidConstraint gc) {
        GuidSet in = gc.getInclude();
        if (!gc.isIncludeValid() || in.size() != 1 || in.get(0).isNull()) {
            return null;
        }
        return in.get(0);
    }
}
