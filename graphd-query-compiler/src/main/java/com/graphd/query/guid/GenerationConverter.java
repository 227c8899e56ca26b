package com.graphd.query.guid;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintOr;
import com.graphd.query.constraint.GenerationalConstraint;
import com.graphd.query.constraint.Linkage;
import com.graphd.query.constraint.Operator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers version-relative GUID constraints into plain GUID sets.
 *
 * <p>{@code previous=}, {@code next=}, {@code guid~=} and the linkage
 * {@code ~=} forms can only be answered by looking at lineages in the
 * store. This pass asks the {@link StorageOracle} and rewrites them into
 * {@code guid=} and linkage {@code =} sets, then settles the default
 * generational window of read requests. It must run without intervening
 * writes, or the sets may be stale by the time the request executes.</p>
 */
public final class GenerationConverter {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        GenerationConverter.class);

    /** The lineage lookup. */
    private final StorageOracle oracle;

    /** Null, or the version horizon of the request. */
    private final Long asOf;

    /** Is this for a read request? */
    private final boolean read;

    /**
     * Creates a new GenerationConverter.
     *
     * @param oracle the lineage lookup
     * @param asOf null or the version horizon
     * @param read true for read requests, false for writes
     */
    public GenerationConverter(final StorageOracle oracle, final Long asOf,
            final boolean read) {
        this.oracle = oracle;
        this.asOf = asOf;
        this.read = read;
    }

    /**
     * Convert a constraint, its or-branches and its subconstraints.
     *
     * @param con the constraint
     * @throws SemanticException if a write request uses a form that only
     *     makes sense for reads
     * @throws StorageException on store failure
     */
    public void convert(final Constraint con)
            throws SemanticException, StorageException {
        if (con.getVersionPrevious().isSet()) {
            convertPrevious(con);
        }
        if (con.getVersionNext().isSet()) {
            convertNext(con);
        }

        GuidConstraint guid = con.getGuid();
        if (!read && guid.isIncludeValid() && guid.getInclude().size() > 1) {
            throw SemanticException.semantics(
                "can't version more than one GUID at once!");
        }

        if (guid.isMatchValid()) {
            convertMatch(con, guid, true);
        }
        for (Linkage linkage : Linkage.values()) {
            GuidConstraint linkcon = con.getLinkcon(linkage);
            if (linkcon.isMatchValid()) {
                convertMatch(con, linkcon, false);
            }
        }

        if (read) {
            completeGenerations(con);
        }

        for (ConstraintOr cor : con.getOrs()) {
            convert(cor.getHead());
            if (cor.getTail() != null) {
                convert(cor.getTail());
            }
        }
        for (Constraint sub : con.getSubs()) {
            // Subconstraints of or-branches were visited with the branch.
            if (sub.getParent() == con) {
                convert(sub);
            }
        }
    }

    private void convertMatch(final Constraint con, final GuidConstraint gc,
            final boolean isGuid) throws StorageException {
        for (GuidSet gs = gc.getMatch(); gs != null; gs = gs.getNext()) {
            gs.convertGenerations(oracle, asOf, con, isGuid);
            gc.merge(con, Operator.EQ, gs.copyLink());
        }
        gc.setMatchValid(false);
    }

    /*  Before this, "not valid" means "use the default"; afterwards it
     *  means "no restriction".
     */
    private static void completeGenerations(final Constraint con) {
        GenerationalConstraint newest = con.getNewest();
        GenerationalConstraint oldest = con.getOldest();
        if (!newest.isValid() && !oldest.isValid()) {
            newest.set(0, 0);
        }
        if (newest.isValid() && newest.getMin() == 0
                && newest.getMax() == GenerationalConstraint.MAX) {
            newest.setValid(false);
        }
        if (oldest.isValid() && oldest.getMin() == 0
                && oldest.getMax() == GenerationalConstraint.MAX) {
            oldest.setValid(false);
        }
    }

    /*  next=X: the candidate is the generation before X. */
    private void convertNext(final Constraint con)
            throws SemanticException, StorageException {
        GuidConstraint vn = con.getVersionNext();
        GuidSet in = vn.getInclude();

        if (vn.isMatchValid()) {
            for (GuidSet ma = vn.getMatch(); ma != null; ma = ma.getNext()) {
                if (ma.size() == 0) {
                    if (read) {
                        requireNewest(con);
                    }
                } else if (!read) {
                    throw SemanticException.semantics(
                        "can't use NEXT~=%s in a write request!", ma.get(0));
                } else {
                    GuidSet gs = new GuidSet();
                    for (Guid g : ma.getGuids()) {
                        Optional<LineageInfo> info =
                            oracle.lineageLastGeneration(g, asOf);
                        if (info.isEmpty()
                                || info.get().generationCount() <= 1) {
                            continue;
                        }
                        // The original can't be anyone's next.
                        gs.addGenerations(oracle, asOf, g, 1,
                            info.get().generationCount() - 1);
                    }
                    vn.merge(con, Operator.EQ, gs);
                }
            }
            vn.setMatchValid(false);
        }

        playOffExclude(con, vn);

        if (vn.isIncludeValid()) {
            if (in.size() == 0) {
                if (read) {
                    requireNewest(con);
                }
            } else if (!read) {
                throw SemanticException.semantics(
                    "can't use NEXT=%s in a write request!", in.get(0));
            } else {
                GuidSet gs = new GuidSet();
                if (in.containsNull()) {
                    gs.add(null);
                }
                for (Guid g : in.getGuids()) {
                    Optional<LineagePosition> pos =
                        oracle.guidToLineagePosition(g);
                    if (pos.isEmpty() || pos.get().generation() <= 0) {
                        continue;
                    }
                    oracle.nthGeneration(g, asOf, false,
                        pos.get().generation() - 1).ifPresent(gs::add);
                }
                con.getGuid().merge(con, Operator.EQ, gs);
                vn.setIncludeValid(false);
            }
        }

        // Having a successor means not being the newest.
        if (read && !con.getNewest().isValid()) {
            con.getNewest().set(1, GenerationalConstraint.MAX);
        }
    }

    /*  previous=X: the candidate is the generation after X. */
    private void convertPrevious(final Constraint con)
            throws StorageException {
        GuidConstraint vp = con.getVersionPrevious();
        GuidSet in = vp.getInclude();

        if (vp.isMatchValid()) {
            for (GuidSet ma = vp.getMatch(); ma != null; ma = ma.getNext()) {
                if (vp.isIncludeValid() && in.size() == 0) {
                    if (!ma.containsNull()) {
                        LOGGER.debug("FALSE: ~= null, but = (!null)");
                        con.markFalse();
                    }
                } else if (ma.size() == 0) {
                    // previous~=null: this is the original.
                    if (!vp.isIncludeValid()) {
                        vp.setIncludeValid(true);
                        in.moveFrom(new GuidSet());
                    } else if (!in.containsNull()) {
                        LOGGER.debug("FALSE: ~= null, but = (!null)");
                        con.markFalse();
                    } else {
                        GuidSet onlyNull = new GuidSet();
                        onlyNull.add(null);
                        in.moveFrom(onlyNull);
                    }
                } else {
                    GuidSet gs = new GuidSet();
                    if (ma.containsNull()) {
                        gs.add(null);
                    }
                    for (Guid g : ma.getGuids()) {
                        Optional<LineageInfo> info =
                            oracle.lineageLastGeneration(g, asOf);
                        if (info.isEmpty()) {
                            continue;
                        }
                        long n = info.get().generationCount();
                        if (LOGGER.isTraceEnabled()) {
                            LOGGER.trace("{} generations of {}", n, g);
                        }
                        if (read && n <= 1) {
                            continue;
                        }
                        if (read) {
                            gs.addGenerations(oracle, asOf, g, 0, n - 1);
                        } else {
                            gs.addGenerations(oracle, asOf, g,
                                Math.max(0, n - 1), 1);
                        }
                    }
                    vp.merge(con, Operator.EQ, gs);
                }
            }
            vp.setMatchValid(false);
        }

        playOffExclude(con, vp);

        if (vp.isIncludeValid()) {
            if (in.size() == 0) {
                // previous=null: this is the original.
                GenerationalConstraint oldest = con.getOldest();
                if (!oldest.isValid() || oldest.getMin() == 0) {
                    oldest.set(0, 0);
                } else {
                    LOGGER.debug("FALSE: GUID is not the original");
                    con.markFalse();
                }
                return;
            }

            GuidSet gs = new GuidSet();
            if (in.isNullFlag()) {
                gs.add(null);
            }
            for (Guid g : in.getGuids()) {
                if (!read) {
                    gs.add(g);
                    continue;
                }
                Optional<LineagePosition> pos =
                    oracle.guidToLineagePosition(g);
                if (pos.isEmpty()) {
                    continue;
                }
                oracle.nthGeneration(g, asOf, false,
                    pos.get().generation() + 1).ifPresent(gs::add);
            }
            con.getGuid().merge(con, Operator.EQ, gs);
            vp.setIncludeValid(false);
        }
    }

    private static void playOffExclude(final Constraint con,
            final GuidConstraint gc) {
        if (gc.isIncludeValid() && gc.isExcludeValid()) {
            if (!gc.getInclude().subtract(gc.getExclude())) {
                LOGGER.debug("FALSE: =/!= subtraction reduces to null");
                con.markFalse();
            }
            gc.setExcludeValid(false);
        }
    }

    private static void requireNewest(final Constraint con) {
        GenerationalConstraint newest = con.getNewest();
        if (!newest.isValid() || newest.getMin() == 0) {
            newest.set(0, 0);
        } else {
            LOGGER.debug("FALSE: GUID is newest");
            con.markFalse();
        }
    }
}
