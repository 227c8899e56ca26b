package com.graphd.query.guid;

import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The GUID restrictions on one field of a constraint: the primitive's own
 * GUID, one of its linkages, or its next/previous version.
 *
 * <p>Three sets, each with a validity flag:</p>
 * <ul>
 *   <li>include - the value must be one of these ({@code =})</li>
 *   <li>exclude - the value must not be one of these ({@code !=})</li>
 *   <li>match - the value must be a version of one of these
 *       ({@code ~=}); converted to include once lineages are known</li>
 * </ul>
 */
public final class GuidConstraint {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        GuidConstraint.class);

    /** The {@code =} set. */
    private final GuidSet include = new GuidSet();

    /** The {@code !=} set. */
    private final GuidSet exclude = new GuidSet();

    /** The {@code ~=} set. */
    private final GuidSet match = new GuidSet();

    /** Is the include set in effect? */
    private boolean includeValid;

    /** Is the exclude set in effect? */
    private boolean excludeValid;

    /** Is the match set in effect? */
    private boolean matchValid;

    /** Was the include set filled in by the compiler rather than the user? */
    private boolean includeAnnotated;

    /**
     * Merge an incoming set into this constraint.
     *
     * <p>{@code EQ} intersects into the include set, {@code NE} subtracts
     * from it (or unions into the exclude set while there is none),
     * {@code MATCH} intersects into the match set, postponing the
     * lineage-aware part. Afterwards {@code EQ(A) & NE(B)} is folded into
     * {@code EQ(A - B)}. {@code UNSPECIFIED} performs only the fold.</p>
     *
     * @param con the owning constraint, marked false on contradiction
     * @param op the operator of the incoming set
     * @param gs the incoming set, or null with {@code UNSPECIFIED}; taken
     *     over
     */
    public void merge(final Constraint con, final Operator op,
            final GuidSet gs) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("merge {} {} into {}", op.symbol(), gs, this);
        }
        switch (op) {
            case MATCH:
                if (matchValid) {
                    match.intersect(con, true, gs);
                } else {
                    match.moveFrom(gs);
                    matchValid = true;
                }
                break;
            case EQ:
                if (includeValid) {
                    include.intersect(con, false, gs);
                } else {
                    include.moveFrom(gs);
                    includeValid = true;
                }
                break;
            case NE:
                if (includeValid) {
                    if (!include.subtract(gs)) {
                        LOGGER.debug("FALSE: =/!= subtraction reduces to null");
                        con.markFalse();
                    }
                    break;
                }
                if (excludeValid) {
                    exclude.union(gs);
                } else {
                    exclude.moveFrom(gs);
                    excludeValid = true;
                }
                break;
            case UNSPECIFIED:
                break;
            default:
                throw new IllegalArgumentException(
                    "unexpected GUID operator " + op);
        }

        if (includeValid && excludeValid) {
            if (!include.subtract(exclude)) {
                LOGGER.debug("FALSE: =/!= subtraction reduces to null");
                con.markFalse();
            } else {
                exclude.moveFrom(new GuidSet());
                excludeValid = false;
            }
        }
    }

    /**
     * Narrow the include set to a single GUID, marking the constraint
     * false if the GUID was not allowed.
     *
     * @param con the owning constraint
     * @param guid the GUID
     */
    public void intersectWithGuid(final Constraint con, final Guid guid) {
        GuidSet tmp = new GuidSet();
        tmp.add(guid);
        if (includeValid) {
            include.intersect(con, false, tmp);
        } else {
            includeValid = true;
            includeAnnotated = true;
            include.moveFrom(tmp);
        }
    }

    /**
     * The single non-null GUID this constraint pins down, if any.
     *
     * @return the GUID, or null if the constraint allows zero or more
     *     than one value
     */
    public Guid single() {
        if (includeValid && include.getNext() == null && include.size() == 1
                && !include.get(0).isNull() && !excludeValid && !matchValid) {
            return include.get(0);
        }
        return null;
    }

    /**
     * Does this constraint restrict anything?
     *
     * @return true if any of the sets is in effect
     */
    public boolean isSet() {
        return includeValid || excludeValid || matchValid;
    }

    /**
     * Get the include set.
     *
     * @return the {@code =} set
     */
    public GuidSet getInclude() {
        return include;
    }

    /**
     * Get the exclude set.
     *
     * @return the {@code !=} set
     */
    public GuidSet getExclude() {
        return exclude;
    }

    /**
     * Get the match set.
     *
     * @return the {@code ~=} set
     */
    public GuidSet getMatch() {
        return match;
    }

    /**
     * Is the include set in effect?
     *
     * @return the flag
     */
    public boolean isIncludeValid() {
        return includeValid;
    }

    /**
     * Set whether the include set is in effect.
     *
     * @param includeValid the flag
     */
    public void setIncludeValid(final boolean includeValid) {
        this.includeValid = includeValid;
    }

    /**
     * Is the exclude set in effect?
     *
     * @return the flag
     */
    public boolean isExcludeValid() {
        return excludeValid;
    }

    /**
     * Set whether the exclude set is in effect.
     *
     * @param excludeValid the flag
     */
    public void setExcludeValid(final boolean excludeValid) {
        this.excludeValid = excludeValid;
    }

    /**
     * Is the match set in effect?
     *
     * @return the flag
     */
    public boolean isMatchValid() {
        return matchValid;
    }

    /**
     * Set whether the match set is in effect.
     *
     * @param matchValid the flag
     */
    public void setMatchValid(final boolean matchValid) {
        this.matchValid = matchValid;
    }

    /**
     * Was the include set computed rather than requested?
     *
     * @return the flag
     */
    public boolean isIncludeAnnotated() {
        return includeAnnotated;
    }

    /**
     * Are two GUID constraints equal? Order-sensitive, so equal
     * constraints may be reported unequal, never the reverse.
     *
     * @param a a constraint
     * @param b another constraint
     * @return true if equal
     */
    public static boolean equal(final GuidConstraint a,
            final GuidConstraint b) {
        if (a.includeValid != b.includeValid
                || a.excludeValid != b.excludeValid
                || a.matchValid != b.matchValid) {
            return false;
        }
        return (!a.includeValid || GuidSet.equal(a.include, b.include))
            && (!a.excludeValid || GuidSet.equal(a.exclude, b.exclude))
            && (!a.matchValid || GuidSet.equal(a.match, b.match));
    }

    /**
     * Hash consistent with {@link #equal}.
     *
     * @param gc a constraint
     * @return the hash
     */
    public static int hash(final GuidConstraint gc) {
        int h = (gc.includeValid ? 4 : 0) | (gc.excludeValid ? 2 : 0)
            | (gc.matchValid ? 1 : 0);
        if (gc.includeValid) {
            h = 31 * h + GuidSet.hash(gc.include);
        }
        if (gc.excludeValid) {
            h = 31 * h + GuidSet.hash(gc.exclude);
        }
        if (gc.matchValid) {
            h = 31 * h + GuidSet.hash(gc.match);
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (includeValid) {
            sb.append('=').append(include);
        }
        if (excludeValid) {
            sb.append(sb.length() > 0 ? " " : "").append("!=").append(exclude);
        }
        if (matchValid) {
            sb.append(sb.length() > 0 ? " " : "").append("~=").append(match);
        }
        return sb.length() == 0 ? "*" : sb.toString();
    }
}
