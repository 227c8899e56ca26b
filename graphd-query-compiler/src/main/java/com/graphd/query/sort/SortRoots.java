package com.graphd.query.sort;

import com.graphd.query.comparator.ValueComparator;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.variable.Assignment;
import com.graphd.query.variable.Assignments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds, prunes and propagates sort roots over a constraint tree.
 *
 * <p>Given {@code (sort=$x (<- $x=value))}, the outer constraint is
 * ordered by the value of its mandatory subconstraint; that
 * subconstraint and its {@code value} are the outer constraint's sort
 * root. Promotion then gives every constraint between the two a sort
 * of its own, so that each level can produce its matches in the
 * root's order.</p>
 */
public final class SortRoots {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SortRoots.class);

    /** Private constructor to prevent instantiation. */
    private SortRoots() {
        // Utility class
    }

    /**
     * Annotate every constraint in a tree with its sort root, if it has
     * one. Subconstraints are marked first.
     *
     * @param con the root of the tree
     */
    public static void mark(final Constraint con) {
        con.setSortRoot(null);
        for (Constraint sub : con.getSubs()) {
            mark(sub);
        }
        if (con.getSort() == null || !con.isSortValid()) {
            return;
        }
        Pattern pat = Pattern.head(con.getSort());
        if (pat == null) {
            return;
        }
        if (pat.getType() == PatternType.VARIABLE) {
            con.setSortRoot(forVariable(con, pat));
        } else {
            con.setSortRoot(new SortRoot(con, pat));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("sort root of {}: {}", con, con.getSortRoot());
        }
    }

    /*  The sort root of a constraint sorted by var: the single mandatory
     *  direct subconstraint that assigns var, followed down through
     *  variable-to-variable assignments. Sign and comparator of the
     *  levels above travel down with the search.
     */
    private static SortRoot forVariable(final Constraint con,
            final Pattern var) {
        SortRoot out = null;

        for (Constraint sub : con.getSubs()) {
            Assignment a = Assignments.byDeclaration(sub,
                var.getDeclaration());
            if (a == null) {
                continue;
            }
            if (out != null) {
                LOGGER.debug("no sort root for {}: more than one source",
                    var);
                return null;
            }
            if (!sub.isMandatory() || sub.getParent() != con) {
                LOGGER.debug("no sort root for {}: optional source {}", var,
                    sub);
                return null;
            }
            Pattern pat = Pattern.head(a.getResult());
            if (pat == null) {
                return null;
            }
            pat.setSortForward(pat.isSortForward() ^ !var.isSortForward());

            if (pat.getType() == PatternType.VARIABLE) {
                if (pat.getComparator() == null) {
                    pat.setComparator(var.getComparator());
                }
                out = forVariable(sub, pat);
                if (out == null) {
                    return null;
                }
            } else {
                if (var.getComparator() != null) {
                    pat.setComparator(var.getComparator());
                }
                out = new SortRoot(sub, pat);
            }

            if (out.getPattern().getType().isSetValue()) {
                LOGGER.debug("no sort root for {}: {} is not per-primitive",
                    var, out.getPattern());
                return null;
            }

            // A sorted source must already be sorted the same way.
            if (sub.getSort() != null && sub.isSortValid()
                    && !sameCriterion(sub.getSortRoot(), out)) {
                LOGGER.debug("no sort root for {}: {} is sorted by {}", var,
                    sub, sub.getSortRoot());
                return null;
            }
        }
        return out;
    }

    private static boolean sameCriterion(final SortRoot a, final SortRoot b) {
        return a != null
            && a.getConstraint() == b.getConstraint()
            && a.getPattern().getType() == b.getPattern().getType()
            && a.getPattern().getComparator() == b.getPattern().getComparator()
            && a.getPattern().isSortForward()
                == b.getPattern().isSortForward();
    }

    /**
     * Remove sort roots that need no propagated ordering, and sort roots
     * whose path disagrees about the value comparator.
     *
     * <p>A constraint sorted locally by GUID or timestamp, and not the
     * sort root of its parent, can be sorted by its iterator alone.</p>
     *
     * @param con the root of the tree
     */
    public static void unmark(final Constraint con) {
        for (Constraint sub : con.getSubs()) {
            unmark(sub);
        }
        if (con.getSort() == null || !con.isSortValid()) {
            return;
        }
        Pattern pat = Pattern.head(con.getSort());
        if (pat == null) {
            return;
        }

        SortRoot sr = con.getSortRoot();
        Constraint parent = con.getParent();
        if (sr != null && sr.getConstraint() == con
                && (parent == null || parent.getSortRoot() == null
                    || parent.getSortRoot().getConstraint() != con)
                && (sr.getPattern().getType() == PatternType.GUID
                    || sr.getPattern().getType() == PatternType.TIMESTAMP)) {
            LOGGER.debug("drop trivial sort root of {}", con);
            con.setSortRoot(null);
            return;
        }

        if (sr == null || sr.getConstraint() == con
                || sr.getPattern().getType() != PatternType.VALUE) {
            return;
        }
        for (Constraint sub = sr.getConstraint(); sub != null && sub != con;
                sub = sub.getParent()) {
            if (sub.getLinkage().isIAm()
                    || sub.getSort() == null || !sub.isSortValid()) {
                continue;
            }
            Pattern spat = Pattern.head(sub.getSort());
            if (spat == null || spat.getComparator() == pat.getComparator()) {
                continue;
            }
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("comparator disagreement between root {} ({}) "
                    + "and {} ({})", comparatorName(pat.getComparator()), con,
                    comparatorName(spat.getComparator()), sub);
            }
            for (Constraint c = sub; c != null; c = c.getParent()) {
                c.setSortRoot(null);
                if (c == con) {
                    break;
                }
            }
            break;
        }
    }

    private static String comparatorName(final ValueComparator cmp) {
        return cmp == null ? "(null)" : cmp.name();
    }

    /**
     * Give every constraint between a sorted constraint and its sort
     * root a sort of its own, unless it already has one.
     *
     * @param con the root of the tree
     */
    public static void promote(final Constraint con) {
        SortRoot root = con.getSortRoot();
        if (con.getSort() != null && con.isSortValid() && root != null
                && root.getConstraint() != con) {
            for (Constraint sub = root.getConstraint();
                    sub != null && sub != con; sub = sub.getParent()) {
                if (sub.getSort() != null && sub.isSortValid()) {
                    continue;
                }
                Pattern pat = intermediary(con, sub);
                sub.setSort(Pattern.dup(null, pat));
                sub.setSortValid(true);
                sub.setSortRoot(root);
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("promoted sort {} into {}",
                        sub.getSort().dump(), sub);
                }
            }
        }
        for (Constraint sub : con.getSubs()) {
            promote(sub);
        }
    }

    /*  The pattern through which top's sort value passes bottom, found
     *  by following the assignment chain down from top's sort variable.
     */
    private static Pattern intermediary(final Constraint top,
            final Constraint bottom) {
        Pattern pat = Pattern.head(top.getSort());
        boolean sign = pat.isSortForward();
        ValueComparator cmp = pat.getComparator();

        for (Constraint con = top;;) {
            Constraint source = null;
            Assignment a = null;
            for (Constraint sub : con.getSubs()) {
                a = Assignments.byDeclaration(sub, pat.getDeclaration());
                if (a != null) {
                    source = sub;
                    break;
                }
            }
            if (source == null) {
                throw new IllegalStateException("no assignment to "
                    + pat + " below " + con);
            }
            pat = Pattern.head(a.getResult());
            if (pat == null) {
                throw new IllegalStateException("empty assignment to "
                    + a.getDeclaration().getName() + " in " + source);
            }
            sign ^= !pat.isSortForward();

            if (source == bottom) {
                pat.setComparator(cmp);
                pat.setSortForward(sign);
                return pat;
            }
            con = source;
        }
    }

    /**
     * How an executor should scan a constraint. Or-branches scan the way
     * their prototype root does.
     *
     * @param con the constraint
     * @return the direction, with the sort root's ordering path if there
     *     is one
     */
    public static ScanOrder iteratorDirection(final Constraint con) {
        if (con.getOr() != null) {
            return iteratorDirection(con.prototypeRoot());
        }
        String ordering = null;
        if (con.getSortRoot() != null) {
            ordering = con.getSortRoot().ordering();
            if (ordering == null) {
                con.setSortRoot(null);
            }
        }
        IteratorDirection dir = SortCompiler.iteratorDirection(
            con.isSortValid() ? con.getSort() : null);
        if (con.getSortRoot() == null) {
            return new ScanOrder(dir, null);
        }
        if (dir == IteratorDirection.ANY) {
            return new ScanOrder(IteratorDirection.ORDERING, ordering);
        }
        return new ScanOrder(dir, ordering);
    }
}
