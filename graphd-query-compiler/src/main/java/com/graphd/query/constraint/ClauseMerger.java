package com.graphd.query.constraint;

import com.graphd.query.SemanticException;
import com.graphd.query.comparator.Comparators;
import com.graphd.query.comparator.ValueComparator;
import com.graphd.query.constraint.ConstraintClause.AssignmentClause;
import com.graphd.query.constraint.ConstraintClause.ComparatorClause;
import com.graphd.query.constraint.ConstraintClause.CountClause;
import com.graphd.query.constraint.ConstraintClause.CursorClause;
import com.graphd.query.constraint.ConstraintClause.FalseClause;
import com.graphd.query.constraint.ConstraintClause.FlagClause;
import com.graphd.query.constraint.ConstraintClause.GenerationClause;
import com.graphd.query.constraint.ConstraintClause.GuidClause;
import com.graphd.query.constraint.ConstraintClause.LimitClause;
import com.graphd.query.constraint.ConstraintClause.LinkageClause;
import com.graphd.query.constraint.ConstraintClause.MetaClause;
import com.graphd.query.constraint.ConstraintClause.OrClause;
import com.graphd.query.constraint.ConstraintClause.PatternClause;
import com.graphd.query.constraint.ConstraintClause.SequenceClause;
import com.graphd.query.constraint.ConstraintClause.SortComparatorClause;
import com.graphd.query.constraint.ConstraintClause.StringClause;
import com.graphd.query.constraint.ConstraintClause.SubconstraintClause;
import com.graphd.query.constraint.ConstraintClause.TimestampClause;
import com.graphd.query.constraint.ConstraintClause.UniqueClause;
import com.graphd.query.constraint.ConstraintClause.ValueTypeClause;
import com.graphd.query.guid.GuidConstraint;
import com.graphd.query.variable.Assignments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds parsed clauses into the fields of their constraint.
 *
 * <p>Single-valued settings may be given once per constraint; a second
 * occurrence is a {@code SEMANTICS} error. Filters (strings, GUIDs,
 * counts, generations, timestamps) accumulate, and a combination that
 * cannot be satisfied marks the constraint false.</p>
 */
public final class ClauseMerger {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ClauseMerger.class);

    /** Private constructor to prevent instantiation. */
    private ClauseMerger() {
        // Utility class
    }

    /**
     * Merge and then discard every clause queued on a constraint.
     *
     * @param con the constraint
     * @throws SemanticException on a conflicting duplicate
     */
    public static void mergeAll(final Constraint con)
            throws SemanticException {
        for (ConstraintClause cc : con.getClauses()) {
            merge(con, cc);
        }
        con.getClauses().clear();
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("merged clauses: {}", con);
        }
    }

    /**
     * Merge one clause into a constraint.
     *
     * @param con the constraint
     * @param cc the clause
     * @throws SemanticException on a conflicting duplicate
     */
    public static void merge(final Constraint con, final ConstraintClause cc)
            throws SemanticException {
        if (cc instanceof FlagClause fc) {
            mergeFlag(con, fc);
        } else if (cc instanceof AssignmentClause ac) {
            Assignments.alloc(con, ac.name()).setResult(ac.pattern());
        } else if (cc instanceof ComparatorClause cmp) {
            mergeComparator(con, cmp);
        } else if (cc instanceof SortComparatorClause scc) {
            if (!con.getSortComparators().isEmpty()) {
                throw SemanticException.semantics(
                    "more than one sortcomparator=...");
            }
            con.getSortComparators().addAll(scc.comparators());
        } else if (cc instanceof CountClause count) {
            if (!con.getCount().merge(count.op(), count.value())) {
                con.markFalse();
            }
        } else if (cc instanceof LimitClause lc) {
            mergeLimit(con, lc);
        } else if (cc instanceof CursorClause cur) {
            if (con.getCursor() != null) {
                throw SemanticException.semantics("more than one cursor=...");
            }
            con.setCursor(cur.cursor());
        } else if (cc instanceof FalseClause) {
            con.markFalse();
        } else if (cc instanceof GuidClause gc) {
            guidTarget(con, gc).merge(con, gc.op(), gc.set());
        } else if (cc instanceof LinkageClause lc) {
            if (con.getLinkage().isSet()) {
                throw SemanticException.semantics(
                    "more than one linkage connection");
            }
            con.setLinkage(lc.linkage());
        } else if (cc instanceof MetaClause mc) {
            if (con.getMeta() != Meta.UNSPECIFIED) {
                throw SemanticException.semantics("more than one meta-type");
            }
            con.setMeta(mc.meta());
        } else if (cc instanceof StringClause sc) {
            switch (sc.field()) {
                case NAME:
                    con.getNameQueue().add(sc.constraint());
                    break;
                case TYPE:
                    con.getTypeQueue().add(sc.constraint());
                    break;
                default:
                    con.getValueQueue().add(sc.constraint());
                    break;
            }
        } else if (cc instanceof GenerationClause gen) {
            GenerationalConstraint gencon = gen.newest()
                ? con.getNewest() : con.getOldest();
            if (!gencon.merge(gen.op(), gen.generation())) {
                con.markFalse();
            }
        } else if (cc instanceof TimestampClause ts) {
            if (!con.mergeTimestamp(ts.op(), ts.timestamp())) {
                con.markFalse();
            }
        } else if (cc instanceof ValueTypeClause vt) {
            if (con.getValueType() != Constraint.VALUETYPE_UNSPECIFIED) {
                throw SemanticException.semantics("more than one valuetype");
            }
            con.setValueType(vt.valueType());
        } else if (cc instanceof UniqueClause uc) {
            if (uc.key()) {
                con.setKey(con.getKey() | uc.mask());
            } else {
                con.setUnique(con.getUnique() | uc.mask());
            }
        } else if (cc instanceof PatternClause pc) {
            mergePattern(con, pc);
        } else if (cc instanceof SequenceClause seq) {
            for (ConstraintClause sub : seq.clauses()) {
                merge(con, sub);
            }
        } else if (cc instanceof SubconstraintClause sc) {
            con.addSub(sc.sub());
        } else if (cc instanceof OrClause oc) {
            mergeOr(con, oc.or());
        } else {
            throw new IllegalArgumentException("unexpected clause " + cc);
        }
    }

    private static void mergeFlag(final Constraint con, final FlagClause fc)
            throws SemanticException {
        Flag current;
        switch (fc.kind()) {
            case ANCHOR:
                current = con.getAnchor();
                break;
            case ARCHIVAL:
                current = con.getArchival();
                break;
            default:
                current = con.getLive();
                break;
        }
        if (current != Flag.UNSPECIFIED) {
            throw SemanticException.semantics(
                "duplicate assignment to \"%s\" flag", fc.kind().keyword());
        }
        switch (fc.kind()) {
            case ANCHOR:
                con.setAnchor(fc.value());
                break;
            case ARCHIVAL:
                con.setArchival(fc.value());
                break;
            default:
                con.setLive(fc.value());
                break;
        }
    }

    private static void mergeComparator(final Constraint con,
            final ComparatorClause cmp) throws SemanticException {
        ValueComparator current = cmp.valueComparator()
            ? con.getValueComparator() : con.getComparator();
        if (current != null && current != Comparators.UNSPECIFIED) {
            throw SemanticException.semantics("more than one %s=...",
                cmp.valueComparator() ? "value-comparator" : "comparator");
        }
        if (cmp.valueComparator()) {
            con.setValueComparator(cmp.comparator());
        } else {
            con.setComparator(cmp.comparator());
        }
    }

    private static void mergeLimit(final Constraint con, final LimitClause lc)
            throws SemanticException {
        switch (lc.kind()) {
            case PAGESIZE:
                if (con.isPageSizeValid()) {
                    throw SemanticException.semantics(
                        "more than one pagesize");
                }
                con.setPageSize(lc.value());
                break;
            case RESULTPAGESIZE:
                if (con.isResultPageSizeParsedValid()) {
                    throw SemanticException.semantics(
                        "more than one resultpagesize");
                }
                con.setResultPageSizeParsed(lc.value());
                break;
            case COUNTLIMIT:
                if (con.isCountLimitValid()) {
                    throw SemanticException.semantics(
                        "more than one countlimit=...");
                }
                con.setCountLimit(lc.value());
                break;
            default:
                if (con.getStart() != 0) {
                    throw SemanticException.semantics("more than one start");
                }
                con.setStart(lc.value());
                break;
        }
    }

    private static GuidConstraint guidTarget(final Constraint con,
            final GuidClause gc) {
        switch (gc.target()) {
            case GUID:
                return con.getGuid();
            case LINKAGE:
                return con.getLinkcon(gc.linkage());
            case NEXT:
                return con.getVersionNext();
            default:
                return con.getVersionPrevious();
        }
    }

    private static void mergePattern(final Constraint con,
            final PatternClause pc) throws SemanticException {
        switch (pc.kind()) {
            case RESULT:
                if (con.getResult() != null) {
                    throw SemanticException.semantics(
                        "more than one value for result");
                }
                con.setResult(pc.pattern());
                break;
            default:
                if (con.getSort() != null && con.isSortValid()) {
                    throw SemanticException.semantics(
                        "more than one value for sort");
                }
                con.setSort(pc.pattern());
                con.setSortValid(true);
                break;
        }
    }

    /*  Each branch inherits the prototype's parent. Its subconstraints
     *  join the prototype's list; the branch stays their parent.
     */
    private static void mergeOr(final Constraint proto, final ConstraintOr cor)
            throws SemanticException {
        proto.getOrs().add(cor);
        cor.setPrototype(proto);
        mergeBranch(proto, cor, cor.getHead());
        if (cor.getTail() != null) {
            mergeBranch(proto, cor, cor.getTail());
        }
    }

    private static void mergeBranch(final Constraint proto,
            final ConstraintOr cor, final Constraint branch)
            throws SemanticException {
        branch.setOr(cor);
        branch.setParent(proto.getParent());
        mergeAll(branch);
        proto.getSubs().addAll(branch.getSubs());
    }
}
