package com.graphd.query.semantic;

import com.graphd.query.SemanticException;
import com.graphd.query.comparator.ValueComparator;
import com.graphd.query.constraint.ClauseMerger;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintLinkage;
import com.graphd.query.constraint.ConstraintOr;
import com.graphd.query.constraint.Flag;
import com.graphd.query.constraint.Linkage;
import com.graphd.query.constraint.Meta;
import com.graphd.query.constraint.OrBranches;
import com.graphd.query.constraint.StringConstraint;
import com.graphd.query.guid.GuidConstraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns freshly parsed constraints into canonical ones.
 *
 * <p>Clauses are merged into fields, then local defaults are filled in:
 * {@code ->}/{@code <-} linkages, archival and live flags, the count
 * minimum, value comparators, range boundaries and sort comparators.
 * Subconstraints are completed before their parent; anchors are
 * inferred once the whole tree is complete.</p>
 */
public final class ParseCompletion {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ParseCompletion.class);

    /** Private constructor to prevent instantiation. */
    private ParseCompletion() {
        // Utility class
    }

    /**
     * Complete a constraint and everything below it.
     *
     * @param con the constraint; the root of the request if it has no
     *     parent
     * @throws SemanticException on conflicting or meaningless clauses
     */
    public static void complete(final Constraint con)
            throws SemanticException {
        ClauseMerger.mergeAll(con);
        // Subconstraints merged out of a branch keep the branch as parent.
        for (Constraint sub : con.getSubs()) {
            complete(sub);
        }

        if (con.getResult() != null) {
            checkResultInstruction(con, con.getResult());
        }
        if ((con.getGuid().isMatchValid() || con.getGuid().isIncludeValid())
                && con.getKey() != 0) {
            throw SemanticException.syntax("cannot mix \"key=\" and "
                + "\"guid~=\" constraints - did you mean \"unique\"?");
        }
        if (con.getUnique() != 0 && con.getKey() != 0) {
            throw SemanticException.syntax(
                "cannot mix \"key=\" and \"unique=\" constraints");
        }

        if (con.getAnchor() == Flag.TRUE) {
            anchorSubtree(con);
        }
        if (con.getParent() == null && con.getOr() == null) {
            anchorInfer(con);
        }

        if (con.getMeta() == Meta.LINK_FROM) {
            defaultLinkage(con, Linkage.LEFT, Linkage.RIGHT);
        } else if (con.getMeta() == Meta.LINK_TO) {
            defaultLinkage(con, Linkage.RIGHT, Linkage.LEFT);
        }

        if (con.getArchival() == Flag.UNSPECIFIED) {
            con.setArchival(Flag.DONTCARE);
        }
        if (con.getLive() == Flag.UNSPECIFIED) {
            con.setLive(Flag.TRUE);
        }
        if (!con.getCount().isMinValid()) {
            con.getCount().setMin(con.getStart() + 1);
        }

        if (isEmptyGuidSet(con.getGuid())) {
            LOGGER.debug("{}: GUID must be null", con);
            con.markFalse("SEMANTICS GUID constraints are impossible "
                + "to satisfy");
        }

        if (con.getValueComparator() == null) {
            con.setValueComparator(con.getComparator());
        }
        for (StringConstraint strcon : con.getValueQueue()) {
            con.getValueComparator().checkSyntax(strcon);
        }

        truncateRangeBoundaries(con, con.getTypeQueue());
        truncateRangeBoundaries(con, con.getNameQueue());
        truncateRangeBoundaries(con, con.getValueQueue());

        annotateSortComparators(con);

        for (ConstraintOr cor : con.getOrs()) {
            OrBranches.completeParse(con, cor.getHead());
            if (cor.getTail() != null) {
                OrBranches.completeParse(con, cor.getTail());
            }
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("parse complete: {}", con);
        }
    }

    private static void checkResultInstruction(final Constraint con,
            final Pattern pat) throws SemanticException {
        if (!con.getSubs().isEmpty()) {
            return;
        }
        if (pat.getType() == PatternType.CONTENTS) {
            throw SemanticException.semantics("can't use \"contents\" "
                + "return instruction in template without contained "
                + "templates");
        }
        if (pat.getType() == PatternType.LIST) {
            for (Pattern child : pat.getChildren()) {
                checkResultInstruction(con, child);
            }
        }
    }

    private static boolean isEmptyGuidSet(final GuidConstraint guid) {
        return (guid.isIncludeValid() && guid.getInclude().size() == 0)
            || (guid.isMatchValid() && guid.getMatch().size() == 0);
    }

    /*  "->" and "<-" without a linkage keyword: the parent is my
     *  parentSide unless that is already fixed, and the first child
     *  without a linkage is my childSide.
     */
    private static void defaultLinkage(final Constraint con,
            final Linkage parentSide, final Linkage childSide) {
        if (!con.getLinkage().isSet() && con.getParent() != null
                && (con.linkagePattern() & parentSide.bit()) == 0) {
            con.setLinkage(ConstraintLinkage.my(parentSide));
        }
        if ((con.linkagePattern() & childSide.bit()) != 0) {
            return;
        }
        for (Constraint sub : con.getSubs()) {
            if (!sub.getLinkage().isSet()) {
                sub.setLinkage(ConstraintLinkage.iAm(childSide));
                break;
            }
        }
    }

    /**
     * Spread {@code anchor=true} into the unspecified part of a subtree.
     * Explicit settings below stop the spread.
     *
     * @param con an anchored constraint
     */
    static void anchorSubtree(final Constraint con) {
        for (Constraint sub : con.getSubs()) {
            if (sub.getAnchor() == Flag.UNSPECIFIED) {
                sub.setAnchor(Flag.TRUE_LOCAL);
                anchorSubtree(sub);
            }
        }
    }

    /**
     * Anchor the neighbours that anchored constraints point to: the
     * parent of a "my" linkage, the children with "I am" linkages.
     *
     * @param con the root of the tree
     * @throws SemanticException if such a neighbour says
     *     {@code anchor=false}
     */
    static void anchorInfer(final Constraint con) throws SemanticException {
        if (isAnchored(con)) {
            Constraint par = con.getParent();
            if (con.getLinkage().isMy() && par != null) {
                inferNeighbour(par);
            }
            for (Constraint sub : con.getSubs()) {
                if (sub.getLinkage().isIAm()) {
                    inferNeighbour(sub);
                }
            }
        }
        for (Constraint sub : con.getSubs()) {
            anchorInfer(sub);
        }
    }

    private static void inferNeighbour(final Constraint neighbour)
            throws SemanticException {
        switch (neighbour.getAnchor()) {
            case TRUE:
            case TRUE_LOCAL:
                break;
            case FALSE:
                throw SemanticException.semantics("an anchored constraint "
                    + "cannot point to an unanchored one.");
            case UNSPECIFIED:
                neighbour.setAnchor(Flag.TRUE_LOCAL);
                anchorInfer(neighbour);
                break;
            default:
                throw new IllegalStateException("unexpected anchor flag "
                    + neighbour.getAnchor());
        }
    }

    private static boolean isAnchored(final Constraint con) {
        return con.getAnchor() == Flag.TRUE
            || con.getAnchor() == Flag.TRUE_LOCAL;
    }

    /*  <= ("a" "b") is <= "a" and >= ("a" "b") is >= "b". Which
     *  element is the boundary depends on the value comparator.
     */
    private static void truncateRangeBoundaries(final Constraint con,
            final List<StringConstraint> queue) {
        for (StringConstraint strcon : queue) {
            if (strcon.getElements().size() <= 1) {
                continue;
            }
            int which;
            switch (strcon.getOperator()) {
                case LT:
                case LE:
                    which = -1;
                    break;
                case GT:
                case GE:
                    which = 1;
                    break;
                default:
                    continue;
            }
            strcon.truncateTo(strcon.pick(con.getValueComparator(), which));
        }
    }

    /*  sortcomparator= names the comparators of the leading sort
     *  elements; the rest use the constraint's comparator.
     */
    private static void annotateSortComparators(final Constraint con)
            throws SemanticException {
        List<ValueComparator> comparators = con.getSortComparators();
        Pattern sort = con.isSortValid() ? con.getSort() : null;
        if (sort == null) {
            if (!comparators.isEmpty()) {
                throw SemanticException.semantics(
                    "sortcomparators with no sort");
            }
            return;
        }

        if (sort.getType() != PatternType.LIST) {
            if (comparators.size() > 1) {
                throw SemanticException.semantics(
                    "more sort comparators than sorts");
            }
            sort.setComparator(comparators.isEmpty()
                ? con.getComparator() : comparators.get(0));
            return;
        }

        List<Pattern> elements = sort.getChildren();
        if (comparators.size() > elements.size()) {
            throw SemanticException.semantics(
                "more sort comparators than sorts");
        }
        for (int i = 0; i < elements.size(); i++) {
            elements.get(i).setComparator(i < comparators.size()
                ? comparators.get(i) : con.getComparator());
        }
    }
}
