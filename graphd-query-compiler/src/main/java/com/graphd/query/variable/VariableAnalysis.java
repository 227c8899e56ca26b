package com.graphd.query.variable;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintOr;
import com.graphd.query.constraint.OrBranches;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.sort.SortCompiler;
import com.graphd.query.sort.SortRoots;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares a read request's variables for execution.
 *
 * <p>Afterwards, every value a constraint reads from below arrives
 * through an explicit assignment chain, aliases are expanded, unused
 * declarations are gone, declarations have local slots, and every
 * sample and sort value knows the pattern frame it is harvested
 * into.</p>
 */
public final class VariableAnalysis {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        VariableAnalysis.class);

    /** Private constructor to prevent instantiation. */
    private VariableAnalysis() {
        // Utility class
    }

    /**
     * Run the analysis over a request's constraint tree. The steps
     * depend on each other and run in a fixed order.
     *
     * @param root the request's root constraint
     * @throws SemanticException if a pattern is malformed or the
     *     assignments form a cycle
     */
    public static void analyze(final Constraint root)
            throws SemanticException {
        if (LOGGER.isTraceEnabled()) {
            dump("incoming", root);
        }
        infer(root);
        removeUnusedResults(root);
        removeUnusedSorts(root);
        resolveAliases(root);

        // Promotion adds sorts, so this precedes the pattern frames.
        SortRoots.mark(root);
        SortRoots.unmark(root);
        SortRoots.promote(root);

        resolveAliases(root);
        SortCompiler.check(root);
        parenthesizeAssignments(root);
        removeUnusedDeclarations(root);
        sortAssignments(root);
        createPatternFrames(root);
        removeUnusedPageSizes(root);

        if (LOGGER.isTraceEnabled()) {
            dump("done", root);
        }
    }

    /* ---------------------------------------------------------------- */
    /* Inferred assignments                                             */
    /* ---------------------------------------------------------------- */

    private static void infer(final Constraint con) {
        for (Constraint sub : con.getSubs()) {
            infer(sub);
        }
        inferOr(con);
    }

    private static void inferOr(final Constraint con) {
        for (ConstraintOr cor : con.getOrs()) {
            inferOr(cor.getHead());
            if (cor.getTail() != null) {
                inferOr(cor.getTail());
            }
        }
        List<VariableDeclaration> decls =
            new ArrayList<>(con.getDeclarations().values());
        for (VariableDeclaration vdecl : decls) {
            inferences(vdecl);
        }
        if (con.getOr() != null) {
            OrBranches.moveAssignments(con.prototypeRoot(), con);
        }
    }

    /*  A variable declared in an or-branch moves to the prototype root
     *  first. Then, if a same-named variable is used further up and
     *  nothing in between assigns it, $name=$name assignments bridge
     *  the gap one level at a time.
     */
    private static void inferences(final VariableDeclaration declared) {
        VariableDeclaration next = declared;
        while (next != null) {
            next = inferOnce(next);
        }
    }

    /*  Returns the declaration to start over from when the bridge
     *  reaches an or-branch, otherwise null.
     */
    private static VariableDeclaration inferOnce(
            final VariableDeclaration declared) {
        VariableDeclaration vdecl = declared;
        Constraint con = vdecl.getConstraint();

        if (con.getOr() != null) {
            Constraint arch = con.prototypeRoot();
            OrBranches.Promotion promotion =
                OrBranches.compileDeclaration(arch, vdecl);
            if (promotion.getCreated() == null) {
                return null;
            }
            con = arch;
            vdecl = promotion.getCreated();
        }

        String name = vdecl.getName();
        Constraint par = con;
        Constraint sub = con;
        VariableDeclaration vdeclPar = null;
        for (;;) {
            par = par.getOr() != null ? par.prototypeRoot() : par.getParent();
            if (par == null) {
                break;
            }
            vdeclPar = VariableDeclarations.lookup(par, name);
            if (vdeclPar != null) {
                break;
            }
            sub = par;
        }
        if (vdeclPar == null) {
            return null;
        }
        if (sub.getOr() != null && hasInputThroughOr(vdeclPar, sub)) {
            return null;
        }
        if ((Assignments.byDeclaration(par, vdeclPar) != null
                && sub.getOr() == null)
                || Assignments.byDeclaration(sub, vdeclPar) != null) {
            return null;
        }

        // Declare and assign all the way up to the existing declaration.
        par = con;
        sub = con;
        VariableDeclaration vdeclNew = vdecl;
        for (;;) {
            if (par.getOr() != null) {
                return vdeclNew;
            }
            par = par.getParent();
            if (par == null) {
                break;
            }
            VariableDeclaration parDecl = VariableDeclarations.lookup(par,
                name);
            VariableDeclaration rhsDecl = null;
            boolean existing = parDecl != null;
            if (!existing) {
                if (par.getOr() != null) {
                    OrBranches.Promotion promotion = OrBranches.declare(par,
                        name);
                    parDecl = promotion.getIndexed();
                    rhsDecl = promotion.getCreated();
                    existing = rhsDecl == null;
                } else {
                    parDecl = VariableDeclarations.addOrLookup(par, name);
                    rhsDecl = parDecl;
                }
            }

            if (sub.getOr() != null) {
                sub = sub.prototypeRoot();
            }
            Assignment a = Assignments.allocDeclaration(sub, parDecl);
            a.setResult(Pattern.allocVariable(null, vdeclNew));
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("inferred {}.{} := {}.{}",
                    parDecl.getConstraint(), name, vdeclNew.getConstraint(),
                    a.getResult());
            }
            if (existing) {
                break;
            }
            vdeclNew = rhsDecl;
            par = vdeclNew.getConstraint();
            sub = par;
        }
        return null;
    }

    /*  Is there an assignment to vdecl that is active whenever orcon is?
     *  Then nothing needs to be forwarded out of orcon.
     */
    private static boolean hasInputThroughOr(final VariableDeclaration vdecl,
            final Constraint orcon) {
        Assignment a = Assignments.byDeclaration(vdecl.getConstraint(), vdecl);
        if (a == null) {
            return false;
        }
        Pattern pat = a.getResult();
        if (pat == null || pat.getType() != PatternType.PICK) {
            return true;
        }
        for (Pattern arm : pat.getChildren()) {
            if (containsOr(orcon, arm.getOrIndex())) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsOr(final Constraint orcon,
            final int orIndex) {
        for (Constraint c = orcon;; c = c.getOr().getPrototype()) {
            if (c.getOrIndex() == orIndex) {
                return true;
            }
            if (c.getOr() == null) {
                return false;
            }
        }
    }

    /* ---------------------------------------------------------------- */
    /* Pruning                                                          */
    /* ---------------------------------------------------------------- */

    private static void removeUnusedResults(final Constraint con) {
        boolean usesContents = con.usesPattern(PatternType.CONTENTS);
        for (Constraint sub : con.getSubs()) {
            if (!usesContents) {
                sub.setResult(null);
            }
            removeUnusedResults(sub);
        }
    }

    /*  A sort matters only to something sort-dependent: a sample, or a
     *  list nested twice.
     */
    private static void removeUnusedSorts(final Constraint con) {
        if (con.getSort() != null && con.isSortValid()
                && !isSortDependent(con)) {
            LOGGER.debug("remove unused sort {} from {}", con.getSort(), con);
            con.setSortValid(false);
        }
        for (Constraint sub : con.getSubs()) {
            removeUnusedSorts(sub);
        }
    }

    private static boolean isSortDependent(final Constraint con) {
        if (con.getResult() != null
                && Pattern.isSortDependent(con, con.getResult())) {
            return true;
        }
        for (Assignment a : con.getAssignments()) {
            if (Pattern.isSortDependent(con, a.getResult())) {
                return true;
            }
        }
        return false;
    }

    private static void resolveAliases(final Constraint con) {
        Variables.replaceAliases(con);
        for (Constraint sub : con.getSubs()) {
            resolveAliases(sub);
        }
    }

    /*  Link counts are recounted from scratch on every pass; dropping an
     *  assignment can orphan the declarations its value referenced.
     */
    private static void removeUnusedDeclarations(final Constraint root) {
        boolean any;
        do {
            clearLinkCounts(root);
            countUses(root);
            any = removeUnmarkedAssignments(root);
            any |= removeUnmarkedDeclarations(root);
        } while (any);
    }

    private static void clearLinkCounts(final Constraint con) {
        for (Constraint c : withBranches(con)) {
            for (VariableDeclaration vdecl : c.getDeclarations().values()) {
                vdecl.setLinkCount(0);
            }
        }
        for (Constraint sub : con.getSubs()) {
            clearLinkCounts(sub);
        }
    }

    private static void countUses(final Constraint con) {
        for (Constraint c : withBranches(con)) {
            for (Assignment a : c.getAssignments()) {
                countVariableUses(a.getResult());
            }
            if (c.getSort() != null && c.isSortValid()) {
                countVariableUses(c.getSort());
            }
            countVariableUses(c.getResult());
        }
        for (Constraint sub : con.getSubs()) {
            countUses(sub);
        }
    }

    private static void countVariableUses(final Pattern pat) {
        if (pat == null) {
            return;
        }
        if (pat.getType() == PatternType.VARIABLE) {
            pat.getDeclaration().incrementLinkCount();
        } else if (pat.getType().isCompound()) {
            for (Pattern p : pat.getChildren()) {
                countVariableUses(p);
            }
        }
    }

    private static boolean removeUnmarkedAssignments(final Constraint con) {
        boolean any = false;
        for (Constraint c : withBranches(con)) {
            any |= c.getAssignments().removeIf(a -> {
                if (a.getDeclaration().getLinkCount() > 0) {
                    return false;
                }
                LOGGER.debug("remove assignment to unused {} from {}",
                    a.getDeclaration().getName(), c);
                return true;
            });
        }
        for (Constraint sub : con.getSubs()) {
            any |= removeUnmarkedAssignments(sub);
        }
        return any;
    }

    private static boolean removeUnmarkedDeclarations(final Constraint con) {
        boolean any = false;
        for (Constraint c : withBranches(con)) {
            any |= VariableDeclarations.removeUnlinked(c) > 0;
        }
        for (Constraint sub : con.getSubs()) {
            any |= removeUnmarkedDeclarations(sub);
        }
        return any;
    }

    /*  The constraint and its or-branches, nested ones included. The
     *  branches' subconstraints are already among the prototype's.
     */
    private static List<Constraint> withBranches(final Constraint con) {
        List<Constraint> all = new ArrayList<>();
        all.add(con);
        for (int i = 0; i < all.size(); i++) {
            for (ConstraintOr cor : all.get(i).getOrs()) {
                all.add(cor.getHead());
                if (cor.getTail() != null) {
                    all.add(cor.getTail());
                }
            }
        }
        return all;
    }

    private static void removeUnusedPageSizes(final Constraint con) {
        con.resetResultPageSize();
        for (Constraint sub : con.getSubs()) {
            removeUnusedPageSizes(sub);
        }
        if (!PatternFrames.usesPerPrimitiveData(con)
                && (!con.isResultPageSizeValid()
                    || con.getResultPageSize() > 1)) {
            con.setResultPageSize(1);
        }
    }

    /* ---------------------------------------------------------------- */
    /* Checks and layout                                                */
    /* ---------------------------------------------------------------- */

    private static void sortAssignments(final Constraint con)
            throws SemanticException {
        Assignments.sort(con);
        for (Constraint sub : con.getSubs()) {
            sortAssignments(sub);
        }
    }

    private static void createPatternFrames(final Constraint con) {
        VariableDeclarations.assignSlots(con);
        PatternFrames.create(con);
        for (Constraint sub : con.getSubs()) {
            createPatternFrames(sub);
        }
    }

    private static void parenthesizeAssignments(final Constraint con)
            throws SemanticException {
        Assignments.parenthesize(con);

        long[] used = new long[1];
        long[] maybeUsed = new long[1];
        if (con.getResult() != null) {
            checkPattern(con, con.getResult(), used, maybeUsed, 0);
        }
        for (Assignment a : con.getAssignments()) {
            VariableDeclaration vdecl = a.getDeclaration();
            checkPattern(con, a.getResult(), used, maybeUsed,
                vdecl.getConstraint() == con ? vdecl.getParentheses() : 0);
        }

        // Checked even if the sort is no longer in use.
        checkSortPattern(con.getSort());

        for (Constraint sub : con.getSubs()) {
            parenthesizeAssignments(sub);
        }
    }

    private static void checkSortPattern(final Pattern pat)
            throws SemanticException {
        if (pat == null || pat.getType() != PatternType.LIST) {
            return;
        }
        for (Pattern p : pat.getChildren()) {
            if (p.getType() == PatternType.LIST) {
                throw SemanticException.syntax("cannot sort by nested lists.");
            }
        }
    }

    /**
     * Check the nesting of a result or assignment pattern.
     *
     * <p>Lists nest at most two deep, with at most one nested list per
     * list, and set values such as {@code count} sit inside at most one
     * list.</p>
     *
     * @param con the constraint the pattern belongs to
     * @param pat null or the pattern
     * @param used accumulates the types that are certainly produced
     * @param maybeUsed accumulates the types produced by some pick arm
     * @param depth list depth of {@code pat}
     * @throws SemanticException {@code SYNTAX} on a nesting violation
     */
    static void checkPattern(final Constraint con, final Pattern pat,
            final long[] used, final long[] maybeUsed, final int depth)
            throws SemanticException {
        if (pat == null) {
            return;
        }
        used[0] |= pat.getType().bit();
        maybeUsed[0] |= pat.getType().bit();

        switch (pat.getType()) {
            case VARIABLE:
                Assignment a = Assignments.byDeclaration(con,
                    pat.getDeclaration());
                if (a != null) {
                    checkPattern(con, a.getResult(), used, maybeUsed, depth);
                }
                return;

            case PICK:
                long common = -1L;
                for (Pattern arm : pat.getChildren()) {
                    long[] armUsed = new long[1];
                    checkPattern(con, arm, armUsed, maybeUsed, depth);
                    common &= armUsed[0];
                }
                used[0] |= common;
                return;

            case CURSOR:
            case ESTIMATE:
            case ITERATOR:
            case TIMEOUT:
            case COUNT:
            case ESTIMATE_COUNT:
                if (depth == 2) {
                    throw SemanticException.syntax("'count', 'cursor', "
                        + "'estimate', 'estimate-count', 'iterator', or "
                        + "'timeout' can only appear inside at most one set "
                        + "of parentheses");
                }
                return;

            case LIST:
                if (depth >= 2) {
                    throw SemanticException.syntax(
                        "result lists can only nest two lists deep");
                }
                break;

            default:
                return;
        }

        int lists = 0;
        for (Pattern p : pat.getChildren()) {
            long[] subMaybeUsed = new long[1];
            checkPattern(con, p, used, subMaybeUsed, depth + 1);
            if ((subMaybeUsed[0] & PatternType.LIST.bit()) != 0
                    && ++lists > 1) {
                throw SemanticException.syntax("can only have one nested "
                    + "list per result list - (x (y)) and ((x y)) work, "
                    + "((x) (y)) doesn't.");
            }
            maybeUsed[0] |= subMaybeUsed[0];
        }
    }

    private static void dump(final String title, final Constraint con) {
        LOGGER.trace("{}: {} decls={} assignments={} frames={}", title, con,
            con.getDeclarations().keySet(), con.getAssignments(),
            con.getFrames());
        for (ConstraintOr cor : con.getOrs()) {
            dump(title + " |", cor.getHead());
            if (cor.getTail() != null) {
                dump(title + " |", cor.getTail());
            }
        }
        if (con.getOr() == null) {
            for (Constraint sub : con.getSubs()) {
                dump(title + " >", sub);
            }
        }
    }
}
