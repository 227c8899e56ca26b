package com.graphd.query.variable;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations on a constraint's assignment chain.
 */
public final class Assignments {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        Assignments.class);

    /** Deepest list nesting allowed in a result. */
    private static final int MAX_LIST_DEPTH = 2;

    /** Private constructor to prevent instantiation. */
    private Assignments() {
        // Utility class
    }

    /**
     * Find the assignment to a named variable.
     *
     * @param con the constraint
     * @param name the variable name
     * @return the assignment, or null
     */
    public static Assignment byName(final Constraint con, final String name) {
        return byDeclaration(con, VariableDeclarations.lookup(con, name));
    }

    /**
     * Find the assignment to a declaration.
     *
     * @param con the constraint
     * @param vdecl null or a declaration
     * @return the assignment, or null
     */
    public static Assignment byDeclaration(final Constraint con,
            final VariableDeclaration vdecl) {
        if (vdecl == null) {
            return null;
        }
        for (Assignment a : con.getAssignments()) {
            if (a.getDeclaration() == vdecl) {
                return a;
            }
        }
        return null;
    }

    /**
     * Append an assignment to a variable, declaring it if needed.
     *
     * @param con the constraint
     * @param name the variable name
     * @return the new assignment, with no right-hand side yet
     */
    public static Assignment alloc(final Constraint con, final String name) {
        return allocDeclaration(con,
            VariableDeclarations.addOrLookup(con, name));
    }

    /**
     * Append an assignment to a declaration.
     *
     * @param con the constraint
     * @param vdecl the declaration
     * @return the new assignment, with no right-hand side yet
     */
    public static Assignment allocDeclaration(final Constraint con,
            final VariableDeclaration vdecl) {
        Assignment a = new Assignment(vdecl, null);
        con.getAssignments().add(a);
        return a;
    }

    /**
     * Does an assignment's right-hand side depend, through any number of
     * same-constraint assignments, on the variable it assigns?
     *
     * @param con the constraint
     * @param a null or an assignment in {@code con}
     * @return true if the assignment is part of a cycle
     */
    public static boolean isRecursive(final Constraint con,
            final Assignment a) {
        if (a == null) {
            return false;
        }
        Set<VariableDeclaration> path = new HashSet<>();
        path.add(a.getDeclaration());
        return reaches(con, a.getResult(), a.getDeclaration(), path,
            con.getAssignments().size());
    }

    /*  Depth-first over the variables in pat, following same-constraint
     *  assignments. The depth bound keeps malformed chains finite even
     *  without the path set.
     */
    private static boolean reaches(final Constraint con, final Pattern pat,
            final VariableDeclaration target,
            final Set<VariableDeclaration> path, final int budget) {
        if (budget <= 0) {
            return true;
        }
        for (Pattern p = pat; p != null; p = next(pat, p)) {
            if (p.getType() != PatternType.VARIABLE
                    || p.getDeclaration().getConstraint() != con) {
                continue;
            }
            VariableDeclaration vdecl = p.getDeclaration();
            if (vdecl == target) {
                return true;
            }
            if (!path.add(vdecl)) {
                continue;
            }
            Assignment b = byDeclaration(con, vdecl);
            if (b != null && reaches(con, b.getResult(), target, path,
                    budget - 1)) {
                return true;
            }
            path.remove(vdecl);
        }
        return false;
    }

    /**
     * Pre-order successor of {@code p} that stays inside {@code root}.
     *
     * @param root the tree being walked
     * @param p the current node
     * @return the next node, or null at the end of {@code root}
     */
    static Pattern next(final Pattern root, final Pattern p) {
        if (p.getType().isCompound() && p.size() > 0) {
            return p.first();
        }
        for (Pattern q = p; q != null && q != root; q = q.getParent()) {
            Pattern sib = q.nextSibling();
            if (sib != null) {
                return sib;
            }
        }
        return null;
    }

    /**
     * Reorder a constraint's assignments so that an assignment using a
     * variable comes after the assignment to that variable.
     *
     * @param con the constraint
     * @throws SemanticException if the assignments form a cycle
     */
    public static void sort(final Constraint con) throws SemanticException {
        List<Assignment> chain = con.getAssignments();
        List<Assignment> done = new ArrayList<>(chain.size());
        List<Assignment> todo = new ArrayList<>(chain);

        int i = 0;
        while (i < todo.size()) {
            Assignment a = todo.get(i);
            if (usesAnyOf(a.getResult(), todo)) {
                // Can't move this one yet.
                i++;
                continue;
            }
            todo.remove(i);
            done.add(a);
            i = 0;
        }
        if (!todo.isEmpty()) {
            throw SemanticException.semantics(
                "loop in variable assignments to/from %s",
                todo.get(0).getDeclaration().getName());
        }
        chain.clear();
        chain.addAll(done);
    }

    private static boolean usesAnyOf(final Pattern pat,
            final List<Assignment> pending) {
        if (pat == null) {
            return false;
        }
        if (pat.getType().isCompound()) {
            for (Pattern child : pat.getChildren()) {
                if (usesAnyOf(child, pending)) {
                    return true;
                }
            }
            return false;
        }
        if (pat.getType() != PatternType.VARIABLE) {
            return false;
        }
        for (Assignment a : pending) {
            if (a.getDeclaration() == pat.getDeclaration()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Label every declaration with the list depth at which it is used,
     * then mark which parts of the result and the assignments are
     * sampled and which are collected.
     *
     * @param con the constraint
     * @throws SemanticException if lists nest more than two deep
     */
    public static void parenthesize(final Constraint con)
            throws SemanticException {
        if (con.getResult() != null) {
            parenthesizePattern(con, con.getResult(), 0);
        }
        for (Assignment a : con.getAssignments()) {
            VariableDeclaration vdecl = a.getDeclaration();
            a.setDepth(vdecl.getConstraint() != con
                ? 0 : vdecl.getParentheses());
            parenthesizePattern(con, a.getResult(), a.getDepth());
        }

        if (con.getResult() != null) {
            markPattern(con, con.getResult(), 0);
        }
        for (Assignment a : con.getAssignments()) {
            markPattern(con, a.getResult(), a.getDepth());
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("parenthesized result {}",
                con.getResult() == null ? "null" : con.getResult().dump());
            for (Assignment a : con.getAssignments()) {
                LOGGER.trace("({}) {} = {}", a.getDepth(),
                    a.getDeclaration().getName(), a.getResult().dump());
            }
        }
    }

    private static void parenthesizePattern(final Constraint con,
            final Pattern pat, final int outer) throws SemanticException {
        int depth = outer;
        if (pat.getType() == PatternType.LIST) {
            depth++;
            if (depth > MAX_LIST_DEPTH) {
                throw SemanticException.semantics(
                    "result expression \"%s\" nests lists more than two "
                    + "levels deep", pat);
            }
        }
        if (pat.getType().isCompound()) {
            // A pick does not add a level.
            for (Pattern sub : pat.getChildren()) {
                parenthesizePattern(con, sub, depth);
            }
            return;
        }
        if (pat.getType() != PatternType.VARIABLE) {
            return;
        }

        VariableDeclaration vdecl = pat.getDeclaration();
        Assignment a = byDeclaration(con, vdecl);
        if (vdecl.getParentheses() < depth) {
            vdecl.setParentheses(depth);

            // Terminates: assignments are acyclic, and depth is bounded.
            if (a != null) {
                a.setDepth(depth);
                parenthesizePattern(con, a.getResult(), depth);
            }
        } else if (a != null) {
            a.setDepth(vdecl.getParentheses());
        }
    }

    /**
     * Mark the subtree roots of a pattern as sampled or collected.
     *
     * <p>A list at depth 1 that is not an arm of a pick is collected;
     * a non-list at depth 0 or 1 that is not an arm of a pick is sampled
     * unless its value belongs to the whole set.</p>
     *
     * @param con the constraint the pattern is evaluated in
     * @param pat the pattern
     * @param depth its list depth
     */
    public static void markPattern(final Constraint con, final Pattern pat,
            final int depth) {
        if (depth > MAX_LIST_DEPTH) {
            return;
        }
        boolean pickArm = pat.getParent() != null
            && pat.getParent().getType() == PatternType.PICK;

        if (depth == 1 && pat.getType() == PatternType.LIST && !pickArm) {
            pat.setCollect(true);
            clearMarksBelow(pat);
        }
        if (depth <= 1 && pat.getType() != PatternType.LIST) {
            pat.setCollect(false);
            if (!pickArm) {
                pat.setSample(!Pattern.isSetDependent(con, pat));
                if (pat.getType() == PatternType.PICK) {
                    clearMarksBelow(pat);
                }
            }
        }
        if (pat.getType().isCompound()) {
            int below = depth + (pat.getType() == PatternType.LIST ? 1 : 0);
            for (Pattern sub : pat.getChildren()) {
                markPattern(con, sub, below);
            }
        }
    }

    private static void clearMarksBelow(final Pattern pat) {
        for (Pattern sub : pat.getChildren()) {
            sub.setSample(false);
            sub.setCollect(false);
            if (sub.getType().isCompound()) {
                clearMarksBelow(sub);
            }
        }
    }

    /**
     * Hash the assignment chains of a constraint by variable name.
     *
     * @param con the constraint
     * @return the hash
     */
    public static int hash(final Constraint con) {
        int h = 0;
        for (Assignment a : con.getAssignments()) {
            h = 31 * h + a.getDeclaration().getName().hashCode();
        }
        return h;
    }

    /**
     * Are the assignment chains of two constraints equal? Chains that
     * differ only in order are reported unequal.
     *
     * @param aCon a constraint
     * @param bCon another constraint
     * @return true if definitely equal
     */
    public static boolean equal(final Constraint aCon, final Constraint bCon) {
        List<Assignment> a = aCon.getAssignments();
        List<Assignment> b = bCon.getAssignments();
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!VariableDeclarations.equal(aCon, a.get(i).getDeclaration(),
                    bCon, b.get(i).getDeclaration())
                    || !Pattern.equal(aCon, a.get(i).getResult(),
                        bCon, b.get(i).getResult())) {
                return false;
            }
        }
        return true;
    }
}
