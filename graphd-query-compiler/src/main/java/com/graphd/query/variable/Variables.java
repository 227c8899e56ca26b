package com.graphd.query.variable;

import com.graphd.query.comparator.ValueComparator;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintOr;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoping of variables across the constraint tree: where a variable is
 * assigned, where it is used, and how its value travels between the
 * two.
 */
public final class Variables {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        Variables.class);

    /** Private constructor to prevent instantiation. */
    private Variables() {
        // Utility class
    }

    /**
     * Is a variable assigned in a constraint, one of its or-branches, or
     * anywhere below it?
     *
     * @param con the constraint
     * @param name the variable name
     * @return true if some assignment sets it
     */
    public static boolean isAssignedInOrBelow(final Constraint con,
            final String name) {
        if (Assignments.byName(con, name) != null) {
            return true;
        }
        for (ConstraintOr cor : con.getOrs()) {
            if (isAssignedInOrBelow(cor.getHead(), name)
                    || (cor.getTail() != null
                        && isAssignedInOrBelow(cor.getTail(), name))) {
                return true;
            }
        }
        for (Constraint sub : con.getSubs()) {
            if (isAssignedInOrBelow(sub, name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUsedInPattern(final Pattern pat,
            final VariableDeclaration vdecl) {
        for (Pattern p = pat; p != null; p = Assignments.next(pat, p)) {
            if (p.getType() == PatternType.VARIABLE
                    && p.getDeclaration() == vdecl) {
                return true;
            }
        }
        return false;
    }

    /**
     * Does a constraint or one of its or-branches use a variable in its
     * result, its sort, or an assignment's right-hand side?
     *
     * @param con the constraint
     * @param name the variable name
     * @return true if it is used
     */
    public static boolean isUsed(final Constraint con, final String name) {
        VariableDeclaration vdecl = VariableDeclarations.lookup(con, name);
        if (vdecl == null) {
            return false;
        }
        if (isUsedInPattern(con.getResult(), vdecl)
                || (con.getSort() != null && con.isSortValid()
                    && isUsedInPattern(con.getSort(), vdecl))) {
            return true;
        }
        for (Assignment a : con.getAssignments()) {
            if (isUsedInPattern(a.getResult(), vdecl)) {
                return true;
            }
        }
        for (ConstraintOr cor : con.getOrs()) {
            if (isUsed(cor.getHead(), name)
                    || (cor.getTail() != null && isUsed(cor.getTail(), name))) {
                return true;
            }
        }
        return false;
    }

    /*  Variables of con that con itself assigns are replaced by a copy
     *  of the assigned pattern. The copy keeps the reference's sign,
     *  comparator and or-index.
     */
    private static void replaceAliasesInPattern(final Constraint con,
            final Pattern root) {
        for (Pattern pat = root; pat != null;
                pat = Assignments.next(root, pat)) {
            if (pat.getType() != PatternType.VARIABLE
                    || pat.getDeclaration().getConstraint() != con) {
                continue;
            }
            Assignment a = Assignments.byDeclaration(con,
                pat.getDeclaration());
            if (a == null) {
                continue;
            }
            boolean sortForward = pat.isSortForward();
            int orIndex = pat.getOrIndex();
            ValueComparator cmp = pat.getComparator();

            pat.dupInPlace(a.getResult());
            pat.setSortForward(pat.isSortForward() ^ !sortForward);
            pat.setComparator(cmp);
            pat.setOrIndex(orIndex);

            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("replace {} with {}",
                    a.getDeclaration().getName(), pat);
            }
        }
    }

    /**
     * Replace references to locally assigned variables with the
     * assigned pattern, in assignments, the result and the sort.
     *
     * @param con the constraint
     */
    public static void replaceAliases(final Constraint con) {
        for (Assignment a : con.getAssignments()) {
            replaceAliasesInPattern(con, a.getResult());
        }
        replaceAliasesInPattern(con, con.getResult());
        if (con.getSort() != null) {
            replaceAliasesInPattern(con, con.getSort());
        }
    }

    private static void renameInConstraint(final Constraint con,
            final VariableDeclaration source, final VariableDeclaration dest) {
        Pattern.variableRename(con.getResult(), source, dest);
        if (con.getSort() != null && con.isSortValid()) {
            Pattern.variableRename(con.getSort(), source, dest);
        }
        for (Assignment a : con.getAssignments()) {
            Pattern.variableRename(a.getResult(), source, dest);
            if (a.getDeclaration() == source) {
                a.setDeclaration(dest);
            }
        }
    }

    /**
     * Point every use of one declaration at another: in the constraint,
     * the top level of its or-branches, and its direct subconstraints.
     *
     * @param con the constraint
     * @param source the old declaration
     * @param dest the new declaration
     */
    public static void rename(final Constraint con,
            final VariableDeclaration source, final VariableDeclaration dest) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("rename {} -> {} in {}", source.getName(),
                dest.getName(), con);
        }
        renameInConstraint(con, source, dest);

        // Branch subconstraints are visited through the subs below.
        for (ConstraintOr cor : con.getOrs()) {
            renameInConstraint(cor.getHead(), source, dest);
            if (cor.getTail() != null) {
                renameInConstraint(cor.getTail(), source, dest);
            }
        }
        for (Constraint sub : con.getSubs()) {
            renameInConstraint(sub, source, dest);
        }
    }
}
