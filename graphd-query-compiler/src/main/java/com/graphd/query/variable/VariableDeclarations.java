package com.graphd.query.variable;

import com.graphd.query.constraint.Constraint;
import java.util.Iterator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations on a constraint's variable declaration table.
 *
 * <p>A variable is declared in a constraint when it appears on the
 * right-hand side of that constraint's {@code result=}, {@code sort=} or
 * an assignment, or on the left-hand side of an assignment.</p>
 */
public final class VariableDeclarations {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        VariableDeclarations.class);

    /** Private constructor to prevent instantiation. */
    private VariableDeclarations() {
        // Utility class
    }

    /**
     * Declare a variable, or return the existing declaration.
     *
     * @param con the constraint
     * @param name the variable name
     * @return the declaration, owned by {@code con}
     */
    public static VariableDeclaration addOrLookup(final Constraint con,
            final String name) {
        Map<String, VariableDeclaration> table = con.getDeclarations();
        VariableDeclaration vdecl = table.get(name);
        if (vdecl == null) {
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("declare {} in {}", name, con);
            }
            vdecl = new VariableDeclaration(con, name);
            table.put(name, vdecl);
        }
        return vdecl;
    }

    /**
     * Look up a declaration by name.
     *
     * @param con the constraint
     * @param name the variable name
     * @return the declaration, or null
     */
    public static VariableDeclaration lookup(final Constraint con,
            final String name) {
        return con.getDeclarations().get(name);
    }

    /**
     * Remove a declaration from its constraint's table.
     *
     * @param vdecl null or the declaration
     */
    public static void delete(final VariableDeclaration vdecl) {
        if (vdecl == null) {
            return;
        }
        Map<String, VariableDeclaration> table =
            vdecl.getConstraint().getDeclarations();
        if (table.get(vdecl.getName()) == vdecl) {
            table.remove(vdecl.getName());
        }
    }

    /**
     * Number the declarations of a constraint contiguously, in
     * declaration order, and record the count as the constraint's local
     * slot count.
     *
     * @param con the constraint
     */
    public static void assignSlots(final Constraint con) {
        int i = 0;
        for (VariableDeclaration vdecl : con.getDeclarations().values()) {
            vdecl.setLocal(i++);
        }
        con.setLocalCount(i);
    }

    /**
     * Remove every declaration whose link count is zero.
     *
     * @param con the constraint
     * @return the number of declarations removed
     */
    public static int removeUnlinked(final Constraint con) {
        int removed = 0;
        Iterator<VariableDeclaration> it =
            con.getDeclarations().values().iterator();
        while (it.hasNext()) {
            VariableDeclaration vdecl = it.next();
            if (vdecl.getLinkCount() == 0) {
                LOGGER.debug("remove unused declaration {}", vdecl.getName());
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Are two declarations, used in two constraints, the same variable?
     *
     * <p>They are if they have the same name and the same position
     * (same constraint, parent, or child) relative to the constraint using
     * them.</p>
     *
     * @param aCon the constraint using {@code a}
     * @param a null or a declaration
     * @param bCon the constraint using {@code b}
     * @param b null or a declaration
     * @return true if they are the same variable
     */
    public static boolean equal(final Constraint aCon,
            final VariableDeclaration a, final Constraint bCon,
            final VariableDeclaration b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        if (!a.getName().equals(b.getName())) {
            return false;
        }
        if (aCon == a.getConstraint()) {
            return bCon == b.getConstraint();
        }
        if (aCon.getParent() == a.getConstraint()) {
            return bCon.getParent() == b.getConstraint();
        }
        return a.getConstraint().getParent() == aCon
            && b.getConstraint().getParent() == bCon;
    }
}
