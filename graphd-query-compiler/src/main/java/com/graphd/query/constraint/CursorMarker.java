package com.graphd.query.constraint;

import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.variable.Assignment;

/**
 * Decides which constraints can hand out a cursor.
 *
 * <p>A constraint is cursor-usable if its result, sort or assignments
 * mention {@code cursor}, if it is a mandatory child of a cursor-usable
 * parent, or if one of its or-branches is cursor-usable.</p>
 */
public final class CursorMarker {

    /** Private constructor to prevent instantiation. */
    private CursorMarker() {
        // Utility class
    }

    /**
     * Mark one constraint. Parents must be marked before their
     * children.
     *
     * @param con the constraint
     */
    public static void markUsable(final Constraint con) {
        con.setCursorUsable(isUsable(con));
        if (con.isCursorUsable()) {
            for (ConstraintOr cor : con.getOrs()) {
                cor.getHead().setCursorUsable(true);
                if (cor.getTail() != null) {
                    cor.getTail().setCursorUsable(true);
                }
            }
        }
    }

    private static boolean isUsable(final Constraint con) {
        if (mentionsCursor(con)) {
            return true;
        }
        if (con.getParent() != null && con.getParent().isCursorUsable()
                && con.isMandatory()) {
            return true;
        }
        for (ConstraintOr cor : con.getOrs()) {
            if (isUsable(cor.getHead())
                    || (cor.getTail() != null && isUsable(cor.getTail()))) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentionsCursor(final Constraint con) {
        if (Pattern.lookup(con.getResult(), PatternType.CURSOR) != null
                || Pattern.lookup(con.getSort(), PatternType.CURSOR) != null) {
            return true;
        }
        for (Assignment a : con.getAssignments()) {
            if (Pattern.lookup(a.getResult(), PatternType.CURSOR) != null) {
                return true;
            }
        }
        return false;
    }
}
