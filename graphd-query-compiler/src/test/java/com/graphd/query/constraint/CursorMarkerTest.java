package com.graphd.query.constraint;

import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.variable.Assignments;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CursorMarker.
 */
public class CursorMarkerTest {

    private static Constraint child(final Constraint parent, final long min) {
        Constraint sub = new Constraint();
        sub.getCount().setMin(min);
        parent.addSub(sub);
        return sub;
    }

    @Test
    @DisplayName("A constraint returning a cursor can hand one out")
    public void testResultMentionsCursor() {
        Constraint con = new Constraint();
        con.setResult(Pattern.list(PatternType.CURSOR));

        CursorMarker.markUsable(con);

        assertTrue(con.isCursorUsable());
    }

    @Test
    @DisplayName("A cursor in an assignment counts")
    public void testAssignmentMentionsCursor() {
        Constraint con = new Constraint();
        Assignments.alloc(con, "$c").setResult(
            Pattern.alloc(null, PatternType.CURSOR));

        CursorMarker.markUsable(con);

        assertTrue(con.isCursorUsable());
    }

    @Test
    @DisplayName("Mandatory children of a usable parent are usable, optional ones are not")
    public void testInheritedByMandatoryChildren() {
        Constraint root = new Constraint();
        root.setResult(Pattern.list(PatternType.CURSOR));
        Constraint mandatory = child(root, 1);
        Constraint optional = child(root, 0);

        CursorMarker.markUsable(root);
        CursorMarker.markUsable(mandatory);
        CursorMarker.markUsable(optional);

        assertTrue(mandatory.isCursorUsable());
        assertFalse(optional.isCursorUsable());
    }

    @Test
    @DisplayName("Nothing is usable without a cursor anywhere above")
    public void testNoCursor() {
        Constraint root = new Constraint();
        root.setResult(Pattern.list(PatternType.GUID));
        Constraint sub = child(root, 1);

        CursorMarker.markUsable(root);
        CursorMarker.markUsable(sub);

        assertFalse(root.isCursorUsable());
        assertFalse(sub.isCursorUsable());
    }

    @Test
    @DisplayName("A usable branch makes the prototype and both branches usable")
    public void testOrBranches() {
        Constraint proto = new Constraint();
        Constraint head = new Constraint();
        Constraint tail = new Constraint();
        ConstraintOr cor = new ConstraintOr(head, tail, false);
        cor.setPrototype(proto);
        proto.getOrs().add(cor);
        head.setOr(cor);
        tail.setOr(cor);
        Assignments.alloc(tail, "$c").setResult(
            Pattern.alloc(null, PatternType.CURSOR));

        CursorMarker.markUsable(proto);

        assertTrue(proto.isCursorUsable());
        assertTrue(head.isCursorUsable());
        assertTrue(tail.isCursorUsable());
    }
}
