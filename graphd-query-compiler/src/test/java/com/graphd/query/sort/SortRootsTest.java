package com.graphd.query.sort;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.variable.Assignments;
import com.graphd.query.variable.PatternFrames;
import com.graphd.query.variable.VariableDeclaration;
import com.graphd.query.variable.VariableDeclarations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SortRoots and SortRoot.
 */
public class SortRootsTest {

    private static Constraint mandatoryChild(final Constraint parent) {
        Constraint sub = new Constraint();
        sub.getCount().setMin(1);
        parent.addSub(sub);
        return sub;
    }

    /** {@code list(var)} for a declaration. */
    private static Pattern listOf(final VariableDeclaration vdecl) {
        Pattern list = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(list, vdecl);
        return list;
    }

    @Test
    @DisplayName("Sorting through two levels of variables promotes sorts into the middle")
    public void testPromoteTransitive() {
        Constraint a = new Constraint();
        Constraint b = mandatoryChild(a);
        Constraint c = mandatoryChild(b);

        VariableDeclaration ax = VariableDeclarations.addOrLookup(a, "$x");
        VariableDeclaration by = VariableDeclarations.addOrLookup(b, "$y");
        a.setSort(listOf(ax));
        Assignments.allocDeclaration(b, ax).setResult(listOf(by));
        Assignments.allocDeclaration(c, by).setResult(
            Pattern.list(PatternType.VALUE));

        SortRoots.mark(a);

        SortRoot root = a.getSortRoot();
        assertNotNull(root);
        assertSame(c, root.getConstraint());
        assertEquals(PatternType.VALUE, root.getPattern().getType());

        SortRoots.promote(a);

        assertNotNull(b.getSort());
        assertTrue(b.isSortValid());
        assertSame(root, b.getSortRoot());
        assertEquals(PatternType.VARIABLE, b.getSort().getType());
        assertSame(by, b.getSort().getDeclaration());
        assertSame(root, c.getSortRoot());
        assertEquals(PatternType.VALUE, c.getSort().getType());
    }

    @Test
    @DisplayName("An optional source has no sort root")
    public void testOptionalSource() {
        Constraint a = new Constraint();
        Constraint b = new Constraint();
        b.getCount().setMin(0);
        a.addSub(b);
        VariableDeclaration ax = VariableDeclarations.addOrLookup(a, "$x");
        a.setSort(listOf(ax));
        Assignments.allocDeclaration(b, ax).setResult(
            Pattern.list(PatternType.NAME));

        SortRoots.mark(a);

        assertNull(a.getSortRoot());
    }

    @Test
    @DisplayName("Reversed variables flip the sort root's direction")
    public void testSignTravelsDown() {
        Constraint a = new Constraint();
        Constraint b = mandatoryChild(a);
        VariableDeclaration ax = VariableDeclarations.addOrLookup(a, "$x");
        Pattern sort = listOf(ax);
        sort.first().setSortForward(false);
        a.setSort(sort);
        Assignments.allocDeclaration(b, ax).setResult(
            Pattern.list(PatternType.NAME));

        SortRoots.mark(a);

        assertFalse(a.getSortRoot().getPattern().isSortForward());
    }

    @Test
    @DisplayName("A local guid sort needs no sort root")
    public void testUnmarkTrivial() {
        Constraint con = new Constraint();
        con.setSort(Pattern.list(PatternType.GUID));

        SortRoots.mark(con);
        assertNotNull(con.getSortRoot());

        SortRoots.unmark(con);
        assertNull(con.getSortRoot());
    }

    @Test
    @DisplayName("Scan order follows the sort or the sort root's ordering")
    public void testIteratorDirection() {
        Constraint a = new Constraint();
        Constraint c = mandatoryChild(a);
        c.setResult(Pattern.list(PatternType.COUNT));
        Pattern.dup(c.getResult(), Pattern.list(PatternType.VALUE));
        PatternFrames.create(c);

        a.setSort(Pattern.list(PatternType.NAME));
        assertEquals(new ScanOrder(IteratorDirection.ANY, null),
            SortRoots.iteratorDirection(a));

        SortRoot sr = new SortRoot(c, Pattern.alloc(null, PatternType.VALUE));
        a.setSortRoot(sr);
        assertEquals(new ScanOrder(IteratorDirection.ORDERING, "/0.0"),
            SortRoots.iteratorDirection(a));
        assertTrue(SortRoot.hasOrdering(sr, "/0.0"));

        Constraint byTime = new Constraint();
        Pattern sort = Pattern.list(PatternType.TIMESTAMP);
        sort.first().setSortForward(false);
        byTime.setSort(sort);
        assertEquals(new ScanOrder(IteratorDirection.BACKWARD, null),
            SortRoots.iteratorDirection(byTime));
    }

    @Test
    @DisplayName("A sort root whose value is in no frame is dropped")
    public void testIteratorDirectionUnresolvable() {
        Constraint a = new Constraint();
        Constraint c = mandatoryChild(a);
        PatternFrames.create(c);
        a.setSortRoot(new SortRoot(c, Pattern.alloc(null, PatternType.NAME)));

        ScanOrder order = SortRoots.iteratorDirection(a);

        assertNull(order.ordering());
        assertNull(a.getSortRoot());
    }

    @Test
    @DisplayName("Ordering paths parse back into sort roots")
    public void testFromString() throws SemanticException {
        Constraint a = new Constraint();
        Constraint c = mandatoryChild(a);
        c.setResult(Pattern.list(PatternType.COUNT));
        Pattern.dup(c.getResult(), Pattern.list(PatternType.VALUE));
        PatternFrames.create(c);

        SortRoot parsed = SortRoot.fromString(a, "/0.0");

        assertSame(c, parsed.getConstraint());
        assertTrue(SortRoot.equal(parsed,
            new SortRoot(c, Pattern.alloc(null, PatternType.VALUE))));
    }

    @Test
    @DisplayName("Malformed or dangling ordering paths are rejected")
    public void testFromStringErrors() {
        Constraint a = new Constraint();
        Constraint c = mandatoryChild(a);
        c.setResult(Pattern.list(PatternType.NAME));
        PatternFrames.create(c);

        SemanticException e = assertThrows(SemanticException.class,
            () -> SortRoot.fromString(a, "abc"));
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertEquals("bad sort root ordering \"abc\"", e.getDetail());

        e = assertThrows(SemanticException.class,
            () -> SortRoot.fromString(a, "/5.0"));
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());

        e = assertThrows(SemanticException.class,
            () -> SortRoot.fromString(a, "/0.7"));
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());

        e = assertThrows(SemanticException.class,
            () -> SortRoot.fromString(a, "/0.0"));
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());
    }
}
