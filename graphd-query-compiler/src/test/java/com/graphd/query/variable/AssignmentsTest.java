package com.graphd.query.variable;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Assignments.
 */
public class AssignmentsTest {

    /** Assign {@code $to = (from)} in con. */
    private static Assignment assignVariable(final Constraint con,
            final String to, final String from) {
        Pattern list = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(list,
            VariableDeclarations.addOrLookup(con, from));
        Assignment a = Assignments.alloc(con, to);
        a.setResult(list);
        return a;
    }

    @Test
    @DisplayName("Sorting puts an assignment after the assignments it uses")
    public void testSortOrder() throws SemanticException {
        Constraint con = new Constraint();
        Assignment a = assignVariable(con, "$a", "$b");
        Assignment b = Assignments.alloc(con, "$b");
        b.setResult(Pattern.list(PatternType.NAME));

        Assignments.sort(con);

        assertEquals(2, con.getAssignments().size());
        assertSame(b, con.getAssignments().get(0));
        assertSame(a, con.getAssignments().get(1));
    }

    @Test
    @DisplayName("Sorting keeps the order of independent assignments")
    public void testSortStable() throws SemanticException {
        Constraint con = new Constraint();
        Assignment a = Assignments.alloc(con, "$a");
        a.setResult(Pattern.list(PatternType.NAME));
        Assignment b = Assignments.alloc(con, "$b");
        b.setResult(Pattern.list(PatternType.VALUE));

        Assignments.sort(con);

        assertSame(a, con.getAssignments().get(0));
        assertSame(b, con.getAssignments().get(1));
    }

    @Test
    @DisplayName("A cycle of assignments is a semantics error")
    public void testSortLoop() {
        Constraint con = new Constraint();
        assignVariable(con, "$a", "$b");
        assignVariable(con, "$b", "$a");

        SemanticException e = assertThrows(SemanticException.class,
            () -> Assignments.sort(con));
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());
        assertEquals("loop in variable assignments to/from $a",
            e.getDetail());
        assertEquals(2, con.getAssignments().size());
    }

    @Test
    @DisplayName("Recursion is found through intermediate assignments")
    public void testIsRecursive() {
        Constraint con = new Constraint();
        Assignment a = assignVariable(con, "$a", "$b");
        Assignment b = assignVariable(con, "$b", "$c");
        Assignment c = Assignments.alloc(con, "$c");
        c.setResult(Pattern.list(PatternType.NAME));

        assertFalse(Assignments.isRecursive(con, a));
        assertFalse(Assignments.isRecursive(con, b));
        assertFalse(Assignments.isRecursive(con, null));

        c.setResult(Pattern.alloc(null, PatternType.LIST));
        Pattern.allocVariable(c.getResult(),
            VariableDeclarations.lookup(con, "$a"));
        assertTrue(Assignments.isRecursive(con, a));
        assertTrue(Assignments.isRecursive(con, c));
    }

    @Test
    @DisplayName("Variables of another constraint do not make a cycle")
    public void testIsRecursiveOtherConstraint() {
        Constraint con = new Constraint();
        Constraint other = new Constraint();
        Pattern list = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(list,
            VariableDeclarations.addOrLookup(other, "$a"));
        Assignment a = Assignments.alloc(con, "$a");
        a.setResult(list);

        assertFalse(Assignments.isRecursive(con, a));
    }

    @Test
    @DisplayName("Lookup by name and by declaration")
    public void testLookup() {
        Constraint con = new Constraint();
        Assignment a = assignVariable(con, "$a", "$b");

        assertSame(a, Assignments.byName(con, "$a"));
        assertNull(Assignments.byName(con, "$b"));
        assertNull(Assignments.byName(con, "$nope"));
        assertSame(a, Assignments.byDeclaration(con,
            VariableDeclarations.lookup(con, "$a")));
        assertNull(Assignments.byDeclaration(con, null));
    }

    @Test
    @DisplayName("Parenthesizing samples top-level values and collects nested lists")
    public void testParenthesizeMarks() throws SemanticException {
        Constraint con = new Constraint();
        Assignment x = Assignments.alloc(con, "$x");
        x.setResult(Pattern.list(PatternType.NAME));
        Pattern result = Pattern.list(PatternType.COUNT);
        Pattern.allocVariable(result, x.getDeclaration());
        con.setResult(result);

        Assignments.parenthesize(con);

        assertEquals(1, x.getDeclaration().getParentheses());
        assertEquals(1, x.getDepth());
        assertTrue(x.getResult().isCollect());
        assertFalse(x.getResult().first().isCollect());
        assertFalse(result.first().isSample());
        assertTrue(result.last().isSample());
    }

    @Test
    @DisplayName("An alias for a set value is not sampled")
    public void testSetValuedAliasNotSampled() {
        Constraint con = new Constraint();
        Assignment n = Assignments.alloc(con, "$n");
        n.setResult(Pattern.alloc(null, PatternType.COUNT));
        Pattern result = Pattern.list(PatternType.NAME);
        Pattern ref = Pattern.allocVariable(result, n.getDeclaration());

        Assignments.markPattern(con, result, 0);

        assertTrue(result.first().isSample());
        assertFalse(ref.isSample());
    }

    @Test
    @DisplayName("A variable used two lists deep cannot hold a list")
    public void testParenthesizeTooDeep() {
        Constraint con = new Constraint();
        Assignment x = Assignments.alloc(con, "$x");
        x.setResult(Pattern.list(PatternType.NAME));
        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern inner = Pattern.alloc(result, PatternType.LIST);
        Pattern.allocVariable(inner, x.getDeclaration());
        con.setResult(result);

        SemanticException e = assertThrows(SemanticException.class,
            () -> Assignments.parenthesize(con));
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());
        assertEquals("result expression \"(name)\" nests lists more than two "
            + "levels deep", e.getDetail());
    }

    @Test
    @DisplayName("Pick arms are neither sampled nor collected")
    public void testPickArmsUnmarked() {
        Constraint con = new Constraint();
        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern pick = Pattern.alloc(result, PatternType.PICK);
        Pattern arm = Pattern.alloc(pick, PatternType.NAME);
        arm.setOrIndex(1);

        Assignments.markPattern(con, result, 0);

        assertTrue(pick.isSample());
        assertFalse(arm.isSample());
        assertFalse(arm.isCollect());
    }

    @Test
    @DisplayName("Chains compare by declaration and value, in order")
    public void testEqualAndHash() {
        Constraint a = new Constraint();
        Assignments.alloc(a, "$x").setResult(Pattern.list(PatternType.NAME));
        Assignments.alloc(a, "$y").setResult(Pattern.list(PatternType.VALUE));
        Constraint b = new Constraint();
        Assignments.alloc(b, "$x").setResult(Pattern.list(PatternType.NAME));
        Assignments.alloc(b, "$y").setResult(Pattern.list(PatternType.VALUE));
        Constraint c = new Constraint();
        Assignments.alloc(c, "$y").setResult(Pattern.list(PatternType.VALUE));
        Assignments.alloc(c, "$x").setResult(Pattern.list(PatternType.NAME));

        assertTrue(Assignments.equal(a, b));
        assertEquals(Assignments.hash(a), Assignments.hash(b));
        assertFalse(Assignments.equal(a, c));
        assertFalse(Assignments.equal(a, new Constraint()));
    }
}
