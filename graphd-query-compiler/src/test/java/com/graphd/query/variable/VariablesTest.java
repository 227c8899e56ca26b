package com.graphd.query.variable;

import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Variables.
 */
public class VariablesTest {

    @Test
    @DisplayName("Assignments are found in the constraint and below it")
    public void testIsAssignedInOrBelow() {
        Constraint root = new Constraint();
        Constraint sub = new Constraint();
        root.addSub(sub);
        Assignments.alloc(sub, "$x").setResult(Pattern.list(PatternType.NAME));

        assertTrue(Variables.isAssignedInOrBelow(root, "$x"));
        assertTrue(Variables.isAssignedInOrBelow(sub, "$x"));
        assertFalse(Variables.isAssignedInOrBelow(root, "$y"));
    }

    @Test
    @DisplayName("Use in the result, a valid sort or an assignment counts")
    public void testIsUsed() {
        Constraint con = new Constraint();
        VariableDeclaration x = VariableDeclarations.addOrLookup(con, "$x");
        VariableDeclarations.addOrLookup(con, "$idle");
        assertFalse(Variables.isUsed(con, "$x"));

        Pattern sort = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(sort, x);
        con.setSort(sort);
        assertTrue(Variables.isUsed(con, "$x"));

        con.setSortValid(false);
        assertFalse(Variables.isUsed(con, "$x"));

        Pattern rhs = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(rhs, x);
        Assignments.alloc(con, "$y").setResult(rhs);
        assertTrue(Variables.isUsed(con, "$x"));

        assertFalse(Variables.isUsed(con, "$idle"));
        assertFalse(Variables.isUsed(con, "$undeclared"));
    }

    @Test
    @DisplayName("Local aliases are replaced by the assigned value, keeping the sign")
    public void testReplaceAliases() {
        Constraint con = new Constraint();
        Assignment x = Assignments.alloc(con, "$x");
        x.setResult(Pattern.list(PatternType.NAME, PatternType.VALUE));

        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern ref = Pattern.allocVariable(result, x.getDeclaration());
        ref.setSortForward(false);
        ref.setOrIndex(3);
        con.setResult(result);

        Variables.replaceAliases(con);

        Pattern replaced = result.first();
        assertEquals(PatternType.LIST, replaced.getType());
        assertFalse(replaced.isSortForward());
        assertEquals(3, replaced.getOrIndex());
        assertEquals("(-(name, value))", result.toString());

        // The assignment itself is untouched.
        assertEquals("(name, value)", x.getResult().toString());
    }

    @Test
    @DisplayName("Variables of other constraints are not aliases")
    public void testReplaceAliasesIgnoresForeignVariables() {
        Constraint root = new Constraint();
        Constraint sub = new Constraint();
        root.addSub(sub);
        VariableDeclaration x = VariableDeclarations.addOrLookup(root, "$x");
        Assignments.allocDeclaration(sub, x).setResult(
            Pattern.list(PatternType.NAME));
        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(result, x);
        sub.setResult(result);

        Variables.replaceAliases(sub);

        assertEquals(PatternType.VARIABLE, result.first().getType());
    }

    @Test
    @DisplayName("Renaming reaches the result, assignments and direct subconstraints")
    public void testRename() {
        Constraint con = new Constraint();
        VariableDeclaration x = VariableDeclarations.addOrLookup(con, "$x");
        VariableDeclaration y = VariableDeclarations.addOrLookup(con, "$y");

        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(result, x);
        con.setResult(result);
        Assignment a = Assignments.allocDeclaration(con, x);
        a.setResult(Pattern.list(PatternType.NAME));

        Constraint sub = new Constraint();
        con.addSub(sub);
        Assignment fromSub = Assignments.allocDeclaration(sub, x);
        fromSub.setResult(Pattern.list(PatternType.VALUE));

        Variables.rename(con, x, y);

        assertSame(y, result.first().getDeclaration());
        assertSame(y, a.getDeclaration());
        assertSame(y, fromSub.getDeclaration());
    }
}
