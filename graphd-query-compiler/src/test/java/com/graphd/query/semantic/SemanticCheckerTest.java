package com.graphd.query.semantic;

import com.graphd.query.CompilerConfig;
import com.graphd.query.QueryRequest;
import com.graphd.query.RequestKind;
import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintLinkage;
import com.graphd.query.constraint.Linkage;
import com.graphd.query.constraint.Operator;
import com.graphd.query.constraint.StringConstraint;
import com.graphd.query.guid.InMemoryStorageOracle;
import com.graphd.query.pattern.DefaultPatterns;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.variable.Assignments;
import com.graphd.query.variable.VariableDeclaration;
import com.graphd.query.variable.VariableDeclarations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SemanticChecker.
 */
public class SemanticCheckerTest {

    private static QueryRequest read(final Constraint root) {
        return QueryRequest.of(RequestKind.READ, root,
            new InMemoryStorageOracle());
    }

    private static QueryRequest write(final Constraint root) {
        return QueryRequest.of(RequestKind.WRITE, root,
            new InMemoryStorageOracle());
    }

    private static SemanticException rejected(final QueryRequest request) {
        return assertThrows(SemanticException.class,
            () -> SemanticChecker.complete(request));
    }

    /** A result {@code ($name)} returning the variable. */
    private static VariableDeclaration returnVariable(final Constraint con,
            final String name) {
        VariableDeclaration v = VariableDeclarations.addOrLookup(con, name);
        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(result, v);
        con.setResult(result);
        return v;
    }

    private static Constraint linkedSub(final Constraint parent) {
        Constraint sub = new Constraint();
        sub.setLinkage(ConstraintLinkage.my(Linkage.LEFT));
        parent.addSub(sub);
        return sub;
    }

    @Test
    @DisplayName("unique= and key= are only accepted by write")
    public void testUniqueAndKeyNeedWrite() {
        Constraint unique = new Constraint();
        unique.setUnique(PatternType.NAME.bit());
        SemanticException e = rejected(read(unique));
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertEquals("\"unique=\" only works with \"write\"", e.getDetail());

        Constraint key = new Constraint();
        key.setKey(PatternType.NAME.bit());
        e = rejected(read(key));
        assertEquals("\"key=\" only works with \"write\"", e.getDetail());
    }

    @Test
    @DisplayName("A returned variable must be assigned somewhere")
    public void testReturnedButNotSet() {
        Constraint root = new Constraint();
        returnVariable(root, "$x");

        SemanticException e = rejected(read(root));
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertEquals("variable $x is returned, but not set in the constraint "
            + "or any subconstraint", e.getDetail());
    }

    @Test
    @DisplayName("A variable assigned below a constraint that returns it is fine")
    public void testReturnedAndSetBelow() throws SemanticException {
        Constraint root = new Constraint();
        returnVariable(root, "$x");
        Constraint sub = linkedSub(root);
        Assignments.alloc(sub, "$x").setResult(
            Pattern.alloc(null, PatternType.NAME));

        SemanticChecker.complete(read(root));

        assertEquals(1, sub.getAssignments().size());
    }

    @Test
    @DisplayName("An assigned variable must be returned by this or a containing constraint")
    public void testAssignedButNotReturned() {
        Constraint root = new Constraint();
        Assignments.alloc(root, "$x").setResult(
            Pattern.list(PatternType.NAME));

        SemanticException e = rejected(read(root));
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertEquals("variable $x is assigned, but not returned in this or "
            + "any containing constraint", e.getDetail());
    }

    @Test
    @DisplayName("A variable is assigned once per constraint")
    public void testAssignedTwice() {
        Constraint root = new Constraint();
        returnVariable(root, "$x");
        Assignments.alloc(root, "$x").setResult(
            Pattern.list(PatternType.NAME));
        Assignments.alloc(root, "$x").setResult(
            Pattern.list(PatternType.VALUE));

        assertEquals("variable $x is assigned to twice",
            rejected(read(root)).getDetail());
    }

    @Test
    @DisplayName("A variable is not assigned in a constraint and again below it")
    public void testAssignedTwiceNested() {
        Constraint root = new Constraint();
        returnVariable(root, "$x");
        Assignments.alloc(root, "$x").setResult(
            Pattern.list(PatternType.NAME));
        Constraint sub = linkedSub(root);
        Assignments.alloc(sub, "$x").setResult(
            Pattern.list(PatternType.VALUE));

        SemanticException e = rejected(read(root));
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertEquals("variable $x is assigned to twice in nested constraints",
            e.getDetail());
    }

    @Test
    @DisplayName("Assignments may not depend on themselves")
    public void testCircularAssignment() {
        Constraint root = new Constraint();
        VariableDeclaration a = VariableDeclarations.addOrLookup(root, "$a");
        VariableDeclaration b = VariableDeclarations.addOrLookup(root, "$b");
        Pattern result = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(result, a);
        Pattern.allocVariable(result, b);
        root.setResult(result);

        Pattern toB = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(toB, b);
        Assignments.alloc(root, "$a").setResult(toB);
        Pattern toA = Pattern.alloc(null, PatternType.LIST);
        Pattern.allocVariable(toA, a);
        Assignments.alloc(root, "$b").setResult(toA);

        SemanticException e = rejected(read(root));
        assertEquals("circular assignment of $a to itself", e.getDetail());
    }

    @Test
    @DisplayName("Subconstraints need a linkage")
    public void testSubWithoutLinkage() {
        Constraint root = new Constraint();
        root.addSub(new Constraint());

        SemanticException e = rejected(read(root));
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());
        assertEquals("don't know how to connect these nested constraints",
            e.getDetail());
    }

    @Test
    @DisplayName("The outermost constraint cannot point to a parent")
    public void testOutermostMyLinkage() {
        Constraint root = new Constraint();
        root.setLinkage(ConstraintLinkage.my(Linkage.LEFT));

        SemanticException e = rejected(read(root));
        assertEquals("can't use (<-left ..) on the outermost constraint - do "
            + "you mean left=GUID?", e.getDetail());
    }

    @Test
    @DisplayName("unique= names only fields the constraint specifies")
    public void testUniqueNeedsFields() throws SemanticException {
        Constraint missing = new Constraint();
        missing.setUnique(PatternType.NAME.bit());
        SemanticException e = rejected(write(missing));
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());
        assertEquals("request for name uniqueness without specifying a name?",
            e.getDetail());

        Constraint linked = new Constraint();
        linked.setUnique(Linkage.LEFT.bit());
        e = rejected(write(linked));
        assertEquals("request for left uniqueness without specifying a left?",
            e.getDetail());

        Constraint named = new Constraint();
        named.setUnique(PatternType.NAME.bit());
        named.getNameQueue().add(new StringConstraint(Operator.EQ, "a"));
        SemanticChecker.complete(write(named));
    }

    @Test
    @DisplayName("key= names only fields the constraint specifies")
    public void testKeyNeedsFields() {
        Constraint con = new Constraint();
        con.setKey(PatternType.VALUE.bit());

        SemanticException e = rejected(write(con));
        assertEquals("value is used as a key without specifying a value in "
            + "the constraint", e.getDetail());
    }

    @Test
    @DisplayName("Missing results default by request kind")
    public void testDefaultResults() throws SemanticException {
        Constraint readRoot = new Constraint();
        SemanticChecker.completeSubtree(read(readRoot), readRoot);
        assertTrue(Pattern.equalValue(DefaultPatterns.readDefault(),
            readRoot.getResult()));
        assertTrue(readRoot.isUsesContents());

        Constraint writeRoot = new Constraint();
        SemanticChecker.complete(write(writeRoot));
        assertTrue(Pattern.equalValue(DefaultPatterns.writeDefault(),
            writeRoot.getResult()));
        assertTrue(writeRoot.getFrames().isEmpty());
    }

    @Test
    @DisplayName("Subconstraints of a constraint that ignores contents return nothing")
    public void testUnusedContentsEmptySubResults() throws SemanticException {
        Constraint root = new Constraint();
        root.setResult(Pattern.list(PatternType.GUID));
        Constraint sub = linkedSub(root);
        sub.setResult(Pattern.list(PatternType.NAME));

        SemanticChecker.completeSubtree(read(root), root);

        assertFalse(root.isUsesContents());
        assertEquals(PatternType.LIST, sub.getResult().getType());
        assertEquals(0, sub.getResult().size());
    }

    @Test
    @DisplayName("countlimit and result page sizes default from pagesize and the configuration")
    public void testPageSizeDefaults() throws SemanticException {
        Constraint con = new Constraint();
        con.setResult(Pattern.list(PatternType.GUID));
        con.setStart(5);
        con.setPageSize(10);

        SemanticChecker.completeSubtree(read(con), con);

        assertEquals(15, con.getCountLimit());
        assertEquals(10, con.getResultPageSizeParsed());
        assertEquals(CompilerConfig.defaults().resultPageSizeDefault(),
            con.getResultPageSize());
    }

    @Test
    @DisplayName("Result page sizes are clamped to the configured maximum")
    public void testPageSizeMaximum() throws SemanticException {
        Constraint con = new Constraint();
        con.setResult(Pattern.list(PatternType.GUID));
        con.setResultPageSizeParsed(1000);
        QueryRequest request = new QueryRequest(RequestKind.READ, con,
            new InMemoryStorageOracle(), null, false,
            new CompilerConfig(100, 500));

        SemanticChecker.completeSubtree(request, con);

        assertEquals(500, con.getResultPageSizeParsed());
        assertEquals(100, con.getResultPageSize());
        assertFalse(con.isCountLimitValid());
    }

    @Test
    @DisplayName("A constraint its parent points to returns at most one primitive")
    public void testIAmClampsPageSizes() throws SemanticException {
        Constraint root = new Constraint();
        root.setResult(Pattern.list(PatternType.GUID, PatternType.CONTENTS));
        Constraint sub = new Constraint();
        sub.setLinkage(ConstraintLinkage.iAm(Linkage.LEFT));
        sub.setResult(Pattern.list(PatternType.GUID));
        sub.setPageSize(20);
        root.addSub(sub);

        SemanticChecker.completeSubtree(read(root), root);

        assertEquals(1, sub.getPageSize());
        assertEquals(1, sub.getCountLimit());
        assertEquals(1, sub.getResultPageSizeParsed());
        assertEquals(1, sub.getResultPageSize());
        assertEquals(CompilerConfig.defaults().resultPageSizeDefault(),
            root.getResultPageSizeParsed());
    }

    @Test
    @DisplayName("Ids are unique, and a constraint's id follows its subconstraints'")
    public void testIds() throws SemanticException {
        Constraint root = new Constraint();
        Constraint a = linkedSub(root);
        Constraint b = linkedSub(a);
        Constraint c = linkedSub(root);

        SemanticChecker.completeSubtree(read(root), root);

        assertEquals(1, b.getId());
        assertEquals(2, a.getId());
        assertEquals(3, c.getId());
        assertEquals(4, root.getId());
    }

    @Test
    @DisplayName("A soft timeout makes cursor results resumable")
    public void testResumable() throws SemanticException {
        Constraint con = new Constraint();
        con.setResult(Pattern.list(PatternType.CURSOR));
        QueryRequest request = new QueryRequest(RequestKind.READ, con,
            new InMemoryStorageOracle(), null, true, null);

        SemanticChecker.completeSubtree(request, con);
        assertTrue(con.isResumable());

        Constraint plain = new Constraint();
        plain.setResult(Pattern.list(PatternType.CURSOR));
        SemanticChecker.completeSubtree(read(plain), plain);
        assertFalse(plain.isResumable());
    }

    @Test
    @DisplayName("Reads run variable analysis over the checked tree")
    public void testReadRunsVariableAnalysis() throws SemanticException {
        Constraint root = new Constraint();
        root.setResult(Pattern.list(PatternType.NAME));

        SemanticChecker.complete(read(root));

        assertEquals(1, root.getDeclaredFrameCount());
        assertFalse(root.getFrames().isEmpty());
    }
}
