package com.graphd.query.semantic;

import com.graphd.query.SemanticException;
import com.graphd.query.comparator.Comparators;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.ConstraintClause.OrClause;
import com.graphd.query.constraint.ConstraintLinkage;
import com.graphd.query.constraint.ConstraintOr;
import com.graphd.query.constraint.Flag;
import com.graphd.query.constraint.Linkage;
import com.graphd.query.constraint.Meta;
import com.graphd.query.constraint.Operator;
import com.graphd.query.constraint.StringConstraint;
import com.graphd.query.guid.Guid;
import com.graphd.query.guid.GuidSet;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ParseCompletion.
 */
public class ParseCompletionTest {

    private static SemanticException rejected(final Constraint con) {
        return assertThrows(SemanticException.class,
            () -> ParseCompletion.complete(con));
    }

    @Test
    @DisplayName("Unset flags, count and value comparator get their defaults")
    public void testDefaults() throws SemanticException {
        Constraint con = new Constraint();
        con.setComparator(Comparators.CASE);

        ParseCompletion.complete(con);

        assertEquals(Flag.DONTCARE, con.getArchival());
        assertEquals(Flag.TRUE, con.getLive());
        assertEquals(1, con.getCount().getMin());
        assertSame(Comparators.CASE, con.getValueComparator());
        assertFalse(con.isFalse());
    }

    @Test
    @DisplayName("The count minimum defaults past the start offset")
    public void testCountMinFollowsStart() throws SemanticException {
        Constraint con = new Constraint();
        con.setStart(4);

        ParseCompletion.complete(con);

        assertEquals(5, con.getCount().getMin());
    }

    @Test
    @DisplayName("Explicit flags are kept")
    public void testExplicitFlagsKept() throws SemanticException {
        Constraint con = new Constraint();
        con.setLive(Flag.DONTCARE);
        con.setArchival(Flag.FALSE);

        ParseCompletion.complete(con);

        assertEquals(Flag.DONTCARE, con.getLive());
        assertEquals(Flag.FALSE, con.getArchival());
    }

    @Test
    @DisplayName("contents without subconstraints is rejected")
    public void testContentsWithoutSubconstraints() {
        Constraint con = new Constraint();
        con.setResult(Pattern.list(PatternType.NAME, PatternType.CONTENTS));

        SemanticException e = rejected(con);
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());
        assertEquals("can't use \"contents\" return instruction in template "
            + "without contained templates", e.getDetail());
    }

    @Test
    @DisplayName("contents with a subconstraint is accepted")
    public void testContentsWithSubconstraint() throws SemanticException {
        Constraint con = new Constraint();
        con.setResult(Pattern.list(PatternType.CONTENTS));
        Constraint sub = new Constraint();
        sub.setLinkage(ConstraintLinkage.my(Linkage.LEFT));
        con.addSub(sub);

        ParseCompletion.complete(con);

        assertEquals(1, sub.getCount().getMin());
    }

    @Test
    @DisplayName("key= cannot be combined with guid= or unique=")
    public void testKeyConflicts() {
        Constraint guid = new Constraint();
        guid.getGuid().merge(guid, Operator.EQ, GuidSet.of(new Guid(1, 1)));
        guid.setKey(PatternType.NAME.bit());
        SemanticException e = rejected(guid);
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertTrue(e.getDetail().startsWith("cannot mix \"key=\" and "
            + "\"guid~=\""));

        Constraint unique = new Constraint();
        unique.setKey(PatternType.NAME.bit());
        unique.setUnique(PatternType.VALUE.bit());
        e = rejected(unique);
        assertEquals(SemanticException.Category.SYNTAX, e.getCategory());
        assertEquals("cannot mix \"key=\" and \"unique=\" constraints",
            e.getDetail());
    }

    @Test
    @DisplayName("An empty GUID set can only match null and makes the constraint false")
    public void testEmptyGuidSetFalse() throws SemanticException {
        Constraint con = new Constraint();
        con.getGuid().merge(con, Operator.EQ, new GuidSet());

        ParseCompletion.complete(con);

        assertTrue(con.isFalse());
    }

    @Test
    @DisplayName("-> and <- connect the parent and the first unlinked child")
    public void testDirectionalDefaults() throws SemanticException {
        Constraint root = new Constraint();
        Constraint link = new Constraint();
        link.setMeta(Meta.LINK_TO);
        root.addSub(link);
        Constraint first = new Constraint();
        Constraint second = new Constraint();
        link.addSub(first);
        link.addSub(second);

        ParseCompletion.complete(root);

        assertEquals(ConstraintLinkage.my(Linkage.RIGHT), link.getLinkage());
        assertEquals(ConstraintLinkage.iAm(Linkage.LEFT), first.getLinkage());
        assertFalse(second.getLinkage().isSet());
    }

    @Test
    @DisplayName("An explicit linkage on a link constraint is not overridden")
    public void testDirectionalExplicitLinkage() throws SemanticException {
        Constraint root = new Constraint();
        Constraint link = new Constraint();
        link.setMeta(Meta.LINK_FROM);
        link.setLinkage(ConstraintLinkage.my(Linkage.SCOPE));
        root.addSub(link);

        ParseCompletion.complete(root);

        assertEquals(ConstraintLinkage.my(Linkage.SCOPE), link.getLinkage());
    }

    @Test
    @DisplayName("anchor=true spreads down to unspecified subconstraints")
    public void testAnchorSubtree() throws SemanticException {
        Constraint root = new Constraint();
        root.setAnchor(Flag.TRUE);
        Constraint sub = new Constraint();
        sub.setLinkage(ConstraintLinkage.my(Linkage.LEFT));
        root.addSub(sub);
        Constraint off = new Constraint();
        off.setAnchor(Flag.FALSE);
        off.setLinkage(ConstraintLinkage.my(Linkage.RIGHT));
        root.addSub(off);

        ParseCompletion.complete(root);

        assertEquals(Flag.TRUE_LOCAL, sub.getAnchor());
        assertEquals(Flag.FALSE, off.getAnchor());
    }

    @Test
    @DisplayName("An anchored constraint anchors the parent it points to")
    public void testAnchorInferParent() throws SemanticException {
        Constraint root = new Constraint();
        Constraint sub = new Constraint();
        sub.setAnchor(Flag.TRUE);
        sub.setLinkage(ConstraintLinkage.my(Linkage.LEFT));
        root.addSub(sub);

        ParseCompletion.complete(root);

        assertEquals(Flag.TRUE_LOCAL, root.getAnchor());
    }

    @Test
    @DisplayName("An anchored constraint cannot point to an unanchored one")
    public void testAnchorConflict() {
        Constraint root = new Constraint();
        root.setAnchor(Flag.TRUE);
        Constraint sub = new Constraint();
        sub.setAnchor(Flag.FALSE);
        sub.setLinkage(ConstraintLinkage.iAm(Linkage.LEFT));
        root.addSub(sub);

        SemanticException e = rejected(root);
        assertEquals(SemanticException.Category.SEMANTICS, e.getCategory());
        assertEquals("an anchored constraint cannot point to an unanchored "
            + "one.", e.getDetail());
    }

    @Test
    @DisplayName("Range comparisons against several strings keep one boundary")
    public void testRangeTruncation() throws SemanticException {
        Constraint con = new Constraint();
        StringConstraint below = new StringConstraint(Operator.LE, "b", "a");
        StringConstraint above = new StringConstraint(Operator.GE, "a", "b");
        StringConstraint equal = new StringConstraint(Operator.EQ, "a", "b");
        con.getNameQueue().add(below);
        con.getNameQueue().add(above);
        con.getValueQueue().add(equal);

        ParseCompletion.complete(con);

        assertEquals(List.of("a"), below.getElements());
        assertEquals(List.of("b"), above.getElements());
        assertEquals(List.of("a", "b"), equal.getElements());
    }

    @Test
    @DisplayName("Range boundaries honor the value comparator")
    public void testRangeTruncationNumeric() throws SemanticException {
        Constraint con = new Constraint();
        con.setValueComparator(Comparators.NUMBER);
        StringConstraint below = new StringConstraint(Operator.LT, "9", "10");
        con.getValueQueue().add(below);

        ParseCompletion.complete(con);

        assertEquals(List.of("9"), below.getElements());
    }

    @Test
    @DisplayName("The value comparator vets ~= value constraints")
    public void testValueComparatorSyntax() {
        Constraint con = new Constraint();
        con.setComparator(Comparators.NUMBER);
        con.getValueQueue().add(new StringConstraint(Operator.MATCH, "1*"));

        SemanticException e = rejected(con);
        assertEquals("cannot use ~= with comparator=\"number\"",
            e.getDetail());
    }

    @Test
    @DisplayName("Sort comparators annotate the leading sort elements")
    public void testSortComparators() throws SemanticException {
        Constraint con = new Constraint();
        con.setComparator(Comparators.CASE);
        Pattern sort = Pattern.list(PatternType.NAME, PatternType.VALUE);
        con.setSort(sort);
        con.getSortComparators().add(Comparators.NUMBER);

        ParseCompletion.complete(con);

        assertSame(Comparators.NUMBER, sort.first().getComparator());
        assertSame(Comparators.CASE, sort.last().getComparator());
    }

    @Test
    @DisplayName("Sort comparators need enough sorts")
    public void testSortComparatorErrors() {
        Constraint unsorted = new Constraint();
        unsorted.getSortComparators().add(Comparators.NUMBER);
        assertEquals("sortcomparators with no sort",
            rejected(unsorted).getDetail());

        Constraint single = new Constraint();
        single.setSort(Pattern.alloc(null, PatternType.NAME));
        single.getSortComparators().add(Comparators.NUMBER);
        single.getSortComparators().add(Comparators.CASE);
        assertEquals("more sort comparators than sorts",
            rejected(single).getDetail());
    }

    @Test
    @DisplayName("Or-branches inherit the completed prototype's defaults")
    public void testOrBranchesCompleted() throws SemanticException {
        Constraint con = new Constraint();
        Constraint head = new Constraint();
        Constraint tail = new Constraint();
        tail.setLive(Flag.FALSE);
        con.addClause(new OrClause(new ConstraintOr(head, tail, false)));

        ParseCompletion.complete(con);

        assertEquals(Flag.TRUE, head.getLive());
        assertEquals(Flag.FALSE, tail.getLive());
        assertEquals(Flag.DONTCARE, head.getArchival());
    }
}
