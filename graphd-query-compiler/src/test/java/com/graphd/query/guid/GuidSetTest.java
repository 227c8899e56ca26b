package com.graphd.query.guid;

import com.graphd.query.constraint.Constraint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GuidSet.
 */
public class GuidSetTest {

    private static final Guid G1 = new Guid(1, 1);
    private static final Guid G2 = new Guid(1, 2);
    private static final Guid G3 = new Guid(1, 3);

    @Test
    @DisplayName("Empty set matches only null")
    public void testEmptySetContainsNull() {
        GuidSet gs = new GuidSet();

        assertTrue(gs.containsNull());
        assertTrue(gs.match(null));
        assertFalse(gs.match(G1));
        assertEquals(0, gs.size());
    }

    @Test
    @DisplayName("Adding to an empty set replaces the implicit null")
    public void testAddToEmptyReplacesNull() {
        GuidSet gs = new GuidSet();
        gs.add(G1);

        assertFalse(gs.containsNull());
        assertTrue(gs.match(G1));
        assertEquals(1, gs.size());
    }

    @Test
    @DisplayName("Duplicates are not added twice")
    public void testAddDuplicate() {
        GuidSet gs = GuidSet.of(G1, G2, G1);

        assertEquals(2, gs.size());
        assertEquals(G1, gs.get(0));
        assertEquals(G2, gs.get(1));
    }

    @Test
    @DisplayName("A null element sets the null flag")
    public void testAddNull() {
        GuidSet gs = GuidSet.of(G1, null);

        assertTrue(gs.isNullFlag());
        assertTrue(gs.containsNull());
        assertTrue(gs.match(G1));
        assertEquals(0, gs.find(null));
    }

    @Test
    @DisplayName("Intersecting overlapping sets keeps the common GUIDs")
    public void testIntersectOverlap() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G1, G2);

        gs.intersect(con, false, GuidSet.of(G2, G3));

        assertEquals(1, gs.size());
        assertEquals(G2, gs.get(0));
        assertFalse(con.isFalse());
    }

    @Test
    @DisplayName("Intersecting with the empty set marks the constraint false")
    public void testIntersectThenEmpty() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G1, G2);
        gs.intersect(con, false, GuidSet.of(G2, G3));

        gs.intersect(con, false, new GuidSet());

        assertTrue(con.isFalse());
        assertEquals(0, gs.size());
    }

    @Test
    @DisplayName("Disjoint sets intersect to nothing")
    public void testIntersectDisjoint() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G1);

        gs.intersect(con, false, GuidSet.of(G2));

        assertTrue(con.isFalse());
    }

    @Test
    @DisplayName("Intersection keeps the order of the receiving set")
    public void testIntersectKeepsOrder() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G3, G1, G2);

        gs.intersect(con, false, GuidSet.of(G1, G2, G3));

        assertEquals(java.util.List.of(G3, G1, G2), gs.getGuids());
    }

    @Test
    @DisplayName("Intersecting a set with itself leaves it as it was")
    public void testIntersectSelf() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G3, G1, null);

        gs.intersect(con, false, gs);

        assertEquals(java.util.List.of(G3, G1), gs.getGuids());
        assertTrue(gs.isNullFlag());
        assertFalse(con.isFalse());
    }

    @Test
    @DisplayName("A null-only set intersects with sets that allow null")
    public void testIntersectEmptyReceiver() {
        Constraint con = new Constraint();
        GuidSet gs = new GuidSet();

        gs.intersect(con, false, GuidSet.of(G1, null));

        assertEquals(0, gs.size());
        assertTrue(gs.containsNull());
        assertFalse(con.isFalse());

        gs.intersect(con, false, GuidSet.of(G1));

        assertEquals(0, gs.size());
        assertTrue(con.isFalse());
    }

    @Test
    @DisplayName("A set that allows null intersects with null-only to null")
    public void testIntersectNullableWithNullOnly() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G1, G2, null);

        gs.intersect(con, false, new GuidSet());

        assertEquals(0, gs.size());
        assertTrue(gs.containsNull());
        assertFalse(con.isFalse());
    }

    @Test
    @DisplayName("Intersection keeps insertion order rather than sorting")
    public void testIntersectNotSorted() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G2, G3, G1);

        gs.intersect(con, false, GuidSet.of(G1, G3));

        assertEquals(java.util.List.of(G3, G1), gs.getGuids());
        assertEquals(0, gs.find(G3));
        assertEquals(1, gs.find(G1));
    }

    @Test
    @DisplayName("Postponed intersection chains the incoming set")
    public void testIntersectPostponed() {
        Constraint con = new Constraint();
        GuidSet gs = GuidSet.of(G1, G2);

        gs.intersect(con, true, GuidSet.of(G3));

        assertEquals(2, gs.size());
        assertNotNull(gs.getNext());
        assertEquals(G3, gs.getNext().get(0));
        assertNull(gs.copyLink().getNext());
        assertFalse(con.isFalse());
    }

    @Test
    @DisplayName("Subtracting everything leaves nothing")
    public void testSubtractAll() {
        GuidSet gs = GuidSet.of(G1, G2);

        assertFalse(gs.subtract(GuidSet.of(G1, G2)));
    }

    @Test
    @DisplayName("Subtracting part of a set keeps the rest")
    public void testSubtractSome() {
        GuidSet gs = GuidSet.of(G1, G2);

        assertTrue(gs.subtract(GuidSet.of(G2, G3)));
        assertEquals(1, gs.size());
        assertEquals(G1, gs.get(0));
    }

    @Test
    @DisplayName("Subtracting null from a non-null set changes nothing")
    public void testSubtractNull() {
        GuidSet gs = GuidSet.of(G1);

        assertTrue(gs.subtract(new GuidSet()));
        assertFalse(gs.containsNull());
    }

    @Test
    @DisplayName("Union with the empty set adds null")
    public void testUnionWithEmpty() {
        GuidSet gs = GuidSet.of(G1);

        gs.union(new GuidSet());

        assertTrue(gs.containsNull());
        assertTrue(gs.match(G1));
    }

    @Test
    @DisplayName("Union merges the elements of both sets")
    public void testUnion() {
        GuidSet gs = GuidSet.of(G1, G2);

        gs.union(GuidSet.of(G2, G3));

        assertEquals(java.util.List.of(G1, G2, G3), gs.getGuids());
        assertFalse(gs.containsNull());
    }

    @Test
    @DisplayName("Set equality depends on order and null membership")
    public void testEqual() {
        assertTrue(GuidSet.equal(GuidSet.of(G1, G2), GuidSet.of(G1, G2)));
        assertFalse(GuidSet.equal(GuidSet.of(G1, G2), GuidSet.of(G2, G1)));
        assertFalse(GuidSet.equal(GuidSet.of(G1), GuidSet.of(G1, null)));
        assertEquals(GuidSet.hash(GuidSet.of(G1, G2)),
            GuidSet.hash(GuidSet.of(G1, G2)));
    }

    @Test
    @DisplayName("Delete removes a GUID or the null flag")
    public void testDelete() {
        GuidSet gs = GuidSet.of(G1, G2, null);

        assertTrue(gs.delete(G1));
        assertFalse(gs.delete(G1));
        assertTrue(gs.delete(null));
        assertFalse(gs.isNullFlag());
        assertEquals(1, gs.size());
    }

    @Test
    @DisplayName("GUIDs parse from 32 hex digits")
    public void testGuidFromString() {
        Guid g = Guid.fromString("0000000000000001000000000000000a");

        assertEquals(new Guid(1, 10), g);
        assertEquals("0000000000000001000000000000000a", g.toString());
        assertThrows(IllegalArgumentException.class,
            () -> Guid.fromString("123"));
        assertThrows(IllegalArgumentException.class,
            () -> Guid.fromString("zz00000000000001000000000000000a"));
        assertTrue(Guid.NULL.isNull());
    }
}
