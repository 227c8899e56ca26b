package com.graphd.query.constraint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CountConstraint.
 */
public class CountConstraintTest {

    @Test
    @DisplayName("count=n pins both bounds")
    public void testEquals() {
        CountConstraint count = new CountConstraint();

        assertTrue(count.merge(Operator.EQ, 3));

        assertTrue(count.isMinValid());
        assertTrue(count.isMaxValid());
        assertEquals(3, count.getMin());
        assertEquals(3, count.getMax());
    }

    @Test
    @DisplayName("An upper bound below 1 implies a minimum of 0")
    public void testUpperBoundZero() {
        CountConstraint count = new CountConstraint();

        assertTrue(count.merge(Operator.LE, 0));

        assertTrue(count.isMinValid());
        assertEquals(0, count.getMin());
        assertEquals(0, count.getMax());
    }

    @Test
    @DisplayName("!= at a bound moves the bound")
    public void testNotEqualsAtBound() {
        CountConstraint count = new CountConstraint();
        assertTrue(count.merge(Operator.LE, 5));

        assertTrue(count.merge(Operator.NE, 5));
        assertEquals(4, count.getMax());

        assertTrue(count.merge(Operator.NE, 0));
        assertEquals(1, count.getMin());
    }

    @Test
    @DisplayName("Impossible bounds are reported")
    public void testImpossible() {
        assertFalse(new CountConstraint().merge(Operator.LT, 0));
        assertFalse(new CountConstraint().merge(Operator.GT, Long.MAX_VALUE));

        CountConstraint count = new CountConstraint();
        assertTrue(count.merge(Operator.GT, 3));
        assertFalse(count.merge(Operator.LT, 4));
    }

    @Test
    @DisplayName("~= is not a count operator")
    public void testMatchRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new CountConstraint().merge(Operator.MATCH, 1));
    }

    @Test
    @DisplayName("Equal bounds compare equal")
    public void testEqual() {
        CountConstraint a = new CountConstraint();
        CountConstraint b = new CountConstraint();
        a.merge(Operator.GE, 2);
        b.merge(Operator.GE, 2);

        assertTrue(CountConstraint.equal(a, b));
        assertEquals(CountConstraint.hash(a), CountConstraint.hash(b));

        b.merge(Operator.LE, 8);
        assertFalse(CountConstraint.equal(a, b));
    }
}
