package com.graphd.query.constraint;

import com.graphd.query.comparator.Comparators;
import com.graphd.query.comparator.ValueComparator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One {@code name=}, {@code type=} or {@code value=} clause: an operator
 * and a disjunction of operands.
 *
 * <p>{@code value=("a" "b")} matches either string; an operand of
 * {@code null} matches primitives without a value, and so does an
 * operand list that is empty.</p>
 */
public final class StringConstraint {

    /** The operator. */
    private final Operator operator;

    /** Operands; null entries stand for the null value. */
    private final List<String> elements = new ArrayList<>();

    /**
     * Create a string constraint.
     *
     * @param operator the operator
     * @param elements the operands, null entries allowed
     */
    public StringConstraint(final Operator operator,
            final String... elements) {
        this.operator = Objects.requireNonNull(operator, "operator");
        Collections.addAll(this.elements, elements);
    }

    /**
     * Get the operator.
     *
     * @return the operator
     */
    public Operator getOperator() {
        return operator;
    }

    /**
     * Get the operands.
     *
     * @return an unmodifiable view of the operands
     */
    public List<String> getElements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * Add an operand.
     *
     * @param element the operand, or null
     */
    public void addElement(final String element) {
        elements.add(element);
    }

    /**
     * Keep only a single operand.
     *
     * @param element the operand to keep
     */
    public void truncateTo(final String element) {
        elements.clear();
        elements.add(element);
    }

    /**
     * Find the lowest or highest operand.
     *
     * @param comparator null or the value comparator
     * @param which negative for the lowest, positive for the highest
     * @return the operand, or null if there are none (or it is null)
     */
    public String pick(final ValueComparator comparator, final int which) {
        ValueComparator cmp = comparator == null
            ? Comparators.UNSPECIFIED : comparator;
        String best = null;
        boolean haveBest = false;
        for (String el : elements) {
            if (!haveBest || (cmp.sortCompare(el, best) < 0) == (which < 0)) {
                best = el;
                haveBest = true;
            }
        }
        return best;
    }

    /**
     * Does the value compare equal to one of the operands?
     *
     * @param cmp the comparator
     * @param s null or a value
     * @return true if it is a member
     */
    public boolean member(final ValueComparator cmp, final String s) {
        if (elements.isEmpty()) {
            return cmp.sortCompare(null, s) == 0;
        }
        for (String el : elements) {
            if (cmp.sortCompare(el, s) == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Does a value satisfy this clause?
     *
     * @param s null or the value
     * @param cmp the comparator to compare with
     * @return true if it matches
     */
    public boolean valueMatch(final String s, final ValueComparator cmp) {
        if (elements.isEmpty()) {
            if (operator == Operator.MATCH) {
                return s == null;
            }
            return operator.holds(cmp.sortCompare(s, null));
        }
        if (operator == Operator.NE) {
            for (String el : elements) {
                if (cmp.sortCompare(s, el) == 0) {
                    return false;
                }
            }
            return true;
        }
        for (String el : elements) {
            if (operator == Operator.MATCH) {
                if (el == null) {
                    if (s == null) {
                        return true;
                    }
                    continue;
                }
                if (s != null && cmp.supportsGlob() && cmp.glob(el, s)) {
                    return true;
                }
            } else if (operator.holds(cmp.sortCompare(s, el))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Find the first {@code =} operand that disagrees with a value.
     *
     * @param queue a list of {@code =} constraints
     * @param s null or the value
     * @return the conflicting operand ({@code "null"} for a null
     *     operand), or null if there is no conflict
     */
    public static String contradiction(final List<StringConstraint> queue,
            final String s) {
        for (StringConstraint sc : queue) {
            if (sc.operator != Operator.EQ) {
                throw new IllegalArgumentException(
                    "contradiction check on " + sc.operator.symbol());
            }
            if (sc.elements.isEmpty() && s != null) {
                return "null";
            }
            for (String el : sc.elements) {
                if (s == null && el == null) {
                    continue;
                }
                if (el == null) {
                    return "null";
                }
                if (!el.equals(s)) {
                    return el;
                }
            }
        }
        return null;
    }

    /**
     * Exact (case-sensitive) equality of two clause lists.
     *
     * @param a a list of clauses
     * @param b another list of clauses
     * @return true if they are identical
     */
    public static boolean queueEqual(final List<StringConstraint> a,
            final List<StringConstraint> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            StringConstraint x = a.get(i);
            StringConstraint y = b.get(i);
            if (x.operator != y.operator || !x.elements.equals(y.elements)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Hash consistent with {@link #queueEqual}.
     *
     * @param queue a list of clauses
     * @return the hash
     */
    public static int queueHash(final List<StringConstraint> queue) {
        int h = 0;
        for (StringConstraint sc : queue) {
            h = 31 * h + sc.operator.ordinal();
            for (String el : sc.elements) {
                if (el != null) {
                    h = 31 * h + el.hashCode();
                }
            }
        }
        return h;
    }

    @Override
    public String toString() {
        String op = operator == Operator.UNSPECIFIED
            ? "unspecified" : operator.symbol();
        if (elements.isEmpty()) {
            return op + "null";
        }
        if (elements.size() == 1) {
            String el = elements.get(0);
            return el == null ? op + "(null)" : op + "\"" + el + "\"";
        }
        StringBuilder sb = new StringBuilder(op).append('(');
        String sep = "";
        for (String el : elements) {
            sb.append(sep).append(el == null ? "null" : "\"" + el + "\"");
            sep = " ";
        }
        return sb.append(')').toString();
    }
}
