package com.graphd.query.comparator;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.StringConstraint;

import java.util.List;

/**
 * How values (and names, and types) compare and match.
 *
 * <p>A request picks a comparator with {@code comparator="..."} or
 * {@code value-comparator="..."}; sorts may pick one per element with
 * {@code sortcomparator=}. {@code null} always sorts after every other
 * value.</p>
 */
public interface ValueComparator {

    /**
     * Get the canonical name.
     *
     * @return the name, e.g. {@code "octet"}
     */
    String name();

    /**
     * Get additional names this comparator answers to.
     *
     * @return the aliases, possibly empty
     */
    default List<String> aliases() {
        return List.of();
    }

    /**
     * Reject string constraints this comparator can't evaluate.
     *
     * @param strcon a string constraint compared with this comparator
     * @throws SemanticException if the constraint is not supported
     */
    default void checkSyntax(final StringConstraint strcon)
            throws SemanticException {
        // Accept anything.
    }

    /**
     * Three-way comparison in this comparator's sort order.
     *
     * @param a null or a value
     * @param b null or a value
     * @return negative, zero or positive
     */
    int sortCompare(String a, String b);

    /**
     * Does this comparator implement {@code ~=}?
     *
     * @return true if {@link #glob} is supported
     */
    default boolean supportsGlob() {
        return false;
    }

    /**
     * Does a value match a {@code ~=} pattern?
     *
     * @param pattern the pattern
     * @param value the value
     * @return true on a match
     */
    default boolean glob(final String pattern, final String value) {
        throw new UnsupportedOperationException(
            "comparator " + name() + " does not support ~=");
    }

    /**
     * The smallest value in this comparator's order.
     *
     * @return the lowest string
     */
    default String lowestString() {
        return "";
    }

    /**
     * The largest value in this comparator's order.
     *
     * @return the highest string, or null if unbounded
     */
    default String highestString() {
        return null;
    }
}
