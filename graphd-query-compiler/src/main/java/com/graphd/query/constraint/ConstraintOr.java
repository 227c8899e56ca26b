package com.graphd.query.constraint;

/**
 * An alternation inside a constraint: {@code (a || b)} or {@code (a | b)}.
 *
 * <p>The constraint that contains the alternation is the prototype. Each
 * side is a branch constraint that inherits everything the prototype
 * says and adds its own filters. Subconstraints written inside a branch
 * are appended to the prototype's subconstraint list as well; the branch
 * stays their parent.</p>
 */
public final class ConstraintOr {

    /** The constraint containing the alternation. */
    private Constraint prototype;

    /** The left side. */
    private final Constraint head;

    /** The right side, or null for a single optional branch. */
    private final Constraint tail;

    /** {@code ||}: the right side is evaluated only if the left fails. */
    private final boolean shortCircuit;

    /**
     * Creates a new ConstraintOr.
     *
     * @param head the left side
     * @param tail the right side, or null
     * @param shortCircuit true for {@code ||}, false for {@code |}
     */
    public ConstraintOr(final Constraint head, final Constraint tail,
            final boolean shortCircuit) {
        this.head = head;
        this.tail = tail;
        this.shortCircuit = shortCircuit;
    }

    /**
     * Get the prototype.
     *
     * @return the constraint containing the alternation
     */
    public Constraint getPrototype() {
        return prototype;
    }

    /**
     * Set the prototype.
     *
     * @param prototype the constraint containing the alternation
     */
    public void setPrototype(final Constraint prototype) {
        this.prototype = prototype;
    }

    /**
     * Get the left side.
     *
     * @return the head branch
     */
    public Constraint getHead() {
        return head;
    }

    /**
     * Get the right side.
     *
     * @return the tail branch, or null
     */
    public Constraint getTail() {
        return tail;
    }

    /**
     * Is this a short-circuit alternation?
     *
     * @return true for {@code ||}
     */
    public boolean isShortCircuit() {
        return shortCircuit;
    }
}
