package com.graphd.query.constraint;

import java.util.Objects;

/**
 * A {@code newest=} or {@code oldest=} range of generations.
 *
 * <p>Generation 0 is the newest (for {@code newest}) or the original
 * (for {@code oldest}) version of a lineage. While {@link #isValid()} is
 * false there is no constraint on the generation.</p>
 */
public final class GenerationalConstraint {

    /** Largest representable generation. */
    public static final long MAX = Long.MAX_VALUE;

    /** Lower bound, inclusive. */
    private long min;

    /** Upper bound, inclusive. */
    private long max;

    /** Is there a constraint at all? */
    private boolean valid;

    /** Was the constraint written in the request? */
    private boolean assigned;

    /**
     * Constrain to a range, marking the constraint valid.
     *
     * @param min lower bound
     * @param max upper bound
     */
    public void set(final long min, final long max) {
        this.min = min;
        this.max = max;
        this.valid = true;
    }

    /**
     * Copy another constraint's state into this one.
     *
     * @param other the constraint to copy
     */
    public void copyFrom(final GenerationalConstraint other) {
        this.min = other.min;
        this.max = other.max;
        this.valid = other.valid;
        this.assigned = other.assigned;
    }

    /**
     * Narrow the range by one parsed clause.
     *
     * @param op the clause operator
     * @param gen the clause value
     * @return false if the range became impossible to satisfy
     */
    public boolean merge(final Operator op, final long gen) {
        boolean possible = true;
        if (!valid) {
            set(0, MAX);
        }
        assigned = true;
        switch (op) {
            case LT:
                if (gen == 0) {
                    possible = false;
                } else {
                    max = gen - 1;
                }
                break;
            case LE:
                if (max > gen) {
                    max = gen;
                }
                break;
            case EQ:
                if (min < gen) {
                    min = gen;
                }
                if (max > gen) {
                    max = gen;
                }
                break;
            case GE:
                if (min < gen) {
                    min = gen;
                }
                break;
            case GT:
                if (gen >= MAX) {
                    possible = false;
                } else if (min <= gen) {
                    min = gen + 1;
                }
                break;
            case NE:
                if (min == gen) {
                    min++;
                }
                if (max == gen) {
                    max--;
                }
                break;
            default:
                throw new IllegalArgumentException(
                    "unexpected generation operator " + op);
        }
        return possible && max >= min;
    }

    /**
     * Get the lower bound.
     *
     * @return the lower bound
     */
    public long getMin() {
        return min;
    }

    /**
     * Get the upper bound.
     *
     * @return the upper bound
     */
    public long getMax() {
        return max;
    }

    /**
     * Is the constraint in effect?
     *
     * @return the validity flag
     */
    public boolean isValid() {
        return valid;
    }

    /**
     * Switch the constraint on or off without changing the bounds.
     *
     * @param valid the validity flag
     */
    public void setValid(final boolean valid) {
        this.valid = valid;
    }

    /**
     * Was the constraint written in the request?
     *
     * @return the assigned flag
     */
    public boolean isAssigned() {
        return assigned;
    }

    /**
     * Equality of the constraints' effect: invalid constraints are equal
     * regardless of their bounds.
     *
     * @param a a constraint
     * @param b another constraint
     * @return true if they constrain identically
     */
    public static boolean equal(final GenerationalConstraint a,
            final GenerationalConstraint b) {
        if (a.valid != b.valid) {
            return false;
        }
        return !a.valid || (a.min == b.min && a.max == b.max);
    }

    /**
     * Hash consistent with {@link #equal}.
     *
     * @param gencon the constraint
     * @return the hash
     */
    public static int hash(final GenerationalConstraint gencon) {
        return gencon.valid ? Objects.hash(gencon.min, gencon.max) : 0;
    }

    @Override
    public String toString() {
        if (!valid) {
            return "*";
        }
        return min == max ? Long.toString(min)
            : min + "-" + (max == MAX ? "" : Long.toString(max));
    }
}
