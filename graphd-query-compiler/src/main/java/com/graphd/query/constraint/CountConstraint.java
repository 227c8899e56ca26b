package com.graphd.query.constraint;

/**
 * The {@code count=} bounds on how many primitives a subconstraint must
 * match for its parent to match.
 */
public final class CountConstraint {

    /** Lower bound, inclusive. */
    private long min;

    /** Upper bound, inclusive. */
    private long max;

    /** Is {@link #min} set? */
    private boolean minValid;

    /** Is {@link #max} set? */
    private boolean maxValid;

    /**
     * Narrow the bounds by one parsed clause.
     *
     * @param op the clause operator
     * @param val the clause value
     * @return false if the bounds became impossible to satisfy
     */
    public boolean merge(final Operator op, final long val) {
        boolean possible = true;

        // < <= = initialize the maximum; = >= > the minimum.
        if (op.compareTo(Operator.EQ) <= 0 && op != Operator.UNSPECIFIED
                && !maxValid) {
            maxValid = true;
            max = val;
        }
        if ((op.compareTo(Operator.EQ) >= 0 && op != Operator.MATCH)
                && !minValid) {
            minValid = true;
            min = 0;
        }

        switch (op) {
            case LT:
                if (val == 0) {
                    possible = false;
                } else if (max >= val) {
                    max = val - 1;
                }
                break;
            case LE:
                if (max > val) {
                    max = val;
                }
                break;
            case EQ:
                if (min < val) {
                    min = val;
                }
                if (max > val) {
                    max = val;
                }
                break;
            case NE:
                if (min == val) {
                    min++;
                }
                if (max == val) {
                    max--;
                }
                break;
            case GE:
                if (min < val) {
                    min = val;
                }
                break;
            case GT:
                if (val >= Long.MAX_VALUE) {
                    possible = false;
                } else if (min <= val) {
                    min = val + 1;
                }
                break;
            default:
                throw new IllegalArgumentException(
                    "unexpected count operator " + op);
        }

        if (!minValid && maxValid && max < 1) {
            minValid = true;
            min = 0;
        }
        return possible && !(maxValid && minValid && max < min);
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
     * Set the lower bound without marking it valid.
     *
     * @param min the lower bound
     */
    public void setMin(final long min) {
        this.min = min;
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
     * Is the lower bound set?
     *
     * @return the flag
     */
    public boolean isMinValid() {
        return minValid;
    }

    /**
     * Is the upper bound set?
     *
     * @return the flag
     */
    public boolean isMaxValid() {
        return maxValid;
    }

    /**
     * Equality of the set bounds.
     *
     * @param a a count constraint
     * @param b another count constraint
     * @return true if they constrain identically
     */
    public static boolean equal(final CountConstraint a,
            final CountConstraint b) {
        return a.minValid == b.minValid && a.maxValid == b.maxValid
            && (!a.minValid || a.min == b.min)
            && (!a.maxValid || a.max == b.max);
    }

    /**
     * Hash consistent with {@link #equal}.
     *
     * @param count the count constraint
     * @return the hash
     */
    public static int hash(final CountConstraint count) {
        int h = (count.minValid ? 2 : 0) | (count.maxValid ? 1 : 0);
        if (count.minValid) {
            h = 31 * h + Long.hashCode(count.min);
        }
        if (count.maxValid) {
            h = 31 * h + Long.hashCode(count.max);
        }
        return h;
    }
}
