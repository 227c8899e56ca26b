package com.graphd.query.constraint;

/**
 * Comparison operator of a constraint clause.
 *
 * <p>The declaration order matters: {@link #LT}, {@link #LE}, {@link #EQ},
 * {@link #GE}, {@link #GT} are ordered so that "at most equal" and "at
 * least equal" can be tested with {@link #compareTo}.</p>
 */
public enum Operator {
    /** No operator. */
    UNSPECIFIED(""),
    /** Less than. */
    LT("<"),
    /** Less than or equal. */
    LE("<="),
    /** Equal. */
    EQ("="),
    /** Greater than or equal. */
    GE(">="),
    /** Greater than. */
    GT(">"),
    /** Not equal. */
    NE("!="),
    /** Fuzzy match. */
    MATCH("~=");

    /** The operator as written in a request. */
    private final String symbol;

    Operator(final String symbol) {
        this.symbol = symbol;
    }

    /**
     * Get the operator as written in a request.
     *
     * @return the symbol
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Does a three-way comparison result satisfy this operator?
     *
     * @param cmp result of comparing the value against the operand
     * @return true if the operator holds
     */
    public boolean holds(final int cmp) {
        switch (this) {
            case NE:
                return cmp != 0;
            case EQ:
                return cmp == 0;
            case LE:
                return cmp <= 0;
            case LT:
                return cmp < 0;
            case GE:
                return cmp >= 0;
            case GT:
                return cmp > 0;
            default:
                return false;
        }
    }
}
