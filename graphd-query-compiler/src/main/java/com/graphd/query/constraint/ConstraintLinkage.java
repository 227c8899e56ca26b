package com.graphd.query.constraint;

/**
 * How a constraint connects to its parent.
 *
 * <ul>
 *   <li>{@code my X}: this constraint's X linkage points to the parent,
 *       e.g. {@code (<-left ...)}</li>
 *   <li>{@code I am X}: the parent's X linkage points to this constraint,
 *       e.g. {@code (->left ...)}; there is at most one such child per
 *       parent primitive</li>
 * </ul>
 *
 * @param kind none, "my" or "I am"
 * @param linkage the linkage; null for {@link Kind#NONE}
 */
public record ConstraintLinkage(Kind kind, Linkage linkage) {

    /** No connection. */
    public static final ConstraintLinkage NONE =
        new ConstraintLinkage(Kind.NONE, null);

    /**
     * Direction of the connection.
     */
    public enum Kind {
        /** Not connected. */
        NONE,
        /** The constraint points to its parent. */
        MY,
        /** The parent points to the constraint. */
        I_AM
    }

    /**
     * Create a "my X" linkage.
     *
     * @param linkage the linkage
     * @return the constraint linkage
     */
    public static ConstraintLinkage my(final Linkage linkage) {
        return new ConstraintLinkage(Kind.MY, linkage);
    }

    /**
     * Create an "I am X" linkage.
     *
     * @param linkage the linkage
     * @return the constraint linkage
     */
    public static ConstraintLinkage iAm(final Linkage linkage) {
        return new ConstraintLinkage(Kind.I_AM, linkage);
    }

    /**
     * Is this a connection at all?
     *
     * @return false for {@link #NONE}
     */
    public boolean isSet() {
        return kind != Kind.NONE;
    }

    /**
     * Does the constraint point to its parent?
     *
     * @return true for "my X"
     */
    public boolean isMy() {
        return kind == Kind.MY;
    }

    /**
     * Does the parent point to the constraint?
     *
     * @return true for "I am X"
     */
    public boolean isIAm() {
        return kind == Kind.I_AM;
    }

    @Override
    public String toString() {
        switch (kind) {
            case MY:
                return "<-" + linkage.keyword();
            case I_AM:
                return "->" + linkage.keyword();
            default:
                return "";
        }
    }
}
