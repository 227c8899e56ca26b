package com.graphd.query.variable;

import com.graphd.query.constraint.Constraint;

/**
 * One variable name as seen by one constraint.
 *
 * <p>Variable patterns point at their declaration; two patterns in the
 * same constraint naming {@code $x} share one declaration. After analysis
 * a declaration also knows where in the constraint's local storage its
 * value lives, and how deeply its uses are nested in lists.</p>
 */
public final class VariableDeclaration {

    /** The name, including the leading {@code $}. */
    private final String name;

    /** The constraint whose table holds this declaration. */
    private final Constraint constraint;

    /** Number of patterns referencing this declaration. */
    private int linkCount;

    /** Local storage slot. */
    private int local;

    /** Deepest list nesting (0 to 2) of any use. */
    private int parentheses;

    /**
     * Creates a new VariableDeclaration. Use
     * {@link VariableDeclarations#addOrLookup} instead.
     *
     * @param constraint the owning constraint
     * @param name the name
     */
    VariableDeclaration(final Constraint constraint, final String name) {
        this.constraint = constraint;
        this.name = name;
    }

    /**
     * Get the name.
     *
     * @return the name
     */
    public String getName() {
        return name;
    }

    /**
     * Get the owning constraint.
     *
     * @return the constraint
     */
    public Constraint getConstraint() {
        return constraint;
    }

    /**
     * Get the link count.
     *
     * @return the number of referencing patterns, as last computed
     */
    public int getLinkCount() {
        return linkCount;
    }

    /**
     * Set the link count.
     *
     * @param linkCount the count
     */
    public void setLinkCount(final int linkCount) {
        this.linkCount = linkCount;
    }

    /**
     * Count one more reference.
     */
    public void incrementLinkCount() {
        linkCount++;
    }

    /**
     * Get the local storage slot.
     *
     * @return the slot index
     */
    public int getLocal() {
        return local;
    }

    /**
     * Set the local storage slot.
     *
     * @param local the slot index
     */
    public void setLocal(final int local) {
        this.local = local;
    }

    /**
     * Get the deepest list nesting of any use.
     *
     * @return 0, 1 or 2
     */
    public int getParentheses() {
        return parentheses;
    }

    /**
     * Set the deepest list nesting of any use.
     *
     * @param parentheses 0, 1 or 2
     */
    public void setParentheses(final int parentheses) {
        this.parentheses = parentheses;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parentheses; i++) {
            sb.append('(');
        }
        sb.append(name);
        for (int i = 0; i < parentheses; i++) {
            sb.append(')');
        }
        return sb.append(" [").append(local).append(']').toString();
    }
}
