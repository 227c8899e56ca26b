package com.graphd.query.variable;

import com.graphd.query.pattern.Pattern;

/**
 * {@code $var = pattern} inside one constraint.
 */
public final class Assignment {

    /** The variable assigned to. */
    private VariableDeclaration declaration;

    /** The right-hand side. */
    private Pattern result;

    /** List nesting at which the variable is used. */
    private int depth;

    /**
     * Creates a new Assignment.
     *
     * @param declaration the variable assigned to
     * @param result the right-hand side, or null until known
     */
    public Assignment(final VariableDeclaration declaration,
            final Pattern result) {
        this.declaration = declaration;
        this.result = result;
    }

    /**
     * Get the declaration assigned to.
     *
     * @return the declaration
     */
    public VariableDeclaration getDeclaration() {
        return declaration;
    }

    /**
     * Point the assignment at another declaration.
     *
     * @param declaration the declaration
     */
    public void setDeclaration(final VariableDeclaration declaration) {
        this.declaration = declaration;
    }

    /**
     * Get the right-hand side.
     *
     * @return the pattern
     */
    public Pattern getResult() {
        return result;
    }

    /**
     * Set the right-hand side.
     *
     * @param result the pattern
     */
    public void setResult(final Pattern result) {
        this.result = result;
    }

    /**
     * Get the nesting depth.
     *
     * @return 0, 1 or 2
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Set the nesting depth.
     *
     * @param depth 0, 1 or 2
     */
    public void setDepth(final int depth) {
        this.depth = depth;
    }

    @Override
    public String toString() {
        return declaration.getName() + "=" + Pattern.toString(result);
    }
}
