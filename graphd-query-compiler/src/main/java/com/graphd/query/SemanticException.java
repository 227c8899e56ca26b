package com.graphd.query;

/**
 * Exception thrown when a constraint tree cannot be compiled.
 *
 * <p>The message is rendered the way the graph server reports request
 * errors on the wire: a category keyword followed by the human readable
 * detail, for example
 * {@code SYNTAX variable $x is assigned to twice}.</p>
 *
 * <p>The first error raised anywhere in the pipeline aborts compilation;
 * no partial plan is returned.</p>
 */
public class SemanticException extends Exception {

    /**
     * Error category keyword prefixed to the message.
     */
    public enum Category {
        /** The request is well-formed but means nothing sensible. */
        SEMANTICS,
        /** The request is malformed. */
        SYNTAX,
        /** A collaborator (storage, allocation) failed. */
        SYSTEM
    }

    /** The error category. */
    private final Category category;

    /** The detail text, without the category keyword. */
    private final String detail;

    /**
     * Constructs a new SemanticException.
     *
     * @param category the error category
     * @param detail the detail message, without the category keyword
     */
    public SemanticException(final Category category, final String detail) {
        super(category.name() + " " + detail);
        this.category = category;
        this.detail = detail;
    }

    /**
     * Constructs a new SemanticException wrapping a lower-level cause.
     *
     * @param category the error category
     * @param detail the detail message, without the category keyword
     * @param cause the underlying failure
     */
    public SemanticException(final Category category, final String detail,
            final Throwable cause) {
        super(category.name() + " " + detail, cause);
        this.category = category;
        this.detail = detail;
    }

    /**
     * Shorthand for a {@link Category#SEMANTICS} error.
     *
     * @param format detail format string
     * @param args format arguments
     * @return the exception
     */
    public static SemanticException semantics(final String format,
            final Object... args) {
        return new SemanticException(Category.SEMANTICS,
            String.format(format, args));
    }

    /**
     * Shorthand for a {@link Category#SYNTAX} error.
     *
     * @param format detail format string
     * @param args format arguments
     * @return the exception
     */
    public static SemanticException syntax(final String format,
            final Object... args) {
        return new SemanticException(Category.SYNTAX,
            String.format(format, args));
    }

    /**
     * Get the error category.
     *
     * @return the category
     */
    public Category getCategory() {
        return category;
    }

    /**
     * Get the detail text without the category keyword.
     *
     * @return the detail text
     */
    public String getDetail() {
        return detail;
    }
}
