package com.graphd.query.guid;

/**
 * Exception thrown when the primitive store fails while answering a
 * lineage or estimate question.
 *
 * <p>"Not found" is not a failure; the {@link StorageOracle} reports it
 * as an empty result.</p>
 */
public class StorageException extends Exception {

    /**
     * Constructs a new StorageException.
     *
     * @param message the detail message
     */
    public StorageException(final String message) {
        super(message);
    }

    /**
     * Constructs a new StorageException with a cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
