package com.codeops.lineage.exception;

/**
 * Thrown when an operation is not allowed in the current state, such as deleting the
 * default branch or resolving a merge request that is no longer open.
 */
public class InvalidOperationException extends LineageException {

    /**
     * Creates a new InvalidOperationException with the specified message.
     *
     * @param message the detail message
     */
    public InvalidOperationException(String message) {
        super(message, ErrorKind.INVALID_OPERATION);
    }
}
