package com.codeops.lineage.exception;

/**
 * Thrown when a module slug is already taken.
 */
public class DuplicateSlugException extends LineageException {

    /**
     * Creates a new DuplicateSlugException with the specified message.
     *
     * @param message the detail message
     */
    public DuplicateSlugException(String message) {
        super(message, ErrorKind.DUPLICATE_SLUG);
    }
}
