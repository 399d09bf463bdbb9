package com.codeops.lineage.exception;

/**
 * Thrown when an open merge request already exists for the same (from, to) pair.
 */
public class DuplicateRequestException extends LineageException {

    /**
     * Creates a new DuplicateRequestException with the specified message.
     *
     * @param message the detail message
     */
    public DuplicateRequestException(String message) {
        super(message, ErrorKind.DUPLICATE_REQUEST);
    }
}
