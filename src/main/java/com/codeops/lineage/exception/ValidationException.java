package com.codeops.lineage.exception;

/**
 * Thrown when arguments fail business validation rules, such as a self-merge or a merge
 * between modules of unrelated lineages.
 */
public class ValidationException extends LineageException {

    /**
     * Creates a new ValidationException with the specified message.
     *
     * @param message the detail message
     */
    public ValidationException(String message) {
        super(message, ErrorKind.INVALID_ARGUMENT);
    }
}
