package com.codeops.lineage.exception;

/**
 * Thrown when a module, branch, commit, version, tag or merge request cannot be found.
 */
public class NotFoundException extends LineageException {

    /**
     * Creates a new NotFoundException with the specified message.
     *
     * @param message the detail message
     */
    public NotFoundException(String message) {
        super(message, ErrorKind.NOT_FOUND);
    }
}
