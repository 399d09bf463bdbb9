package com.codeops.lineage.exception;

/**
 * Thrown when a branch with the requested name already exists.
 */
public class DuplicateBranchException extends LineageException {

    /**
     * Creates a new DuplicateBranchException with the specified message.
     *
     * @param message the detail message
     */
    public DuplicateBranchException(String message) {
        super(message, ErrorKind.DUPLICATE_BRANCH);
    }
}
