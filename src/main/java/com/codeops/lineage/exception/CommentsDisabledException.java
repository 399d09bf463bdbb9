package com.codeops.lineage.exception;

/**
 * Thrown when commenting on a merge request whose comments have been stopped.
 */
public class CommentsDisabledException extends LineageException {

    /**
     * Creates a new CommentsDisabledException with the specified message.
     *
     * @param message the detail message
     */
    public CommentsDisabledException(String message) {
        super(message, ErrorKind.COMMENTS_DISABLED);
    }
}
