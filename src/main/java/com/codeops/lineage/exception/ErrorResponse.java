package com.codeops.lineage.exception;

import jakarta.validation.ConstraintViolationException;
import org.springframework.dao.OptimisticLockingFailureException;

/**
 * Typed failure value handed to callers of the version-control operations.
 *
 * @param kind    the failure category
 * @param message the human-readable error message
 */
public record ErrorResponse(ErrorKind kind, String message) {

    /**
     * Classifies a failure that escaped an operation. Store failures that are not
     * {@link LineageException}s are reported as {@link ErrorKind#UNKNOWN} without leaking
     * their internal message.
     *
     * @param failure the thrown failure
     * @return the classified error
     */
    public static ErrorResponse from(Throwable failure) {
        if (failure instanceof LineageException le) {
            return new ErrorResponse(le.getKind(), le.getMessage());
        }
        if (failure instanceof OptimisticLockingFailureException) {
            return new ErrorResponse(ErrorKind.WRITE_CONFLICT, "Concurrent update detected, retry the operation");
        }
        if (failure instanceof ConstraintViolationException cve) {
            return new ErrorResponse(ErrorKind.INVALID_ARGUMENT, cve.getMessage());
        }
        return new ErrorResponse(ErrorKind.UNKNOWN, "An unexpected error occurred");
    }
}
