package com.codeops.lineage.exception;

/**
 * Failure categories reported by the version-control operations.
 */
public enum ErrorKind {
    NOT_FOUND,
    DUPLICATE_SLUG,
    DUPLICATE_BRANCH,
    DUPLICATE_REQUEST,
    INVALID_ARGUMENT,
    INVALID_OPERATION,
    COMMENTS_DISABLED,
    CONFLICT_RESOLUTION_REQUIRED,
    WRITE_CONFLICT,
    UNKNOWN
}
