package com.codeops.lineage.exception;

/**
 * Base exception for all CodeOps-Lineage service exceptions.
 * Carries the {@link ErrorKind} callers branch on; defaults to {@link ErrorKind#UNKNOWN}.
 */
public class LineageException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Creates a new LineageException of kind {@code UNKNOWN}.
     *
     * @param message the detail message
     */
    public LineageException(String message) {
        this(message, ErrorKind.UNKNOWN);
    }

    /**
     * Creates a new LineageException of kind {@code UNKNOWN} wrapping a root cause.
     *
     * @param message the detail message
     * @param cause   the root cause
     */
    public LineageException(String message, Throwable cause) {
        super(message, cause);
        this.kind = ErrorKind.UNKNOWN;
    }

    protected LineageException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
