package com.ragward.exception;

/**
 * Base class for every failure that reaches a dispatch caller.
 */
public abstract class MediationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected MediationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MediationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
