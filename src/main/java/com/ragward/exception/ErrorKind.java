package com.ragward.exception;

/**
 * Failure taxonomy surfaced to dispatch callers.
 */
public enum ErrorKind {
    /**
     * Empty or invalid request, rejected before any provider call.
     */
    INPUT(false),

    /**
     * Provider signalled throttling.
     */
    RATE_LIMIT(true),

    /**
     * Network or connection failure, or a 5xx from the provider.
     */
    TRANSIENT_PROVIDER(true),

    /**
     * Authentication, authorization or malformed-request failure.
     */
    PERMANENT_PROVIDER(false),

    /**
     * User-visible deadline elapsed before any attempt succeeded.
     */
    TIMEOUT(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
