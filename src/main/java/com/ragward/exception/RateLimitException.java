package com.ragward.exception;

public class RateLimitException extends ProviderException {

    private static final long serialVersionUID = 1L;

    public RateLimitException(String provider, String message) {
        this(provider, message, null);
    }

    public RateLimitException(String provider, String message, Throwable cause) {
        super(ErrorKind.RATE_LIMIT, provider, 429, message, cause);
    }
}
