package com.ragward.exception;

import lombok.Getter;

/**
 * Failure reported by a provider call, with the HTTP status when one was received.
 */
@Getter
public abstract class ProviderException extends MediationException {

    private static final long serialVersionUID = 1L;

    private final String provider;
    private final Integer statusCode;

    protected ProviderException(ErrorKind kind, String provider, Integer statusCode, String message, Throwable cause) {
        super(kind, message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }
}
