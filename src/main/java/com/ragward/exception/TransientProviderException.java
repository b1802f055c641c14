package com.ragward.exception;

public class TransientProviderException extends ProviderException {

    private static final long serialVersionUID = 1L;

    public TransientProviderException(String provider, String message) {
        this(provider, null, message, null);
    }

    public TransientProviderException(String provider, Integer statusCode, String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_PROVIDER, provider, statusCode, message, cause);
    }
}
