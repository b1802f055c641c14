package com.ragward.exception;

public class PermanentProviderException extends ProviderException {

    private static final long serialVersionUID = 1L;

    public PermanentProviderException(String provider, String message) {
        this(provider, null, message, null);
    }

    public PermanentProviderException(String provider, Integer statusCode, String message, Throwable cause) {
        super(ErrorKind.PERMANENT_PROVIDER, provider, statusCode, message, cause);
    }
}
