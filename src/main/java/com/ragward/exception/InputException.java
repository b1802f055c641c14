package com.ragward.exception;

public class InputException extends MediationException {

    private static final long serialVersionUID = 1L;

    public InputException(String message) {
        super(ErrorKind.INPUT, message);
    }
}
