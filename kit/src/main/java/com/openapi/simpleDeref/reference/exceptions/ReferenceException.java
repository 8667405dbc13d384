package com.openapi.simpleDeref.reference.exceptions;

public class ReferenceException extends Exception {
    public ReferenceException(String message) {
        super(message);
    }

    public ReferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReferenceException(Throwable cause) {
        super(cause);
    }
}
