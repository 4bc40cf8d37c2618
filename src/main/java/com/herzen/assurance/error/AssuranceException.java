package com.herzen.assurance.error;

public abstract class AssuranceException extends RuntimeException {
    protected AssuranceException(String message) {
        super(message);
    }

    protected AssuranceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}
