package com.bmsedge.forecast.exception;

public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
