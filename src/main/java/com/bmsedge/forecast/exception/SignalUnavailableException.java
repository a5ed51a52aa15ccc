package com.bmsedge.forecast.exception;

/**
 * Raised by a weather or holiday feed that cannot answer. Callers fall back to a neutral signal.
 */
public class SignalUnavailableException extends RuntimeException {

    public SignalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
