package com.bmsedge.forecast.exception;

/**
 * Canonical history has not been committed far enough to forecast the requested week.
 */
public class HistoryNotReadyException extends RuntimeException {

    public HistoryNotReadyException(String message) {
        super(message);
    }
}
