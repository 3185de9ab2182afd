package com.genai.anomaly.exception;

/**
 * Anomaly store unavailable or unreadable. Fatal to the operation in progress.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
