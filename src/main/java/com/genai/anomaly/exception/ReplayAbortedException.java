package com.genai.anomaly.exception;

/**
 * A replay was interrupted or ran past its deadline. Nothing was written.
 */
public class ReplayAbortedException extends RuntimeException {

    public ReplayAbortedException(String message) {
        super(message);
    }
}
