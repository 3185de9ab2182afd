package com.genai.anomaly.exception;

import com.genai.anomaly.model.AnomalyType;

/**
 * Failure of a single detector variant on a single record.
 */
public class DetectorException extends RuntimeException {

    private final AnomalyType anomalyType;

    public DetectorException(AnomalyType anomalyType, String message, Throwable cause) {
        super(message, cause);
        this.anomalyType = anomalyType;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }
}
