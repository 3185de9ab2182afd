package com.genai.anomaly.exception;

/**
 * A malformed, duplicated or unmatched predicted/actual record. The record is
 * skipped and reported; the rest of the batch continues.
 */
public class InputDataException extends RuntimeException {

    private final String sourceId;
    private final String metricName;

    public InputDataException(String sourceId, String metricName, String message) {
        super(message);
        this.sourceId = sourceId;
        this.metricName = metricName;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getMetricName() {
        return metricName;
    }
}
