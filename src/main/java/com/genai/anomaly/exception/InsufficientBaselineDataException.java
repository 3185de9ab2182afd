package com.genai.anomaly.exception;

/**
 * Fewer baseline samples than the configured minimum; detectors for the metric are skipped.
 */
public class InsufficientBaselineDataException extends RuntimeException {

    private final String metricName;
    private final long sampleCount;
    private final long minimum;

    public InsufficientBaselineDataException(String metricName, long sampleCount, long minimum) {
        super(String.format("Insufficient baseline data for %s: %d samples, minimum %d",
                metricName, sampleCount, minimum));
        this.metricName = metricName;
        this.sampleCount = sampleCount;
        this.minimum = minimum;
    }

    public String getMetricName() {
        return metricName;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public long getMinimum() {
        return minimum;
    }
}
