package com.genai.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * A predicted record paired with its actual counterpart for one
 * (source, metric, window). Numeric metrics carry values, categorical
 * metrics carry outcomes.
 */
@Value
@Builder
@Schema(description = "Correlated predicted/actual pair")
public class InputRecord {

    String sourceId;
    String metricName;
    Double predictedValue;
    Double actualValue;
    String predictedOutcome;
    String actualOutcome;

    // Observation time of the actual record
    Instant timestamp;

    TimeWindow timeWindow;

    public boolean isCategorical() {
        return actualOutcome != null || predictedOutcome != null;
    }

    public boolean isOutcomeMismatch() {
        return isCategorical() && !Objects.equals(predictedOutcome, actualOutcome);
    }

    /**
     * The value this record contributes to a baseline: the actual value for
     * numeric metrics, the mismatch indicator (1.0 / 0.0) for categorical ones.
     */
    public double sampleValue() {
        if (isCategorical()) {
            return isOutcomeMismatch() ? 1.0 : 0.0;
        }
        return actualValue;
    }
}
