package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Objects;

/**
 * An emitted anomaly. Created once by the scorer, never updated or deleted.
 * The JSON shape is the persisted compatibility contract.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"record_id", "anomaly_type", "observed_value", "expected_value", "deviation_score",
        "confidence", "algorithm_version", "time_window", "timestamp", "metric_name", "source_id"})
@Schema(description = "Immutable anomaly record")
public class AnomalyRecord {

    @JsonProperty("record_id")
    @Schema(description = "Unique record identifier (UUID)", example = "5f0c2b1e-8d4a-4c1f-9d0e-2a6f1e7b3c44")
    String recordId;

    @JsonProperty("anomaly_type")
    @Schema(description = "Anomaly type", example = "cost", allowableValues = {"cost", "quality", "latency", "policy"})
    AnomalyType anomalyType;

    @JsonProperty("observed_value")
    @Schema(description = "Observed (actual) value", example = "150.0")
    double observedValue;

    @JsonProperty("expected_value")
    @Schema(description = "Expected value the observation was compared against", example = "100.0")
    double expectedValue;

    @JsonProperty("deviation_score")
    @Schema(description = "Normalized deviation magnitude (|z| for statistical detectors)", example = "2.5")
    double deviationScore;

    @JsonProperty("confidence")
    @Schema(description = "Confidence in [0, 1]", example = "0.625")
    double confidence;

    @JsonProperty("algorithm_version")
    @Schema(description = "Algorithm version that produced the record", example = "1.0.0")
    String algorithmVersion;

    @JsonProperty("time_window")
    @Schema(description = "Evaluation window of the source observation")
    TimeWindow timeWindow;

    @JsonProperty("timestamp")
    @Schema(description = "Observation timestamp (UTC)", example = "2025-02-18T10:15:02Z")
    Instant timestamp;

    @JsonProperty("metric_name")
    @Schema(description = "Metric name", example = "cost_usd")
    String metricName;

    @JsonProperty("source_id")
    @Schema(description = "Source identifier of the observation", example = "trace-0001")
    String sourceId;

    private AnomalyRecord(String recordId, AnomalyType anomalyType, double observedValue, double expectedValue,
                          double deviationScore, double confidence, String algorithmVersion,
                          TimeWindow timeWindow, Instant timestamp, String metricName, String sourceId) {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("record_id is required");
        }
        if (algorithmVersion == null || algorithmVersion.isBlank()) {
            throw new IllegalArgumentException("algorithm_version is required");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        this.recordId = recordId;
        this.anomalyType = Objects.requireNonNull(anomalyType, "anomaly_type");
        this.observedValue = observedValue;
        this.expectedValue = expectedValue;
        this.deviationScore = deviationScore;
        this.confidence = confidence;
        this.algorithmVersion = algorithmVersion;
        this.timeWindow = Objects.requireNonNull(timeWindow, "time_window");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.metricName = Objects.requireNonNull(metricName, "metric_name");
        this.sourceId = Objects.requireNonNull(sourceId, "source_id");
    }

    /**
     * True when both records describe the same detection, ignoring {@code record_id}.
     */
    public boolean sameDetectionAs(AnomalyRecord other) {
        return anomalyType == other.anomalyType
                && Double.compare(observedValue, other.observedValue) == 0
                && Double.compare(expectedValue, other.expectedValue) == 0
                && Double.compare(deviationScore, other.deviationScore) == 0
                && Double.compare(confidence, other.confidence) == 0
                && algorithmVersion.equals(other.algorithmVersion)
                && timeWindow.equals(other.timeWindow)
                && timestamp.equals(other.timestamp)
                && metricName.equals(other.metricName)
                && sourceId.equals(other.sourceId);
    }
}
