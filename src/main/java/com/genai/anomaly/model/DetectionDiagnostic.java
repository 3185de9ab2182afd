package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * A recoverable problem surfaced by a detection run: skipped input, a metric
 * without enough baseline data, a failing detector or a replay divergence.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Per-record or per-metric diagnostic reported by a detection run")
public class DetectionDiagnostic {

    @Schema(description = "Diagnostic kind", example = "INSUFFICIENT_BASELINE")
    DiagnosticKind kind;

    @JsonProperty("source_id")
    @Schema(description = "Affected source, when the problem is record-level", example = "trace-0042")
    String sourceId;

    @JsonProperty("metric_name")
    @Schema(description = "Affected metric", example = "latency_ms")
    String metricName;

    @JsonProperty("anomaly_type")
    @Schema(description = "Affected detector, for detector failures", example = "latency")
    AnomalyType anomalyType;

    @Schema(description = "Human-readable explanation",
            example = "Insufficient baseline data for latency_ms: 4 samples, minimum 10")
    String message;

    public static DetectionDiagnostic inputData(String sourceId, String metricName, String message) {
        return DetectionDiagnostic.builder()
                .kind(DiagnosticKind.INPUT_DATA)
                .sourceId(sourceId)
                .metricName(metricName)
                .message(message)
                .build();
    }

    public static DetectionDiagnostic insufficientBaseline(String metricName, String message) {
        return DetectionDiagnostic.builder()
                .kind(DiagnosticKind.INSUFFICIENT_BASELINE)
                .metricName(metricName)
                .message(message)
                .build();
    }

    public static DetectionDiagnostic detectorFailure(AnomalyType type, InputRecord record, String message) {
        return DetectionDiagnostic.builder()
                .kind(DiagnosticKind.DETECTOR_FAILURE)
                .anomalyType(type)
                .sourceId(record.getSourceId())
                .metricName(record.getMetricName())
                .message(message)
                .build();
    }

    public static DetectionDiagnostic replayDivergence(String message) {
        return DetectionDiagnostic.builder()
                .kind(DiagnosticKind.REPLAY_DIVERGENCE)
                .message(message)
                .build();
    }
}
