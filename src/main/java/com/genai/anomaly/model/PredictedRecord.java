package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A prediction emitted upstream for one source and metric. Read-only input.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Predicted value or outcome for a source/metric, as read from the prediction stream")
public class PredictedRecord {

    @JsonProperty("source_id")
    @Schema(description = "Upstream source identifier (trace, request or entity id)", example = "trace-0001")
    String sourceId;

    @JsonProperty("metric_name")
    @Schema(description = "Metric name", example = "latency_ms")
    String metricName;

    @JsonProperty("value")
    @Schema(description = "Predicted numeric value (cost, quality, latency metrics)", example = "420.0")
    Double value;

    @JsonProperty("outcome")
    @Schema(description = "Predicted categorical outcome (policy metrics)", example = "approved")
    String outcome;

    @JsonProperty("timestamp")
    @Schema(description = "When the prediction applies (UTC)", example = "2025-02-18T10:15:00Z")
    Instant timestamp;
}
