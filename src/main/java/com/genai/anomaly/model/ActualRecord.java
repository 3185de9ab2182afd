package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An observed outcome for one source and metric. Read-only input.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Observed value or outcome for a source/metric, as read from the actuals stream")
public class ActualRecord {

    @JsonProperty("source_id")
    @Schema(description = "Upstream source identifier", example = "trace-0001")
    String sourceId;

    @JsonProperty("metric_name")
    @Schema(description = "Metric name", example = "latency_ms")
    String metricName;

    @JsonProperty("value")
    @Schema(description = "Observed numeric value", example = "910.0")
    Double value;

    @JsonProperty("outcome")
    @Schema(description = "Observed categorical outcome", example = "denied")
    String outcome;

    @JsonProperty("timestamp")
    @Schema(description = "Observation time (UTC)", example = "2025-02-18T10:15:02Z")
    Instant timestamp;
}
