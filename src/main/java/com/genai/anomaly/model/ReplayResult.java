package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Replay output. Always labelled {@link EmissionMode#REPLAY}; never merged into the live store.
 */
@Value
@Builder
@Schema(description = "Anomalies re-derived from historical inputs for a pinned algorithm version")
public class ReplayResult {

    TimeWindow window;

    @JsonProperty("algorithm_version")
    @Schema(example = "1.0.0")
    String algorithmVersion;

    @JsonProperty("emission_mode")
    @Builder.Default
    @Schema(example = "REPLAY")
    EmissionMode emissionMode = EmissionMode.REPLAY;

    @Singular
    @Schema(description = "Replayed records ordered by timestamp, source, metric and type")
    List<AnomalyRecord> records;

    @Singular
    List<DetectionDiagnostic> diagnostics;

    ReplayComparison comparison;

    @JsonProperty("count")
    public int getCount() {
        return records.size();
    }
}
