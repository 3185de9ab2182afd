package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Schema(description = "Outcome of one pass of the detection pipeline over a window")
public class DetectionReport {

    @Schema(description = "Evaluated window")
    TimeWindow window;

    @JsonProperty("algorithm_version")
    @Schema(description = "Algorithm version the pass was bound to", example = "1.0.0")
    String algorithmVersion;

    @JsonProperty("emission_mode")
    @Schema(description = "LIVE for the production path, REPLAY for audit re-runs", example = "LIVE")
    EmissionMode emissionMode;

    @Singular
    @Schema(description = "Emitted anomaly records")
    List<AnomalyRecord> records;

    @JsonProperty("correlated_count")
    @Schema(description = "Number of correlated predicted/actual pairs evaluated", example = "1200")
    int correlatedCount;

    @JsonProperty("candidate_count")
    @Schema(description = "Number of detector candidates before the confidence filter", example = "14")
    int candidateCount;

    @JsonProperty("filtered_count")
    @Schema(description = "Candidates dropped below the minimum confidence", example = "3")
    int filteredCount;

    @JsonProperty("already_processed")
    @Schema(description = "True when the window was processed before; records are those of the earlier run",
            example = "false")
    boolean alreadyProcessed;

    @Singular
    @Schema(description = "Recoverable problems encountered during the pass")
    List<DetectionDiagnostic> diagnostics;
}
