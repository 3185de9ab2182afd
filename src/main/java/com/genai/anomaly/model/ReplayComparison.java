package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Comparison of a replay against live records of the same window and version")
public record ReplayComparison(
        @Schema(description = "MATCHED, DIVERGED or NOT_COMPARED", example = "MATCHED")
        ComparisonStatus status,
        @JsonProperty("live_count") int liveCount,
        @JsonProperty("replay_count") int replayCount,
        @Schema(description = "Live records with no identical replayed counterpart")
        @JsonProperty("missing_in_replay") int missingInReplay,
        @Schema(description = "Replayed records with no identical live counterpart")
        @JsonProperty("unexpected_in_replay") int unexpectedInReplay) {

    public static ReplayComparison notCompared(int replayCount) {
        return new ReplayComparison(ComparisonStatus.NOT_COMPARED, 0, replayCount, 0, 0);
    }
}
