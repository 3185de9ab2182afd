package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Schema(description = "Anomaly store statistics")
public class StoreStats {

    @Schema(description = "Total number of stored records", example = "42")
    long count;

    @JsonProperty("counts_by_type")
    Map<AnomalyType, Long> countsByType;

    @Schema(description = "Earliest record timestamp, null when empty")
    Instant earliest;

    @Schema(description = "Latest record timestamp, null when empty")
    Instant latest;

    @JsonProperty("storage_type")
    @Schema(example = "file", allowableValues = {"memory", "file", "aerospike"})
    String storageType;

    @Schema(description = "Whether records survive a process restart", example = "true")
    boolean persistent;
}
