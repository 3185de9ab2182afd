package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Historical window and algorithm version to replay")
public class ReplayRequest {

    @NotNull
    @Schema(description = "Inclusive window start (UTC)", example = "2025-02-18T00:00:00Z")
    private Instant start;

    @NotNull
    @Schema(description = "Exclusive window end (UTC)", example = "2025-02-19T00:00:00Z")
    private Instant end;

    @JsonProperty("algorithm_version")
    @Schema(description = "Algorithm version to bind to; defaults to the active version", example = "1.0.0")
    private String algorithmVersion;

    @JsonIgnore
    public TimeWindow toWindow() {
        return TimeWindow.of(start, end);
    }
}
