package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
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
@Schema(description = "Window to run live detection over")
public class AnalyzeRequest {

    @NotNull
    @Schema(description = "Inclusive window start (UTC)", example = "2025-02-18T10:00:00Z")
    private Instant start;

    @NotNull
    @Schema(description = "Exclusive window end (UTC)", example = "2025-02-18T11:00:00Z")
    private Instant end;

    @JsonIgnore
    public TimeWindow toWindow() {
        return TimeWindow.of(start, end);
    }
}
