package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

public record AnomalyListResponse(List<AnomalyRecord> anomalies,
                                  @Schema(description = "Records matching the filters, before the limit", example = "240")
                                  @JsonProperty("total_count") long totalCount,
                                  @Schema(description = "Records in this response", example = "100")
                                  @JsonProperty("returned_count") int returnedCount) {

    public static AnomalyListResponse of(List<AnomalyRecord> anomalies, long totalCount) {
        return new AnomalyListResponse(anomalies, totalCount, anomalies.size());
    }
}
