package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Composite trust score over a window. Derived from stored records on demand; never persisted.
 */
@Value
@Builder
@Schema(description = "Advisory composite trust signal (0 = fully trusted, 1 = maximally anomalous)")
public class TrustSignal {

    TimeWindow window;

    @JsonProperty("composite_score")
    @Schema(example = "0.18")
    double compositeScore;

    @JsonProperty("trust_level")
    @Schema(example = "HIGH")
    TrustLevel trustLevel;

    @JsonProperty("contributing_counts")
    @Schema(description = "Anomaly count per type within the window",
            example = "{\"cost\": 1, \"quality\": 0, \"latency\": 2, \"policy\": 0}")
    Map<AnomalyType, Long> contributingCounts;

    @JsonProperty("algorithm_version")
    @Schema(example = "1.0.0")
    String algorithmVersion;

    @JsonProperty("computed_at")
    Instant computedAt;

    @JsonProperty("total_count")
    public long getTotalCount() {
        return contributingCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
