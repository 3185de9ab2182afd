package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A completed live detection run: the window, the algorithm version it was
 * bound to and the ids of the records it emitted. At most one per
 * (window, version).
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"time_window", "algorithm_version", "record_ids", "completed_at"})
public class DetectionRun {

    @JsonProperty("time_window")
    TimeWindow window;

    @JsonProperty("algorithm_version")
    String algorithmVersion;

    @JsonProperty("record_ids")
    List<String> recordIds;

    @JsonProperty("completed_at")
    Instant completedAt;

    private DetectionRun(TimeWindow window, String algorithmVersion, List<String> recordIds, Instant completedAt) {
        if (algorithmVersion == null || algorithmVersion.isBlank()) {
            throw new IllegalArgumentException("algorithm_version is required");
        }
        this.window = Objects.requireNonNull(window, "time_window");
        this.algorithmVersion = algorithmVersion;
        this.recordIds = List.copyOf(recordIds);
        this.completedAt = Objects.requireNonNull(completedAt, "completed_at");
    }

    /**
     * Identity of the run within a ledger.
     */
    public String key() {
        return keyOf(window, algorithmVersion);
    }

    public static String keyOf(TimeWindow window, String algorithmVersion) {
        return algorithmVersion + "|" + window.start() + "|" + window.end();
    }
}
