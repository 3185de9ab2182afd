package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)}. Bounds baselines, queries and replay.
 */
@Schema(description = "Half-open time window, end exclusive (ISO-8601 UTC)")
public record TimeWindow(
        @Schema(description = "Inclusive start", example = "2025-02-18T00:00:00Z")
        @JsonProperty("start") Instant start,
        @Schema(description = "Exclusive end", example = "2025-02-19T00:00:00Z")
        @JsonProperty("end") Instant end) {

    @JsonCreator
    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                    "Time window start must be before end: " + start + " >= " + end);
        }
    }

    public static TimeWindow of(Instant start, Instant end) {
        return new TimeWindow(start, end);
    }

    /**
     * The window of the given size ending at {@code end}.
     */
    public static TimeWindow ending(Instant end, Duration size) {
        return new TimeWindow(end.minus(size), end);
    }

    /**
     * The epoch-aligned bucket of the given size that contains {@code instant}.
     */
    public static TimeWindow alignedTo(Instant instant, Duration size) {
        long sizeMillis = size.toMillis();
        if (sizeMillis <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + size);
        }
        long startMillis = Math.floorDiv(instant.toEpochMilli(), sizeMillis) * sizeMillis;
        return new TimeWindow(Instant.ofEpochMilli(startMillis), Instant.ofEpochMilli(startMillis + sizeMillis));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * The window of the given length that ends where this one starts.
     */
    public TimeWindow preceding(Duration length) {
        return new TimeWindow(start.minus(length), start);
    }

    /**
     * This window widened backwards to also cover {@code lookback}.
     */
    public TimeWindow withLookback(Duration lookback) {
        return new TimeWindow(start.minus(lookback), end);
    }

    @JsonIgnore
    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
