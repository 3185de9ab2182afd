package com.genai.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.SortedMap;

/**
 * Summary statistics for one metric over a historical window. A new window
 * produces a new Baseline; instances are never edited.
 */
@Value
@Builder
@Schema(description = "Historical baseline statistics for a metric")
public class Baseline {

    @Schema(description = "Metric name", example = "cost_usd")
    String metricName;

    @Schema(description = "Historical window the statistics were computed over")
    TimeWindow window;

    @Schema(description = "Arithmetic mean", example = "100.0")
    double mean;

    @Schema(description = "Population standard deviation", example = "20.0")
    double stdDev;

    @Singular
    @Schema(description = "Exact percentiles keyed by percentile (0-100)", example = "{\"5.0\": 71.2, \"99.0\": 160.4}")
    SortedMap<Double, Double> percentiles;

    @Schema(description = "Number of samples", example = "240")
    long sampleCount;

    @Schema(description = "Algorithm version that produced this baseline", example = "1.0.0")
    String algorithmVersion;

    public boolean hasPercentile(double percentile) {
        return percentiles.containsKey(percentile);
    }

    /**
     * @throws IllegalStateException if the percentile was not part of the configured set
     */
    public double percentile(double percentile) {
        Double value = percentiles.get(percentile);
        if (value == null) {
            throw new IllegalStateException(String.format(
                    "Percentile %.1f not computed for metric %s (available: %s)",
                    percentile, metricName, percentiles.keySet()));
        }
        return value;
    }

    public boolean isZeroVariance() {
        return stdDev == 0.0;
    }
}
