package com.genai.anomaly.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Frozen parameter set of one algorithm version. Everything a detection pass
 * reads comes from here, so binding a pass to a version fixes its output.
 */
@Value
@Builder
public class AlgorithmConfig {

    String version;
    long minSamples;
    List<Double> percentiles;
    Duration baselineLookback;
    Duration correlationWindow;
    double minConfidence;
    double maxDeviationScore;
    CostSettings cost;
    QualitySettings quality;
    LatencySettings latency;
    PolicySettings policy;

    public record CostSettings(boolean enabled, Set<String> metrics, double deviationThreshold) {
    }

    public record QualitySettings(boolean enabled, Set<String> metrics, double deviationThreshold,
                                  double lowPercentile, double percentileBoost) {
    }

    public record LatencySettings(boolean enabled, Set<String> metrics, double deviationThreshold,
                                  double highPercentile, double percentileMultiplier, double percentileBoost) {
    }

    public record PolicySettings(boolean enabled, Set<String> metrics, double confidence) {
    }

    /**
     * Snapshot the bound properties of one version, validating them.
     *
     * @throws IllegalStateException if the parameter set is unusable
     */
    public static AlgorithmConfig from(String version, AnomalyProperties.Algorithm props) {
        AnomalyProperties.Cost c = props.getCost();
        AnomalyProperties.Quality q = props.getQuality();
        AnomalyProperties.Latency l = props.getLatency();
        AnomalyProperties.Policy p = props.getPolicy();

        AlgorithmConfig config = AlgorithmConfig.builder()
                .version(version)
                .minSamples(props.getMinSamples())
                .percentiles(props.getPercentiles().stream().sorted().distinct().toList())
                .baselineLookback(props.getBaselineLookback())
                .correlationWindow(props.getCorrelationWindow())
                .minConfidence(props.getMinConfidence())
                .maxDeviationScore(props.getMaxDeviationScore())
                .cost(new CostSettings(c.isEnabled(), Set.copyOf(c.getMetrics()), c.getDeviationThreshold()))
                .quality(new QualitySettings(q.isEnabled(), Set.copyOf(q.getMetrics()), q.getDeviationThreshold(),
                        q.getLowPercentile(), q.getPercentileBoost()))
                .latency(new LatencySettings(l.isEnabled(), Set.copyOf(l.getMetrics()), l.getDeviationThreshold(),
                        l.getHighPercentile(), l.getPercentileMultiplier(), l.getPercentileBoost()))
                .policy(new PolicySettings(p.isEnabled(), Set.copyOf(p.getMetrics()), p.getConfidence()))
                .build();
        config.validate();
        return config;
    }

    private void validate() {
        if (version == null || version.isBlank()) {
            throw new IllegalStateException("Algorithm version must not be blank");
        }
        if (minSamples < 2) {
            throw new IllegalStateException(version + ": min-samples must be at least 2, got " + minSamples);
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalStateException(version + ": min-confidence must be within [0, 1], got " + minConfidence);
        }
        if (maxDeviationScore <= 0.0) {
            throw new IllegalStateException(version + ": max-deviation-score must be positive");
        }
        if (baselineLookback == null || baselineLookback.isZero() || baselineLookback.isNegative()) {
            throw new IllegalStateException(version + ": baseline-lookback must be positive");
        }
        if (correlationWindow == null || correlationWindow.isZero() || correlationWindow.isNegative()) {
            throw new IllegalStateException(version + ": correlation-window must be positive");
        }
        for (double pct : percentiles) {
            if (pct < 0.0 || pct > 100.0) {
                throw new IllegalStateException(version + ": percentile out of range: " + pct);
            }
        }
        if (quality.enabled() && !percentiles.contains(quality.lowPercentile())) {
            throw new IllegalStateException(version + ": quality low-percentile " + quality.lowPercentile()
                    + " is not in percentiles " + percentiles);
        }
        if (latency.enabled() && !percentiles.contains(latency.highPercentile())) {
            throw new IllegalStateException(version + ": latency high-percentile " + latency.highPercentile()
                    + " is not in percentiles " + percentiles);
        }
        if (policy.confidence() < 0.0 || policy.confidence() > 1.0) {
            throw new IllegalStateException(version + ": policy confidence must be within [0, 1]");
        }
    }
}
