package com.genai.anomaly.engine.detectors;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.engine.AnomalyDetector;
import com.genai.anomaly.engine.DeviationMath;
import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.Baseline;
import com.genai.anomaly.model.InputRecord;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects latency spikes. Only the high side matters: a faster-than-usual
 * response is never an anomaly.
 *
 * Logic: flag when observed > P99 * multiplier, or when z >= threshold.
 * A P99 breach lifts the confidence to at least 0.5 and adds the P99 boost.
 */
@Component
public final class LatencyDetector implements AnomalyDetector {

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.LATENCY;
    }

    @Override
    public boolean appliesTo(String metricName, AlgorithmConfig config) {
        return config.getLatency().enabled() && config.getLatency().metrics().contains(metricName);
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(InputRecord record, Baseline baseline, AlgorithmConfig config) {
        AlgorithmConfig.LatencySettings settings = config.getLatency();
        double observed = record.getActualValue();
        double z = DeviationMath.zScore(observed, baseline, config.getMaxDeviationScore());

        double p99Threshold = baseline.percentile(settings.highPercentile()) * settings.percentileMultiplier();
        boolean p99Trigger = observed > p99Threshold;
        boolean spikeTrigger = z >= settings.deviationThreshold();

        if (!p99Trigger && !spikeTrigger) {
            return Optional.empty();
        }

        double absZ = Math.abs(z);
        double confidence = DeviationMath.zConfidence(absZ, settings.deviationThreshold());
        if (p99Trigger) {
            confidence = DeviationMath.boosted(confidence, settings.percentileBoost());
        }

        return Optional.of(new AnomalyCandidate(
                AnomalyType.LATENCY,
                absZ,
                confidence,
                observed,
                baseline.getMean()));
    }
}
