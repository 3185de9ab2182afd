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
 * Detects quality scores that deviate from the baseline or fall below its low tail.
 *
 * Logic: flag when |z| >= threshold, or when the observation is below the
 * configured low percentile (5th by default). A low-tail breach lifts the
 * confidence to at least 0.5 and adds the percentile boost.
 */
@Component
public final class QualityDetector implements AnomalyDetector {

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.QUALITY;
    }

    @Override
    public boolean appliesTo(String metricName, AlgorithmConfig config) {
        return config.getQuality().enabled() && config.getQuality().metrics().contains(metricName);
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(InputRecord record, Baseline baseline, AlgorithmConfig config) {
        AlgorithmConfig.QualitySettings settings = config.getQuality();
        double observed = record.getActualValue();
        double absZ = Math.abs(DeviationMath.zScore(observed, baseline, config.getMaxDeviationScore()));

        boolean deviationTrigger = absZ >= settings.deviationThreshold();
        boolean lowTailTrigger = observed < baseline.percentile(settings.lowPercentile());

        if (!deviationTrigger && !lowTailTrigger) {
            return Optional.empty();
        }

        double confidence = DeviationMath.zConfidence(absZ, settings.deviationThreshold());
        if (lowTailTrigger) {
            confidence = DeviationMath.boosted(confidence, settings.percentileBoost());
        }

        return Optional.of(new AnomalyCandidate(
                AnomalyType.QUALITY,
                absZ,
                confidence,
                observed,
                baseline.getMean()));
    }
}
