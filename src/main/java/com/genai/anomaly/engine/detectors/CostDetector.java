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
 * Detects cost observations far from the historical mean in either direction.
 *
 * Logic: flag when |z| >= threshold. Score is |z|, confidence rises from 0.5
 * at the threshold to 1.0 at twice the threshold.
 *
 * Example: mean 100, std 20, threshold 2.0. An observed cost of 150 gives
 * z = 2.5, so score 2.5 and confidence 2.5 / 4.0 = 0.625.
 */
@Component
public final class CostDetector implements AnomalyDetector {

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.COST;
    }

    @Override
    public boolean appliesTo(String metricName, AlgorithmConfig config) {
        return config.getCost().enabled() && config.getCost().metrics().contains(metricName);
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(InputRecord record, Baseline baseline, AlgorithmConfig config) {
        double threshold = config.getCost().deviationThreshold();
        double observed = record.getActualValue();
        double z = DeviationMath.zScore(observed, baseline, config.getMaxDeviationScore());
        double absZ = Math.abs(z);

        if (absZ < threshold) {
            return Optional.empty();
        }

        return Optional.of(new AnomalyCandidate(
                AnomalyType.COST,
                absZ,
                DeviationMath.zConfidence(absZ, threshold),
                observed,
                baseline.getMean()));
    }
}
