package com.genai.anomaly.engine.detectors;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.engine.AnomalyDetector;
import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.Baseline;
import com.genai.anomaly.model.InputRecord;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects a policy outcome that differs from the predicted one.
 *
 * The signal is binary, so confidence is a fixed configured value rather
 * than a statistic. Observed is 1.0 (mismatch), expected 0.0.
 *
 * Example: predicted "approved", actual "denied" gives score 1.0 and confidence 0.9.
 */
@Component
public final class PolicyDetector implements AnomalyDetector {

    private static final double MISMATCH = 1.0;
    private static final double MATCH = 0.0;

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.POLICY;
    }

    @Override
    public boolean appliesTo(String metricName, AlgorithmConfig config) {
        return config.getPolicy().enabled() && config.getPolicy().metrics().contains(metricName);
    }

    @Override
    public boolean requiresBaseline() {
        return false;
    }

    @Override
    public Optional<AnomalyCandidate> evaluate(InputRecord record, Baseline baseline, AlgorithmConfig config) {
        if (!record.isOutcomeMismatch()) {
            return Optional.empty();
        }
        return Optional.of(new AnomalyCandidate(
                AnomalyType.POLICY,
                1.0,
                config.getPolicy().confidence(),
                MISMATCH,
                MATCH));
    }
}
