package com.genai.anomaly.engine.detectors;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.Baseline;
import com.genai.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static com.genai.anomaly.testutil.TestDataFactory.T0;
import static com.genai.anomaly.testutil.TestDataFactory.baseline;
import static com.genai.anomaly.testutil.TestDataFactory.numericRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CostDetectorTest {

    private final CostDetector detector = new CostDetector();
    private final AlgorithmConfig config = TestDataFactory.algorithmConfig();
    private final Baseline baseline = baseline("cost_usd", 100.0, 20.0, Map.of());

    @Test
    void evaluate_observedTwoAndAHalfStdDevsAbove_flagsWithExpectedScore() {
        Optional<AnomalyCandidate> result = detector.evaluate(
                numericRecord("trace-1", "cost_usd", 150.0, T0), baseline, config);

        assertThat(result).isPresent();
        AnomalyCandidate candidate = result.get();
        assertThat(candidate.anomalyType()).isEqualTo(AnomalyType.COST);
        assertThat(candidate.deviationScore()).isCloseTo(2.5, within(1e-12));
        assertThat(candidate.confidence()).isCloseTo(0.625, within(1e-12));
        assertThat(candidate.observed()).isEqualTo(150.0);
        assertThat(candidate.expected()).isEqualTo(100.0);
    }

    @Test
    void evaluate_withinThreshold_notFlagged() {
        assertThat(detector.evaluate(numericRecord("trace-1", "cost_usd", 139.0, T0), baseline, config)).isEmpty();
    }

    @Test
    void evaluate_exactlyAtThreshold_flaggedWithHalfConfidence() {
        Optional<AnomalyCandidate> result = detector.evaluate(
                numericRecord("trace-1", "cost_usd", 140.0, T0), baseline, config);

        assertThat(result).isPresent();
        assertThat(result.get().confidence()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void evaluate_lowCost_flaggedOnMagnitude() {
        Optional<AnomalyCandidate> result = detector.evaluate(
                numericRecord("trace-1", "cost_usd", 40.0, T0), baseline, config);

        assertThat(result).isPresent();
        assertThat(result.get().deviationScore()).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void evaluate_zeroVarianceBaseline_flagsAnyDeviationWithFullConfidence() {
        Baseline flat = baseline("cost_usd", 100.0, 0.0, Map.of());

        Optional<AnomalyCandidate> result = detector.evaluate(
                numericRecord("trace-1", "cost_usd", 100.01, T0), flat, config);

        assertThat(result).isPresent();
        assertThat(result.get().deviationScore()).isEqualTo(config.getMaxDeviationScore());
        assertThat(result.get().confidence()).isEqualTo(1.0);
        assertThat(detector.evaluate(numericRecord("trace-2", "cost_usd", 100.0, T0), flat, config)).isEmpty();
    }

    @Test
    void appliesTo_onlyConfiguredMetrics() {
        assertThat(detector.appliesTo("cost_usd", config)).isTrue();
        assertThat(detector.appliesTo("latency_ms", config)).isFalse();

        AlgorithmConfig disabled = TestDataFactory.algorithmConfig("2.0.0", a -> a.getCost().setEnabled(false));
        assertThat(detector.appliesTo("cost_usd", disabled)).isFalse();
    }
}
