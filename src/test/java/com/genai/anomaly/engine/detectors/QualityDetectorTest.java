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

class QualityDetectorTest {

    private final QualityDetector detector = new QualityDetector();
    private final AlgorithmConfig config = TestDataFactory.algorithmConfig();
    // Wide spread, so the low tail can be breached without a large z-score
    private final Baseline baseline = baseline("quality_score", 0.80, 0.20,
            Map.of(5.0, 0.70, 50.0, 0.80, 95.0, 0.95, 99.0, 0.99));

    @Test
    void evaluate_belowLowPercentile_flaggedWithBoostedConfidence() {
        // z = (0.65 - 0.80) / 0.20 = -0.75, below the deviation threshold
        Optional<AnomalyCandidate> result = detector.evaluate(
                numericRecord("trace-1", "quality_score", 0.65, T0), baseline, config);

        assertThat(result).isPresent();
        AnomalyCandidate candidate = result.get();
        assertThat(candidate.anomalyType()).isEqualTo(AnomalyType.QUALITY);
        assertThat(candidate.deviationScore()).isCloseTo(0.75, within(1e-9));
        assertThat(candidate.confidence()).isCloseTo(0.6, within(1e-9));
        assertThat(candidate.expected()).isEqualTo(0.80);
    }

    @Test
    void evaluate_largeDeviation_flaggedOnZScore() {
        Baseline tight = baseline("quality_score", 0.80, 0.02,
                Map.of(5.0, 0.70, 50.0, 0.80, 95.0, 0.95, 99.0, 0.99));

        Optional<AnomalyCandidate> result = detector.evaluate(
                numericRecord("trace-1", "quality_score", 0.88, T0), tight, config);

        assertThat(result).isPresent();
        assertThat(result.get().deviationScore()).isCloseTo(4.0, within(1e-9));
        assertThat(result.get().confidence()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void evaluate_typicalQuality_notFlagged() {
        assertThat(detector.evaluate(numericRecord("trace-1", "quality_score", 0.82, T0), baseline, config)).isEmpty();
    }
}
