package com.genai.anomaly.engine;

import com.genai.anomaly.model.Baseline;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.genai.anomaly.testutil.TestDataFactory.baseline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeviationMathTest {

    @Test
    void zScore_normalBaseline_isDistanceInStdDevs() {
        Baseline b = baseline("cost_usd", 100.0, 20.0, Map.of());

        assertThat(DeviationMath.zScore(150.0, b, 1000.0)).isCloseTo(2.5, within(1e-12));
        assertThat(DeviationMath.zScore(60.0, b, 1000.0)).isCloseTo(-2.0, within(1e-12));
    }

    @Test
    void zScore_clampedToMaxScore() {
        Baseline b = baseline("cost_usd", 100.0, 0.001, Map.of());

        assertThat(DeviationMath.zScore(1_000_000.0, b, 1000.0)).isEqualTo(1000.0);
        assertThat(DeviationMath.zScore(-1_000_000.0, b, 1000.0)).isEqualTo(-1000.0);
    }

    @Test
    void zScore_zeroVariance_isZeroOnMeanAndMaxOtherwise() {
        Baseline b = baseline("cost_usd", 100.0, 0.0, Map.of());

        assertThat(DeviationMath.zScore(100.0, b, 1000.0)).isEqualTo(0.0);
        assertThat(DeviationMath.zScore(100.5, b, 1000.0)).isEqualTo(1000.0);
        assertThat(DeviationMath.zScore(99.5, b, 1000.0)).isEqualTo(-1000.0);
    }

    @Test
    void zConfidence_isHalfAtThresholdAndCappedAtOne() {
        assertThat(DeviationMath.zConfidence(2.0, 2.0)).isEqualTo(0.5);
        assertThat(DeviationMath.zConfidence(2.5, 2.0)).isEqualTo(0.625);
        assertThat(DeviationMath.zConfidence(10.0, 2.0)).isEqualTo(1.0);
    }

    @Test
    void boosted_liftsToHalfThenAddsBoost() {
        assertThat(DeviationMath.boosted(0.1, 0.15)).isCloseTo(0.65, within(1e-12));
        assertThat(DeviationMath.boosted(0.7, 0.15)).isCloseTo(0.85, within(1e-12));
        assertThat(DeviationMath.boosted(0.95, 0.15)).isEqualTo(1.0);
    }
}
