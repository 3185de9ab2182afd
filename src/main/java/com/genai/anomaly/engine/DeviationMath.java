package com.genai.anomaly.engine;

import com.genai.anomaly.model.Baseline;

/**
 * Shared deviation formulas. Pure functions of their arguments; never NaN.
 */
public final class DeviationMath {

    private DeviationMath() {
    }

    /**
     * Signed z-score of {@code observed} against the baseline, clamped to
     * {@code ±maxScore}. A zero-variance baseline yields 0 for an observation
     * equal to the mean and {@code ±maxScore} for any other.
     */
    public static double zScore(double observed, Baseline baseline, double maxScore) {
        double diff = observed - baseline.getMean();
        if (baseline.isZeroVariance()) {
            if (diff == 0.0) return 0.0;
            return Math.copySign(maxScore, diff);
        }
        double z = diff / baseline.getStdDev();
        return Math.max(-maxScore, Math.min(maxScore, z));
    }

    /**
     * Confidence from z-score magnitude: 0.5 at the threshold, rising linearly to 1.0 at twice the threshold.
     */
    public static double zConfidence(double absZ, double threshold) {
        if (threshold <= 0.0) return 1.0;
        return Math.min(1.0, absZ / (2.0 * threshold));
    }

    /**
     * Confidence when a percentile trigger fired: at least 0.5, plus the boost, capped at 1.0.
     */
    public static double boosted(double zConfidence, double boost) {
        return Math.min(1.0, Math.max(zConfidence, 0.5) + boost);
    }
}
