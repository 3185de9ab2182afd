package com.genai.anomaly.engine.baseline;

/**
 * Single-pass running mean and variance. Not thread-safe; one instance per baseline computation.
 */
final class WelfordAccumulator {

    private long count;
    private double mean;
    private double m2;

    void add(double value) {
        count++;
        double oldMean = mean;
        double newMean = oldMean + (value - oldMean) / count;
        double delta = value - oldMean;
        double delta2 = value - newMean;
        mean = newMean;
        m2 += delta * delta2;
    }

    long count() {
        return count;
    }

    double mean() {
        return mean;
    }

    // Population variance (M2 / n)
    double variance() {
        if (count == 0) return 0.0;
        return Math.max(0.0, m2 / count);
    }

    double stdDev() {
        return Math.sqrt(variance());
    }
}
