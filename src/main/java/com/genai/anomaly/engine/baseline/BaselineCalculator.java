package com.genai.anomaly.engine.baseline;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.exception.InputDataException;
import com.genai.anomaly.exception.InsufficientBaselineDataException;
import com.genai.anomaly.model.Baseline;
import com.genai.anomaly.model.InputRecord;
import com.genai.anomaly.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Computes per-metric baselines from historical correlated records.
 *
 * Samples are ordered by (timestamp, source_id) before aggregation so the
 * floating-point result is the same for any input order. Mean and variance
 * use Welford's update; percentiles are exact, interpolating linearly
 * between the closest ranks.
 */
@Component
public class BaselineCalculator {

    private static final Logger log = LoggerFactory.getLogger(BaselineCalculator.class);

    private static final Comparator<InputRecord> SAMPLE_ORDER = Comparator
            .comparing(InputRecord::getTimestamp)
            .thenComparing(InputRecord::getSourceId);

    /**
     * @param metricName the metric all samples belong to
     * @param window     the historical window; samples outside it are ignored
     * @param samples    correlated records of the metric
     * @param config     supplies the minimum sample count and percentile set
     * @throws InsufficientBaselineDataException when fewer than {@code minSamples} samples fall in the window
     * @throws InputDataException                when a sample value is not finite
     */
    public Baseline compute(String metricName, TimeWindow window, List<InputRecord> samples, AlgorithmConfig config) {
        List<InputRecord> ordered = samples.stream()
                .filter(r -> metricName.equals(r.getMetricName()))
                .filter(r -> window.contains(r.getTimestamp()))
                .sorted(SAMPLE_ORDER)
                .toList();

        if (ordered.size() < config.getMinSamples()) {
            throw new InsufficientBaselineDataException(metricName, ordered.size(), config.getMinSamples());
        }

        double[] values = new double[ordered.size()];
        WelfordAccumulator accumulator = new WelfordAccumulator();
        for (int i = 0; i < values.length; i++) {
            InputRecord record = ordered.get(i);
            double value = record.sampleValue();
            if (!Double.isFinite(value)) {
                throw new InputDataException(record.getSourceId(), metricName,
                        "Non-finite baseline sample: " + value);
            }
            values[i] = value;
            accumulator.add(value);
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        Baseline.BaselineBuilder builder = Baseline.builder()
                .metricName(metricName)
                .window(window)
                .mean(accumulator.mean())
                .stdDev(accumulator.stdDev())
                .sampleCount(accumulator.count())
                .algorithmVersion(config.getVersion());
        for (double pct : config.getPercentiles()) {
            builder.percentile(pct, percentile(sorted, pct));
        }
        Baseline baseline = builder.build();

        log.debug("Baseline computed for {} over {}: n={}, mean={}, std={}",
                metricName, window, baseline.getSampleCount(), baseline.getMean(), baseline.getStdDev());
        return baseline;
    }

    /**
     * Exact percentile of an ascending array: linear interpolation at rank {@code p/100 * (n - 1)}.
     */
    static double percentile(double[] sorted, double pct) {
        if (sorted.length == 1) return sorted[0];
        double rank = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) return sorted[lower];
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
