package com.genai.anomaly.testutil;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.engine.DetectorRegistry;
import com.genai.anomaly.engine.InputCorrelator;
import com.genai.anomaly.engine.baseline.BaselineCalculator;
import com.genai.anomaly.engine.detectors.CostDetector;
import com.genai.anomaly.engine.detectors.LatencyDetector;
import com.genai.anomaly.engine.detectors.PolicyDetector;
import com.genai.anomaly.engine.detectors.QualityDetector;
import com.genai.anomaly.model.*;
import com.genai.anomaly.repository.InputSource;
import com.genai.anomaly.service.DetectionPipeline;
import com.genai.anomaly.service.DeviationScoringService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant T0 = Instant.parse("2025-02-18T10:00:00Z");
    public static final TimeWindow HOUR = TimeWindow.of(T0, T0.plus(Duration.ofHours(1)));

    private TestDataFactory() {}

    public static AlgorithmConfig algorithmConfig() {
        return AlgorithmConfig.from("1.0.0", new AnomalyProperties.Algorithm());
    }

    public static AlgorithmConfig algorithmConfig(String version, Consumer<AnomalyProperties.Algorithm> customizer) {
        AnomalyProperties.Algorithm props = new AnomalyProperties.Algorithm();
        customizer.accept(props);
        return AlgorithmConfig.from(version, props);
    }

    public static MetricsConfig metricsConfig() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    public static DetectorRegistry detectorRegistry(MetricsConfig metricsConfig) {
        return new DetectorRegistry(
                List.of(new CostDetector(), new QualityDetector(), new LatencyDetector(), new PolicyDetector()),
                Tracer.NOOP, metricsConfig);
    }

    public static DetectionPipeline detectionPipeline(InputSource inputSource, ExecutorService executor,
                                                      MetricsConfig metricsConfig) {
        return new DetectionPipeline(inputSource, new InputCorrelator(), new BaselineCalculator(),
                detectorRegistry(metricsConfig), new DeviationScoringService(), executor, metricsConfig);
    }

    public static InputRecord numericRecord(String sourceId, String metric, double actual, Instant timestamp) {
        return InputRecord.builder()
                .sourceId(sourceId)
                .metricName(metric)
                .predictedValue(actual)
                .actualValue(actual)
                .timestamp(timestamp)
                .timeWindow(TimeWindow.alignedTo(timestamp, Duration.ofHours(1)))
                .build();
    }

    public static InputRecord policyRecord(String sourceId, String predicted, String actual, Instant timestamp) {
        return InputRecord.builder()
                .sourceId(sourceId)
                .metricName("policy_outcome")
                .predictedOutcome(predicted)
                .actualOutcome(actual)
                .timestamp(timestamp)
                .timeWindow(TimeWindow.alignedTo(timestamp, Duration.ofHours(1)))
                .build();
    }

    public static Baseline baseline(String metric, double mean, double stdDev, Map<Double, Double> percentiles) {
        return Baseline.builder()
                .metricName(metric)
                .window(HOUR.preceding(Duration.ofDays(7)))
                .mean(mean)
                .stdDev(stdDev)
                .percentiles(percentiles)
                .sampleCount(100)
                .algorithmVersion("1.0.0")
                .build();
    }

    public static PredictedRecord predicted(String sourceId, String metric, Double value, Instant timestamp) {
        return PredictedRecord.builder().sourceId(sourceId).metricName(metric).value(value).timestamp(timestamp).build();
    }

    public static PredictedRecord predictedOutcome(String sourceId, String outcome, Instant timestamp) {
        return PredictedRecord.builder().sourceId(sourceId).metricName("policy_outcome").outcome(outcome).timestamp(timestamp).build();
    }

    public static ActualRecord actual(String sourceId, String metric, Double value, Instant timestamp) {
        return ActualRecord.builder().sourceId(sourceId).metricName(metric).value(value).timestamp(timestamp).build();
    }

    public static ActualRecord actualOutcome(String sourceId, String outcome, Instant timestamp) {
        return ActualRecord.builder().sourceId(sourceId).metricName("policy_outcome").outcome(outcome).timestamp(timestamp).build();
    }

    public static AnomalyRecord anomalyRecord(AnomalyType type, double confidence, Instant timestamp) {
        return anomalyRecord(UUID.randomUUID().toString(), type, confidence, timestamp);
    }

    public static AnomalyRecord anomalyRecord(String recordId, AnomalyType type, double confidence, Instant timestamp) {
        return AnomalyRecord.builder()
                .recordId(recordId)
                .anomalyType(type)
                .observedValue(150.0)
                .expectedValue(100.0)
                .deviationScore(2.5)
                .confidence(confidence)
                .algorithmVersion("1.0.0")
                .timeWindow(TimeWindow.alignedTo(timestamp, Duration.ofHours(1)))
                .timestamp(timestamp)
                .metricName("cost_usd")
                .sourceId("trace-" + recordId)
                .build();
    }

    /**
     * Seeds a cost history of 20 hourly samples alternating 80 and 120 (mean 100,
     * population std 20) in the week before {@link #T0}, plus the given current observations.
     */
    public static InMemoryInputSource costScenario(double... currentValues) {
        InMemoryInputSource source = new InMemoryInputSource();
        for (int i = 0; i < 20; i++) {
            Instant ts = T0.minus(Duration.ofHours(i + 1)).plusSeconds(60);
            double value = i % 2 == 0 ? 80.0 : 120.0;
            source.add(predicted("hist-" + i, "cost_usd", 100.0, ts), actual("hist-" + i, "cost_usd", value, ts));
        }
        for (int i = 0; i < currentValues.length; i++) {
            Instant ts = T0.plus(Duration.ofMinutes(5L * (i + 1)));
            source.add(predicted("trace-" + i, "cost_usd", 100.0, ts), actual("trace-" + i, "cost_usd", currentValues[i], ts));
        }
        return source;
    }
}
