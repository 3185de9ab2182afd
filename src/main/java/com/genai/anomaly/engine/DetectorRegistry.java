package com.genai.anomaly.engine;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.exception.DetectorException;
import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.Baseline;
import com.genai.anomaly.model.DetectionDiagnostic;
import com.genai.anomaly.model.InputRecord;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds exactly one detector per {@link AnomalyType} and runs them against
 * correlated records. Detectors run in enum order so output order is fixed.
 */
@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<AnomalyType, AnomalyDetector> detectors;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectorRegistry(List<AnomalyDetector> detectorBeans, Tracer tracer, MetricsConfig metricsConfig) {
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        Map<AnomalyType, AnomalyDetector> byType = new EnumMap<>(AnomalyType.class);
        for (AnomalyDetector detector : detectorBeans) {
            AnomalyDetector previous = byType.put(detector.getSupportedType(), detector);
            if (previous != null) {
                throw new IllegalStateException("Duplicate detector for " + detector.getSupportedType() + ": "
                        + previous.getClass().getSimpleName() + " and " + detector.getClass().getSimpleName());
            }
        }
        Set<AnomalyType> missing = EnumSet.complementOf(toEnumSet(byType.keySet()));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No detector registered for anomaly types " + missing);
        }
        this.detectors = Collections.unmodifiableMap(byType);
        detectors.forEach((type, detector) ->
                log.info("Registered detector: {} -> {}", type, detector.getClass().getSimpleName()));
    }

    /**
     * Result of running every applicable detector on one record.
     */
    public record Evaluation(List<AnomalyCandidate> candidates, List<DetectionDiagnostic> diagnostics) {
    }

    /**
     * True when at least one detector applies to the metric under this configuration.
     */
    public boolean isMonitored(String metricName, AlgorithmConfig config) {
        return detectors.values().stream().anyMatch(d -> d.appliesTo(metricName, config));
    }

    /**
     * True when some applicable detector for the metric can run without a baseline.
     */
    public boolean hasBaselineFreeDetector(String metricName, AlgorithmConfig config) {
        return detectors.values().stream()
                .anyMatch(d -> d.appliesTo(metricName, config) && !d.requiresBaseline());
    }

    /**
     * Run every detector that applies to the record's metric. A failing detector
     * is reported as a diagnostic; the others still run.
     *
     * @param baseline the metric baseline, or null when it could not be computed;
     *                 detectors that need one are then skipped
     */
    public Evaluation evaluate(InputRecord record, Baseline baseline, AlgorithmConfig config) {
        List<AnomalyCandidate> candidates = new ArrayList<>();
        List<DetectionDiagnostic> diagnostics = new ArrayList<>();

        for (AnomalyDetector detector : detectors.values()) {
            AnomalyType type = detector.getSupportedType();
            if (!detector.appliesTo(record.getMetricName(), config)) continue;
            if (baseline == null && detector.requiresBaseline()) continue;

            Span span = tracer.nextSpan()
                    .name("detector.evaluate." + type.getCode())
                    .tag("anomaly.type", type.getCode())
                    .tag("metric.name", record.getMetricName())
                    .tag("algorithm.version", config.getVersion())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                Optional<AnomalyCandidate> candidate = detector.evaluate(record, baseline, config);
                span.tag("detector.flagged", String.valueOf(candidate.isPresent()));
                candidate.ifPresent(c -> {
                    candidates.add(c);
                    log.debug("Detector {} flagged {}/{}: score={}, confidence={}",
                            type, record.getSourceId(), record.getMetricName(),
                            c.deviationScore(), c.confidence());
                });
            } catch (Exception e) {
                DetectorException failure = new DetectorException(type,
                        String.format("Detector %s failed on %s/%s: %s",
                                type.getCode(), record.getSourceId(), record.getMetricName(), e.getMessage()), e);
                span.error(failure);
                metricsConfig.recordDetectorFailure(type.getCode());
                log.error(failure.getMessage(), e);
                // One failing detector must not block the others
                diagnostics.add(DetectionDiagnostic.detectorFailure(type, record, failure.getMessage()));
            } finally {
                span.end();
            }
        }
        return new Evaluation(candidates, diagnostics);
    }

    public Map<AnomalyType, AnomalyDetector> getDetectors() {
        return detectors;
    }

    private static EnumSet<AnomalyType> toEnumSet(Collection<AnomalyType> types) {
        return types.isEmpty() ? EnumSet.noneOf(AnomalyType.class) : EnumSet.copyOf(types);
    }
}
