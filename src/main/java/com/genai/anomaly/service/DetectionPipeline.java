package com.genai.anomaly.service;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.engine.DetectorRegistry;
import com.genai.anomaly.engine.InputCorrelator;
import com.genai.anomaly.engine.baseline.BaselineCalculator;
import com.genai.anomaly.exception.InputDataException;
import com.genai.anomaly.exception.InsufficientBaselineDataException;
import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.Baseline;
import com.genai.anomaly.model.DetectionDiagnostic;
import com.genai.anomaly.model.DetectionReport;
import com.genai.anomaly.model.EmissionMode;
import com.genai.anomaly.model.InputRecord;
import com.genai.anomaly.model.RawInputs;
import com.genai.anomaly.model.TimeWindow;
import com.genai.anomaly.repository.InputSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Correlate, baseline, detect and score one window under one algorithm
 * version. Shared by live detection and replay; never writes anywhere.
 *
 * Metric groups are evaluated in parallel and merged in metric-name order,
 * so the report is the same however the work is scheduled.
 */
@Component
public class DetectionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private final InputSource inputSource;
    private final InputCorrelator correlator;
    private final BaselineCalculator baselineCalculator;
    private final DetectorRegistry detectorRegistry;
    private final DeviationScoringService scoringService;
    private final ExecutorService detectionExecutor;
    private final MetricsConfig metricsConfig;

    public DetectionPipeline(InputSource inputSource,
                             InputCorrelator correlator,
                             BaselineCalculator baselineCalculator,
                             DetectorRegistry detectorRegistry,
                             DeviationScoringService scoringService,
                             @Qualifier("detectionExecutor") ExecutorService detectionExecutor,
                             MetricsConfig metricsConfig) {
        this.inputSource = inputSource;
        this.correlator = correlator;
        this.baselineCalculator = baselineCalculator;
        this.detectorRegistry = detectorRegistry;
        this.scoringService = scoringService;
        this.detectionExecutor = detectionExecutor;
        this.metricsConfig = metricsConfig;
    }

    private record MetricOutcome(List<AnomalyRecord> records, int candidateCount, int filteredCount,
                                 List<DetectionDiagnostic> diagnostics) {
    }

    public DetectionReport run(TimeWindow window, AlgorithmConfig config, EmissionMode mode,
                               RecordIdGenerator idGenerator, DetectionCheckpoint checkpoint) {
        TimeWindow lookback = window.preceding(config.getBaselineLookback());
        TimeWindow fetchWindow = window.withLookback(config.getBaselineLookback());

        RawInputs raw = new RawInputs(inputSource.fetchPredicted(fetchWindow), inputSource.fetchActual(fetchWindow));
        checkpoint.check();
        InputCorrelator.CorrelationResult correlation = correlator.correlate(raw, config);

        // Group by metric, in name order; history feeds baselines, the window is evaluated
        Map<String, List<InputRecord>> historyByMetric = new TreeMap<>();
        Map<String, List<InputRecord>> currentByMetric = new TreeMap<>();
        int correlatedInWindow = 0;
        for (InputRecord record : correlation.records()) {
            if (!detectorRegistry.isMonitored(record.getMetricName(), config)) continue;
            if (window.contains(record.getTimestamp())) {
                currentByMetric.computeIfAbsent(record.getMetricName(), k -> new ArrayList<>()).add(record);
                correlatedInWindow++;
            } else if (lookback.contains(record.getTimestamp())) {
                historyByMetric.computeIfAbsent(record.getMetricName(), k -> new ArrayList<>()).add(record);
            }
        }

        Map<String, Future<MetricOutcome>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, List<InputRecord>> entry : currentByMetric.entrySet()) {
            String metric = entry.getKey();
            List<InputRecord> history = historyByMetric.getOrDefault(metric, List.of());
            List<InputRecord> current = entry.getValue();
            futures.put(metric, detectionExecutor.submit(() ->
                    evaluateMetric(metric, lookback, history, current, config, idGenerator, checkpoint)));
        }

        DetectionReport.DetectionReportBuilder report = DetectionReport.builder()
                .window(window)
                .algorithmVersion(config.getVersion())
                .emissionMode(mode)
                .correlatedCount(correlatedInWindow)
                .diagnostics(correlation.diagnostics());

        int candidates = 0;
        int filtered = 0;
        try {
            for (Map.Entry<String, Future<MetricOutcome>> entry : futures.entrySet()) {
                MetricOutcome outcome = await(entry.getValue(), checkpoint, futures);
                report.records(outcome.records()).diagnostics(outcome.diagnostics());
                candidates += outcome.candidateCount();
                filtered += outcome.filteredCount();
            }
        } finally {
            futures.values().forEach(f -> f.cancel(true));
        }

        DetectionReport result = report.candidateCount(candidates).filteredCount(filtered).build();
        result.getDiagnostics().forEach(d -> metricsConfig.recordDiagnostic(d.getKind().name()));
        metricsConfig.recordDetectionRun(mode.name(), config.getVersion(), result.getRecords().size(), filtered);
        log.info("Detection pass {} {} v{}: correlated={}, candidates={}, emitted={}, filtered={}, diagnostics={}",
                mode, window, config.getVersion(), correlatedInWindow, candidates,
                result.getRecords().size(), filtered, result.getDiagnostics().size());
        return result;
    }

    private MetricOutcome evaluateMetric(String metric, TimeWindow lookback, List<InputRecord> history,
                                         List<InputRecord> current, AlgorithmConfig config,
                                         RecordIdGenerator idGenerator, DetectionCheckpoint checkpoint) {
        List<DetectionDiagnostic> diagnostics = new ArrayList<>();
        Baseline baseline = null;
        try {
            baseline = baselineCalculator.compute(metric, lookback, history, config);
        } catch (InsufficientBaselineDataException e) {
            log.warn("Skipping baseline detectors for {}: {}", metric, e.getMessage());
            diagnostics.add(DetectionDiagnostic.insufficientBaseline(metric, e.getMessage()));
        } catch (InputDataException e) {
            log.warn("Skipping baseline detectors for {}: {}", metric, e.getMessage());
            diagnostics.add(DetectionDiagnostic.inputData(e.getSourceId(), metric, e.getMessage()));
        }
        if (baseline == null && !detectorRegistry.hasBaselineFreeDetector(metric, config)) {
            return new MetricOutcome(List.of(), 0, 0, diagnostics);
        }

        List<AnomalyRecord> records = new ArrayList<>();
        int candidateCount = 0;
        int filteredCount = 0;
        for (InputRecord record : current) {
            checkpoint.check();
            DetectorRegistry.Evaluation evaluation = detectorRegistry.evaluate(record, baseline, config);
            diagnostics.addAll(evaluation.diagnostics());
            for (AnomalyCandidate candidate : evaluation.candidates()) {
                candidateCount++;
                Optional<AnomalyRecord> scored = scoringService.score(record, candidate, config, idGenerator);
                if (scored.isPresent()) {
                    records.add(scored.get());
                } else {
                    filteredCount++;
                }
            }
        }
        return new MetricOutcome(records, candidateCount, filteredCount, diagnostics);
    }

    private MetricOutcome await(Future<MetricOutcome> future, DetectionCheckpoint checkpoint,
                                Map<String, Future<MetricOutcome>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            all.values().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            checkpoint.check();
            throw new IllegalStateException("Detection pass interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Detection pass failed: " + cause.getMessage(), cause);
        }
    }
}
