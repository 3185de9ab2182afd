package com.genai.anomaly.engine;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.exception.InputDataException;
import com.genai.anomaly.model.ActualRecord;
import com.genai.anomaly.model.DetectionDiagnostic;
import com.genai.anomaly.model.InputRecord;
import com.genai.anomaly.model.PredictedRecord;
import com.genai.anomaly.model.RawInputs;
import com.genai.anomaly.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs predicted and actual records by (source, metric, aligned window).
 *
 * Malformed, duplicated and unmatched records are skipped and reported as
 * diagnostics; they never stop the batch. The output does not depend on the
 * order the raw records arrived in.
 */
@Component
public class InputCorrelator {

    private static final Logger log = LoggerFactory.getLogger(InputCorrelator.class);

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<Double> DOUBLE_NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    public static final Comparator<InputRecord> RECORD_ORDER = Comparator
            .comparing(InputRecord::getTimestamp)
            .thenComparing(InputRecord::getSourceId)
            .thenComparing(InputRecord::getMetricName);

    public record CorrelationResult(List<InputRecord> records, List<DetectionDiagnostic> diagnostics) {
    }

    private record PairKey(String sourceId, String metricName, TimeWindow window) {
    }

    public CorrelationResult correlate(RawInputs inputs, AlgorithmConfig config) {
        List<DetectionDiagnostic> diagnostics = new ArrayList<>();

        Map<PairKey, PredictedRecord> predictedByKey = new LinkedHashMap<>();
        inputs.predicted().stream()
                .sorted(Comparator.comparing(PredictedRecord::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(PredictedRecord::getSourceId, NULLS_FIRST)
                        .thenComparing(PredictedRecord::getMetricName, NULLS_FIRST)
                        .thenComparing(PredictedRecord::getValue, DOUBLE_NULLS_FIRST)
                        .thenComparing(PredictedRecord::getOutcome, NULLS_FIRST))
                .forEach(p -> {
                    try {
                        validate(p.getSourceId(), p.getMetricName(), p.getValue(), p.getOutcome(), p.getTimestamp(), "predicted");
                        PairKey key = keyOf(p.getSourceId(), p.getMetricName(), p.getTimestamp(), config);
                        if (predictedByKey.putIfAbsent(key, p) != null) {
                            throw new InputDataException(p.getSourceId(), p.getMetricName(),
                                    "Duplicate predicted record in window " + key.window());
                        }
                    } catch (InputDataException e) {
                        diagnostics.add(skip(e));
                    }
                });

        Map<PairKey, ActualRecord> actualByKey = new LinkedHashMap<>();
        inputs.actual().stream()
                .sorted(Comparator.comparing(ActualRecord::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(ActualRecord::getSourceId, NULLS_FIRST)
                        .thenComparing(ActualRecord::getMetricName, NULLS_FIRST)
                        .thenComparing(ActualRecord::getValue, DOUBLE_NULLS_FIRST)
                        .thenComparing(ActualRecord::getOutcome, NULLS_FIRST))
                .forEach(a -> {
                    try {
                        validate(a.getSourceId(), a.getMetricName(), a.getValue(), a.getOutcome(), a.getTimestamp(), "actual");
                        PairKey key = keyOf(a.getSourceId(), a.getMetricName(), a.getTimestamp(), config);
                        if (actualByKey.putIfAbsent(key, a) != null) {
                            throw new InputDataException(a.getSourceId(), a.getMetricName(),
                                    "Duplicate actual record in window " + key.window());
                        }
                    } catch (InputDataException e) {
                        diagnostics.add(skip(e));
                    }
                });

        List<InputRecord> records = new ArrayList<>();
        for (Map.Entry<PairKey, ActualRecord> entry : actualByKey.entrySet()) {
            PairKey key = entry.getKey();
            ActualRecord actual = entry.getValue();
            PredictedRecord predicted = predictedByKey.remove(key);
            try {
                if (predicted == null) {
                    throw new InputDataException(key.sourceId(), key.metricName(),
                            "Actual record has no matching prediction in window " + key.window());
                }
                if ((predicted.getValue() == null) != (actual.getValue() == null)) {
                    throw new InputDataException(key.sourceId(), key.metricName(),
                            "Predicted and actual records disagree on numeric vs. categorical metric");
                }
                records.add(InputRecord.builder()
                        .sourceId(key.sourceId())
                        .metricName(key.metricName())
                        .predictedValue(predicted.getValue())
                        .actualValue(actual.getValue())
                        .predictedOutcome(predicted.getOutcome())
                        .actualOutcome(actual.getOutcome())
                        .timestamp(actual.getTimestamp())
                        .timeWindow(key.window())
                        .build());
            } catch (InputDataException e) {
                diagnostics.add(skip(e));
            }
        }
        predictedByKey.keySet().forEach(key -> diagnostics.add(skip(new InputDataException(
                key.sourceId(), key.metricName(), "Prediction has no matching actual record in window " + key.window()))));

        records.sort(RECORD_ORDER);
        return new CorrelationResult(List.copyOf(records), List.copyOf(diagnostics));
    }

    private static void validate(String sourceId, String metricName, Double value, String outcome,
                                 Instant timestamp, String stream) {
        if (sourceId == null || sourceId.isBlank() || metricName == null || metricName.isBlank()) {
            throw new InputDataException(sourceId, metricName, "Malformed " + stream + " record: missing source_id or metric_name");
        }
        if (timestamp == null) {
            throw new InputDataException(sourceId, metricName, "Malformed " + stream + " record: missing timestamp");
        }
        if ((value == null) == (outcome == null)) {
            throw new InputDataException(sourceId, metricName,
                    "Malformed " + stream + " record: exactly one of value or outcome is required");
        }
        if (value != null && !Double.isFinite(value)) {
            throw new InputDataException(sourceId, metricName, "Malformed " + stream + " record: non-finite value " + value);
        }
    }

    private static PairKey keyOf(String sourceId, String metricName, Instant timestamp, AlgorithmConfig config) {
        return new PairKey(sourceId, metricName, TimeWindow.alignedTo(timestamp, config.getCorrelationWindow()));
    }

    private static DetectionDiagnostic skip(InputDataException e) {
        log.warn("Skipping input record {}/{}: {}", e.getSourceId(), e.getMetricName(), e.getMessage());
        return DetectionDiagnostic.inputData(e.getSourceId(), e.getMetricName(), e.getMessage());
    }
}
