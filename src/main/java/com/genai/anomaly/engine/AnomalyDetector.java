package com.genai.anomaly.engine;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.Baseline;
import com.genai.anomaly.model.InputRecord;

import java.util.Optional;

/**
 * Shared capability of the four detector variants. The set is closed: one
 * implementation per {@link AnomalyType}, checked by {@link DetectorRegistry}.
 */
public interface AnomalyDetector {

    /**
     * The anomaly type this detector emits.
     */
    AnomalyType getSupportedType();

    /**
     * Whether this detector is enabled for the metric under the given configuration.
     */
    boolean appliesTo(String metricName, AlgorithmConfig config);

    /**
     * Whether evaluation needs a baseline. Detectors that do not are still run
     * when the metric's baseline could not be computed, with a null baseline.
     */
    default boolean requiresBaseline() {
        return true;
    }

    /**
     * Evaluate one correlated record.
     *
     * @param record   the correlated predicted/actual pair
     * @param baseline the metric's baseline over the look-back window
     * @param config   the algorithm version the evaluation is bound to
     * @return a candidate when the record is anomalous, empty otherwise
     */
    Optional<AnomalyCandidate> evaluate(InputRecord record, Baseline baseline, AlgorithmConfig config);
}
