package com.genai.anomaly.service;

import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.InputRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns detector candidates into immutable anomaly records, dropping those
 * below the configured confidence floor.
 */
@Service
public class DeviationScoringService {

    private static final Logger log = LoggerFactory.getLogger(DeviationScoringService.class);

    /**
     * @return the record, or empty when the candidate's confidence is below {@code minConfidence}
     */
    public Optional<AnomalyRecord> score(InputRecord source, AnomalyCandidate candidate,
                                         AlgorithmConfig config, RecordIdGenerator idGenerator) {
        double confidence = Math.max(0.0, Math.min(1.0, candidate.confidence()));
        if (confidence < config.getMinConfidence()) {
            log.debug("Dropping {} candidate for {}/{}: confidence {} below minimum {}",
                    candidate.anomalyType(), source.getSourceId(), source.getMetricName(),
                    confidence, config.getMinConfidence());
            return Optional.empty();
        }

        return Optional.of(AnomalyRecord.builder()
                .recordId(idGenerator.nextId(source, candidate, config.getVersion()))
                .anomalyType(candidate.anomalyType())
                .observedValue(candidate.observed())
                .expectedValue(candidate.expected())
                .deviationScore(candidate.deviationScore())
                .confidence(confidence)
                .algorithmVersion(config.getVersion())
                .timeWindow(source.getTimeWindow())
                .timestamp(source.getTimestamp())
                .metricName(source.getMetricName())
                .sourceId(source.getSourceId())
                .build());
    }
}
