package com.genai.anomaly.model;

/**
 * Raw detector output, before it is stamped into an {@link AnomalyRecord}.
 */
public record AnomalyCandidate(AnomalyType anomalyType,
                               double deviationScore,
                               double confidence,
                               double observed,
                               double expected) {
}
