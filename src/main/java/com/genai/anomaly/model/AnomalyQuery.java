package com.genai.anomaly.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Store filter. All criteria are optional and combined with AND; types are OR-ed among themselves.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyQuery {

    public static final AnomalyQuery ALL = AnomalyQuery.builder().build();

    @Singular
    Set<AnomalyType> anomalyTypes;

    Double minConfidence;

    // Matches record timestamps, half-open
    TimeWindow timeRange;

    String sourceId;

    String metricName;

    String algorithmVersion;

    Integer limit;

    public boolean matches(AnomalyRecord record) {
        if (!anomalyTypes.isEmpty() && !anomalyTypes.contains(record.getAnomalyType())) {
            return false;
        }
        if (minConfidence != null && record.getConfidence() < minConfidence) {
            return false;
        }
        if (timeRange != null && !timeRange.contains(record.getTimestamp())) {
            return false;
        }
        if (sourceId != null && !sourceId.equals(record.getSourceId())) {
            return false;
        }
        if (metricName != null && !metricName.equals(record.getMetricName())) {
            return false;
        }
        return algorithmVersion == null || algorithmVersion.equals(record.getAlgorithmVersion());
    }
}
