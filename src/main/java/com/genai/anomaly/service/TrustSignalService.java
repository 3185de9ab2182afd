package com.genai.anomaly.service;

import com.genai.anomaly.config.AlgorithmCatalog;
import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.TimeWindow;
import com.genai.anomaly.model.TrustLevel;
import com.genai.anomaly.model.TrustSignal;
import com.genai.anomaly.repository.AnomalyStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates stored anomalies into an advisory trust signal. Computed on
 * demand from the store, never persisted.
 *
 * Each record contributes {@code typeWeight * confidence * 2^(-age / halfLife)},
 * age measured back from the window end. The composite score is
 * {@code 1 - exp(-sum / saturation)}: 0 with no anomalies, approaching 1 as they accumulate.
 */
@Service
public class TrustSignalService {

    private static final Logger log = LoggerFactory.getLogger(TrustSignalService.class);

    private final AnomalyStore store;
    private final AlgorithmCatalog catalog;
    private final AnomalyProperties.Trust trust;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    public TrustSignalService(AnomalyStore store, AlgorithmCatalog catalog, AnomalyProperties properties,
                              Clock clock, MetricsConfig metricsConfig) {
        this.store = store;
        this.catalog = catalog;
        this.trust = properties.getTrust();
        this.clock = clock;
        this.metricsConfig = metricsConfig;
        validate(trust);
    }

    /**
     * @throws IllegalStateException if the parameters would make scores undefined
     */
    static void validate(AnomalyProperties.Trust trust) {
        Duration halfLife = trust.getHalfLife();
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalStateException("trust.half-life must be positive, got " + halfLife);
        }
        Duration defaultWindow = trust.getDefaultWindow();
        if (defaultWindow == null || defaultWindow.isZero() || defaultWindow.isNegative()) {
            throw new IllegalStateException("trust.default-window must be positive, got " + defaultWindow);
        }
        if (!(trust.getSaturation() > 0.0) || Double.isInfinite(trust.getSaturation())) {
            throw new IllegalStateException("trust.saturation must be positive and finite, got "
                    + trust.getSaturation());
        }
        double medium = trust.getMediumThreshold();
        double low = trust.getLowThreshold();
        if (!(medium >= 0.0 && medium <= low && low <= 1.0)) {
            throw new IllegalStateException("trust thresholds must satisfy 0 <= medium-threshold <= low-threshold <= 1, got "
                    + medium + " and " + low);
        }
        trust.getTypeWeights().forEach((type, weight) -> {
            if (weight == null || !(weight >= 0.0) || Double.isInfinite(weight)) {
                throw new IllegalStateException("trust.type-weights." + type.getCode()
                        + " must be non-negative and finite, got " + weight);
            }
        });
    }

    /**
     * Trust signal for the given bounds. Missing bounds default to a window of
     * the configured length ending now.
     */
    public TrustSignal current(Instant start, Instant end) {
        Instant now = clock.instant();
        TimeWindow window;
        if (start == null && end == null) {
            window = TimeWindow.ending(now, trust.getDefaultWindow());
        } else if (start == null) {
            window = TimeWindow.ending(end, trust.getDefaultWindow());
        } else {
            window = TimeWindow.of(start, end != null ? end : now);
        }
        return compute(window);
    }

    @Observed(name = "trust.compute", contextualName = "compute-trust-signal")
    public TrustSignal compute(TimeWindow window) {
        List<AnomalyRecord> records = store.query(AnomalyQuery.builder().timeRange(window).build());

        Map<AnomalyType, Long> counts = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) {
            counts.put(type, 0L);
        }

        double halfLifeMillis = trust.getHalfLife().toMillis();
        double weightSum = 0.0;
        for (AnomalyRecord record : records) {
            counts.merge(record.getAnomalyType(), 1L, Long::sum);
            double ageMillis = Math.max(0L, Duration.between(record.getTimestamp(), window.end()).toMillis());
            double decay = Math.pow(2.0, -ageMillis / halfLifeMillis);
            double typeWeight = trust.getTypeWeights().getOrDefault(record.getAnomalyType(), 1.0);
            weightSum += typeWeight * record.getConfidence() * decay;
        }

        double composite = 1.0 - Math.exp(-weightSum / trust.getSaturation());
        TrustLevel level = TrustLevel.fromScore(composite, trust.getMediumThreshold(), trust.getLowThreshold());
        metricsConfig.recordTrustScore(level.name(), composite);
        log.debug("Trust signal for {}: records={}, weight={}, composite={}, level={}",
                window, records.size(), weightSum, composite, level);

        return TrustSignal.builder()
                .window(window)
                .compositeScore(composite)
                .trustLevel(level)
                .contributingCounts(Collections.unmodifiableMap(counts))
                .algorithmVersion(catalog.active().getVersion())
                .computedAt(clock.instant())
                .build();
    }
}
