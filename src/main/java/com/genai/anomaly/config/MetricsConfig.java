package com.genai.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong lastProcessedWindowEnd;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastProcessedWindowEnd = registry.gauge("live.last_window_end_epoch_ms", new AtomicLong(0));
    }

    public void recordDetectionRun(String mode, String algorithmVersion, int emitted, int filtered) {
        Counter.builder("detection.run.count")
                .tag("mode", mode)
                .tag("algorithm_version", algorithmVersion)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.run.emitted")
                .tag("mode", mode)
                .register(registry)
                .record(emitted);

        Counter.builder("detection.candidate.filtered.count")
                .tag("mode", mode)
                .register(registry)
                .increment(filtered);
    }

    public void recordAnomalyEmitted(String anomalyType, String mode) {
        Counter.builder("anomaly.emitted.count")
                .tag("anomaly_type", anomalyType)
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String anomalyType) {
        Counter.builder("detector.failure.count")
                .tag("anomaly_type", anomalyType)
                .register(registry)
                .increment();
    }

    public void recordDiagnostic(String kind) {
        Counter.builder("detection.diagnostic.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordStoreAppend(String backend, String status) {
        Counter.builder("store.append.count")
                .tag("backend", backend)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordReplayComparison(String status) {
        Counter.builder("replay.comparison.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTrustScore(String trustLevel, double compositeScore) {
        DistributionSummary.builder("trust.composite_score")
                .tag("trust_level", trustLevel)
                .register(registry)
                .record(compositeScore);
    }

    public void updateLastProcessedWindowEnd(long epochMillis) {
        lastProcessedWindowEnd.set(epochMillis);
    }
}
