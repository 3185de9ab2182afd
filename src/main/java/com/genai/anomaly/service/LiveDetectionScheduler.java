package com.genai.anomaly.service;

import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.model.DetectionReport;
import com.genai.anomaly.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Processes the most recently closed, epoch-aligned window on a fixed
 * schedule. Each window is processed at most once per process.
 */
@Component
public class LiveDetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(LiveDetectionScheduler.class);

    private final DetectionPipelineService detectionService;
    private final AnomalyProperties.Live live;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<TimeWindow> lastProcessed = new AtomicReference<>();

    public LiveDetectionScheduler(DetectionPipelineService detectionService, AnomalyProperties properties,
                                  Clock clock, MetricsConfig metricsConfig) {
        this.detectionService = detectionService;
        this.live = properties.getLive();
        this.clock = clock;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(fixedDelayString = "${anomaly.live.check-interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void processLatestWindow() {
        if (!live.isEnabled()) {
            return;
        }

        Duration size = live.getWindowSize();
        TimeWindow window = TimeWindow.alignedTo(clock.instant(), size).preceding(size);
        TimeWindow previous = lastProcessed.get();
        if (previous != null && !window.end().isAfter(previous.end())) {
            log.debug("Window {} already processed, skipping", window);
            return;
        }

        try {
            DetectionReport report = detectionService.processWindow(window);
            lastProcessed.set(window);
            metricsConfig.updateLastProcessedWindowEnd(window.end().toEpochMilli());
            if (report.isAlreadyProcessed()) {
                log.info("Window {} was processed before this process started, skipping", window);
            } else {
                log.info("Live detection complete for {}: {} anomalies, {} diagnostics",
                        window, report.getRecords().size(), report.getDiagnostics().size());
            }
        } catch (Exception e) {
            // Retried on the next tick; the window is not marked processed
            log.error("Live detection failed for {}: {}", window, e.getMessage(), e);
        }
    }

    public TimeWindow getLastProcessed() {
        return lastProcessed.get();
    }
}
