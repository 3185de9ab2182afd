package com.genai.anomaly.service;

import com.genai.anomaly.config.AlgorithmCatalog;
import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.DetectionReport;
import com.genai.anomaly.model.DetectionRun;
import com.genai.anomaly.model.EmissionMode;
import com.genai.anomaly.model.TimeWindow;
import com.genai.anomaly.repository.AnomalyStore;
import com.genai.anomaly.repository.DetectionRunLedger;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Live detection: runs the pipeline under the active algorithm version and
 * appends every emitted record to the anomaly store.
 *
 * Processing is idempotent per (window, version). A completed run is
 * recorded in the {@link DetectionRunLedger}; asking for the same window
 * again returns the recorded records without appending anything.
 */
@Service
public class DetectionPipelineService {

    private static final Logger log = LoggerFactory.getLogger(DetectionPipelineService.class);

    private final DetectionPipeline pipeline;
    private final AlgorithmCatalog catalog;
    private final AnomalyStore store;
    private final DetectionRunLedger ledger;
    private final RecordIdGenerator recordIdGenerator;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final String storeBackend;

    public DetectionPipelineService(DetectionPipeline pipeline,
                                    AlgorithmCatalog catalog,
                                    AnomalyStore store,
                                    DetectionRunLedger ledger,
                                    RecordIdGenerator recordIdGenerator,
                                    MetricsConfig metricsConfig,
                                    Clock clock,
                                    AnomalyProperties properties) {
        this.pipeline = pipeline;
        this.catalog = catalog;
        this.store = store;
        this.ledger = ledger;
        this.recordIdGenerator = recordIdGenerator;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.storeBackend = properties.getStore().getBackend();
    }

    /**
     * Detect and persist anomalies for one window, once per algorithm version.
     *
     * @throws StoreWriteException if an append or the run record fails; records appended
     *                             before it stay committed and are reused by the next attempt
     */
    @Observed(name = "detection.process_window", contextualName = "process-window")
    public synchronized DetectionReport processWindow(TimeWindow window) {
        AlgorithmConfig config = catalog.active();

        Optional<DetectionRun> completed = ledger.find(window, config.getVersion());
        if (completed.isPresent()) {
            log.info("Window {} already processed under v{} at {}, returning its {} records",
                    window, config.getVersion(), completed.get().getCompletedAt(),
                    completed.get().getRecordIds().size());
            return recordedReport(completed.get());
        }

        DetectionReport report = pipeline.run(window, config, EmissionMode.LIVE,
                recordIdGenerator, DetectionCheckpoint.NONE);

        // Left behind by an earlier attempt that failed before it was recorded
        List<AnomalyRecord> unclaimed = new ArrayList<>(store.query(AnomalyQuery.builder()
                .timeRange(window)
                .algorithmVersion(config.getVersion())
                .build()));

        List<AnomalyRecord> emitted = new ArrayList<>(report.getRecords().size());
        for (AnomalyRecord record : report.getRecords()) {
            Optional<AnomalyRecord> existing = claim(unclaimed, record);
            if (existing.isPresent()) {
                log.debug("Reusing stored record {} for {}/{} at {}", existing.get().getRecordId(),
                        record.getSourceId(), record.getMetricName(), record.getTimestamp());
                emitted.add(existing.get());
                continue;
            }
            append(window, record);
            emitted.add(record);
        }

        ledger.record(DetectionRun.builder()
                .window(window)
                .algorithmVersion(config.getVersion())
                .recordIds(emitted.stream().map(AnomalyRecord::getRecordId).toList())
                .completedAt(clock.instant())
                .build());

        return report.toBuilder()
                .clearRecords()
                .records(emitted)
                .build();
    }

    private void append(TimeWindow window, AnomalyRecord record) {
        try {
            store.append(record);
        } catch (StoreWriteException e) {
            metricsConfig.recordStoreAppend(storeBackend, "failed");
            log.error("Aborting live detection for {}: append of {} failed: {}",
                    window, record.getRecordId(), e.getMessage(), e);
            throw e;
        }
        metricsConfig.recordStoreAppend(storeBackend, "ok");
        metricsConfig.recordAnomalyEmitted(record.getAnomalyType().getCode(), EmissionMode.LIVE.name());
        log.info("Anomaly emitted: {} {} {}/{} score={} confidence={}",
                record.getRecordId(), record.getAnomalyType().getCode(), record.getSourceId(),
                record.getMetricName(), record.getDeviationScore(), record.getConfidence());
    }

    private static Optional<AnomalyRecord> claim(List<AnomalyRecord> unclaimed, AnomalyRecord record) {
        Iterator<AnomalyRecord> it = unclaimed.iterator();
        while (it.hasNext()) {
            AnomalyRecord candidate = it.next();
            if (candidate.sameDetectionAs(record)) {
                it.remove();
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private DetectionReport recordedReport(DetectionRun run) {
        DetectionReport.DetectionReportBuilder report = DetectionReport.builder()
                .window(run.getWindow())
                .algorithmVersion(run.getAlgorithmVersion())
                .emissionMode(EmissionMode.LIVE)
                .alreadyProcessed(true);
        for (String recordId : run.getRecordIds()) {
            Optional<AnomalyRecord> record = store.get(recordId);
            if (record.isPresent()) {
                report.record(record.get());
            } else {
                log.warn("Record {} of completed run {} is missing from the store", recordId, run.key());
            }
        }
        return report.build();
    }
}
