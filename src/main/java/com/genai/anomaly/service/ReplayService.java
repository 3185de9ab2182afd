package com.genai.anomaly.service;

import com.genai.anomaly.config.AlgorithmCatalog;
import com.genai.anomaly.config.AlgorithmConfig;
import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.exception.ReplayAbortedException;
import com.genai.anomaly.exception.UnknownAlgorithmVersionException;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.ComparisonStatus;
import com.genai.anomaly.model.DetectionDiagnostic;
import com.genai.anomaly.model.DetectionReport;
import com.genai.anomaly.model.DetectionRun;
import com.genai.anomaly.model.EmissionMode;
import com.genai.anomaly.model.ReplayComparison;
import com.genai.anomaly.model.ReplayResult;
import com.genai.anomaly.model.TimeWindow;
import com.genai.anomaly.repository.AnomalyStore;
import com.genai.anomaly.repository.DetectionRunLedger;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Re-derives anomalies for a historical window under a pinned algorithm
 * version. Read-only: results are returned as a REPLAY-labelled set and
 * never written to the store.
 *
 * The output is compared with the live run recorded for exactly the same
 * window and version, if there is one. Live output over other windows is
 * not comparable because the baseline look-back starts at the window start.
 */
@Service
public class ReplayService {

    private static final Logger log = LoggerFactory.getLogger(ReplayService.class);

    static final Comparator<AnomalyRecord> SEMANTIC_ORDER = Comparator
            .comparing(AnomalyRecord::getTimestamp)
            .thenComparing(AnomalyRecord::getSourceId)
            .thenComparing(AnomalyRecord::getMetricName)
            .thenComparing(AnomalyRecord::getAnomalyType);

    private final DetectionPipeline pipeline;
    private final AlgorithmCatalog catalog;
    private final AnomalyStore store;
    private final DetectionRunLedger ledger;
    private final RecordIdGenerator idGenerator;
    private final ExecutorService replayExecutor;
    private final MetricsConfig metricsConfig;
    private final Duration timeout;

    public ReplayService(DetectionPipeline pipeline,
                         AlgorithmCatalog catalog,
                         AnomalyStore store,
                         DetectionRunLedger ledger,
                         RecordIdGenerator idGenerator,
                         @Qualifier("replayExecutor") ExecutorService replayExecutor,
                         MetricsConfig metricsConfig,
                         AnomalyProperties properties) {
        this.pipeline = pipeline;
        this.catalog = catalog;
        this.store = store;
        this.ledger = ledger;
        this.idGenerator = idGenerator;
        this.replayExecutor = replayExecutor;
        this.metricsConfig = metricsConfig;
        this.timeout = properties.getReplay().getTimeout();
    }

    /**
     * Replay on the calling thread.
     *
     * @param algorithmVersion the version to bind to, or null for the active one
     * @throws UnknownAlgorithmVersionException if the version is not configured
     * @throws ReplayAbortedException           if the thread is interrupted or the timeout elapses
     */
    @Observed(name = "replay.run", contextualName = "replay-window")
    public ReplayResult replay(TimeWindow window, String algorithmVersion) {
        AlgorithmConfig config = catalog.resolve(algorithmVersion);
        DetectionCheckpoint checkpoint = DetectionCheckpoint.interruptOrDeadline(Thread.currentThread(), timeout);

        log.info("Replay started for {} v{}", window, config.getVersion());
        DetectionReport report = pipeline.run(window, config, EmissionMode.REPLAY, idGenerator, checkpoint);

        List<AnomalyRecord> replayed = new ArrayList<>(report.getRecords());
        replayed.sort(SEMANTIC_ORDER);
        checkpoint.check();

        Optional<DetectionRun> liveRun = ledger.find(window, config.getVersion());
        ReplayComparison comparison = liveRun.isPresent()
                ? compare(recordsOf(liveRun.get()), replayed)
                : ReplayComparison.notCompared(replayed.size());
        metricsConfig.recordReplayComparison(comparison.status().name());

        ReplayResult.ReplayResultBuilder result = ReplayResult.builder()
                .window(window)
                .algorithmVersion(config.getVersion())
                .records(replayed)
                .diagnostics(report.getDiagnostics())
                .comparison(comparison);

        if (comparison.status() == ComparisonStatus.DIVERGED) {
            String message = String.format(
                    "Replay of %s v%s diverged from live records: live=%d, replayed=%d, missing=%d, unexpected=%d",
                    window, config.getVersion(), comparison.liveCount(), comparison.replayCount(),
                    comparison.missingInReplay(), comparison.unexpectedInReplay());
            log.error(message);
            DetectionDiagnostic divergence = DetectionDiagnostic.replayDivergence(message);
            metricsConfig.recordDiagnostic(divergence.getKind().name());
            result.diagnostic(divergence);
        }

        log.info("Replay finished for {} v{}: {} records, comparison={}",
                window, config.getVersion(), replayed.size(), comparison.status());
        return result.build();
    }

    /**
     * Replay on the replay executor. Cancelling the returned future interrupts the run.
     */
    public CompletableFuture<ReplayResult> replayAsync(TimeWindow window, String algorithmVersion) {
        // Resolve eagerly so an unknown version fails the call, not the future
        catalog.resolve(algorithmVersion);

        CompletableFuture<ReplayResult> result = new CompletableFuture<>();
        Future<?> task = replayExecutor.submit(() -> {
            try {
                result.complete(replay(window, algorithmVersion));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((r, t) -> {
            if (result.isCancelled()) {
                task.cancel(true);
                log.info("Replay of {} cancelled", window);
            }
        });
        return result;
    }

    private List<AnomalyRecord> recordsOf(DetectionRun run) {
        List<AnomalyRecord> records = new ArrayList<>(run.getRecordIds().size());
        for (String recordId : run.getRecordIds()) {
            Optional<AnomalyRecord> record = store.get(recordId);
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                log.warn("Record {} of live run {} is missing from the store", recordId, run.key());
            }
        }
        return records;
    }

    /**
     * Multiset comparison ignoring record ids.
     */
    static ReplayComparison compare(List<AnomalyRecord> live, List<AnomalyRecord> replayed) {
        List<AnomalyRecord> unmatchedLive = new ArrayList<>(live);
        int unexpected = 0;
        for (AnomalyRecord record : replayed) {
            boolean matched = false;
            Iterator<AnomalyRecord> it = unmatchedLive.iterator();
            while (it.hasNext()) {
                if (it.next().sameDetectionAs(record)) {
                    it.remove();
                    matched = true;
                    break;
                }
            }
            if (!matched) unexpected++;
        }
        ComparisonStatus status = unmatchedLive.isEmpty() && unexpected == 0
                ? ComparisonStatus.MATCHED : ComparisonStatus.DIVERGED;
        return new ReplayComparison(status, live.size(), replayed.size(), unmatchedLive.size(), unexpected);
    }
}
