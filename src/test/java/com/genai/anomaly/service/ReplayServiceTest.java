package com.genai.anomaly.service;

import com.genai.anomaly.config.AlgorithmCatalog;
import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.config.MetricsConfig;
import com.genai.anomaly.exception.ReplayAbortedException;
import com.genai.anomaly.exception.UnknownAlgorithmVersionException;
import com.genai.anomaly.model.ActualRecord;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.ComparisonStatus;
import com.genai.anomaly.model.DiagnosticKind;
import com.genai.anomaly.model.EmissionMode;
import com.genai.anomaly.model.PredictedRecord;
import com.genai.anomaly.model.ReplayResult;
import com.genai.anomaly.model.TimeWindow;
import com.genai.anomaly.repository.InMemoryAnomalyStore;
import com.genai.anomaly.repository.InMemoryDetectionRunLedger;
import com.genai.anomaly.repository.InputSource;
import com.genai.anomaly.testutil.InMemoryInputSource;
import com.genai.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.genai.anomaly.testutil.TestDataFactory.HOUR;
import static com.genai.anomaly.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplayServiceTest {

    private ExecutorService detectionExecutor;
    private ExecutorService replayExecutor;
    private MetricsConfig metricsConfig;
    private AnomalyProperties properties;
    private InMemoryAnomalyStore store;
    private InMemoryDetectionRunLedger ledger;

    @BeforeEach
    void setUp() {
        detectionExecutor = Executors.newFixedThreadPool(2);
        replayExecutor = Executors.newSingleThreadExecutor();
        metricsConfig = TestDataFactory.metricsConfig();
        properties = new AnomalyProperties();
        AnomalyProperties.Algorithm strict = new AnomalyProperties.Algorithm();
        strict.getCost().setDeviationThreshold(3.0);
        properties.getAlgorithms().put("2.0.0", strict);
        store = new InMemoryAnomalyStore();
        ledger = new InMemoryDetectionRunLedger();
    }

    @AfterEach
    void tearDown() {
        detectionExecutor.shutdownNow();
        replayExecutor.shutdownNow();
    }

    private ReplayService replayService(InputSource input) {
        return new ReplayService(TestDataFactory.detectionPipeline(input, detectionExecutor, metricsConfig),
                new AlgorithmCatalog(properties), store, ledger, RecordIdGenerator.randomUuid(),
                replayExecutor, metricsConfig, properties);
    }

    private DetectionPipelineService liveService(InputSource input) {
        return new DetectionPipelineService(TestDataFactory.detectionPipeline(input, detectionExecutor, metricsConfig),
                new AlgorithmCatalog(properties), store, ledger, RecordIdGenerator.randomUuid(), metricsConfig,
                Clock.fixed(T0.plus(Duration.ofHours(3)), ZoneOffset.UTC), properties);
    }

    @Test
    void replay_sameWindowAndVersionTwice_identicalOutput() {
        ReplayService replayService = replayService(TestDataFactory.costScenario(150.0, 40.0, 105.0));

        ReplayResult first = replayService.replay(HOUR, "1.0.0");
        ReplayResult second = replayService.replay(HOUR, "1.0.0");

        assertThat(first.getRecords()).hasSize(2);
        assertThat(second.getRecords()).hasSameSizeAs(first.getRecords());
        for (int i = 0; i < first.getRecords().size(); i++) {
            AnomalyRecord a = first.getRecords().get(i);
            AnomalyRecord b = second.getRecords().get(i);
            assertThat(a.sameDetectionAs(b)).isTrue();
            // Ids are fresh per run and carry no meaning
            assertThat(a.getRecordId()).isNotEqualTo(b.getRecordId());
        }
        assertThat(first.getEmissionMode()).isEqualTo(EmissionMode.REPLAY);
        assertThat(first.getRecords()).isSortedAccordingTo(ReplayService.SEMANTIC_ORDER);
        assertThat(second.getRecords()).isSortedAccordingTo(ReplayService.SEMANTIC_ORDER);
    }

    @Test
    void replay_neverWritesToStore() {
        ReplayService replayService = replayService(TestDataFactory.costScenario(150.0));

        replayService.replay(HOUR, null);

        assertThat(store.count()).isZero();
    }

    @Test
    void replay_noLiveRecords_notCompared() {
        ReplayResult result = replayService(TestDataFactory.costScenario(150.0)).replay(HOUR, null);

        assertThat(result.getComparison().status()).isEqualTo(ComparisonStatus.NOT_COMPARED);
        assertThat(result.getComparison().replayCount()).isEqualTo(1);
        assertThat(result.getAlgorithmVersion()).isEqualTo("1.0.0");
    }

    @Test
    void replay_afterLiveRun_matchesStoredRecordsIgnoringIds() {
        InMemoryInputSource input = TestDataFactory.costScenario(150.0, 40.0, 105.0);
        liveService(input).processWindow(HOUR);
        long stored = store.count();

        ReplayResult result = replayService(input).replay(HOUR, "1.0.0");

        assertThat(result.getComparison().status()).isEqualTo(ComparisonStatus.MATCHED);
        assertThat(result.getComparison().liveCount()).isEqualTo(2);
        assertThat(result.getDiagnostics()).noneMatch(d -> d.getKind() == DiagnosticKind.REPLAY_DIVERGENCE);
        assertThat(store.count()).isEqualTo(stored);
    }

    @Test
    void replay_windowProcessedTwiceLive_stillMatches() {
        InMemoryInputSource input = TestDataFactory.costScenario(150.0);
        DetectionPipelineService live = liveService(input);
        live.processWindow(HOUR);
        live.processWindow(HOUR);

        ReplayResult result = replayService(input).replay(HOUR, "1.0.0");

        assertThat(store.count()).isEqualTo(1);
        assertThat(result.getComparison().status()).isEqualTo(ComparisonStatus.MATCHED);
        assertThat(result.getComparison().liveCount()).isEqualTo(1);
        assertThat(result.getDiagnostics()).noneMatch(d -> d.getKind() == DiagnosticKind.REPLAY_DIVERGENCE);
    }

    @Test
    void replay_windowSpanningSeveralLiveRuns_notCompared() {
        TimeWindow nextHour = TimeWindow.of(HOUR.end(), HOUR.end().plus(Duration.ofHours(1)));
        InMemoryInputSource input = TestDataFactory.costScenario(150.0);
        input.add(TestDataFactory.predicted("trace-next", "cost_usd", 100.0, nextHour.start().plusSeconds(300)),
                TestDataFactory.actual("trace-next", "cost_usd", 150.0, nextHour.start().plusSeconds(300)));
        DetectionPipelineService live = liveService(input);
        live.processWindow(HOUR);
        live.processWindow(nextHour);

        ReplayResult spanning = replayService(input).replay(TimeWindow.of(HOUR.start(), nextHour.end()), "1.0.0");
        ReplayResult exact = replayService(input).replay(nextHour, "1.0.0");

        assertThat(spanning.getComparison().status()).isEqualTo(ComparisonStatus.NOT_COMPARED);
        assertThat(spanning.getDiagnostics()).noneMatch(d -> d.getKind() == DiagnosticKind.REPLAY_DIVERGENCE);
        assertThat(exact.getComparison().status()).isEqualTo(ComparisonStatus.MATCHED);
    }

    @Test
    void replay_liveRecordNotReproduced_diverged() {
        liveService(TestDataFactory.costScenario(150.0, 40.0)).processWindow(HOUR);

        // The 40.0 observation has since disappeared from the input
        ReplayResult result = replayService(TestDataFactory.costScenario(150.0)).replay(HOUR, "1.0.0");

        assertThat(result.getComparison().status()).isEqualTo(ComparisonStatus.DIVERGED);
        assertThat(result.getComparison().missingInReplay()).isEqualTo(1);
        assertThat(result.getComparison().unexpectedInReplay()).isZero();
        assertThat(result.getDiagnostics()).anyMatch(d -> d.getKind() == DiagnosticKind.REPLAY_DIVERGENCE);
    }

    @Test
    void replay_pinnedHistoricalVersion_usesItsParameters() {
        InMemoryInputSource input = TestDataFactory.costScenario(150.0, 180.0);
        liveService(input).processWindow(HOUR);

        ReplayResult result = replayService(input).replay(HOUR, "2.0.0");

        // threshold 3.0: z = 2.5 no longer flagged, z = 4.0 still is
        assertThat(result.getAlgorithmVersion()).isEqualTo("2.0.0");
        assertThat(result.getRecords()).singleElement()
                .satisfies(r -> assertThat(r.getObservedValue()).isEqualTo(180.0))
                .satisfies(r -> assertThat(r.getAlgorithmVersion()).isEqualTo("2.0.0"));
        assertThat(result.getComparison().status()).isEqualTo(ComparisonStatus.NOT_COMPARED);
    }

    @Test
    void replay_unknownVersion_rejected() {
        ReplayService replayService = replayService(TestDataFactory.costScenario(150.0));

        assertThatThrownBy(() -> replayService.replay(HOUR, "0.0.1"))
                .isInstanceOf(UnknownAlgorithmVersionException.class);
        assertThatThrownBy(() -> replayService.replayAsync(HOUR, "0.0.1"))
                .isInstanceOf(UnknownAlgorithmVersionException.class);
    }

    @Test
    void replay_interruptedCaller_aborts() {
        ReplayService replayService = replayService(TestDataFactory.costScenario(150.0));

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> replayService.replay(HOUR, null)).isInstanceOf(ReplayAbortedException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(store.count()).isZero();
    }

    @Test
    void replay_pastTimeout_aborts() {
        properties.getReplay().setTimeout(Duration.ofMillis(1));
        InMemoryInputSource delegate = TestDataFactory.costScenario(150.0);
        InputSource slow = new InputSource() {
            @Override
            public List<PredictedRecord> fetchPredicted(TimeWindow window) {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return delegate.fetchPredicted(window);
            }

            @Override
            public List<ActualRecord> fetchActual(TimeWindow window) {
                return delegate.fetchActual(window);
            }
        };

        assertThatThrownBy(() -> replayService(slow).replay(HOUR, null))
                .isInstanceOf(ReplayAbortedException.class)
                .hasMessageContaining("timeout");
    }

    @Test
    void replayAsync_completesWithResult() throws Exception {
        CompletableFuture<ReplayResult> future = replayService(TestDataFactory.costScenario(150.0))
                .replayAsync(HOUR, null);

        assertThat(future.get(10, TimeUnit.SECONDS).getRecords()).hasSize(1);
    }

    @Test
    void replayAsync_cancel_interruptsRunAndFreesExecutor() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryInputSource delegate = TestDataFactory.costScenario(150.0);
        InputSource blocking = new InputSource() {
            @Override
            public List<PredictedRecord> fetchPredicted(TimeWindow window) {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return delegate.fetchPredicted(window);
            }

            @Override
            public List<ActualRecord> fetchActual(TimeWindow window) {
                return delegate.fetchActual(window);
            }
        };

        CompletableFuture<ReplayResult> future = replayService(blocking).replayAsync(HOUR, null);
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        future.cancel(true);

        assertThat(future.isCancelled()).isTrue();
        // The single replay thread is released once the cancelled run stops
        assertThat(replayExecutor.submit(() -> "free").get(10, TimeUnit.SECONDS)).isEqualTo("free");
        assertThat(store.count()).isZero();
    }
}
