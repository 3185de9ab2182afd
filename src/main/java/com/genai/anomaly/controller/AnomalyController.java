package com.genai.anomaly.controller;

import com.genai.anomaly.model.AnalyzeRequest;
import com.genai.anomaly.model.AnomalyListResponse;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.DetectionReport;
import com.genai.anomaly.model.ReplayRequest;
import com.genai.anomaly.model.ReplayResult;
import com.genai.anomaly.model.StoreStats;
import com.genai.anomaly.model.TimeWindow;
import com.genai.anomaly.model.TrustSignal;
import com.genai.anomaly.repository.AnomalyStore;
import com.genai.anomaly.service.DetectionPipelineService;
import com.genai.anomaly.service.ReplayService;
import com.genai.anomaly.service.TrustSignalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Query stored anomalies, trust signals, live analysis and replay")
public class AnomalyController {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private final AnomalyStore store;
    private final TrustSignalService trustSignalService;
    private final DetectionPipelineService detectionService;
    private final ReplayService replayService;

    public AnomalyController(AnomalyStore store,
                             TrustSignalService trustSignalService,
                             DetectionPipelineService detectionService,
                             ReplayService replayService) {
        this.store = store;
        this.trustSignalService = trustSignalService;
        this.detectionService = detectionService;
        this.replayService = replayService;
    }

    @GetMapping
    @Operation(summary = "List anomalies",
               description = "Returns stored anomalies ordered by timestamp ascending. All filters are optional")
    public ResponseEntity<AnomalyListResponse> listAnomalies(
            @Parameter(description = "Anomaly type filter, repeatable", example = "latency")
            @RequestParam(name = "anomaly_type", required = false) List<String> anomalyTypes,
            @Parameter(description = "Minimum confidence in [0, 1]", example = "0.7")
            @RequestParam(name = "min_confidence", required = false) Double minConfidence,
            @Parameter(description = "Inclusive start of the timestamp range (ISO-8601)", example = "2025-02-18T00:00:00Z")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @Parameter(description = "Exclusive end of the timestamp range (ISO-8601)", example = "2025-02-19T00:00:00Z")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @Parameter(description = "Maximum records to return (1-1000)", example = "100")
            @RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit) {

        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0)) {
            throw new IllegalArgumentException("min_confidence must be within [0, 1]: " + minConfidence);
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }

        AnomalyQuery.AnomalyQueryBuilder query = AnomalyQuery.builder()
                .minConfidence(minConfidence)
                .limit(limit);
        if (anomalyTypes != null) {
            anomalyTypes.forEach(code -> query.anomalyType(AnomalyType.fromCode(code)));
        }
        if (start != null || end != null) {
            query.timeRange(TimeWindow.of(start != null ? start : Instant.EPOCH, end != null ? end : Instant.MAX));
        }
        AnomalyQuery filters = query.build();
        List<AnomalyRecord> anomalies = store.query(filters);
        return ResponseEntity.ok(AnomalyListResponse.of(anomalies, store.count(filters)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get store statistics",
               description = "Returns record counts per anomaly type, timestamp bounds and the storage backend")
    public ResponseEntity<StoreStats> getStats() {
        return ResponseEntity.ok(store.stats());
    }

    @GetMapping("/trust-signals/current")
    @Operation(summary = "Get current trust signal",
               description = "Composite advisory trust score over a window, 24h ending now by default")
    public ResponseEntity<TrustSignal> getCurrentTrustSignal(
            @Parameter(description = "Inclusive window start (ISO-8601)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @Parameter(description = "Exclusive window end (ISO-8601)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return ResponseEntity.ok(trustSignalService.current(start, end));
    }

    @PostMapping("/analyze")
    @Operation(summary = "Run live detection",
               description = "Detects anomalies in the window under the active algorithm version and appends them to the store")
    public ResponseEntity<DetectionReport> analyze(@Valid @RequestBody AnalyzeRequest request) {
        return ResponseEntity.ok(detectionService.processWindow(request.toWindow()));
    }

    @PostMapping("/analyze/replay")
    @Operation(summary = "Replay a historical window",
               description = "Re-derives anomalies for a pinned algorithm version. Results are labelled REPLAY, "
                       + "compared against live records and never written to the store")
    public ResponseEntity<ReplayResult> replay(@Valid @RequestBody ReplayRequest request) {
        return ResponseEntity.ok(replayService.replay(request.toWindow(), request.getAlgorithmVersion()));
    }

    @GetMapping("/{recordId}")
    @Operation(summary = "Get anomaly by record id")
    public ResponseEntity<AnomalyRecord> getAnomaly(
            @Parameter(description = "Record id", example = "5f0c2b1e-8d4a-4c1f-9d0e-2a6f1e7b3c44")
            @PathVariable String recordId) {
        return store.get(recordId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
