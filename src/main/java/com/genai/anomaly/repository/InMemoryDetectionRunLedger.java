package com.genai.anomaly.repository;

import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.DetectionRun;
import com.genai.anomaly.model.TimeWindow;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "anomaly.store.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryDetectionRunLedger implements DetectionRunLedger {

    private final Map<String, DetectionRun> runs = new ConcurrentHashMap<>();

    @Override
    public Optional<DetectionRun> find(TimeWindow window, String algorithmVersion) {
        return Optional.ofNullable(runs.get(DetectionRun.keyOf(window, algorithmVersion)));
    }

    @Override
    public void record(DetectionRun run) {
        if (runs.putIfAbsent(run.key(), run) != null) {
            throw StoreWriteException.duplicateRun(run.key());
        }
    }
}
