package com.genai.anomaly.repository;

import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.DetectionRun;
import com.genai.anomaly.model.TimeWindow;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger of completed live runs in a JSON-Lines file next to the anomaly store.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.store.backend", havingValue = "file")
public class FileDetectionRunLedger implements DetectionRunLedger, Closeable {

    private static final Logger log = LoggerFactory.getLogger(FileDetectionRunLedger.class);

    private final JsonLinesFile file;
    private final AnomalyRecordCodec codec;
    private final Map<String, DetectionRun> runs = new ConcurrentHashMap<>();

    @Autowired
    public FileDetectionRunLedger(AnomalyProperties properties, AnomalyRecordCodec codec) {
        this(Paths.get(properties.getStore().getRunsFilePath()), codec);
    }

    public FileDetectionRunLedger(Path path, AnomalyRecordCodec codec) {
        this.file = new JsonLinesFile(path, "detection run ledger");
        this.codec = codec;
        try {
            file.load(this::loadLine);
        } catch (RuntimeException e) {
            file.closeQuietly();
            throw e;
        }
        log.info("Detection run ledger opened at {} with {} runs", file.getPath(), runs.size());
    }

    private void loadLine(int lineNumber, String line) {
        DetectionRun run;
        try {
            run = codec.decodeRun(line);
        } catch (StoreException e) {
            throw new StoreException("Corrupt detection run ledger " + file.getPath() + " at line " + lineNumber
                    + ": " + e.getMessage(), e);
        }
        if (runs.putIfAbsent(run.key(), run) != null) {
            throw new StoreException("Corrupt detection run ledger " + file.getPath() + ": duplicate run "
                    + run.key() + " at line " + lineNumber);
        }
    }

    @Override
    public Optional<DetectionRun> find(TimeWindow window, String algorithmVersion) {
        return Optional.ofNullable(runs.get(DetectionRun.keyOf(window, algorithmVersion)));
    }

    @Override
    public synchronized void record(DetectionRun run) {
        if (runs.containsKey(run.key())) {
            throw StoreWriteException.duplicateRun(run.key());
        }
        try {
            file.append(codec.encode(run));
        } catch (IOException e) {
            throw new StoreWriteException(run.key(), "Failed to record detection run " + run.key()
                    + " in " + file.getPath(), e);
        }
        runs.put(run.key(), run);
    }

    @Override
    @PreDestroy
    public synchronized void close() throws IOException {
        file.close();
    }
}
