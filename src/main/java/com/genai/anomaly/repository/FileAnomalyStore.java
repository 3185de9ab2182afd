package com.genai.anomaly.repository;

import com.genai.anomaly.config.AnomalyProperties;
import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.StoreStats;
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
import java.util.List;
import java.util.Optional;

/**
 * Durable store backed by a JSON-Lines file, one record per line.
 *
 * Each append is fsynced before it is acknowledged and rolled back if the
 * write fails. On start the file is read into an in-memory index; an
 * incomplete final line left by a crash is dropped, any other unreadable
 * line fails start-up.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.store.backend", havingValue = "file")
public class FileAnomalyStore implements AnomalyStore, Closeable {

    private static final Logger log = LoggerFactory.getLogger(FileAnomalyStore.class);

    private final JsonLinesFile file;
    private final AnomalyRecordCodec codec;
    private final AnomalyRecordIndex index = new AnomalyRecordIndex();

    @Autowired
    public FileAnomalyStore(AnomalyProperties properties, AnomalyRecordCodec codec) {
        this(Paths.get(properties.getStore().getFilePath()), codec);
    }

    public FileAnomalyStore(Path path, AnomalyRecordCodec codec) {
        this.file = new JsonLinesFile(path, "anomaly store file");
        this.codec = codec;
        try {
            file.load(this::loadLine);
        } catch (RuntimeException e) {
            file.closeQuietly();
            throw e;
        }
        log.info("File anomaly store opened at {} with {} records", file.getPath(), index.count());
    }

    private void loadLine(int lineNumber, String line) {
        AnomalyRecord record;
        try {
            record = codec.decode(line);
        } catch (StoreException e) {
            throw new StoreException("Corrupt anomaly store file " + file.getPath() + " at line " + lineNumber
                    + ": " + e.getMessage(), e);
        }
        if (index.contains(record.getRecordId())) {
            throw new StoreException("Corrupt anomaly store file " + file.getPath() + ": duplicate record id "
                    + record.getRecordId() + " at line " + lineNumber);
        }
        index.add(record);
    }

    @Override
    public synchronized String append(AnomalyRecord record) {
        String recordId = record.getRecordId();
        if (index.contains(recordId)) {
            throw StoreWriteException.duplicate(recordId);
        }

        try {
            file.append(codec.encode(record));
        } catch (IOException e) {
            throw new StoreWriteException(recordId,
                    "Failed to append anomaly record " + recordId + " to " + file.getPath(), e);
        }

        index.add(record);
        log.debug("Appended anomaly record {} ({})", recordId, record.getAnomalyType());
        return recordId;
    }

    @Override
    public Optional<AnomalyRecord> get(String recordId) {
        return index.get(recordId);
    }

    @Override
    public List<AnomalyRecord> query(AnomalyQuery query) {
        return index.query(query);
    }

    @Override
    public long count() {
        return index.count();
    }

    @Override
    public long count(AnomalyQuery query) {
        return index.count(query);
    }

    @Override
    public StoreStats stats() {
        return index.stats("file", true);
    }

    public Path getPath() {
        return file.getPath();
    }

    @Override
    @PreDestroy
    public synchronized void close() throws IOException {
        file.close();
    }
}
