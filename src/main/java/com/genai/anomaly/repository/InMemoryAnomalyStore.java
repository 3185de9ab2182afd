package com.genai.anomaly.repository;

import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.StoreStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Ephemeral store for tests and local runs. Lost on restart.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.store.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryAnomalyStore implements AnomalyStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAnomalyStore.class);

    private final AnomalyRecordIndex index = new AnomalyRecordIndex();

    @Override
    public synchronized String append(AnomalyRecord record) {
        if (index.contains(record.getRecordId())) {
            throw StoreWriteException.duplicate(record.getRecordId());
        }
        index.add(record);
        log.debug("Appended anomaly record {} ({})", record.getRecordId(), record.getAnomalyType());
        return record.getRecordId();
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
        return index.stats("memory", false);
    }
}
