package com.genai.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.genai.anomaly.config.AerospikeConfig;
import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.StoreStats;
import com.genai.anomaly.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable store with one Aerospike record per anomaly, keyed by record id.
 * Writes use CREATE_ONLY so an existing key is rejected by the server.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.store.backend", havingValue = "aerospike")
public class AerospikeAnomalyStore implements AnomalyStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAnomalyStore.class);

    // Bin names are limited to 15 characters
    static final String BIN_RECORD_ID = "recordId";
    static final String BIN_TYPE = "anomalyType";
    static final String BIN_OBSERVED = "observed";
    static final String BIN_EXPECTED = "expected";
    static final String BIN_DEVIATION = "deviation";
    static final String BIN_CONFIDENCE = "confidence";
    static final String BIN_VERSION = "algoVersion";
    static final String BIN_WINDOW_START = "windowStart";
    static final String BIN_WINDOW_END = "windowEnd";
    static final String BIN_TIMESTAMP = "timestamp";
    static final String BIN_METRIC = "metric";
    static final String BIN_SOURCE = "sourceId";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeAnomalyStore(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("createOnlyWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public String append(AnomalyRecord record) {
        String recordId = record.getRecordId();
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RECORDS, recordId);

        try {
            client.put(writePolicy, key,
                    new Bin(BIN_RECORD_ID, recordId),
                    new Bin(BIN_TYPE, record.getAnomalyType().getCode()),
                    new Bin(BIN_OBSERVED, record.getObservedValue()),
                    new Bin(BIN_EXPECTED, record.getExpectedValue()),
                    new Bin(BIN_DEVIATION, record.getDeviationScore()),
                    new Bin(BIN_CONFIDENCE, record.getConfidence()),
                    new Bin(BIN_VERSION, record.getAlgorithmVersion()),
                    new Bin(BIN_WINDOW_START, record.getTimeWindow().start().toString()),
                    new Bin(BIN_WINDOW_END, record.getTimeWindow().end().toString()),
                    new Bin(BIN_TIMESTAMP, record.getTimestamp().toString()),
                    new Bin(BIN_METRIC, record.getMetricName()),
                    new Bin(BIN_SOURCE, record.getSourceId()));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw StoreWriteException.duplicate(recordId);
            }
            throw new StoreWriteException(recordId, "Failed to append anomaly record " + recordId
                    + ": " + e.getMessage(), e);
        }
        log.debug("Appended anomaly record {} ({})", recordId, record.getAnomalyType());
        return recordId;
    }

    @Override
    public Optional<AnomalyRecord> get(String recordId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RECORDS, recordId);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) return Optional.empty();
            return Optional.of(mapRecord(record));
        } catch (AerospikeException e) {
            throw new StoreException("Failed to read anomaly record " + recordId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<AnomalyRecord> query(AnomalyQuery query) {
        return AnomalyRecordIndex.select(scanAll().stream(), query);
    }

    @Override
    public long count() {
        return scanAll().size();
    }

    @Override
    public StoreStats stats() {
        return AnomalyRecordIndex.statsOf(scanAll(), "aerospike", true);
    }

    private List<AnomalyRecord> scanAll() {
        List<AnomalyRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RECORDS,
                    (key, record) -> {
                        AnomalyRecord mapped = mapRecord(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    });
        } catch (AerospikeException e) {
            throw new StoreException("Failed to scan anomaly records: " + e.getMessage(), e);
        }
        return results;
    }

    private AnomalyRecord mapRecord(Record record) {
        try {
            return AnomalyRecord.builder()
                    .recordId(record.getString(BIN_RECORD_ID))
                    .anomalyType(AnomalyType.fromCode(record.getString(BIN_TYPE)))
                    .observedValue(record.getDouble(BIN_OBSERVED))
                    .expectedValue(record.getDouble(BIN_EXPECTED))
                    .deviationScore(record.getDouble(BIN_DEVIATION))
                    .confidence(record.getDouble(BIN_CONFIDENCE))
                    .algorithmVersion(record.getString(BIN_VERSION))
                    .timeWindow(TimeWindow.of(
                            Instant.parse(record.getString(BIN_WINDOW_START)),
                            Instant.parse(record.getString(BIN_WINDOW_END))))
                    .timestamp(Instant.parse(record.getString(BIN_TIMESTAMP)))
                    .metricName(record.getString(BIN_METRIC))
                    .sourceId(record.getString(BIN_SOURCE))
                    .build();
        } catch (RuntimeException e) {
            throw new StoreException("Unreadable anomaly record in Aerospike: " + e.getMessage(), e);
        }
    }
}
