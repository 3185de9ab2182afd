package com.genai.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.genai.anomaly.config.AerospikeConfig;
import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.DetectionRun;
import com.genai.anomaly.model.TimeWindow;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One Aerospike record per completed live run, keyed by version and window.
 */
@Repository
@ConditionalOnProperty(name = "anomaly.store.backend", havingValue = "aerospike")
public class AerospikeDetectionRunLedger implements DetectionRunLedger {

    static final String BIN_WINDOW_START = "windowStart";
    static final String BIN_WINDOW_END = "windowEnd";
    static final String BIN_VERSION = "algoVersion";
    static final String BIN_RECORD_IDS = "recordIds";
    static final String BIN_COMPLETED_AT = "completedAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeDetectionRunLedger(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("createOnlyWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public Optional<DetectionRun> find(TimeWindow window, String algorithmVersion) {
        String runKey = DetectionRun.keyOf(window, algorithmVersion);
        try {
            Record record = client.get(readPolicy, key(runKey));
            if (record == null) return Optional.empty();
            return Optional.of(mapRecord(record));
        } catch (AerospikeException e) {
            throw new StoreException("Failed to read detection run " + runKey + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void record(DetectionRun run) {
        try {
            client.put(writePolicy, key(run.key()),
                    new Bin(BIN_WINDOW_START, run.getWindow().start().toString()),
                    new Bin(BIN_WINDOW_END, run.getWindow().end().toString()),
                    new Bin(BIN_VERSION, run.getAlgorithmVersion()),
                    new Bin(BIN_RECORD_IDS, run.getRecordIds()),
                    new Bin(BIN_COMPLETED_AT, run.getCompletedAt().toString()));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw StoreWriteException.duplicateRun(run.key());
            }
            throw new StoreWriteException(run.key(), "Failed to record detection run " + run.key()
                    + ": " + e.getMessage(), e);
        }
    }

    private Key key(String runKey) {
        return new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runKey);
    }

    private DetectionRun mapRecord(Record record) {
        try {
            List<?> ids = record.getList(BIN_RECORD_IDS);
            return DetectionRun.builder()
                    .window(TimeWindow.of(
                            Instant.parse(record.getString(BIN_WINDOW_START)),
                            Instant.parse(record.getString(BIN_WINDOW_END))))
                    .algorithmVersion(record.getString(BIN_VERSION))
                    .recordIds(ids == null ? List.of() : ids.stream().map(String::valueOf).toList())
                    .completedAt(Instant.parse(record.getString(BIN_COMPLETED_AT)))
                    .build();
        } catch (RuntimeException e) {
            throw new StoreException("Unreadable detection run in Aerospike: " + e.getMessage(), e);
        }
    }
}
