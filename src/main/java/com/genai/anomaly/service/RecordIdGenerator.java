package com.genai.anomaly.service;

import com.genai.anomaly.model.AnomalyCandidate;
import com.genai.anomaly.model.InputRecord;

import java.util.UUID;

/**
 * Supplies the {@code record_id} of a new anomaly record. Ids carry no
 * meaning: two evaluations of the same metric and window get distinct ids.
 */
@FunctionalInterface
public interface RecordIdGenerator {

    String nextId(InputRecord source, AnomalyCandidate candidate, String algorithmVersion);

    static RecordIdGenerator randomUuid() {
        return (source, candidate, version) -> UUID.randomUUID().toString();
    }
}
