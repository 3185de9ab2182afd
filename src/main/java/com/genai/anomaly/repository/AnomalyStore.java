package com.genai.anomaly.repository;

import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.StoreStats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only anomaly persistence. Records are never updated or deleted;
 * readers see a monotonically growing set.
 */
public interface AnomalyStore {

    /**
     * Query result order: timestamp ascending, ties broken by record id.
     */
    Comparator<AnomalyRecord> QUERY_ORDER = Comparator
            .comparing(AnomalyRecord::getTimestamp)
            .thenComparing(AnomalyRecord::getRecordId);

    /**
     * Persist one record. A failed append leaves no trace.
     *
     * @return the record id
     * @throws StoreWriteException on a duplicate id, a serialization failure or a backend failure
     */
    String append(AnomalyRecord record);

    /**
     * Append records in order, stopping at the first failure. Records appended
     * before the failure stay committed.
     */
    default List<String> appendAll(List<AnomalyRecord> records) {
        List<String> ids = new ArrayList<>(records.size());
        for (AnomalyRecord record : records) {
            ids.add(append(record));
        }
        return ids;
    }

    /**
     * @throws StoreException if the backend cannot be read
     */
    Optional<AnomalyRecord> get(String recordId);

    List<AnomalyRecord> query(AnomalyQuery query);

    long count();

    /**
     * Number of records matching the filters, ignoring the query limit.
     */
    default long count(AnomalyQuery query) {
        return query(query.toBuilder().limit(null).build()).size();
    }

    StoreStats stats();
}
