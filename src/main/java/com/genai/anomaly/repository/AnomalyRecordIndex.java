package com.genai.anomaly.repository;

import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.AnomalyQuery;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.AnomalyType;
import com.genai.anomaly.model.StoreStats;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * In-process view of stored records shared by the memory and file backends.
 * Writers are serialized by the owning store; readers iterate an immutable
 * snapshot and never block them.
 */
class AnomalyRecordIndex {

    private final CopyOnWriteArrayList<AnomalyRecord> records = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, AnomalyRecord> byId = new ConcurrentHashMap<>();

    boolean contains(String recordId) {
        return byId.containsKey(recordId);
    }

    // Caller holds the store's write lock and has checked contains().
    // The list is published first so get() never sees a record query() does not.
    void add(AnomalyRecord record) {
        if (byId.containsKey(record.getRecordId())) {
            throw StoreWriteException.duplicate(record.getRecordId());
        }
        records.add(record);
        byId.put(record.getRecordId(), record);
    }

    Optional<AnomalyRecord> get(String recordId) {
        return Optional.ofNullable(byId.get(recordId));
    }

    List<AnomalyRecord> query(AnomalyQuery query) {
        return select(records.stream(), query);
    }

    long count() {
        return records.size();
    }

    long count(AnomalyQuery query) {
        return records.stream().filter(query::matches).count();
    }

    StoreStats stats(String storageType, boolean persistent) {
        return statsOf(records, storageType, persistent);
    }

    static List<AnomalyRecord> select(Stream<AnomalyRecord> source, AnomalyQuery query) {
        Stream<AnomalyRecord> matching = source
                .filter(query::matches)
                .sorted(AnomalyStore.QUERY_ORDER);
        if (query.getLimit() != null) {
            matching = matching.limit(query.getLimit());
        }
        return matching.toList();
    }

    static StoreStats statsOf(Collection<AnomalyRecord> snapshot, String storageType, boolean persistent) {
        Map<AnomalyType, Long> countsByType = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) {
            countsByType.put(type, 0L);
        }
        Instant earliest = null;
        Instant latest = null;
        long count = 0;
        for (AnomalyRecord record : snapshot) {
            count++;
            countsByType.merge(record.getAnomalyType(), 1L, Long::sum);
            Instant ts = record.getTimestamp();
            if (earliest == null || ts.isBefore(earliest)) earliest = ts;
            if (latest == null || ts.isAfter(latest)) latest = ts;
        }
        return StoreStats.builder()
                .count(count)
                .countsByType(countsByType)
                .earliest(earliest)
                .latest(latest)
                .storageType(storageType)
                .persistent(persistent)
                .build();
    }
}
