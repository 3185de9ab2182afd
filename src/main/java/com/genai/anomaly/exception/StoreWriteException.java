package com.genai.anomaly.exception;

/**
 * An append was rejected: duplicate record id, serialization failure or backend I/O
 * failure. The record is never partially written.
 */
public class StoreWriteException extends StoreException {

    private final String recordId;
    private final boolean duplicate;

    public StoreWriteException(String recordId, String message, boolean duplicate) {
        super(message);
        this.recordId = recordId;
        this.duplicate = duplicate;
    }

    public StoreWriteException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
        this.duplicate = false;
    }

    public static StoreWriteException duplicate(String recordId) {
        return new StoreWriteException(recordId, "Record with id " + recordId + " already exists", true);
    }

    public static StoreWriteException duplicateRun(String runKey) {
        return new StoreWriteException(runKey, "Detection run " + runKey + " is already recorded", true);
    }

    public String getRecordId() {
        return recordId;
    }

    public boolean isDuplicate() {
        return duplicate;
    }
}
