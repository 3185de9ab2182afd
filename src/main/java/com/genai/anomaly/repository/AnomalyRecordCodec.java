package com.genai.anomaly.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.AnomalyRecord;
import com.genai.anomaly.model.DetectionRun;
import org.springframework.stereotype.Component;

/**
 * The persisted JSON shape of an {@link AnomalyRecord} and of a
 * {@link DetectionRun}: snake_case fields, ISO-8601 UTC instants, lower-case
 * anomaly types. Independent of the web
 * layer's ObjectMapper so API settings cannot change what is on disk.
 */
@Component
public class AnomalyRecordCodec {

    private final ObjectMapper objectMapper;

    public AnomalyRecordCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(AnomalyRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StoreWriteException(record.getRecordId(),
                    "Failed to serialize anomaly record " + record.getRecordId(), e);
        }
    }

    public AnomalyRecord decode(String json) {
        try {
            return objectMapper.readValue(json, AnomalyRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StoreException("Failed to deserialize anomaly record: " + e.getMessage(), e);
        }
    }

    public String encode(DetectionRun run) {
        try {
            return objectMapper.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new StoreWriteException(run.key(), "Failed to serialize detection run " + run.key(), e);
        }
    }

    public DetectionRun decodeRun(String json) {
        try {
            return objectMapper.readValue(json, DetectionRun.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StoreException("Failed to deserialize detection run: " + e.getMessage(), e);
        }
    }
}
