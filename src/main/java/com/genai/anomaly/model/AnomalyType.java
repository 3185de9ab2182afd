package com.genai.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The closed set of anomaly kinds. Exactly one detector exists per constant.
 */
public enum AnomalyType {
    COST("cost"),
    QUALITY("quality"),
    LATENCY("latency"),
    POLICY("policy");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AnomalyType fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Anomaly type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AnomalyType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + value);
    }
}
