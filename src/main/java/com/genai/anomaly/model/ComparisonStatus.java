package com.genai.anomaly.model;

public enum ComparisonStatus {
    MATCHED,
    DIVERGED,
    // The window was never live-processed under the replayed version
    NOT_COMPARED
}
