package com.genai.anomaly.model;

public enum DiagnosticKind {
    INPUT_DATA,
    INSUFFICIENT_BASELINE,
    DETECTOR_FAILURE,
    REPLAY_DIVERGENCE
}
