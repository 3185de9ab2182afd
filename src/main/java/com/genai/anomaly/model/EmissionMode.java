package com.genai.anomaly.model;

/**
 * Distinguishes records detected on the live path from records re-derived by replay.
 */
public enum EmissionMode {
    LIVE,
    REPLAY
}
