package com.genai.anomaly.model;

public enum TrustLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static TrustLevel fromScore(double compositeScore, double mediumThreshold, double lowThreshold) {
        if (compositeScore >= lowThreshold) return LOW;
        if (compositeScore >= mediumThreshold) return MEDIUM;
        return HIGH;
    }
}
