package com.genai.anomaly.exception;

import java.util.Set;

public class UnknownAlgorithmVersionException extends RuntimeException {

    private final String version;

    public UnknownAlgorithmVersionException(String version, Set<String> known) {
        super("Unknown algorithm version: " + version + " (known: " + known + ")");
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
