package com.genai.anomaly.model;

import java.util.List;

/**
 * Both raw streams fetched for one window, as handed to the correlator.
 */
public record RawInputs(List<PredictedRecord> predicted, List<ActualRecord> actual) {

    public RawInputs {
        predicted = List.copyOf(predicted);
        actual = List.copyOf(actual);
    }
}
