package com.genai.anomaly.repository;

import com.genai.anomaly.model.ActualRecord;
import com.genai.anomaly.model.PredictedRecord;
import com.genai.anomaly.model.TimeWindow;

import java.util.List;

/**
 * Read-only access to the upstream predicted and actual streams.
 * Implementations never modify their source.
 */
public interface InputSource {

    /**
     * Predicted records whose timestamp falls in the window.
     */
    List<PredictedRecord> fetchPredicted(TimeWindow window);

    /**
     * Actual records whose timestamp falls in the window.
     */
    List<ActualRecord> fetchActual(TimeWindow window);
}
