package com.genai.anomaly.repository;

import com.genai.anomaly.exception.StoreException;
import com.genai.anomaly.exception.StoreWriteException;
import com.genai.anomaly.model.DetectionRun;
import com.genai.anomaly.model.TimeWindow;

import java.util.Optional;

/**
 * Append-only record of completed live detection runs, kept by the same
 * backend as the anomaly store. Makes live processing of a window
 * idempotent across requests and restarts, and tells replay which live
 * output to compare against.
 */
public interface DetectionRunLedger {

    /**
     * @throws StoreException if the backend cannot be read
     */
    Optional<DetectionRun> find(TimeWindow window, String algorithmVersion);

    /**
     * @throws StoreWriteException if a run for the same window and version is already recorded,
     *                             or the backend write fails
     */
    void record(DetectionRun run);
}
