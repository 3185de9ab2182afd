package com.genai.anomaly.service;

import com.genai.anomaly.exception.ReplayAbortedException;

import java.time.Duration;

/**
 * Cooperative cancellation point polled between records.
 */
@FunctionalInterface
public interface DetectionCheckpoint {

    DetectionCheckpoint NONE = () -> {
    };

    /**
     * @throws ReplayAbortedException when the run must stop
     */
    void check();

    /**
     * Aborts once {@code owner} is interrupted or {@code timeout} has elapsed from now.
     */
    static DetectionCheckpoint interruptOrDeadline(Thread owner, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        return () -> {
            if (owner.isInterrupted()) {
                throw new ReplayAbortedException("Replay cancelled");
            }
            if (System.nanoTime() - deadline > 0) {
                throw new ReplayAbortedException("Replay exceeded its timeout of " + timeout);
            }
        };
    }
}
