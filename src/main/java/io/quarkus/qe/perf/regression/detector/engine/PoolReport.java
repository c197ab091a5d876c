package io.quarkus.qe.perf.regression.detector.engine;

/**
 * @param processed series processed successfully
 * @param failed series whose processing failed
 * @param notStarted series left in the queue because a stop was requested
 */
public record PoolReport(int processed, int failed, int notStarted) {

    public boolean cancelled() {
        return notStarted > 0;
    }
}
