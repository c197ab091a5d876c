package io.quarkus.qe.perf.regression.detector.output;

import io.quarkus.qe.perf.regression.detector.machine.InactiveMachineWarning;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;

import java.util.List;

/**
 * Sink for the results of a run. Channels are called one after another once all workers are done.
 */
public interface OutputChannel {

    void process(AnalysisResult result);

    default void processInactiveMachines(List<InactiveMachineWarning> warnings) {
    }

    /**
     * @return name used in log messages
     */
    default String name() {
        return getClass().getSimpleName();
    }

}
