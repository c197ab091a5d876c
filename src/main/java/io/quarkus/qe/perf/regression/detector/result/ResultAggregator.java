package io.quarkus.qe.perf.regression.detector.result;

import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.engine.SharedLock;
import jakarta.enterprise.context.Dependent;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the events of all series of a run.
 */
@Dependent // this bean is stateful, so keep it in "command execution scope"
public final class ResultAggregator {

    private final SharedLock lock;
    private final List<ClassifiedEvent> events = new ArrayList<>();

    public ResultAggregator(SharedLock lock) {
        this.lock = lock;
    }

    public void append(List<ClassifiedEvent> seriesEvents) {
        lock.run(() -> events.addAll(seriesEvents));
    }

    /**
     * Must only be called once every worker has finished; there is no locking here.
     */
    public AnalysisResult snapshot() {
        return new AnalysisResult(events);
    }
}
