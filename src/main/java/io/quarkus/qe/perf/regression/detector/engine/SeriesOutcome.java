package io.quarkus.qe.perf.regression.detector.engine;

import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.source.Series;

import java.util.List;

/**
 * Result of processing one series: its events, or the failure that stopped it.
 */
public record SeriesOutcome(Series series, List<ClassifiedEvent> events, RuntimeException failure) {

    public static SeriesOutcome success(Series series, List<ClassifiedEvent> events) {
        return new SeriesOutcome(series, List.copyOf(events), null);
    }

    public static SeriesOutcome failure(Series series, RuntimeException failure) {
        return new SeriesOutcome(series, List.of(), failure);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
