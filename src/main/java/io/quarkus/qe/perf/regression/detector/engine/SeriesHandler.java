package io.quarkus.qe.perf.regression.detector.engine;

import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.source.Series;

import java.util.List;

/**
 * Processes one series end to end on a worker thread.
 */
@FunctionalInterface
public interface SeriesHandler {

    List<ClassifiedEvent> handle(Series series);

}
