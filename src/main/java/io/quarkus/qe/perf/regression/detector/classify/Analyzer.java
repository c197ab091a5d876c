package io.quarkus.qe.perf.regression.detector.classify;

import io.quarkus.qe.perf.regression.detector.source.Datum;

import java.util.Iterator;
import java.util.List;

/**
 * Classification algorithm. Implementations keep no state between calls.
 */
public interface Analyzer {

    /**
     * Classify the measurement history of one series.
     * <p>
     * The returned iterator is lazy and finite. Its order is the order in which the algorithm processes
     * the measurements, which is not necessarily push time order. Measurements classified as
     * {@link State#MACHINE} carry the datum they were compared with in {@link Datum#lastOther()}.
     */
    Iterator<ClassifiedDatum> analyze(List<Datum> data, AnalyzerSettings settings);

}
