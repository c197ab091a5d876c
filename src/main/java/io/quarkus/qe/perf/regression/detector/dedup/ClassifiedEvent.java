package io.quarkus.qe.perf.regression.detector.dedup;

import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;

/**
 * A classified measurement after de-duplication.
 *
 * @param series series the measurement belongs to
 * @param datum the measurement
 * @param state classification of the measurement
 * @param skip true if no warning must be sent about this measurement
 * @param lastGood most recent good measurement up to this one, or null
 */
public record ClassifiedEvent(Series series, Datum datum, State state, boolean skip, Datum lastGood) {

    /**
     * @return true if people must be warned about this event
     */
    public boolean isDeliverable() {
        return state != State.GOOD && !skip && lastGood != null;
    }
}
