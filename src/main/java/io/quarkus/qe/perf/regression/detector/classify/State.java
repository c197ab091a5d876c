package io.quarkus.qe.perf.regression.detector.classify;

import java.util.Locale;

/**
 * Classification of a single measurement.
 */
public enum State {
    /** Consistent with the previous measurements */
    GOOD,
    /** Significant change compared to the previous measurements */
    REGRESSION,
    /** Anomalous reading attributed to the machine that ran the test */
    MACHINE;

    /**
     * @return the lower case name used in exported documents
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
