package io.quarkus.qe.perf.regression.detector.history;

import java.util.Map;

/**
 * Persists push dates fetched from the push log, keyed by branch and 12 character revision.
 */
public interface PushDateStore {

    /**
     * @return the cached push dates, or an empty map when there are none or they cannot be read
     */
    Map<String, Map<String, Long>> load();

    void save(Map<String, Map<String, Long>> pushDates);

}
