package io.quarkus.qe.perf.regression.detector.source;

import java.time.Instant;
import java.util.List;

/**
 * Store with the raw measurements. Implementations must be safe to call from several workers at once.
 */
public interface DataSource {

    /**
     * @param branches branch names to enumerate
     * @param startTime only series with data reported at or after this instant
     * @param tests test names to keep, all tests when empty
     */
    List<Series> getTestSeries(List<String> branches, Instant startTime, List<String> tests);

    /**
     * Measurements of all machines running the series, reported at or after {@code startTime}.
     */
    List<Datum> getTestData(Series series, Instant startTime);

    String getMachineName(int machineId);

    List<Integer> getMachinesForTest(Series series);

}
