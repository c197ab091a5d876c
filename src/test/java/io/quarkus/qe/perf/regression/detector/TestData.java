package io.quarkus.qe.perf.regression.detector;

import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.history.WarningHistory;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore.WarnedBuild;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders of series, measurements and configuration for tests.
 */
public final class TestData {

    public static final Series TS_FEDORA = new Series("Firefox", 1, "Fedora 12", 12, "Ts", 16);

    private TestData() {
    }

    public static Datum datum(int machineId, double value, long timestamp, String buildId) {
        return Datum.of(machineId, value, timestamp, null, buildId, 1);
    }

    /**
     * @return true if the measurement of {@code buildId} reported at {@code timestamp} is in the history
     */
    public static boolean isWarned(WarningHistory history, Series series, String buildId, long timestamp) {
        List<WarnedBuild> builds = history.toData().warnings()
                .getOrDefault(series.branchName(), Map.of())
                .getOrDefault(series.platformName(), Map.of())
                .getOrDefault(series.testName(), List.of());
        return builds.contains(new WarnedBuild(buildId, timestamp));
    }

    public static AppConfig appConfig(Path directory) {
        return new AppConfig(List.of("Firefox"), List.of(), Instant.EPOCH, null, false, List.of(), List.of(),
                directory.resolve("perf-data.json").toString(), directory.resolve("warning_history.json").toString(),
                directory.resolve("pushdates.json").toString(), 2);
    }

    /**
     * In memory data source.
     */
    public static final class FakeDataSource implements DataSource {

        private final Map<Series, List<Datum>> data = new LinkedHashMap<>();
        private final Map<Integer, String> machineNames = new HashMap<>();

        public FakeDataSource add(Series series, List<Datum> seriesData) {
            data.computeIfAbsent(series, k -> new ArrayList<>()).addAll(seriesData);
            return this;
        }

        public FakeDataSource machine(int machineId, String name) {
            machineNames.put(machineId, name);
            return this;
        }

        @Override
        public List<Series> getTestSeries(List<String> branches, Instant startTime, List<String> tests) {
            return data.keySet().stream()
                    .filter(s -> branches.contains(s.branchName()))
                    .filter(s -> tests.isEmpty() || tests.contains(s.testName()))
                    .toList();
        }

        @Override
        public List<Datum> getTestData(Series series, Instant startTime) {
            return data.getOrDefault(series, List.of()).stream()
                    .filter(d -> d.timestamp() >= startTime.getEpochSecond())
                    .toList();
        }

        @Override
        public String getMachineName(int machineId) {
            return machineNames.getOrDefault(machineId, String.valueOf(machineId));
        }

        @Override
        public List<Integer> getMachinesForTest(Series series) {
            return data.getOrDefault(series, List.of()).stream()
                    .map(Datum::machineId)
                    .distinct()
                    .sorted()
                    .toList();
        }
    }
}
