package io.quarkus.qe.perf.regression.detector.output.impl;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.quarkus.qe.perf.regression.detector.alert.AlertFactory;
import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.output.OutputChannel;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;
import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Writes {@code testdata.js} for the dashboard: the last week of results of selected tests, per machine.
 */
@Singleton
final class DashboardOutputChannel implements OutputChannel {

    static final String DATA_FILE = "testdata.js";
    static final Duration DASHBOARD_PERIOD = Duration.ofDays(7);

    private static final DateTimeFormatter FETCH_TIME_FORMAT = DateTimeFormatter
            .ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ROOT)
            .withZone(ZoneId.systemDefault());

    // both names are used for the same measurement, depending on the platform
    private static final Map<String, String> MERGED_TESTS = Map.of("Tp3 (Memset)", "Tp3 (RSS)");

    private final Logger logger;
    private final Optional<Path> dashboardDir;
    private final Optional<List<String>> tests;
    private final IntFunction<String> machineNames;
    private final Function<Series, String> chartUrls;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    @Inject
    DashboardOutputChannel(Logger logger, AnalysisConfig config, DataSource dataSource, AlertFactory alertFactory,
                           Clock clock) {
        this(logger, config.dashboardDir().map(Path::of), config.dashboardTests(), dataSource::getMachineName,
                series -> alertFactory.chartUrl(series, null), clock);
    }

    DashboardOutputChannel(Logger logger, Optional<Path> dashboardDir, Optional<List<String>> tests,
                           IntFunction<String> machineNames, Function<Series, String> chartUrls, Clock clock) {
        this.logger = logger;
        this.dashboardDir = dashboardDir;
        this.tests = tests;
        this.machineNames = machineNames;
        this.chartUrls = chartUrls;
        this.clock = clock;
    }

    @Override
    public void process(AnalysisResult result) {
        if (dashboardDir.isEmpty()) {
            return;
        }
        Path directory = dashboardDir.get();
        Path dataFile = directory.resolve(DATA_FILE);
        Path tmpFile = directory.resolve(DATA_FILE + ".tmp");
        String fetchTime = FETCH_TIME_FORMAT.format(clock.instant());
        try {
            Files.createDirectories(directory);
            String content = "// Generated at " + fetchTime + "\n"
                    + "gFetchTime = " + objectMapper.writeValueAsString(fetchTime) + ";\n"
                    + "var gData = " + objectMapper.writeValueAsString(collect(result)) + ";\n";
            Files.writeString(tmpFile, content);
            try {
                Files.move(tmpFile, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmpFile, dataFile, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Dashboard data saved to: " + dataFile.toAbsolutePath());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize dashboard data", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write dashboard data to " + dataFile, e);
        }
    }

    /**
     * @return branch → test → platform → machine → {results, stats}, with the ids and graph URL
     *         stored under underscore-prefixed keys
     */
    Map<String, Map<String, TestResults>> collect(AnalysisResult result) {
        long periodStart = clock.instant().minus(DASHBOARD_PERIOD).getEpochSecond();
        Map<String, Map<String, TestResults>> data = new TreeMap<>();
        for (ClassifiedEvent event : result.events()) {
            Series series = event.series();
            Datum datum = event.datum();
            if (datum.time() < periodStart || !isDashboardTest(series.testName())) {
                continue;
            }
            String testName = MERGED_TESTS.getOrDefault(series.testName(), series.testName());

            TestResults test = data.computeIfAbsent(series.branchName(), k -> new TreeMap<>())
                    .computeIfAbsent(testName, k -> new TestResults(series.testId()));
            PlatformResults platform = test.platforms.computeIfAbsent(series.platformName(),
                    k -> new PlatformResults(series.platformId(), chartUrls.apply(series)));
            platform.machines.computeIfAbsent(machineNames.apply(datum.machineId()), k -> new MachineResults())
                    .add(datum.time(), datum.value());
        }
        return data;
    }

    private boolean isDashboardTest(String testName) {
        return tests.map(names -> names.contains(testName)).orElse(true);
    }

    @RegisterForReflection
    static final class TestResults {

        private final int testId;
        private final Map<String, PlatformResults> platforms = new TreeMap<>();

        TestResults(int testId) {
            this.testId = testId;
        }

        @JsonProperty("_testid")
        public int getTestId() {
            return testId;
        }

        @JsonAnyGetter
        public Map<String, PlatformResults> getPlatforms() {
            return platforms;
        }
    }

    @RegisterForReflection
    static final class PlatformResults {

        private final int platformId;
        private final String graphUrl;
        private final Map<String, MachineResults> machines = new TreeMap<>();

        PlatformResults(int platformId, String graphUrl) {
            this.platformId = platformId;
            this.graphUrl = graphUrl;
        }

        @JsonProperty("_platformid")
        public int getPlatformId() {
            return platformId;
        }

        @JsonProperty("_graphURL")
        public String getGraphUrl() {
            return graphUrl;
        }

        @JsonAnyGetter
        public Map<String, MachineResults> getMachines() {
            return machines;
        }
    }

    /**
     * Flat list of (time, value) pairs and the [avg, max, min] of the values.
     */
    @RegisterForReflection
    static final class MachineResults {

        private final List<Number> results = new ArrayList<>();
        private double sum;
        private double max = Double.NEGATIVE_INFINITY;
        private double min = Double.POSITIVE_INFINITY;
        private int count;

        void add(long time, double value) {
            results.add(time);
            results.add(value);
            sum += value;
            max = Math.max(max, value);
            min = Math.min(min, value);
            count++;
        }

        public List<Number> getResults() {
            return results;
        }

        public List<Double> getStats() {
            return List.of(sum / count, max, min);
        }
    }
}
