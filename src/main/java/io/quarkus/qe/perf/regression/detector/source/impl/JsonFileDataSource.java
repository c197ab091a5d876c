package io.quarkus.qe.perf.regression.detector.source.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;
import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Reads all measurements from a single JSON document:
 * <pre>
 * {
 *   "machines": { "1": "talos-r3-fed-001" },
 *   "series": [ { "branchName": "Firefox", "branchId": 1, "platformName": "Fedora 12", "platformId": 12,
 *                 "testName": "Ts", "testId": 16,
 *                 "data": [ { "machineId": 1, "value": 512.0, "timestamp": 1700000000,
 *                             "revision": "0123456789ab", "buildId": "20231114000000", "runNumber": 1 } ] } ]
 * }
 * </pre>
 * The document is read once, on first use, and is never modified afterwards.
 */
@Singleton
final class JsonFileDataSource implements DataSource {

    private final Logger logger;
    private final ObjectMapper objectMapper;
    private Path dataFile = Path.of("perf-data.json");
    private volatile DataDocument document;

    JsonFileDataSource(Logger logger) {
        this.logger = logger;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    void loadConfig(@Observes AppConfig appConfig) {
        this.dataFile = Path.of(appConfig.dataFilePath());
        this.document = null;
    }

    @Override
    public List<Series> getTestSeries(List<String> branches, Instant startTime, List<String> tests) {
        long start = startTime.getEpochSecond();
        return document().series().stream()
                .filter(s -> branches.contains(s.branchName()))
                .filter(s -> tests.isEmpty() || tests.contains(s.testName()))
                .filter(s -> s.data().stream().anyMatch(d -> d.timestamp() >= start))
                .map(SeriesDocument::toSeries)
                .toList();
    }

    @Override
    public List<Datum> getTestData(Series series, Instant startTime) {
        long start = startTime.getEpochSecond();
        return find(series).data().stream()
                .filter(d -> d.timestamp() >= start)
                .map(DatumDocument::toDatum)
                .toList();
    }

    @Override
    public String getMachineName(int machineId) {
        String name = document().machines().get(String.valueOf(machineId));
        return name != null ? name : String.valueOf(machineId);
    }

    @Override
    public List<Integer> getMachinesForTest(Series series) {
        return find(series).data().stream()
                .map(DatumDocument::machineId)
                .distinct()
                .sorted()
                .toList();
    }

    private SeriesDocument find(Series series) {
        return document().series().stream()
                .filter(s -> s.branchId() == series.branchId()
                        && s.platformId() == series.platformId()
                        && s.testId() == series.testId())
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown series: " + series));
    }

    private DataDocument document() {
        DataDocument current = document;
        if (current == null) {
            synchronized (this) {
                current = document;
                if (current == null) {
                    current = read();
                    document = current;
                }
            }
        }
        return current;
    }

    private DataDocument read() {
        if (!Files.exists(dataFile)) {
            throw new IllegalStateException("Measurement data file not found: " + dataFile.toAbsolutePath());
        }
        try {
            logger.info("Loading measurements from: " + dataFile);
            DataDocument loaded = objectMapper.readValue(dataFile.toFile(), DataDocument.class);
            return new DataDocument(
                    loaded.machines() == null ? Map.of() : loaded.machines(),
                    loaded.series() == null ? List.of() : loaded.series());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read measurement data from " + dataFile, e);
        }
    }

    @RegisterForReflection
    record DataDocument(Map<String, String> machines, List<SeriesDocument> series) {
    }

    @RegisterForReflection
    record SeriesDocument(String branchName, int branchId, String platformName, int platformId, String testName,
                          int testId, List<DatumDocument> data) {

        SeriesDocument {
            data = data == null ? List.of() : List.copyOf(data);
        }

        Series toSeries() {
            return new Series(branchName, branchId, platformName, platformId, testName, testId);
        }
    }

    @RegisterForReflection
    record DatumDocument(int machineId, double value, long timestamp, String revision, String buildId,
                         int runNumber) {

        Datum toDatum() {
            return Datum.of(machineId, value, timestamp, revision, buildId, runNumber);
        }
    }
}
