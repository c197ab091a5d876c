package io.quarkus.qe.perf.regression.detector.history.impl;

import io.quarkus.qe.perf.regression.detector.TestData;
import io.quarkus.qe.perf.regression.detector.TestLogger;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore.HistoryData;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore.WarnedBuild;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test JSON warning history persistence.
 */
class JsonWarningHistoryStoreTest {

    @TempDir
    Path tempDir;

    private final TestLogger logger = new TestLogger();
    private JsonWarningHistoryStore store;
    private Path historyFile;

    @BeforeEach
    void setUp() {
        store = new JsonWarningHistoryStore(logger);
        store.loadConfig(TestData.appConfig(tempDir));
        historyFile = tempDir.resolve("warning_history.json");
    }

    @Test
    void testMissingFileStartsEmpty() {
        HistoryData loaded = store.load(Instant.EPOCH);

        assertEquals(0, loaded.warnedBuildCount());
        assertTrue(loaded.badMachines().isEmpty());
        assertTrue(logger.errorMessages().isEmpty());
    }

    @Test
    void testEmptyFileStartsEmpty() throws IOException {
        Files.createFile(historyFile);

        assertEquals(HistoryData.empty(), store.load(Instant.EPOCH));
    }

    @Test
    void testCorruptedFileStartsEmpty() throws IOException {
        Files.writeString(historyFile, "{\"Firefox\": [");

        HistoryData loaded = store.load(Instant.EPOCH);

        assertEquals(HistoryData.empty(), loaded);
        assertTrue(logger.errorMessages().stream().anyMatch(m -> m.startsWith("Couldn't load warnings")),
                "Load failure should be logged: " + logger.errorMessages());
    }

    @Test
    void testSaveAndLoad() {
        HistoryData history = new HistoryData(
                Map.of("Firefox", Map.of("Fedora 12", Map.of("Ts", List.of(new WarnedBuild("b1", 200),
                        new WarnedBuild("b2", 300))))),
                Map.of("talos-r3-fed-002", 1_700_000_100L),
                Map.of("talos-r3-fed-001", 1_700_000_000L));

        store.save(history);

        assertTrue(Files.exists(historyFile));
        assertFalse(Files.exists(tempDir.resolve("warning_history.json.tmp")), "Temporary file must be moved");
        assertEquals(history, store.load(Instant.EPOCH));
    }

    @Test
    void testLoadPurgesWarningsBeforeCutoff() throws IOException {
        Files.writeString(historyFile, """
                {
                  "Firefox": {"Fedora 12": {"Ts": [["b1", 100], ["b2", 300]]}},
                  "bad_machines": {"talos-r3-fed-001": 1699920000.25},
                  "inactive_machines": {}
                }
                """);

        HistoryData loaded = store.load(Instant.ofEpochSecond(200));

        assertEquals(List.of(new WarnedBuild("b2", 300)), loaded.warnings().get("Firefox").get("Fedora 12").get("Ts"));
        assertEquals(1_699_920_000L, loaded.badMachines().get("talos-r3-fed-001"));
    }

    @Test
    void testSavedDocumentLayout() throws IOException {
        store.save(new HistoryData(Map.of("Firefox", Map.of("XP", Map.of("Ts", List.of(new WarnedBuild("b1", 5))))),
                Map.of(), Map.of("m1", 7L)));

        String json = Files.readString(historyFile).replaceAll("\\s", "");

        assertTrue(json.contains("\"Firefox\":{\"XP\":{\"Ts\":[[\"b1\",5]]}}"), json);
        assertTrue(json.contains("\"bad_machines\":{\"m1\":7}"), json);
        assertTrue(json.contains("\"inactive_machines\":{}"), json);
    }
}
