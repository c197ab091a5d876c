package io.quarkus.qe.perf.regression.detector.history;

import io.quarkus.qe.perf.regression.detector.engine.SharedLock;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore.HistoryData;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore.WarnedBuild;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.quarkus.qe.perf.regression.detector.TestData.TS_FEDORA;
import static io.quarkus.qe.perf.regression.detector.TestData.isWarned;
import static org.junit.jupiter.api.Assertions.*;

class WarningHistoryTest {

    private static final Duration WEEK = Duration.ofDays(7);
    private static final long NOW = 1_700_000_000L;

    @Test
    void testWarnedBuildIsRecordedOnce() {
        WarningHistory history = new WarningHistory(HistoryData.empty(), new SharedLock());

        assertFalse(isWarned(history, TS_FEDORA, "b1", 200));
        assertTrue(history.tryMarkWarned(TS_FEDORA, "b1", 200));
        assertFalse(history.tryMarkWarned(TS_FEDORA, "b1", 200), "Second claim of the same build must fail");
        assertTrue(isWarned(history, TS_FEDORA, "b1", 200));
        assertTrue(history.tryMarkWarned(TS_FEDORA, "b1", 201), "Same build reported at another time is different");

        assertEquals(List.of(new WarnedBuild("b1", 200), new WarnedBuild("b1", 201)),
                history.toData().warnings().get("Firefox").get("Fedora 12").get("Ts"));
    }

    @Test
    void testLoadedWarningsAreKnown() {
        HistoryData data = new HistoryData(
                Map.of("Firefox", Map.of("Fedora 12", Map.of("Ts", List.of(new WarnedBuild("b1", 200))))),
                Map.of(), Map.of());
        WarningHistory history = new WarningHistory(data, new SharedLock());

        assertTrue(isWarned(history, TS_FEDORA, "b1", 200));
        assertFalse(history.tryMarkWarned(TS_FEDORA, "b1", 200));
        assertEquals(1, history.toData().warnedBuildCount());
    }

    @Test
    void testBadMachineWarningIsRateLimited() {
        WarningHistory history = new WarningHistory(HistoryData.empty(), new SharedLock());

        assertTrue(history.tryMarkBadMachine("talos-r3-fed-001", NOW, WEEK));
        assertFalse(history.tryMarkBadMachine("talos-r3-fed-001", NOW + 3600, WEEK));
        assertEquals(Map.of("talos-r3-fed-001", NOW), history.toData().badMachines(),
                "Suppressed warning must not move the last warning time");
        assertTrue(history.tryMarkBadMachine("talos-r3-fed-002", NOW + 3600, WEEK));
        assertTrue(history.tryMarkBadMachine("talos-r3-fed-001", NOW + WEEK.toSeconds() + 1, WEEK));
    }

    @Test
    void testInactiveMachineWarningIsRateLimited() {
        HistoryData data = new HistoryData(Map.of(), Map.of("talos-r3-fed-001", NOW - WEEK.toSeconds() - 1),
                Map.of());
        WarningHistory history = new WarningHistory(data, new SharedLock());

        assertTrue(history.tryMarkInactiveMachine("talos-r3-fed-001", NOW, WEEK));
        assertFalse(history.tryMarkInactiveMachine("talos-r3-fed-001", NOW + 3600, WEEK));
        assertEquals(Map.of("talos-r3-fed-001", NOW), history.toData().inactiveMachines());
    }

    @Test
    void testPurgeDropsOldBuildsAndEmptyEntries() {
        HistoryData data = new HistoryData(Map.of(
                "Firefox", Map.of("Fedora 12", Map.of(
                        "Ts", List.of(new WarnedBuild("old", 100), new WarnedBuild("new", 300)),
                        "Tp4", List.of(new WarnedBuild("old", 100)))),
                "TraceMonkey", Map.of("XP", Map.of("Ts", List.of(new WarnedBuild("old", 50))))),
                Map.of("m1", 10L), Map.of("m2", 20L));

        HistoryData purged = data.purgeBefore(200);

        assertEquals(Map.of("Firefox", Map.of("Fedora 12", Map.of("Ts", List.of(new WarnedBuild("new", 300))))),
                purged.warnings());
        assertEquals(Map.of("m1", 10L), purged.inactiveMachines());
        assertEquals(Map.of("m2", 20L), purged.badMachines());
    }

    @Test
    void testHistoryDataImmutability() {
        HistoryData data = HistoryData.empty();

        assertThrows(UnsupportedOperationException.class, () -> data.badMachines().put("m1", 1L));
        assertThrows(UnsupportedOperationException.class, () -> data.warnings().put("Firefox", Map.of()));
    }
}
