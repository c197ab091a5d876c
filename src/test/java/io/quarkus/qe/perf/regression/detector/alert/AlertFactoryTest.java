package io.quarkus.qe.perf.regression.detector.alert;

import io.quarkus.qe.perf.regression.detector.TestData.FakeDataSource;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.quarkus.qe.perf.regression.detector.TestData.TS_FEDORA;
import static org.junit.jupiter.api.Assertions.*;

class AlertFactoryTest {

    private static final Datum GOOD = Datum.of(1, 400, 1_700_000_000L, "0123456789ab", "20231114000000", 1);
    private static final Datum BAD = Datum.of(1, 500, 1_700_086_400L, "ba9876543210", "20231115000000", 2);

    private final FakeDataSource dataSource = new FakeDataSource()
            .add(TS_FEDORA, List.of(GOOD, BAD, Datum.of(3, 450, 1_700_000_100L, null, "x", 1)))
            .machine(1, "talos-r3-fed-001")
            .machine(3, "talos-r3-fed-003");
    private final AlertFactory factory = new AlertFactory(dataSource, "https://graphs.example.org",
            "https://hg.example.org", branch -> "Firefox".equals(branch) ? Optional.of("mozilla-central")
            : Optional.empty());

    @Test
    void testRegressionAlert() {
        Alert alert = factory.create(new ClassifiedEvent(TS_FEDORA, BAD, State.REGRESSION, false, GOOD));

        assertEquals("Regression", alert.reason());
        assertEquals("increase", alert.direction());
        assertEquals(25.0, alert.changePercent(), 1e-9);
        assertEquals("Performance Regression: Ts increase 25.00% on Fedora 12 Firefox", alert.subject());
        assertEquals("talos-r3-fed-001", alert.badMachineName());
        assertEquals("https://hg.example.org/mozilla-central/pushloghtml?fromchange=0123456789ab&tochange=ba9876543210",
                alert.pushLogUrl());
        assertEquals("https://graphs.example.org/graph.html#tests=[{\"test\":16,\"branch\":1,\"machine\":1},"
                + "{\"test\":16,\"branch\":1,\"machine\":3}]&sel=1700000000,1700172800", alert.chartUrl());
    }

    @Test
    void testImprovementAlert() {
        Alert alert = factory.create(new ClassifiedEvent(TS_FEDORA, GOOD, State.REGRESSION, false, BAD));

        assertEquals("Improvement", alert.reason());
        assertEquals("decrease", alert.direction());
        assertEquals("20.00%", alert.formattedChange());
    }

    @Test
    void testMachineAlertComparesWithOtherMachines() {
        Datum other = Datum.of(3, 450, 1_700_000_100L, null, "x", 1);
        Datum outlier = Datum.of(1, 900, 1_700_000_200L, "ba9876543210", "y", 1).withLastOther(other);

        Alert alert = factory.create(new ClassifiedEvent(TS_FEDORA, outlier, State.MACHINE, false, GOOD));

        assertEquals(other, alert.good());
        assertEquals("talos-r3-fed-003", alert.goodMachineName());
        assertEquals("Suspected machine issue (talos-r3-fed-001)", alert.reason());
        assertEquals(100.0, alert.changePercent(), 1e-9);
        assertNull(alert.pushLogUrl());
    }

    @Test
    void testPushLogUrls() {
        assertEquals("https://hg.example.org/mozilla-central/rev/ba9876543210",
                factory.pushLogUrl("Firefox", null, "ba9876543210"));
        assertNull(factory.pushLogUrl("TraceMonkey", "0123456789ab", "ba9876543210"));
        assertNull(factory.pushLogUrl("Firefox", "0123456789ab", null));
    }

    @Test
    void testUndeliverableEventIsRejected() {
        ClassifiedEvent skipped = new ClassifiedEvent(TS_FEDORA, BAD, State.REGRESSION, true, GOOD);

        assertThrows(IllegalArgumentException.class, () -> factory.create(skipped));
    }
}
