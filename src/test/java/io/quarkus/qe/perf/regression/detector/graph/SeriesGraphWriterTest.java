package io.quarkus.qe.perf.regression.detector.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.qe.perf.regression.detector.TestLogger;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static io.quarkus.qe.perf.regression.detector.TestData.TS_FEDORA;
import static io.quarkus.qe.perf.regression.detector.TestData.datum;
import static org.junit.jupiter.api.Assertions.*;

class SeriesGraphWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testGraphFiles() throws IOException {
        List<ClassifiedEvent> events = List.of(
                new ClassifiedEvent(TS_FEDORA, datum(1, 100, 10, "b0"), State.GOOD, false, null),
                new ClassifiedEvent(TS_FEDORA, datum(1, 200, 20, "b1"), State.REGRESSION, false, null),
                new ClassifiedEvent(TS_FEDORA, datum(2, 900, 30, "b2"), State.MACHINE, false, null));
        Path graphDir = tempDir.resolve("graphs");

        new SeriesGraphWriter(new TestLogger(), Optional.of(graphDir), machineId -> "talos-" + machineId)
                .write(TS_FEDORA, events);

        String html = Files.readString(graphDir.resolve("Firefox-Fedora 12-Ts.html"));
        assertTrue(html.contains("<title>Regression Graph for Ts on Fedora 12 Firefox</title>"), html);
        assertTrue(html.contains("src=\"Firefox-Fedora 12-Ts.js\""), html);

        String script = Files.readString(graphDir.resolve("Firefox-Fedora 12-Ts.js"));
        assertTrue(script.startsWith("var graph_data = ") && script.endsWith(";"), script);
        JsonNode graphs = new ObjectMapper().readTree(script.substring("var graph_data = ".length(), script.length() - 1));

        assertEquals(4, graphs.size());
        assertEquals("Value", graphs.get(0).get("label").asText());
        assertEquals(3, graphs.get(0).get("data").size());
        assertEquals(10_000, graphs.get(0).get("data").get(0).get(0).asLong(), "Flot expects milliseconds");
        assertEquals("Smooth Value", graphs.get(1).get("label").asText());
        assertEquals("green", graphs.get(1).get("color").asText());
        assertEquals("Regressions", graphs.get(2).get("label").asText());
        assertFalse(graphs.get(2).get("lines").get("show").asBoolean());
        assertEquals(200.0, graphs.get(2).get("data").get(0).get(1).asDouble());
        assertEquals("Bad Machines (talos-2)", graphs.get(3).get("label").asText());
    }

    @Test
    void testNothingIsWrittenWithoutDirectory() {
        new SeriesGraphWriter(new TestLogger(), Optional.empty(), String::valueOf).write(TS_FEDORA, List.of());

        assertEquals(0, tempDir.toFile().list().length);
    }
}
