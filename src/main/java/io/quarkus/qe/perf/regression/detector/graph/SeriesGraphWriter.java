package io.quarkus.qe.perf.regression.detector.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Series;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.IntFunction;

/**
 * Writes a flot graph of every processed series: {@code <branch>-<platform>-<test>.js} with the points
 * and an HTML page showing them.
 * Called by the workers, so every series must have its own files.
 */
@Singleton
public final class SeriesGraphWriter {

    static final String TEMPLATE_RESOURCE = "graph-template.html";

    private final Logger logger;
    private final Optional<Path> graphDir;
    private final IntFunction<String> machineNames;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Inject
    SeriesGraphWriter(Logger logger, AnalysisConfig config, DataSource dataSource) {
        this(logger, config.graphDir().map(Path::of), dataSource::getMachineName);
    }

    public SeriesGraphWriter(Logger logger, Optional<Path> graphDir, IntFunction<String> machineNames) {
        this.logger = logger;
        this.graphDir = graphDir;
        this.machineNames = machineNames;
    }

    public void write(Series series, List<ClassifiedEvent> events) {
        if (graphDir.isEmpty()) {
            return;
        }
        Path directory = graphDir.get();
        String baseName = series.branchName() + "-" + series.platformName() + "-" + series.testName();
        logger.debug("Creating graph " + baseName);

        String title = "Regression Graph for " + series.testName() + " on " + series.platformName() + " "
                + series.branchName();
        String html = loadTemplate()
                .replace("{title}", title)
                .replace("{graphFile}", baseName + ".js");
        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(baseName + ".html"), html);
            Files.writeString(directory.resolve(baseName + ".js"),
                    "var graph_data = " + objectMapper.writeValueAsString(toGraphs(events)) + ";");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph of " + series, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write graph of " + series + " to " + directory, e);
        }
    }

    List<Map<String, Object>> toGraphs(List<ClassifiedEvent> events) {
        List<List<Number>> all = new ArrayList<>();
        List<List<Number>> good = new ArrayList<>();
        List<List<Number>> regressions = new ArrayList<>();
        Map<Integer, List<List<Number>>> badMachines = new TreeMap<>();
        for (ClassifiedEvent event : events) {
            List<Number> point = List.of(event.datum().time() * 1000, event.datum().value());
            all.add(point);
            switch (event.state()) {
                case GOOD -> good.add(point);
                case REGRESSION -> regressions.add(point);
                case MACHINE -> badMachines.computeIfAbsent(event.datum().machineId(), k -> new ArrayList<>())
                        .add(point);
            }
        }

        List<Map<String, Object>> graphs = new ArrayList<>();
        graphs.add(graph("Value", all, null, false));
        graphs.add(graph("Smooth Value", good, "green", false));
        graphs.add(graph("Regressions", regressions, "red", true));
        badMachines.forEach((machineId, points) ->
                graphs.add(graph("Bad Machines (" + machineNames.apply(machineId) + ")", points, null, true)));
        return graphs;
    }

    private static Map<String, Object> graph(String label, List<List<Number>> data, String color, boolean pointsOnly) {
        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("label", label);
        graph.put("data", data);
        if (color != null) {
            graph.put("color", color);
        }
        if (pointsOnly) {
            graph.put("lines", Map.of("show", false));
            graph.put("points", Map.of("show", true));
        }
        return graph;
    }

    private static String loadTemplate() {
        try (InputStream template = SeriesGraphWriter.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (template == null) {
                throw new IllegalStateException("Graph template '" + TEMPLATE_RESOURCE + "' not found on classpath");
            }
            return new String(template.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph template", e);
        }
    }
}
