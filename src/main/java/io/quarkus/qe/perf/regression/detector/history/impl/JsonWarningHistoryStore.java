package io.quarkus.qe.perf.regression.detector.history.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON file-based warning history:
 * <pre>
 * {
 *   "Firefox": { "Fedora 12": { "Ts": [ ["20231114000000", 1699920000] ] } },
 *   "bad_machines": { "talos-r3-fed-001": 1699920000 },
 *   "inactive_machines": { "talos-r3-fed-002": 1699920000 }
 * }
 * </pre>
 */
@Singleton
final class JsonWarningHistoryStore implements WarningHistoryStore {

    static final String INACTIVE_MACHINES = "inactive_machines";
    static final String BAD_MACHINES = "bad_machines";

    private final Logger logger;
    private final ObjectMapper objectMapper;
    private Path historyFile = Path.of("warning_history.json");

    JsonWarningHistoryStore(Logger logger) {
        this.logger = logger;
        this.objectMapper = StateFiles.objectMapper();
    }

    void loadConfig(@Observes AppConfig appConfig) {
        historyFile = Path.of(appConfig.historyFilePath());
    }

    @Override
    public HistoryData load(Instant cutoff) {
        try {
            if (!StateFiles.hasContent(historyFile)) {
                logger.info("No previous warning history found at " + historyFile + ", starting fresh");
                return HistoryData.empty();
            }
            logger.info("Loading warning history from: " + historyFile);
            HistoryData loaded = fromJson(objectMapper.readTree(historyFile.toFile()));
            HistoryData purged = loaded.purgeBefore(cutoff.getEpochSecond());
            int removed = loaded.warnedBuildCount() - purged.warnedBuildCount();
            if (removed > 0) {
                logger.debug("Removed " + removed + " warnings about measurements before " + cutoff);
            }
            return purged;
        } catch (IOException | RuntimeException e) {
            logger.error("Couldn't load warnings from " + historyFile, e);
            logger.error("Starting with empty warning history");
            return HistoryData.empty();
        }
    }

    @Override
    public void save(HistoryData history) {
        try {
            logger.info("Saving warning history to: " + historyFile);
            StateFiles.write(objectMapper, historyFile, toJson(history));
        } catch (IOException e) {
            logger.error("Failed to save warning history: " + e.getMessage());
            throw new UncheckedIOException("Failed to save warning history to " + historyFile, e);
        }
    }

    private static HistoryData fromJson(JsonNode root) throws IOException {
        if (!root.isObject()) {
            throw new IOException("Warning history must be a JSON object");
        }
        Map<String, Map<String, Map<String, List<WarnedBuild>>>> warnings = new TreeMap<>();
        Map<String, Long> inactiveMachines = new TreeMap<>();
        Map<String, Long> badMachines = new TreeMap<>();

        Iterator<Map.Entry<String, JsonNode>> branches = root.fields();
        while (branches.hasNext()) {
            Map.Entry<String, JsonNode> branch = branches.next();
            switch (branch.getKey()) {
                case INACTIVE_MACHINES -> readMachines(branch.getValue(), inactiveMachines);
                case BAD_MACHINES -> readMachines(branch.getValue(), badMachines);
                default -> warnings.put(branch.getKey(), readPlatforms(branch.getValue()));
            }
        }
        return new HistoryData(warnings, inactiveMachines, badMachines);
    }

    private static Map<String, Map<String, List<WarnedBuild>>> readPlatforms(JsonNode platformsNode) {
        Map<String, Map<String, List<WarnedBuild>>> platforms = new TreeMap<>();
        platformsNode.fields().forEachRemaining(platform -> {
            Map<String, List<WarnedBuild>> tests = new TreeMap<>();
            platform.getValue().fields().forEachRemaining(test -> {
                List<WarnedBuild> builds = new ArrayList<>();
                for (JsonNode entry : test.getValue()) {
                    builds.add(new WarnedBuild(entry.get(0).asText(), entry.get(1).asLong()));
                }
                tests.put(test.getKey(), builds);
            });
            platforms.put(platform.getKey(), tests);
        });
        return platforms;
    }

    private static void readMachines(JsonNode machinesNode, Map<String, Long> machines) {
        // older histories stored fractional seconds
        machinesNode.fields().forEachRemaining(machine -> machines.put(machine.getKey(),
                (long) machine.getValue().asDouble()));
    }

    private ObjectNode toJson(HistoryData history) {
        ObjectNode root = objectMapper.createObjectNode();
        Map<String, JsonNode> topLevel = new TreeMap<>();
        history.warnings().forEach((branch, platforms) -> {
            ObjectNode platformsNode = objectMapper.createObjectNode();
            platforms.forEach((platform, tests) -> {
                ObjectNode testsNode = platformsNode.putObject(platform);
                tests.forEach((test, builds) -> {
                    ArrayNode buildsNode = testsNode.putArray(test);
                    builds.forEach(build -> buildsNode.addArray().add(build.buildId()).add(build.timestamp()));
                });
            });
            topLevel.put(branch, platformsNode);
        });
        topLevel.put(INACTIVE_MACHINES, machinesToJson(history.inactiveMachines()));
        topLevel.put(BAD_MACHINES, machinesToJson(history.badMachines()));
        topLevel.forEach((key, value) -> root.set(key, value));
        return root;
    }

    private ObjectNode machinesToJson(Map<String, Long> machines) {
        ObjectNode node = objectMapper.createObjectNode();
        new TreeMap<>(machines).forEach((machine, timestamp) -> node.put(machine, timestamp.longValue()));
        return node;
    }
}
