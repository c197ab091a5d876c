package io.quarkus.qe.perf.regression.detector.output.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.output.OutputChannel;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Exports every regression and machine issue found in this run, including already reported ones.
 */
@Singleton
final class JsonExportOutputChannel implements OutputChannel {

    private final Logger logger;
    private final Optional<Path> exportFile;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    @Inject
    JsonExportOutputChannel(Logger logger, AnalysisConfig config) {
        this(logger, config.json().map(Path::of));
    }

    JsonExportOutputChannel(Logger logger, Optional<Path> exportFile) {
        this.logger = logger;
        this.exportFile = exportFile;
    }

    @Override
    public void process(AnalysisResult result) {
        if (exportFile.isEmpty()) {
            return;
        }
        Map<String, Map<String, Map<String, List<ExportedWarning>>>> warnings = new TreeMap<>();
        for (ClassifiedEvent event : result.events()) {
            if (event.state() == State.GOOD || event.lastGood() == null) {
                continue;
            }
            warnings.computeIfAbsent(event.series().branchName(), k -> new TreeMap<>())
                    .computeIfAbsent(event.series().platformName(), k -> new TreeMap<>())
                    .computeIfAbsent(event.series().testName(), k -> new ArrayList<>())
                    .add(new ExportedWarning(event.state().label(), ExportedDatum.of(event.lastGood()),
                            ExportedDatum.of(event.datum())));
        }
        Path target = exportFile.get();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            objectMapper.writeValue(target.toFile(), warnings);
            logger.info("Warnings exported to: " + target.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export warnings to " + target, e);
        }
    }

    @RegisterForReflection
    record ExportedWarning(String type, ExportedDatum good, ExportedDatum bad) {
    }

    @RegisterForReflection
    record ExportedDatum(@JsonProperty("build_id") String buildId, @JsonProperty("machine_id") int machineId,
                         long timestamp, long time, String revision, double value) {

        static ExportedDatum of(Datum datum) {
            return new ExportedDatum(datum.buildId(), datum.machineId(), datum.timestamp(), datum.time(),
                    datum.revision(), datum.value());
        }
    }
}
