package io.quarkus.qe.perf.regression.detector.history.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.history.PushDateStore;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@Singleton
final class JsonPushDateStore implements PushDateStore {

    private static final TypeReference<Map<String, Map<String, Long>>> PUSH_DATES_TYPE = new TypeReference<>() {
    };

    private final Logger logger;
    private final ObjectMapper objectMapper;
    private Path pushDatesFile = Path.of("pushdates.json");

    JsonPushDateStore(Logger logger) {
        this.logger = logger;
        this.objectMapper = StateFiles.objectMapper();
    }

    void loadConfig(@Observes AppConfig appConfig) {
        pushDatesFile = Path.of(appConfig.pushDatesFilePath());
    }

    @Override
    public Map<String, Map<String, Long>> load() {
        try {
            if (!StateFiles.hasContent(pushDatesFile)) {
                logger.info("No push date cache found at " + pushDatesFile + ", starting fresh");
                return new HashMap<>();
            }
            Map<String, Map<String, Long>> loaded = objectMapper.readValue(pushDatesFile.toFile(), PUSH_DATES_TYPE);
            Map<String, Map<String, Long>> pushDates = new HashMap<>();
            if (loaded == null) {
                return pushDates;
            }
            loaded.forEach((branch, dates) -> {
                if (dates == null) {
                    logger.error("Ignoring push dates of branch " + branch + ", expected an object");
                    return;
                }
                Map<String, Long> known = new HashMap<>();
                dates.forEach((revision, date) -> {
                    if (date != null) {
                        known.put(revision, date);
                    }
                });
                pushDates.put(branch, known);
            });
            logger.debug("Loaded push dates of " + pushDates.size() + " branches from " + pushDatesFile);
            return pushDates;
        } catch (IOException | RuntimeException e) {
            logger.error("Couldn't load push dates from " + pushDatesFile, e);
            return new HashMap<>();
        }
    }

    @Override
    public void save(Map<String, Map<String, Long>> pushDates) {
        try {
            logger.info("Saving push dates to: " + pushDatesFile);
            StateFiles.write(objectMapper, pushDatesFile, pushDates);
        } catch (IOException e) {
            logger.error("Failed to save push dates: " + e.getMessage());
            throw new UncheckedIOException("Failed to save push dates to " + pushDatesFile, e);
        }
    }
}
