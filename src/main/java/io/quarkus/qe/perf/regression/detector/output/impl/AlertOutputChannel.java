package io.quarkus.qe.perf.regression.detector.output.impl;

import io.quarkus.qe.perf.regression.detector.alert.AlertFactory;
import io.quarkus.qe.perf.regression.detector.alert.PlainTextAlertRenderer;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.machine.InactiveMachineWarning;
import io.quarkus.qe.perf.regression.detector.output.OutputChannel;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Prints alerts to the console and, if configured, to the output file.
 */
@Singleton
final class AlertOutputChannel implements OutputChannel {

    private final Logger logger;
    private final AlertFactory alertFactory;
    private final PlainTextAlertRenderer renderer;
    private String outputFilePath;
    private boolean catchup;

    AlertOutputChannel(Logger logger, AlertFactory alertFactory, PlainTextAlertRenderer renderer) {
        this.logger = logger;
        this.alertFactory = alertFactory;
        this.renderer = renderer;
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        this.outputFilePath = appConfig.outputFilePath();
        this.catchup = appConfig.catchup();
    }

    @Override
    public void process(AnalysisResult result) {
        if (catchup) {
            return;
        }
        StringBuilder output = new StringBuilder();
        for (ClassifiedEvent warning : result.warnings()) {
            String message = renderer.render(alertFactory.create(warning));
            logger.info(message);
            output.append(message).append('\n');
        }
        if (isFileConfigured()) {
            writeToFile(output.toString(), false);
        }
    }

    @Override
    public void processInactiveMachines(List<InactiveMachineWarning> warnings) {
        if (catchup || warnings.isEmpty()) {
            return;
        }
        StringBuilder output = new StringBuilder();
        for (InactiveMachineWarning warning : warnings) {
            logger.info(warning.message());
            output.append(warning.message()).append("\n\n");
        }
        if (isFileConfigured()) {
            writeToFile(output.toString(), true);
        }
    }

    private boolean isFileConfigured() {
        return outputFilePath != null && !outputFilePath.isBlank() && !"-".equals(outputFilePath);
    }

    private void writeToFile(String content, boolean append) {
        try {
            Path outputPath = Paths.get(outputFilePath);

            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }

            if (append) {
                Files.writeString(outputPath, content, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(outputPath, content);
                logger.info("Alerts saved to: " + outputPath.toAbsolutePath());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write alerts to file: " + outputFilePath, e);
        }
    }

}
