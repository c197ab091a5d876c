package io.quarkus.qe.perf.regression.detector.classify;

import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;

/**
 * Tunable parameters handed to the {@link Analyzer}.
 */
public record AnalyzerSettings(int backWindow, int foreWindow, double threshold, double machineThreshold,
                               int machineHistorySize) {

    public static AnalyzerSettings from(AnalysisConfig config) {
        return new AnalyzerSettings(config.backWindow(), config.foreWindow(), config.threshold(),
                config.machineThreshold(), config.machineHistorySize());
    }
}
