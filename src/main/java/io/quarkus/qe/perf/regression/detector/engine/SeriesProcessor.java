package io.quarkus.qe.perf.regression.detector.engine;

import io.quarkus.qe.perf.regression.detector.classify.AnalyzerSettings;
import io.quarkus.qe.perf.regression.detector.classify.SeriesClassifier;
import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.dedup.DeduplicationEngine;
import io.quarkus.qe.perf.regression.detector.dedup.SeriesDeduplicator;
import io.quarkus.qe.perf.regression.detector.graph.SeriesGraphWriter;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.pushdate.PushDateResolver;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Processes one series end to end: fetch, order by push date, classify, de-duplicate and draw.
 */
@Singleton
public final class SeriesProcessor implements SeriesHandler {

    private final Logger logger;
    private final DataSource dataSource;
    private final PushDateResolver pushDateResolver;
    private final SeriesClassifier classifier;
    private final DeduplicationEngine deduplicationEngine;
    private final SeriesGraphWriter graphWriter;
    private final AnalyzerSettings settings;
    private final Map<String, String> platformAliases;
    private Instant startTime = Instant.EPOCH;

    @Inject
    SeriesProcessor(Logger logger, DataSource dataSource, PushDateResolver pushDateResolver,
                    SeriesClassifier classifier, DeduplicationEngine deduplicationEngine,
                    SeriesGraphWriter graphWriter, AnalysisConfig config) {
        this(logger, dataSource, pushDateResolver, classifier, deduplicationEngine, graphWriter,
                AnalyzerSettings.from(config), config.platformAliases());
    }

    SeriesProcessor(Logger logger, DataSource dataSource, PushDateResolver pushDateResolver,
                    SeriesClassifier classifier, DeduplicationEngine deduplicationEngine,
                    SeriesGraphWriter graphWriter, AnalyzerSettings settings, Map<String, String> platformAliases) {
        this.logger = logger;
        this.dataSource = dataSource;
        this.pushDateResolver = pushDateResolver;
        this.classifier = classifier;
        this.deduplicationEngine = deduplicationEngine;
        this.graphWriter = graphWriter;
        this.settings = settings;
        this.platformAliases = platformAliases;
    }

    void loadConfig(@Observes AppConfig appConfig) {
        this.startTime = appConfig.startTime();
    }

    @Override
    public List<ClassifiedEvent> handle(Series rawSeries) {
        String alias = platformAliases.get(rawSeries.platformName());
        Series series = alias != null ? rawSeries.withPlatformName(alias) : rawSeries;
        logger.info("Processing " + series);

        List<Datum> data = dataSource.getTestData(series, startTime);
        data = pushDateResolver.applyPushDates(series.branchName(), data);

        SeriesDeduplicator deduplicator = deduplicationEngine.forSeries(series);
        List<ClassifiedEvent> events = classifier
                .classify(series, data, settings, deduplicationEngine.warningCutoff())
                .map(deduplicator::process)
                .toList();

        // the events are already recorded in the warning history, they must reach the output channels
        try {
            graphWriter.write(series, events);
        } catch (RuntimeException e) {
            logger.error("Failed to write graph of " + series, e);
        }
        return events;
    }
}
