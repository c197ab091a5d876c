package io.quarkus.qe.perf.regression.detector.engine;

import io.quarkus.arc.All;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.history.PersistedState;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.machine.InactiveMachineDetector;
import io.quarkus.qe.perf.regression.detector.machine.InactiveMachineWarning;
import io.quarkus.qe.perf.regression.detector.output.OutputChannel;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import io.quarkus.qe.perf.regression.detector.result.ResultAggregator;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Series;
import jakarta.enterprise.context.Dependent;

import java.util.List;
import java.util.function.Consumer;

/**
 * Runs one analysis: load the persisted state, process all series on the worker pool, then drive the
 * output channels. Saving the state is left to the {@code OnCommandExit} observers.
 */
@Dependent // this bean is stateful, so keep it in "command execution scope"
public class RegressionAnalysisRunner {

    private final Logger logger;
    private final PersistedState persistedState;
    private final DataSource dataSource;
    private final WorkerPool workerPool;
    private final SeriesProcessor seriesProcessor;
    private final ResultAggregator aggregator;
    private final InactiveMachineDetector inactiveMachineDetector;
    private final List<OutputChannel> outputChannels;

    RegressionAnalysisRunner(Logger logger, PersistedState persistedState, DataSource dataSource,
                             WorkerPool workerPool, SeriesProcessor seriesProcessor, ResultAggregator aggregator,
                             InactiveMachineDetector inactiveMachineDetector,
                             @All List<OutputChannel> outputChannels) {
        this.logger = logger;
        this.persistedState = persistedState;
        this.dataSource = dataSource;
        this.workerPool = workerPool;
        this.seriesProcessor = seriesProcessor;
        this.aggregator = aggregator;
        this.inactiveMachineDetector = inactiveMachineDetector;
        this.outputChannels = outputChannels;
    }

    public AnalysisResult run(AppConfig appConfig) {
        persistedState.load(appConfig.startTime());

        List<Series> series = dataSource.getTestSeries(appConfig.branches(), appConfig.startTime(), appConfig.tests());
        logger.info("Found " + series.size() + " series on " + String.join(", ", appConfig.branches()));

        PoolReport report = workerPool.run(series, seriesProcessor, aggregator);
        AnalysisResult result = aggregator.snapshot();
        logger.info("Found " + result.warnings().size() + " new warnings in " + result.events().size() + " measurements");

        forEachChannel(channel -> channel.process(result));

        if (appConfig.catchup()) {
            logger.debug("Catch-up mode, not looking for inactive machines");
        } else if (report.cancelled()) {
            logger.info("Analysis was interrupted, not looking for inactive machines");
        } else {
            List<InactiveMachineWarning> inactive = inactiveMachineDetector.detect(result);
            if (!inactive.isEmpty()) {
                forEachChannel(channel -> channel.processInactiveMachines(inactive));
            }
        }
        return result;
    }

    private void forEachChannel(Consumer<OutputChannel> action) {
        for (OutputChannel channel : outputChannels) {
            try {
                action.accept(channel);
            } catch (RuntimeException e) {
                logger.error("Output channel " + channel.name() + " failed", e);
            }
        }
    }
}
