package io.quarkus.qe.perf.regression.detector.engine;

import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.result.ResultAggregator;
import io.quarkus.qe.perf.regression.detector.source.Series;
import io.quarkus.runtime.Shutdown;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of workers draining a shared queue of series.
 * <p>
 * Each worker takes one series at a time and processes it end to end. A failing series is logged and
 * the worker moves on to the next one. A stop request prevents workers from taking another series but
 * never interrupts one in progress.
 */
@Singleton
public final class WorkerPool {

    public static final int DEFAULT_WORKERS = 4;

    private final Logger logger;
    private final SharedLock lock;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final AtomicBoolean running = new AtomicBoolean();
    private int workers = DEFAULT_WORKERS;

    public WorkerPool(Logger logger, SharedLock lock) {
        this.logger = logger;
        this.lock = lock;
    }

    void loadConfig(@Observes AppConfig appConfig) {
        this.workers = Math.max(1, appConfig.workers());
    }

    public PoolReport run(List<Series> series, SeriesHandler handler, ResultAggregator aggregator) {
        Deque<Series> queue = new ArrayDeque<>(series);
        AtomicInteger processed = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger threadCounter = new AtomicInteger();

        logger.info("Processing " + series.size() + " series with " + workers + " workers");
        ExecutorService executor = Executors.newFixedThreadPool(workers,
                r -> new Thread(r, "regression-worker-" + threadCounter.incrementAndGet()));
        stopRequested.set(false);
        running.set(true);
        try {
            for (int i = 0; i < workers; i++) {
                executor.execute(() -> drain(queue, handler, aggregator, processed, failed));
            }
            executor.shutdown();
            awaitWorkers(executor);
        } finally {
            running.set(false);
        }

        int notStarted = lock.call(queue::size);
        PoolReport report = new PoolReport(processed.get(), failed.get(), notStarted);
        logger.info("Processed " + report.processed() + " series, " + report.failed() + " failed"
                + (report.cancelled() ? ", " + notStarted + " not started" : ""));
        return report;
    }

    /**
     * Let workers finish the series they are processing and stop taking new ones.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            logger.info("Exiting...");
        }
    }

    boolean isStopRequested() {
        return stopRequested.get();
    }

    @Shutdown
    void stopOnShutdown() {
        if (running.get()) {
            requestStop();
        }
    }

    private void drain(Deque<Series> queue, SeriesHandler handler, ResultAggregator aggregator,
                       AtomicInteger processed, AtomicInteger failed) {
        while (!stopRequested.get()) {
            Series next = lock.call(queue::pollLast);
            if (next == null) {
                return;
            }
            SeriesOutcome outcome = process(next, handler);
            if (outcome.isFailure()) {
                failed.incrementAndGet();
                logger.error("Failed to process " + next, outcome.failure());
            } else {
                aggregator.append(outcome.events());
                processed.incrementAndGet();
            }
        }
    }

    private static SeriesOutcome process(Series series, SeriesHandler handler) {
        try {
            return SeriesOutcome.success(series, handler.handle(series));
        } catch (RuntimeException e) {
            return SeriesOutcome.failure(series, e);
        }
    }

    private void awaitWorkers(ExecutorService executor) {
        boolean interrupted = false;
        while (true) {
            try {
                if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                interrupted = true;
                requestStop();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
