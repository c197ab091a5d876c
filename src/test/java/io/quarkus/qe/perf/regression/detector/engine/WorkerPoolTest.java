package io.quarkus.qe.perf.regression.detector.engine;

import io.quarkus.qe.perf.regression.detector.TestData;
import io.quarkus.qe.perf.regression.detector.TestLogger;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import io.quarkus.qe.perf.regression.detector.result.ResultAggregator;
import io.quarkus.qe.perf.regression.detector.source.Series;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    @TempDir
    Path tempDir;

    private final TestLogger logger = new TestLogger();
    private final SharedLock lock = new SharedLock();
    private final ResultAggregator aggregator = new ResultAggregator(lock);

    @Test
    void testEverySeriesIsProcessedOnce() {
        WorkerPool pool = pool(4);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        List<Series> series = series(20);

        PoolReport report = pool.run(series, s -> {
            threads.add(Thread.currentThread().getName());
            return List.of(event(s));
        }, aggregator);

        assertEquals(new PoolReport(20, 0, 0), report);
        AnalysisResult result = aggregator.snapshot();
        assertEquals(Set.copyOf(series), result.events().stream().map(ClassifiedEvent::series).collect(Collectors.toSet()));
        assertEquals(20, result.events().size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("regression-worker-")), threads.toString());
    }

    @Test
    void testFailingSeriesDoesNotStopOthers() {
        WorkerPool pool = pool(2);
        List<Series> series = series(10);

        PoolReport report = pool.run(series, s -> {
            if (s.testId() == 3) {
                throw new IllegalStateException("data source unavailable");
            }
            return List.of(event(s));
        }, aggregator);

        assertEquals(9, report.processed());
        assertEquals(1, report.failed());
        assertFalse(report.cancelled());
        assertEquals(9, aggregator.snapshot().events().size());
        assertTrue(logger.errorMessages().stream().anyMatch(m -> m.contains("Firefox XP T3")
                && m.contains("data source unavailable")), logger.errorMessages().toString());
    }

    @Test
    void testStopRequestLeavesRemainingSeries() {
        WorkerPool pool = pool(1);

        PoolReport report = pool.run(series(20), s -> {
            pool.requestStop();
            return List.of(event(s));
        }, aggregator);

        assertTrue(pool.isStopRequested());
        assertEquals(new PoolReport(1, 0, 19), report);
        assertTrue(report.cancelled());
        assertEquals(1, aggregator.snapshot().events().size(), "Results of finished series are kept");
        assertTrue(logger.infoMessages().contains("Exiting..."));
    }

    @Test
    void testNextRunStartsAfterStop() {
        WorkerPool pool = pool(1);
        pool.run(series(5), s -> {
            pool.requestStop();
            return List.of(event(s));
        }, aggregator);

        PoolReport report = pool.run(series(5), s -> List.of(event(s)), new ResultAggregator(lock));

        assertFalse(pool.isStopRequested());
        assertEquals(new PoolReport(5, 0, 0), report);
    }

    @Test
    void testSeriesAreProcessedConcurrently() {
        WorkerPool pool = pool(2);
        CountDownLatch bothRunning = new CountDownLatch(2);
        Set<Boolean> met = ConcurrentHashMap.newKeySet();

        pool.run(series(2), s -> {
            bothRunning.countDown();
            try {
                met.add(bothRunning.await(10, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        }, aggregator);

        assertEquals(Set.of(true), met);
    }

    private WorkerPool pool(int workers) {
        WorkerPool pool = new WorkerPool(logger, lock);
        AppConfig defaults = TestData.appConfig(tempDir);
        pool.loadConfig(new AppConfig(defaults.branches(), defaults.tests(), defaults.startTime(),
                defaults.outputFilePath(), false, List.of(), List.of(), defaults.dataFilePath(),
                defaults.historyFilePath(), defaults.pushDatesFilePath(), workers));
        return pool;
    }

    private static List<Series> series(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Series("Firefox", 1, "XP", 5, "T" + i, i))
                .toList();
    }

    private static ClassifiedEvent event(Series series) {
        return new ClassifiedEvent(series, TestData.datum(1, 100, 1000, "b" + series.testId()), State.GOOD, false,
                null);
    }
}
