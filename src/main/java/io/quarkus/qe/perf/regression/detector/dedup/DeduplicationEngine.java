package io.quarkus.qe.perf.regression.detector.dedup;

import io.quarkus.qe.perf.regression.detector.history.PersistedState;
import io.quarkus.qe.perf.regression.detector.history.WarningHistory;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Series;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Duration;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Decides which classified measurements are worth a warning, using the shared {@link WarningHistory}.
 */
@Singleton
public final class DeduplicationEngine {

    /**
     * Regressions and machine issues reported longer ago are never reported.
     */
    public static final Duration MAX_WARNING_AGE = Duration.ofDays(7);

    /**
     * At most one machine issue warning is sent per machine within this interval.
     */
    public static final Duration MACHINE_WARNING_INTERVAL = Duration.ofDays(7);

    private final Supplier<WarningHistory> warningHistory;
    private final IntFunction<String> machineNames;
    private final Clock clock;

    @Inject
    DeduplicationEngine(PersistedState persistedState, DataSource dataSource, Clock clock) {
        this(persistedState::warningHistory, dataSource::getMachineName, clock);
    }

    public DeduplicationEngine(Supplier<WarningHistory> warningHistory, IntFunction<String> machineNames, Clock clock) {
        this.warningHistory = warningHistory;
        this.machineNames = machineNames;
        this.clock = clock;
    }

    /**
     * @return a de-duplicator for the events of {@code series}, to be used by a single worker
     */
    public SeriesDeduplicator forSeries(Series series) {
        return new SeriesDeduplicator(series, warningHistory.get(), machineNames, clock);
    }

    /**
     * @return epoch second before which regressions and machine issues are dropped
     */
    public long warningCutoff() {
        return clock.instant().minus(MAX_WARNING_AGE).getEpochSecond();
    }
}
