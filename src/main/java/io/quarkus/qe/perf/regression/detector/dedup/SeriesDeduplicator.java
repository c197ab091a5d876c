package io.quarkus.qe.perf.regression.detector.dedup;

import io.quarkus.qe.perf.regression.detector.classify.ClassifiedDatum;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.history.WarningHistory;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;

import java.time.Clock;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * De-duplicates the events of one series, in the order the classifier produced them.
 * Not thread-safe; only the shared {@link WarningHistory} is accessed under the lock.
 */
public final class SeriesDeduplicator {

    private final Series series;
    private final WarningHistory warningHistory;
    private final IntFunction<String> machineNames;
    private final Clock clock;

    private Datum lastGood;
    private Datum lastError;
    private Datum lastErrorGood;

    SeriesDeduplicator(Series series, WarningHistory warningHistory, IntFunction<String> machineNames,
                       Clock clock) {
        this.series = series;
        this.warningHistory = warningHistory;
        this.machineNames = machineNames;
        this.clock = clock;
    }

    public ClassifiedEvent process(ClassifiedDatum classified) {
        Datum datum = classified.datum();
        State state = classified.state();

        if (state == State.GOOD) {
            lastError = null;
            lastGood = datum;
            return new ClassifiedEvent(series, datum, state, false, lastGood);
        }

        boolean skip = false;
        // recorded even when rate limiting suppresses the warning below
        if (!warningHistory.tryMarkWarned(series, datum.buildId(), datum.timestamp())) {
            skip = true;
        } else if (state == State.MACHINE) {
            String machineName = machineNames.apply(datum.machineId());
            long now = clock.instant().getEpochSecond();
            if (!warningHistory.tryMarkBadMachine(machineName, now, DeduplicationEngine.MACHINE_WARNING_INTERVAL)) {
                skip = true;
            }
        }

        if (lastError == null) {
            lastError = datum;
            lastErrorGood = lastGood;
        } else if (Objects.equals(lastErrorGood, lastGood)) {
            // no good measurement since the first error of this run of errors
            skip = true;
        }
        return new ClassifiedEvent(series, datum, state, skip, lastGood);
    }
}
