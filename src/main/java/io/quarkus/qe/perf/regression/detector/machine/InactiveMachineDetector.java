package io.quarkus.qe.perf.regression.detector.machine;

import io.quarkus.qe.perf.regression.detector.history.PersistedState;
import io.quarkus.qe.perf.regression.detector.history.WarningHistory;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Finds machines that stopped reporting results.
 */
@Singleton
public final class InactiveMachineDetector {

    public static final Duration INACTIVITY_LIMIT = Duration.ofHours(48);

    public static final Duration WARNING_INTERVAL = Duration.ofDays(7);

    private final Logger logger;
    private final Supplier<WarningHistory> warningHistory;
    private final IntFunction<String> machineNames;
    private final Clock clock;

    @Inject
    InactiveMachineDetector(Logger logger, PersistedState persistedState, DataSource dataSource, Clock clock) {
        this(logger, persistedState::warningHistory, dataSource::getMachineName, clock);
    }

    public InactiveMachineDetector(Logger logger, Supplier<WarningHistory> warningHistory,
                                   IntFunction<String> machineNames, Clock clock) {
        this.logger = logger;
        this.warningHistory = warningHistory;
        this.machineNames = machineNames;
        this.clock = clock;
    }

    /**
     * Records a warning for every machine whose latest measurement is older than {@link #INACTIVITY_LIMIT},
     * unless it was already warned about within {@link #WARNING_INTERVAL}.
     *
     * @return the warnings to deliver
     */
    public List<InactiveMachineWarning> detect(AnalysisResult result) {
        long now = clock.instant().getEpochSecond();
        long cutoff = now - INACTIVITY_LIMIT.toSeconds();
        WarningHistory history = warningHistory.get();
        List<InactiveMachineWarning> warnings = new ArrayList<>();
        for (Map.Entry<Integer, Long> machine : result.latestTimeByMachine().entrySet()) {
            if (machine.getValue() >= cutoff) {
                continue;
            }
            String machineName = machineNames.apply(machine.getKey());
            if (history.tryMarkInactiveMachine(machineName, now, WARNING_INTERVAL)) {
                warnings.add(new InactiveMachineWarning(machineName, machine.getValue()));
            } else {
                logger.debug("Machine " + machineName + " is inactive, already warned about");
            }
        }
        return warnings;
    }
}
