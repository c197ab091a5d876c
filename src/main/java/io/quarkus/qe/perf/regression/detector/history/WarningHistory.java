package io.quarkus.qe.perf.regression.detector.history;

import io.quarkus.qe.perf.regression.detector.engine.SharedLock;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore.HistoryData;
import io.quarkus.qe.perf.regression.detector.history.WarningHistoryStore.WarnedBuild;
import io.quarkus.qe.perf.regression.detector.source.Series;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Warnings already sent, shared by all workers. Every operation runs under the {@link SharedLock}.
 */
public final class WarningHistory {

    private final SharedLock lock;
    private final Map<String, Map<String, Map<String, Set<WarnedBuild>>>> warnings = new HashMap<>();
    private final Map<String, Long> inactiveMachines = new HashMap<>();
    private final Map<String, Long> badMachines = new HashMap<>();

    public WarningHistory(HistoryData data, SharedLock lock) {
        this.lock = lock;
        data.warnings().forEach((branch, platforms) -> platforms.forEach((platform, tests) -> tests.forEach(
                (test, builds) -> builds(branch, platform, test).addAll(builds))));
        inactiveMachines.putAll(data.inactiveMachines());
        badMachines.putAll(data.badMachines());
    }

    /**
     * Record that the measurement of {@code buildId} reported at {@code timestamp} is warned about.
     *
     * @return false if it had already been recorded, in which case nothing changes
     */
    public boolean tryMarkWarned(Series series, String buildId, long timestamp) {
        WarnedBuild build = new WarnedBuild(buildId, timestamp);
        return lock.call(() -> builds(series.branchName(), series.platformName(), series.testName()).add(build));
    }

    /**
     * Claim the machine issue warning for {@code machineName} unless one was sent within {@code rateLimit}.
     *
     * @return true if the warning may be sent, the claim is then recorded at {@code now}
     */
    public boolean tryMarkBadMachine(String machineName, long now, Duration rateLimit) {
        return lock.call(() -> {
            Long last = badMachines.get(machineName);
            if (last != null && last > now - rateLimit.toSeconds()) {
                return false;
            }
            badMachines.put(machineName, now);
            return true;
        });
    }

    /**
     * Claim the inactivity warning for {@code machineName} unless one was sent within {@code rateLimit}.
     *
     * @return true if the warning may be sent, the claim is then recorded at {@code now}
     */
    public boolean tryMarkInactiveMachine(String machineName, long now, Duration rateLimit) {
        return lock.call(() -> {
            if (inactiveMachines.getOrDefault(machineName, 0L) >= now - rateLimit.toSeconds()) {
                return false;
            }
            inactiveMachines.put(machineName, now);
            return true;
        });
    }

    public HistoryData toData() {
        return lock.call(() -> {
            Map<String, Map<String, Map<String, List<WarnedBuild>>>> copy = new TreeMap<>();
            warnings.forEach((branch, platforms) -> platforms.forEach((platform, tests) -> tests.forEach(
                    (test, builds) -> copy.computeIfAbsent(branch, k -> new TreeMap<>())
                            .computeIfAbsent(platform, k -> new TreeMap<>())
                            .put(test, new ArrayList<>(builds)))));
            return new HistoryData(copy, inactiveMachines, badMachines);
        });
    }

    private Set<WarnedBuild> builds(String branch, String platform, String test) {
        return warnings.computeIfAbsent(branch, k -> new HashMap<>())
                .computeIfAbsent(platform, k -> new HashMap<>())
                .computeIfAbsent(test, k -> new LinkedHashSet<>());
    }
}
