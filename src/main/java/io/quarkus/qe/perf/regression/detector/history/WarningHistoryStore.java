package io.quarkus.qe.perf.regression.detector.history;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persists the warnings already sent, so that the next execution does not repeat them.
 */
public interface WarningHistoryStore {

    /**
     * Load the warning history, dropping warnings about measurements reported before {@code cutoff}.
     * A missing or unreadable history is logged and yields {@link HistoryData#empty()}.
     */
    HistoryData load(Instant cutoff);

    /**
     * Replace the stored history with {@code history}.
     */
    void save(HistoryData history);

    /**
     * A build that has been warned about.
     *
     * @param buildId build identifier of the measurement
     * @param timestamp report time of the measurement, in epoch seconds
     */
    record WarnedBuild(String buildId, long timestamp) {
    }

    /**
     * Snapshot of the warning history.
     *
     * @param warnings branch, platform, test to the builds already warned about, in warning order
     * @param inactiveMachines machine name to the epoch second of the last inactivity warning
     * @param badMachines machine name to the epoch second of the last machine issue warning
     */
    record HistoryData(Map<String, Map<String, Map<String, List<WarnedBuild>>>> warnings,
                       Map<String, Long> inactiveMachines,
                       Map<String, Long> badMachines) {

        public HistoryData {
            warnings = copy(warnings);
            inactiveMachines = Map.copyOf(inactiveMachines);
            badMachines = Map.copyOf(badMachines);
        }

        public static HistoryData empty() {
            return new HistoryData(Map.of(), Map.of(), Map.of());
        }

        /**
         * Remove every warned build reported before {@code cutoff} and the test, platform and branch
         * entries left without warnings.
         */
        public HistoryData purgeBefore(long cutoff) {
            Map<String, Map<String, Map<String, List<WarnedBuild>>>> kept = new TreeMap<>();
            warnings.forEach((branch, platforms) -> platforms.forEach((platform, tests) -> tests.forEach(
                    (test, builds) -> {
                        List<WarnedBuild> recent = builds.stream()
                                .filter(build -> build.timestamp() >= cutoff)
                                .toList();
                        if (!recent.isEmpty()) {
                            kept.computeIfAbsent(branch, k -> new TreeMap<>())
                                    .computeIfAbsent(platform, k -> new TreeMap<>())
                                    .put(test, recent);
                        }
                    })));
            return new HistoryData(kept, inactiveMachines, badMachines);
        }

        public int warnedBuildCount() {
            return warnings.values().stream()
                    .flatMap(platforms -> platforms.values().stream())
                    .flatMap(tests -> tests.values().stream())
                    .mapToInt(List::size)
                    .sum();
        }

        private static Map<String, Map<String, Map<String, List<WarnedBuild>>>> copy(
                Map<String, Map<String, Map<String, List<WarnedBuild>>>> warnings) {
            Map<String, Map<String, Map<String, List<WarnedBuild>>>> result = new TreeMap<>();
            warnings.forEach((branch, platforms) -> {
                Map<String, Map<String, List<WarnedBuild>>> platformCopy = new TreeMap<>();
                platforms.forEach((platform, tests) -> {
                    Map<String, List<WarnedBuild>> testCopy = new TreeMap<>();
                    tests.forEach((test, builds) -> testCopy.put(test, List.copyOf(builds)));
                    platformCopy.put(platform, Collections.unmodifiableMap(testCopy));
                });
                result.put(branch, Collections.unmodifiableMap(platformCopy));
            });
            return Collections.unmodifiableMap(result);
        }
    }
}
