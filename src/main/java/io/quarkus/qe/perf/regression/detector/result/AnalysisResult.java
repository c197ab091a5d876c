package io.quarkus.qe.perf.regression.detector.result;

import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only view of every event produced by a run, in the order workers appended them.
 */
public record AnalysisResult(List<ClassifiedEvent> events) {

    public AnalysisResult {
        events = List.copyOf(events);
    }

    /**
     * @return events people must be warned about
     */
    public List<ClassifiedEvent> warnings() {
        return events.stream()
                .filter(ClassifiedEvent::isDeliverable)
                .toList();
    }

    /**
     * @return events grouped by branch, platform and test name, all sorted by name
     */
    public Map<String, Map<String, Map<String, List<ClassifiedEvent>>>> byBranchPlatformTest() {
        Map<String, Map<String, Map<String, List<ClassifiedEvent>>>> partition = new TreeMap<>();
        for (ClassifiedEvent event : events) {
            partition.computeIfAbsent(event.series().branchName(), k -> new TreeMap<>())
                    .computeIfAbsent(event.series().platformName(), k -> new TreeMap<>())
                    .computeIfAbsent(event.series().testName(), k -> new ArrayList<>())
                    .add(event);
        }
        return Collections.unmodifiableMap(partition);
    }

    /**
     * @return the latest measurement time of every machine that reported in this run
     */
    public Map<Integer, Long> latestTimeByMachine() {
        Map<Integer, Long> latest = new TreeMap<>();
        for (ClassifiedEvent event : events) {
            latest.merge(event.datum().machineId(), event.datum().time(), Math::max);
        }
        return latest;
    }
}
