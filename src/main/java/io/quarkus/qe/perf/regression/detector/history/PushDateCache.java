package io.quarkus.qe.perf.regression.detector.history;

import io.quarkus.qe.perf.regression.detector.engine.SharedLock;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Push dates already known, shared by all workers. Entries are written once and never replaced.
 */
public final class PushDateCache {

    private final SharedLock lock;
    private final Map<String, Map<String, Long>> pushDates = new HashMap<>();

    public PushDateCache(Map<String, Map<String, Long>> initial, SharedLock lock) {
        this.lock = lock;
        initial.forEach((branch, dates) -> {
            if (dates != null) {
                pushDates.put(branch, new HashMap<>(dates));
            }
        });
    }

    /**
     * @return push dates of those {@code revisions} that are cached
     */
    public Map<String, Long> lookup(String branch, Collection<String> revisions) {
        return lock.call(() -> {
            Map<String, Long> dates = pushDates.getOrDefault(branch, Map.of());
            Map<String, Long> found = new HashMap<>();
            for (String revision : revisions) {
                Long date = dates.get(revision);
                if (date != null) {
                    found.put(revision, date);
                }
            }
            return found;
        });
    }

    /**
     * Cache fetched push dates. Revisions cached meanwhile keep their existing date.
     *
     * @return the cached date of every fetched revision
     */
    public Map<String, Long> commit(String branch, Map<String, Long> fetched) {
        return lock.call(() -> {
            Map<String, Long> dates = pushDates.computeIfAbsent(branch, k -> new HashMap<>());
            Map<String, Long> effective = new HashMap<>();
            fetched.forEach((revision, date) -> {
                Long existing = dates.putIfAbsent(revision, date);
                effective.put(revision, existing != null ? existing : date);
            });
            return effective;
        });
    }

    public Map<String, Map<String, Long>> toData() {
        return lock.call(() -> {
            Map<String, Map<String, Long>> copy = new TreeMap<>();
            pushDates.forEach((branch, dates) -> copy.put(branch, new TreeMap<>(dates)));
            return copy;
        });
    }
}
