package io.quarkus.qe.perf.regression.detector.history;

import io.quarkus.qe.perf.regression.detector.engine.SharedLock;
import io.quarkus.qe.perf.regression.detector.lifecycle.OnCommandExit;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.time.Instant;

/**
 * Owns the warning history and the push date cache for one execution: loaded before the workers start,
 * saved when the command exits, whatever the outcome of the analysis.
 */
@Singleton
public final class PersistedState {

    private final Logger logger;
    private final WarningHistoryStore warningHistoryStore;
    private final PushDateStore pushDateStore;
    private final SharedLock lock;

    private volatile WarningHistory warningHistory;
    private volatile PushDateCache pushDateCache;

    public PersistedState(Logger logger, WarningHistoryStore warningHistoryStore, PushDateStore pushDateStore,
                   SharedLock lock) {
        this.logger = logger;
        this.warningHistoryStore = warningHistoryStore;
        this.pushDateStore = pushDateStore;
        this.lock = lock;
    }

    /**
     * @param cutoff warnings about measurements reported before this instant are forgotten
     */
    public void load(Instant cutoff) {
        WarningHistoryStore.HistoryData history = warningHistoryStore.load(cutoff);
        logger.info("Loaded warning history: " + history.warnedBuildCount() + " warned builds, "
                + history.badMachines().size() + " bad machines, "
                + history.inactiveMachines().size() + " inactive machines");
        WarningHistory loadedHistory = new WarningHistory(history, lock);
        PushDateCache loadedPushDates = new PushDateCache(pushDateStore.load(), lock);
        // both or neither, save relies on it
        pushDateCache = loadedPushDates;
        warningHistory = loadedHistory;
    }

    public boolean isLoaded() {
        return warningHistory != null;
    }

    public WarningHistory warningHistory() {
        requireLoaded();
        return warningHistory;
    }

    public PushDateCache pushDateCache() {
        requireLoaded();
        return pushDateCache;
    }

    void save(@Observes OnCommandExit ignored) {
        if (!isLoaded()) {
            logger.info("State was never loaded, skipping save");
            return;
        }
        IllegalStateException failure = null;
        try {
            warningHistoryStore.save(warningHistory.toData());
        } catch (RuntimeException e) {
            failure = new IllegalStateException("Failed to save the warning history", e);
        }
        try {
            pushDateStore.save(pushDateCache.toData());
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = new IllegalStateException("Failed to save the push date cache", e);
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void requireLoaded() {
        if (!isLoaded()) {
            throw new IllegalStateException("Persisted state has not been loaded");
        }
    }
}
