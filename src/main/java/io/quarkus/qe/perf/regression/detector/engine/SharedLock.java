package io.quarkus.qe.perf.regression.detector.engine;

import jakarta.inject.Singleton;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single mutual-exclusion lock shared by the series queue, the warning history,
 * the push date cache and the result aggregator.
 */
@Singleton
public final class SharedLock {

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T call(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
