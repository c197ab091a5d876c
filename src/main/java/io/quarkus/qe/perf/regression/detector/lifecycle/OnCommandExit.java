package io.quarkus.qe.perf.regression.detector.lifecycle;

/**
 * Fired once when the command finishes, whether the analysis succeeded or not.
 * Observers persist whatever state they own.
 */
public record OnCommandExit() {
}
