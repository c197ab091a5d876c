package io.quarkus.qe.perf.regression.detector.logger;

public interface Logger {

    void info(String logMessage);

    void error(String logMessage);

    default void error(String logMessage, Throwable throwable) {
        error(logMessage + ": " + throwable);
    }

    default void debug(String logMessage) {
    }

}
