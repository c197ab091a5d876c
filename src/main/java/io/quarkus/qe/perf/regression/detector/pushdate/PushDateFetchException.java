package io.quarkus.qe.perf.regression.detector.pushdate;

/**
 * The push log could not be queried or answered with something that is not a push list.
 * Fails the series being processed; it is never retried.
 */
public class PushDateFetchException extends RuntimeException {

    public PushDateFetchException(String message) {
        super(message);
    }

    public PushDateFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
