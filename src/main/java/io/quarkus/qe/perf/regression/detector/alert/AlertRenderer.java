package io.quarkus.qe.perf.regression.detector.alert;

/**
 * Turns an {@link Alert} into a message body.
 */
public interface AlertRenderer {

    String render(Alert alert);

}
