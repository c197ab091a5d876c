package io.quarkus.qe.perf.regression.detector.machine;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * @param machineName machine that stopped reporting
 * @param lastSeen time of its latest measurement, epoch seconds
 */
public record InactiveMachineWarning(String machineName, long lastSeen) {

    private static final DateTimeFormatter LAST_SEEN_FORMAT = DateTimeFormatter
            .ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ROOT)
            .withZone(ZoneId.systemDefault());

    public String subject() {
        return "Inactive test machine: " + machineName;
    }

    public String message() {
        return "Test machine " + machineName + " hasn't reported any results since "
                + LAST_SEEN_FORMAT.format(Instant.ofEpochSecond(lastSeen));
    }
}
