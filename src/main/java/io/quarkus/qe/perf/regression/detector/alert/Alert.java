package io.quarkus.qe.perf.regression.detector.alert;

import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Everything needed to tell people about a regression or a machine issue.
 *
 * @param state {@link State#REGRESSION} or {@link State#MACHINE}
 * @param series affected series
 * @param good measurement the new one is compared with
 * @param bad the new measurement
 * @param goodMachineName machine that produced {@code good}
 * @param badMachineName machine that produced {@code bad}
 * @param chartUrl graph of the series around the new measurement
 * @param pushLogUrl range of suspected check-ins, or null when a revision is unknown
 */
public record Alert(State state, Series series, Datum good, Datum bad, String goodMachineName,
                   String badMachineName, String chartUrl, String pushLogUrl) {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    public double changePercent() {
        return 100.0 * Math.abs(bad.value() - good.value()) / good.value();
    }

    public String direction() {
        return bad.value() > good.value() ? "increase" : "decrease";
    }

    public String reason() {
        if (state == State.MACHINE) {
            return "Suspected machine issue (" + badMachineName + ")";
        }
        return bad.value() > good.value() ? "Regression" : "Improvement";
    }

    /**
     * @return e.g. "Regression: Ts increase 12.50% on Fedora 12 Firefox"
     */
    public String headline() {
        return reason() + ": " + series.testName() + " " + direction() + " " + formattedChange()
                + " on " + series.platformName() + " " + series.branchName();
    }

    public String subject() {
        return "Performance " + headline();
    }

    public String formattedChange() {
        return String.format(Locale.ROOT, "%.2f%%", changePercent());
    }

    public static String revisionLabel(Datum datum) {
        return datum.revision() != null ? "revision " + datum.revision() : "(unknown revision)";
    }

    public static String buildTime(Datum datum) {
        return TIME_FORMAT.format(Instant.ofEpochSecond(datum.timestamp()));
    }
}
