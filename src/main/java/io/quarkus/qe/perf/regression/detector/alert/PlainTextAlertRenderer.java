package io.quarkus.qe.perf.regression.detector.alert;

import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import jakarta.inject.Singleton;

@Singleton
public final class PlainTextAlertRenderer implements AlertRenderer {

    @Override
    public String render(Alert alert) {
        boolean machineIssue = alert.state() == State.MACHINE;
        StringBuilder message = new StringBuilder();
        message.append(alert.headline()).append('\n');
        message.append("    Previous results:\n");
        message.append("        ").append(describe(alert.good(), alert.goodMachineName(), !machineIssue)).append('\n');
        message.append("    New results:\n");
        message.append("        ").append(describe(alert.bad(), alert.badMachineName(), !machineIssue)).append('\n');
        message.append("    ").append(alert.chartUrl());
        if (!machineIssue && alert.pushLogUrl() != null) {
            message.append("\n    ").append(alert.pushLogUrl());
        }
        message.append('\n');
        return message.toString();
    }

    static String describe(Datum datum, String machineName, boolean withRunNumber) {
        String description = datum.value() + " from build " + datum.buildId() + " of " + Alert.revisionLabel(datum)
                + " at " + Alert.buildTime(datum) + " on " + machineName;
        return withRunNumber ? description + " run # " + datum.runNumber() : description;
    }
}
