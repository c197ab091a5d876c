package io.quarkus.qe.perf.regression.detector.alert;

import io.quarkus.qe.perf.regression.detector.classify.State;
import jakarta.inject.Singleton;

@Singleton
public final class HtmlAlertRenderer implements AlertRenderer {

    @Override
    public String render(Alert alert) {
        boolean withRunNumber = alert.state() != State.MACHINE;
        StringBuilder html = new StringBuilder();
        html.append("<p>").append(escape(alert.reason())).append(": ").append(escape(alert.series().testName()))
                .append(" <a href=").append(quoteAttribute(alert.chartUrl())).append('>')
                .append(alert.direction()).append(' ').append(alert.formattedChange()).append("</a> on ")
                .append(escape(alert.series().platformName())).append(' ')
                .append(escape(alert.series().branchName())).append("</p>\n");
        html.append("<p>Previous results: ").append(escape(PlainTextAlertRenderer.describe(alert.good(),
                alert.goodMachineName(), withRunNumber))).append("</p>\n");
        html.append("<p>New results: ").append(escape(PlainTextAlertRenderer.describe(alert.bad(),
                alert.badMachineName(), withRunNumber))).append("</p>\n");
        if (alert.pushLogUrl() != null) {
            html.append("\n<p>Suspected checkin range: <a href=").append(quoteAttribute(alert.pushLogUrl()))
                    .append(">from ").append(escape(Alert.revisionLabel(alert.good())))
                    .append(" to ").append(escape(Alert.revisionLabel(alert.bad()))).append("</a></p>\n");
        }
        return html.toString();
    }

    static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String quoteAttribute(String value) {
        return '"' + escape(value).replace("\"", "&quot;") + '"';
    }
}
