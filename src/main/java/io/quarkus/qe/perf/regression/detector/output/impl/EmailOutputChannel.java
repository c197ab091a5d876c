package io.quarkus.qe.perf.regression.detector.output.impl;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import io.quarkus.qe.perf.regression.detector.alert.Alert;
import io.quarkus.qe.perf.regression.detector.alert.AlertFactory;
import io.quarkus.qe.perf.regression.detector.alert.HtmlAlertRenderer;
import io.quarkus.qe.perf.regression.detector.alert.PlainTextAlertRenderer;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.machine.InactiveMachineWarning;
import io.quarkus.qe.perf.regression.detector.output.OutputChannel;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.Optional;

/**
 * Sends every alert as a plain text and HTML message, one message per recipient.
 */
@Singleton
final class EmailOutputChannel implements OutputChannel {

    private final Logger logger;
    private final Mailer mailer;
    private final AlertFactory alertFactory;
    private final PlainTextAlertRenderer textRenderer;
    private final HtmlAlertRenderer htmlRenderer;
    private final Optional<String> from;
    private List<String> regressionEmails = List.of();
    private List<String> machineEmails = List.of();
    private boolean catchup;

    EmailOutputChannel(Logger logger, Mailer mailer, AlertFactory alertFactory, PlainTextAlertRenderer textRenderer,
                       HtmlAlertRenderer htmlRenderer, AnalysisConfig config) {
        this.logger = logger;
        this.mailer = mailer;
        this.alertFactory = alertFactory;
        this.textRenderer = textRenderer;
        this.htmlRenderer = htmlRenderer;
        this.from = config.fromEmail();
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        this.regressionEmails = appConfig.regressionEmails();
        this.machineEmails = appConfig.machineEmails();
        this.catchup = appConfig.catchup();
    }

    @Override
    public void process(AnalysisResult result) {
        if (catchup || (regressionEmails.isEmpty() && machineEmails.isEmpty())) {
            logger.debug("No email recipients, skipping email alerts");
            return;
        }
        for (ClassifiedEvent warning : result.warnings()) {
            List<String> recipients = warning.state() == State.MACHINE ? machineEmails : regressionEmails;
            if (recipients.isEmpty()) {
                continue;
            }
            Alert alert = alertFactory.create(warning);
            String text = textRenderer.render(alert);
            String html = htmlRenderer.render(alert);
            for (String recipient : recipients) {
                send(Mail.withText(recipient, alert.subject(), text).setHtml(html));
            }
        }
    }

    @Override
    public void processInactiveMachines(List<InactiveMachineWarning> warnings) {
        if (catchup || machineEmails.isEmpty()) {
            return;
        }
        for (InactiveMachineWarning warning : warnings) {
            for (String recipient : machineEmails) {
                send(Mail.withText(recipient, warning.subject(), warning.message()));
            }
        }
    }

    private void send(Mail mail) {
        from.ifPresent(mail::setFrom);
        try {
            mailer.send(mail);
            logger.debug("Sent '" + mail.getSubject() + "' to " + mail.getTo());
        } catch (RuntimeException e) {
            logger.error("Failed to send '" + mail.getSubject() + "' to " + mail.getTo(), e);
        }
    }
}
