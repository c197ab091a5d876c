package io.quarkus.qe.perf.regression.detector.output.impl;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.MockMailbox;
import io.quarkus.qe.perf.regression.detector.TestLoggerProfile;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.machine.InactiveMachineWarning;
import io.quarkus.qe.perf.regression.detector.result.AnalysisResult;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static io.quarkus.qe.perf.regression.detector.output.impl.AlertOutputChannelTest.BAD;
import static io.quarkus.qe.perf.regression.detector.output.impl.AlertOutputChannelTest.DATA;
import static io.quarkus.qe.perf.regression.detector.output.impl.AlertOutputChannelTest.GOOD;
import static io.quarkus.qe.perf.regression.detector.output.impl.AlertOutputChannelTest.TS;
import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@TestProfile(TestLoggerProfile.class)
class EmailOutputChannelTest {

    Path tempDir;

    @Inject
    EmailOutputChannel channel;

    @Inject
    MockMailbox mailbox;

    @Inject
    Event<AppConfig> appConfigEvent;

    @BeforeEach
    void setUp(@TempDir Path tempDir) throws IOException {
        this.tempDir = tempDir;
        Files.writeString(tempDir.resolve("perf-data.json"), DATA);
        mailbox.clear();
    }

    @Test
    void testRegressionIsSentToEveryRecipient() {
        appConfigEvent.fire(appConfig(List.of("dev@example.org", "qa@example.org"), List.of("ops@example.org"), false));

        channel.process(new AnalysisResult(List.of(
                new ClassifiedEvent(TS, BAD, State.REGRESSION, false, GOOD),
                new ClassifiedEvent(TS, BAD, State.REGRESSION, true, GOOD))));

        assertEquals(2, mailbox.getTotalMessagesSent());
        List<Mail> mails = mailbox.getMailsSentTo("dev@example.org");
        assertEquals(1, mails.size());
        Mail mail = mails.get(0);
        assertEquals("Performance Regression: Ts increase 25.00% on Fedora 12 Firefox", mail.getSubject());
        assertEquals("perf-regressions@example.org", mail.getFrom());
        assertTrue(mail.getText().contains("Previous results:"), mail.getText());
        assertTrue(mail.getHtml().startsWith("<p>Regression: Ts <a href="), mail.getHtml());
        assertEquals(1, mailbox.getMailsSentTo("qa@example.org").size());
        assertNoMailTo("ops@example.org");
    }

    @Test
    void testMachineIssuesGoToMachineRecipients() {
        appConfigEvent.fire(appConfig(List.of("dev@example.org"), List.of("ops@example.org"), false));
        Datum outlier = Datum.of(2, 900, 1_700_000_200L, null, "b2", 1).withLastOther(GOOD);

        channel.process(new AnalysisResult(List.of(new ClassifiedEvent(TS, outlier, State.MACHINE, false, GOOD))));
        channel.processInactiveMachines(List.of(new InactiveMachineWarning("talos-r3-fed-002", 1_699_000_000L)));

        List<Mail> mails = mailbox.getMailsSentTo("ops@example.org");
        assertEquals(2, mails.size());
        assertEquals("Performance Suspected machine issue (talos-r3-fed-002): Ts increase 125.00% on Fedora 12 Firefox",
                mails.get(0).getSubject());
        assertEquals("Inactive test machine: talos-r3-fed-002", mails.get(1).getSubject());
        assertNoMailTo("dev@example.org");
    }

    @Test
    void testNothingIsSentInCatchup() {
        appConfigEvent.fire(appConfig(List.of("dev@example.org"), List.of("ops@example.org"), true));

        channel.process(new AnalysisResult(List.of(new ClassifiedEvent(TS, BAD, State.REGRESSION, false, GOOD))));
        channel.processInactiveMachines(List.of(new InactiveMachineWarning("talos-r3-fed-002", 1_699_000_000L)));

        assertEquals(0, mailbox.getTotalMessagesSent());
    }

    private void assertNoMailTo(String address) {
        List<Mail> mails = mailbox.getMailsSentTo(address);
        assertTrue(mails == null || mails.isEmpty(), "Unexpected mail to " + address);
    }

    private AppConfig appConfig(List<String> regressionEmails, List<String> machineEmails, boolean catchup) {
        return new AppConfig(List.of("Firefox"), List.of(), Instant.EPOCH, null, catchup, regressionEmails,
                machineEmails, tempDir.resolve("perf-data.json").toString(),
                tempDir.resolve("warning_history.json").toString(), tempDir.resolve("pushdates.json").toString(), 2);
    }
}
