package io.quarkus.qe.perf.regression.detector.cli;

import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.configuration.AppConfig;
import io.quarkus.qe.perf.regression.detector.engine.RegressionAnalysisRunner;
import io.quarkus.qe.perf.regression.detector.lifecycle.OnCommandExit;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static io.quarkus.qe.perf.regression.detector.cli.CommandUtils.parseDate;
import static io.quarkus.qe.perf.regression.detector.cli.CommandUtils.splitValues;

@CommandLine.Command(name = "analyze", mixinStandardHelpOptions = true, description = """
        Analyzes performance test results, warns about regressions and misbehaving test machines.
        Warnings that were already sent are remembered in the warning history file and never sent again.
        """)
public class AnalyzeRegressionsCommand implements Runnable {

    static final Duration DEFAULT_LOOKBACK = Duration.ofDays(30);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(order = 1, names = { "-b", "--branch" }, description = """
            Branch to analyze, may be repeated.
            Default: all branches configured with 'regression.branches'
            """)
    List<String> branches = new ArrayList<>();

    @CommandLine.Option(order = 2, names = { "-t", "--test" }, description = """
            Only analyze this test, may be repeated.
            Default: all tests
            """)
    List<String> tests = new ArrayList<>();

    @CommandLine.Option(order = 3, names = { "-o", "--output" }, description = """
            File that receives the alerts in addition to the console.
            Use '-' to only print them.
            """)
    String outputFilePath;

    @CommandLine.Option(order = 4, names = { "-v", "--verbose" }, description = "Log debug messages", defaultValue = "false")
    boolean verbose = false;

    @CommandLine.Option(order = 5, names = { "-e", "--email" }, description = """
            Send regression alerts to this address, may be repeated.
            Replaces 'regression.regression-emails'.
            """)
    List<String> regressionEmails = new ArrayList<>();

    @CommandLine.Option(order = 6, names = { "-m", "--machine-email" }, description = """
            Send machine alerts to this address, may be repeated.
            Replaces 'regression.machine-emails'.
            """)
    List<String> machineEmails = new ArrayList<>();

    @CommandLine.Option(order = 7, names = { "--start-time" }, description = """
            Oldest measurement to analyze (default: 30 days ago).
            Accepts formats:
            - epoch seconds (e.g., 1768003200)
            - d.M.yyyy (e.g., 10.1.2026 for January 10th, 2026)
            - yyyy-MM-dd (e.g., 2026-01-10)
            - ISO-8601 instant (e.g., 2026-01-10T00:00:00Z)
            """)
    String startTime;

    @CommandLine.Option(order = 8, names = { "--catchup" }, description = """
            Don't output any warnings, just process data and update the warning history.
            """, defaultValue = "false")
    boolean catchup = false;

    @CommandLine.Option(order = 9, names = { "--data-file" }, description = """
            JSON document with the test results to analyze.
            """, defaultValue = "perf-data.json")
    String dataFilePath;

    @CommandLine.Option(order = 10, names = { "--history-file" }, description = """
            Where to find the history of warnings sent by previous executions of this tool.
            The file is replaced at the end of every execution.
            Default: 'regression.warning-history'
            """)
    String historyFilePath;

    @CommandLine.Option(order = 11, names = { "--pushdates-file" }, description = """
            Where to cache the push dates of revisions between executions.
            Default: 'regression.pushdates'
            """)
    String pushDatesFilePath;

    @CommandLine.Option(order = 12, names = { "--workers" }, description = """
            Number of series analyzed concurrently.
            Default: 'regression.workers'
            """)
    Integer workers;

    @Inject
    AnalysisConfig analysisConfig;

    @Inject
    RegressionAnalysisRunner runner;

    @Inject
    ConsoleLogger consoleLogger;

    @Inject
    Clock clock;

    @Inject
    Event<AppConfig> appConfigEvent;

    @Inject
    Event<OnCommandExit> onCommandExitEvent;

    @Override
    public void run() {
        consoleLogger.setWriters(spec.commandLine().getOut(), spec.commandLine().getErr(), verbose);

        AppConfig appConfig = createAppConfig();
        appConfigEvent.fire(appConfig);

        try {
            runner.run(appConfig);
        } finally {
            onCommandExitEvent.fire(new OnCommandExit());
        }
    }

    private AppConfig createAppConfig() {
        List<String> selectedBranches = branches.isEmpty()
                ? new ArrayList<>(new TreeSet<>(analysisConfig.branches().keySet()))
                : branches;
        if (selectedBranches.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "No branch to analyze, use '--branch' or configure 'regression.branches'");
        }
        Instant start = parseDate(startTime);
        if (start == null) {
            start = clock.instant().minus(DEFAULT_LOOKBACK);
        }
        List<String> regressionRecipients = regressionEmails.isEmpty()
                ? analysisConfig.regressionEmails().orElse(List.of())
                : regressionEmails;
        List<String> machineRecipients = machineEmails.isEmpty()
                ? analysisConfig.machineEmails().orElse(List.of())
                : machineEmails;
        return new AppConfig(selectedBranches, tests, start, outputFilePath, catchup,
                splitValues(regressionRecipients), splitValues(machineRecipients), dataFilePath,
                historyFilePath != null ? historyFilePath : analysisConfig.warningHistory(),
                pushDatesFilePath != null ? pushDatesFilePath : analysisConfig.pushdates(),
                workers != null ? workers : analysisConfig.workers());
    }

}
