package io.quarkus.qe.perf.regression.detector.configuration;

import java.time.Instant;
import java.util.List;

/**
 * Options of a single command execution, published as a CDI event before the analysis starts.
 *
 * @param branches branches to analyze
 * @param tests test names to restrict the analysis to; empty means all tests
 * @param startTime oldest measurement to look at, also the cutoff for purging the warning history
 * @param outputFilePath file that receives the alerts in addition to the console, or null
 * @param catchup process data and update the history without emitting any warning
 * @param regressionEmails recipients of regression alerts
 * @param machineEmails recipients of machine issue alerts
 * @param dataFilePath JSON document with the measurements
 * @param historyFilePath warning history document
 * @param pushDatesFilePath push date cache document
 * @param workers number of concurrent workers
 */
public record AppConfig(List<String> branches, List<String> tests, Instant startTime, String outputFilePath,
                        boolean catchup, List<String> regressionEmails, List<String> machineEmails,
                        String dataFilePath, String historyFilePath, String pushDatesFilePath, int workers) {

    public AppConfig {
        branches = List.copyOf(branches);
        tests = List.copyOf(tests);
        regressionEmails = List.copyOf(regressionEmails);
        machineEmails = List.copyOf(machineEmails);
    }
}
