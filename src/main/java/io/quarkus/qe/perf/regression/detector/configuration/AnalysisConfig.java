package io.quarkus.qe.perf.regression.detector.configuration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settings read from {@code application.properties}. Run options given on the command line
 * are published separately through {@link AppConfig}.
 */
@ConfigMapping(prefix = "regression")
public interface AnalysisConfig {

    /**
     * Number of measurements after the analyzed one that are compared to the back window.
     */
    @WithDefault("12")
    int foreWindow();

    /**
     * Number of good measurements before the analyzed one used as a baseline.
     */
    @WithDefault("12")
    int backWindow();

    @WithDefault("7")
    double threshold();

    @WithDefault("15")
    double machineThreshold();

    @WithDefault("5")
    int machineHistorySize();

    @WithDefault("4")
    int workers();

    @WithDefault("warning_history.json")
    String warningHistory();

    @WithDefault("pushdates.json")
    String pushdates();

    @WithDefault("https://hg.mozilla.org")
    String baseHgUrl();

    @WithDefault("https://graphs.mozilla.org")
    String baseGraphUrl();

    Map<String, Branch> branches();

    /**
     * Display names of platforms, keyed by the name the data source reports.
     */
    Map<String, String> platformAliases();

    Optional<List<String>> regressionEmails();

    Optional<List<String>> machineEmails();

    Optional<String> fromEmail();

    /**
     * Destination of the JSON export of all warnings.
     */
    Optional<String> json();

    Optional<String> dashboardDir();

    Optional<List<String>> dashboardTests();

    Optional<String> graphDir();

    interface Branch {

        /**
         * Repository path under the base push log URL, e.g. {@code mozilla-central} or {@code releases/mozilla-beta}.
         */
        String repoPath();
    }
}
