package io.quarkus.qe.perf.regression.detector.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.dedup.ClassifiedEvent;
import io.quarkus.qe.perf.regression.detector.source.DataSource;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Singleton
public final class AlertFactory {

    private static final long CHART_MARGIN = Duration.ofHours(24).toSeconds();

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final String baseGraphUrl;
    private final String baseHgUrl;
    private final Function<String, Optional<String>> repoPaths;

    @Inject
    AlertFactory(DataSource dataSource, AnalysisConfig config) {
        this(dataSource, config.baseGraphUrl(), config.baseHgUrl(),
                branch -> Optional.ofNullable(config.branches().get(branch)).map(AnalysisConfig.Branch::repoPath));
    }

    AlertFactory(DataSource dataSource, String baseGraphUrl, String baseHgUrl,
                 Function<String, Optional<String>> repoPaths) {
        this.dataSource = dataSource;
        this.objectMapper = new ObjectMapper();
        this.baseGraphUrl = baseGraphUrl;
        this.baseHgUrl = baseHgUrl;
        this.repoPaths = repoPaths;
    }

    /**
     * @param event a deliverable event
     */
    public Alert create(ClassifiedEvent event) {
        if (!event.isDeliverable()) {
            throw new IllegalArgumentException("No alert can be created for " + event);
        }
        Datum bad = event.datum();
        Datum good = event.lastGood();
        String pushLogUrl = null;
        if (event.state() == State.MACHINE) {
            // compare with the other machines rather than with the last good measurement
            if (bad.lastOther() != null) {
                good = bad.lastOther();
            }
        } else {
            pushLogUrl = pushLogUrl(event.series().branchName(), good.revision(), bad.revision());
        }
        return new Alert(event.state(), event.series(), good, bad, dataSource.getMachineName(good.machineId()),
                dataSource.getMachineName(bad.machineId()), chartUrl(event.series(), bad), pushLogUrl);
    }

    /**
     * @param anchor measurement the chart is centered on, or null to show the whole series
     */
    public String chartUrl(Series series, Datum anchor) {
        List<Map<String, Integer>> tests = dataSource.getMachinesForTest(series).stream()
                .map(machineId -> {
                    Map<String, Integer> test = new LinkedHashMap<>();
                    test.put("test", series.testId());
                    test.put("branch", series.branchId());
                    test.put("machine", machineId);
                    return test;
                })
                .toList();
        String url;
        try {
            url = baseGraphUrl + "/graph.html#tests=" + objectMapper.writeValueAsString(tests);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chart parameters of " + series, e);
        }
        if (anchor != null) {
            url += "&sel=" + (anchor.time() - CHART_MARGIN) + "," + (anchor.time() + CHART_MARGIN);
        }
        return url;
    }

    /**
     * @return link to the pushes between the two revisions, or null if it cannot be built
     */
    public String pushLogUrl(String branch, String goodRevision, String badRevision) {
        Optional<String> repoPath = repoPaths.apply(branch);
        if (repoPath.isEmpty() || badRevision == null) {
            return null;
        }
        if (goodRevision != null) {
            return baseHgUrl + "/" + repoPath.get() + "/pushloghtml?fromchange=" + goodRevision
                    + "&tochange=" + badRevision;
        }
        return baseHgUrl + "/" + repoPath.get() + "/rev/" + badRevision;
    }
}
