package io.quarkus.qe.perf.regression.detector.pushdate.impl;

import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.history.PersistedState;
import io.quarkus.qe.perf.regression.detector.history.PushDateCache;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.pushdate.PushDateResolver;
import io.quarkus.qe.perf.regression.detector.pushdate.PushLogClient;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

@Singleton
final class PushDateResolverImpl implements PushDateResolver {

    private final Logger logger;
    private final Supplier<PushDateCache> cache;
    private final PushLogClient pushLogClient;
    private final Function<String, Optional<String>> repoPaths;

    @Inject
    PushDateResolverImpl(Logger logger, PersistedState persistedState, PushLogClient pushLogClient,
                         AnalysisConfig config) {
        this(logger, persistedState::pushDateCache, pushLogClient,
                branch -> Optional.ofNullable(config.branches().get(branch)).map(AnalysisConfig.Branch::repoPath));
    }

    PushDateResolverImpl(Logger logger, Supplier<PushDateCache> cache, PushLogClient pushLogClient,
                         Function<String, Optional<String>> repoPaths) {
        this.logger = logger;
        this.cache = cache;
        this.pushLogClient = pushLogClient;
        this.repoPaths = repoPaths;
    }

    @Override
    public Map<String, Long> resolve(String branch, Set<String> revisions) {
        PushDateCache pushDates = cache.get();
        Map<String, Long> resolved = new HashMap<>(pushDates.lookup(branch, revisions));

        List<String> toQuery = revisions.stream()
                .filter(revision -> !resolved.containsKey(revision))
                .sorted()
                .toList();
        if (toQuery.isEmpty()) {
            return resolved;
        }

        Optional<String> repoPath = repoPaths.apply(branch);
        if (repoPath.isEmpty()) {
            logger.info("No repository path configured for branch " + branch + ", ordering "
                    + toQuery.size() + " revisions by report time");
            return resolved;
        }

        logger.debug("Fetching " + toQuery.size() + " changesets of " + branch);
        for (int i = 0; i < toQuery.size(); i += BATCH_SIZE) {
            List<String> batch = toQuery.subList(i, Math.min(i + BATCH_SIZE, toQuery.size()));

            // another worker may have fetched some of them meanwhile
            Map<String, Long> committedMeanwhile = pushDates.lookup(branch, batch);
            resolved.putAll(committedMeanwhile);
            List<String> missing = new ArrayList<>(batch);
            missing.removeAll(committedMeanwhile.keySet());
            if (missing.isEmpty()) {
                continue;
            }

            Map<String, Long> fetched = pushLogClient.fetchPushDates(repoPath.get(), missing);
            resolved.putAll(pushDates.commit(branch, fetched));
        }
        return resolved;
    }
}
