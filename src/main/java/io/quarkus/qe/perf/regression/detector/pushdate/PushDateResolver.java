package io.quarkus.qe.perf.regression.detector.pushdate;

import io.quarkus.qe.perf.regression.detector.source.Datum;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves revisions to the time they were pushed, so measurements can be ordered by code history
 * rather than by test execution time.
 */
public interface PushDateResolver {

    /**
     * Maximum number of revisions queried with a single push log request.
     */
    int BATCH_SIZE = 50;

    int REVISION_LENGTH = 12;

    /**
     * @param branch branch the revisions belong to
     * @param revisions 12 character revision prefixes
     * @return push dates in epoch seconds of the revisions that could be resolved
     * @throws PushDateFetchException if a push log request fails
     */
    Map<String, Long> resolve(String branch, Set<String> revisions);

    /**
     * @return {@code data} with {@link Datum#time()} set to the push date wherever the revision resolved
     */
    default List<Datum> applyPushDates(String branch, List<Datum> data) {
        Set<String> revisions = data.stream()
                .map(Datum::revision)
                .filter(Objects::nonNull)
                .map(PushDateResolver::shortRevision)
                .collect(Collectors.toSet());
        if (revisions.isEmpty()) {
            return data;
        }
        Map<String, Long> dates = resolve(branch, revisions);
        return data.stream()
                .map(d -> {
                    Long pushDate = d.revision() == null ? null : dates.get(shortRevision(d.revision()));
                    return pushDate != null ? d.withTime(pushDate) : d;
                })
                .toList();
    }

    static String shortRevision(String revision) {
        return revision.length() > REVISION_LENGTH ? revision.substring(0, REVISION_LENGTH) : revision;
    }
}
