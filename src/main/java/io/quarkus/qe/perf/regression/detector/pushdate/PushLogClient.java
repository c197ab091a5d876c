package io.quarkus.qe.perf.regression.detector.pushdate;

import java.util.List;
import java.util.Map;

/**
 * Remote push log of a repository.
 */
public interface PushLogClient {

    /**
     * Fetch push dates of up to {@link PushDateResolver#BATCH_SIZE} revisions with a single request.
     *
     * @param repoPath repository path, e.g. {@code mozilla-central}
     * @param revisions revisions to look up
     * @return push date in epoch seconds, keyed by the 12 character revision prefix
     * @throws PushDateFetchException if the request fails or the response is malformed
     */
    Map<String, Long> fetchPushDates(String repoPath, List<String> revisions);

}
