package io.quarkus.qe.perf.regression.detector.source;

/**
 * One (branch, platform, test) measurement stream.
 */
public record Series(String branchName, int branchId, String platformName, int platformId,
                     String testName, int testId) {

    public Series withPlatformName(String alias) {
        return new Series(branchName, branchId, alias, platformId, testName, testId);
    }

    @Override
    public String toString() {
        return branchName + " " + platformName + " " + testName;
    }
}
