package io.quarkus.qe.perf.regression.detector.source;

/**
 * A single reported value of a {@link Series}.
 *
 * @param machineId machine that ran the test
 * @param value measured value
 * @param timestamp when the result was reported, in epoch seconds
 * @param time push time of {@link #revision()} once resolved, {@link #timestamp()} until then
 * @param revision source control revision the build was made from, may be null
 * @param buildId build identifier
 * @param runNumber run number of the build on the machine
 * @param lastOther datum of another machine this one was compared with, set for machine issues only
 */
public record Datum(int machineId, double value, long timestamp, long time, String revision, String buildId,
                    int runNumber, Datum lastOther) {

    public static Datum of(int machineId, double value, long timestamp, String revision, String buildId,
                           int runNumber) {
        return new Datum(machineId, value, timestamp, timestamp, revision, buildId, runNumber, null);
    }

    public Datum withTime(long pushTime) {
        return new Datum(machineId, value, timestamp, pushTime, revision, buildId, runNumber, lastOther);
    }

    public Datum withLastOther(Datum other) {
        return new Datum(machineId, value, timestamp, time, revision, buildId, runNumber, other);
    }
}
