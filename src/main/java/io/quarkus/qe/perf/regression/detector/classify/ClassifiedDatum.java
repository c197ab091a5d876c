package io.quarkus.qe.perf.regression.detector.classify;

import io.quarkus.qe.perf.regression.detector.source.Datum;

public record ClassifiedDatum(Datum datum, State state) {
}
