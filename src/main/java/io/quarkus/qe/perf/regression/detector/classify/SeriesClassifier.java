package io.quarkus.qe.perf.regression.detector.classify;

import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import io.quarkus.qe.perf.regression.detector.source.Series;
import jakarta.inject.Singleton;

import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Feeds the measurement history of a series to the {@link Analyzer}.
 */
@Singleton
public final class SeriesClassifier {

    private final Logger logger;
    private final Analyzer analyzer;

    public SeriesClassifier(Logger logger, Analyzer analyzer) {
        this.logger = logger;
        this.analyzer = analyzer;
    }

    /**
     * Classify the measurements of {@code series}.
     * <p>
     * The stream is lazy and can be consumed only once. Regressions and machine issues reported before
     * {@code cutoff} (epoch seconds) are dropped, since old problems are never reported again; good
     * measurements always pass, whatever their age.
     */
    public Stream<ClassifiedDatum> classify(Series series, List<Datum> data, AnalyzerSettings settings,
                                            long cutoff) {
        logger.debug("Classifying " + data.size() + " measurements of " + series);
        Iterator<ClassifiedDatum> classified = analyzer.analyze(List.copyOf(data), settings);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(classified,
                        Spliterator.ORDERED | Spliterator.NONNULL), false)
                .filter(c -> c.state() == State.GOOD || c.datum().timestamp() >= cutoff);
    }
}
