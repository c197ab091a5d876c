package io.quarkus.qe.perf.regression.detector.classify.impl;

import io.quarkus.qe.perf.regression.detector.classify.Analyzer;
import io.quarkus.qe.perf.regression.detector.classify.AnalyzerSettings;
import io.quarkus.qe.perf.regression.detector.classify.ClassifiedDatum;
import io.quarkus.qe.perf.regression.detector.classify.State;
import io.quarkus.qe.perf.regression.detector.source.Datum;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Baseline analyzer comparing windows of measurements with Welch's t statistic.
 * <ul>
 *     <li>a measurement deviating from the recent results of the other machines by more than the machine
 *     threshold is a machine issue and is left out of the baseline</li>
 *     <li>otherwise, when the fore window starting at the measurement deviates from the back window of
 *     baseline measurements by more than the threshold, it is a regression</li>
 * </ul>
 * Measurements are processed in push time order.
 */
@Singleton
final class WindowedMeanAnalyzer implements Analyzer {

    @Override
    public Iterator<ClassifiedDatum> analyze(List<Datum> data, AnalyzerSettings settings) {
        List<Datum> ordered = data.stream()
                .sorted(Comparator.comparingLong(Datum::time).thenComparingLong(Datum::timestamp))
                .toList();
        return new Classification(ordered, settings);
    }

    static double tScore(List<Double> first, List<Double> second) {
        double firstMean = mean(first);
        double secondMean = mean(second);
        double standardError = Math.sqrt(variance(first, firstMean) / first.size()
                + variance(second, secondMean) / second.size());
        if (standardError == 0) {
            return firstMean == secondMean ? 0 : Double.POSITIVE_INFINITY;
        }
        return Math.abs(secondMean - firstMean) / standardError;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double variance(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / (values.size() - 1);
    }

    private static final class Classification implements Iterator<ClassifiedDatum> {

        private final List<Datum> data;
        private final AnalyzerSettings settings;
        private final List<Datum> baseline = new ArrayList<>();
        private int next;

        private Classification(List<Datum> data, AnalyzerSettings settings) {
            this.data = data;
            this.settings = settings;
        }

        @Override
        public boolean hasNext() {
            return next < data.size();
        }

        @Override
        public ClassifiedDatum next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int index = next++;
            return classify(index, data.get(index));
        }

        private ClassifiedDatum classify(int index, Datum datum) {
            List<Datum> otherMachines = recentBaselineOfOtherMachines(datum.machineId());
            if (otherMachines.size() >= settings.machineHistorySize()
                    && tScore(values(otherMachines), List.of(datum.value())) > settings.machineThreshold()) {
                return new ClassifiedDatum(datum.withLastOther(otherMachines.get(otherMachines.size() - 1)),
                        State.MACHINE);
            }

            List<Datum> back = baseline.subList(Math.max(0, baseline.size() - settings.backWindow()),
                    baseline.size());
            List<Datum> fore = data.subList(index, Math.min(data.size(), index + settings.foreWindow()));
            State state = State.GOOD;
            if (back.size() >= settings.backWindow() && fore.size() >= settings.foreWindow()
                    && tScore(values(back), values(fore)) > settings.threshold()) {
                state = State.REGRESSION;
            }
            // a persisting change becomes the new baseline
            baseline.add(datum);
            return new ClassifiedDatum(datum, state);
        }

        private List<Datum> recentBaselineOfOtherMachines(int machineId) {
            List<Datum> result = new ArrayList<>();
            for (int i = baseline.size() - 1; i >= 0 && result.size() < settings.machineHistorySize(); i--) {
                Datum candidate = baseline.get(i);
                if (candidate.machineId() != machineId) {
                    result.add(0, candidate);
                }
            }
            return result;
        }

        private static List<Double> values(List<Datum> data) {
            return data.stream().map(Datum::value).toList();
        }
    }
}
