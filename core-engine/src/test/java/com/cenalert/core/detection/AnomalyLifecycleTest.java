package com.cenalert.core.detection;

import com.cenalert.core.demand.DemandClassifier;
import com.cenalert.core.episode.EpisodeExtractor;
import com.cenalert.core.model.AnnotatedRecord;
import com.cenalert.core.model.AnomalyEpisode;
import com.cenalert.core.model.DemandPattern;
import com.cenalert.core.model.SeriesPoint;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

/**
 * Scenario tests for {@link AnomalyLifecycle}.
 */
class AnomalyLifecycleTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);

    // ----------------------------------------------------------------
    // Dense regimes (Chebyshev, window 60)
    // ----------------------------------------------------------------

    @Test
    @DisplayName("Warm-up points are never anomalous and carry no statistics")
    void shouldOnlyFillWindowDuringWarmUp() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<AnnotatedRecord> records = lifecycle.run(series(Collections.nCopies(60, 5.0)));

        assertThat(records).hasSize(60);
        assertThat(records).allSatisfy(r -> {
            assertThat(r.isAnomaly()).isFalse();
            assertThat(r.getDemandPattern()).isEqualTo(DemandPattern.NONE);
            assertThat(r.getScore()).isNaN();
            assertThat(r.getThreshold()).isNaN();
        });
        assertThat(lifecycle.window().size()).isEqualTo(60);
    }

    @Test
    @DisplayName("A surge over a flat baseline is anomalous with infinite score")
    void shouldFlagSurgeOverFlatBaseline() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<Double> values = new ArrayList<>(Collections.nCopies(61, 5.0));
        values.add(1000.0);

        List<AnnotatedRecord> records = lifecycle.run(series(values));

        // The warm-up sentinel gap still dominates ADI at the first scored point
        AnnotatedRecord first = records.get(60);
        assertThat(first.isAnomaly()).isFalse();
        assertThat(first.getDemandPattern()).isEqualTo(DemandPattern.INTERMITTENT);
        assertThat(first.getResidual()).isCloseTo(0.7506, within(1e-4));

        AnnotatedRecord surge = records.get(61);
        assertThat(surge.isAnomaly()).isTrue();
        assertThat(surge.getDemandPattern()).isEqualTo(DemandPattern.SMOOTH);
        assertThat(surge.getScore()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(surge.getMinScore()).isEqualTo(6);
        assertThat(surge.getThreshold()).isCloseTo(5.0, within(1e-12));
        assertThat(lifecycle.isActiveAnomaly()).isTrue();
    }

    @Test
    @DisplayName("A surge after a constant warm-up is caught by the forecaster")
    void shouldFlagSurgeAfterConstantWarmUp() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<Double> values = new ArrayList<>(Collections.nCopies(60, 10.0));
        values.add(1000.0);

        AnnotatedRecord surge = lifecycle.run(series(values)).get(60);

        // The sentinel gap makes the first scored point look intermittent
        assertThat(surge.isAnomaly()).isTrue();
        assertThat(surge.getDemandPattern()).isEqualTo(DemandPattern.INTERMITTENT);
        assertThat(surge.getScore()).isZero();
        assertThat(surge.getResidual()).isCloseTo(991.50, within(1e-2));
        assertThat(surge.getThreshold()).isCloseTo(9.4988, within(1e-4));
        assertThat(surge.getMinScore()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    @DisplayName("A surge over a normal baseline uses the tight bound")
    void shouldFlagSurgeOverNormalBaseline() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<Double> values = baseline();
        values.add(5.0);
        values.add(1000.0);

        List<AnnotatedRecord> records = lifecycle.run(series(values));

        AnnotatedRecord surge = records.get(61);
        assertThat(surge.isAnomaly()).isTrue();
        assertThat(surge.getDemandPattern()).isEqualTo(DemandPattern.SMOOTH);
        assertThat(surge.getMinScore()).isEqualTo(3);
        assertThat(surge.getScore()).isCloseTo(3715.63, withinPercentage(0.01));
        assertThat(surge.getThreshold()).isCloseTo(5.8084, within(1e-3));
        assertThat(surge.getResidual()).isZero();
        assertThat(surge.getCov2()).isNotNaN();
        assertThat(surge.getAdi()).isNotNaN();

        // The surge never entered the window
        assertThat(lifecycle.window().mean()).isCloseTo(5.005, within(1e-3));
    }

    @Test
    @DisplayName("The demand pattern is frozen for the whole of a persistent shift")
    void shouldFreezeDemandPatternWhileActive() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<Double> values = baseline();
        values.add(5.0);
        values.add(5.0);
        values.addAll(Collections.nCopies(40, 1000.0));

        List<AnnotatedRecord> records = lifecycle.run(series(values));
        List<AnnotatedRecord> shift = records.subList(62, records.size());

        assertThat(shift).allSatisfy(r -> {
            assertThat(r.isAnomaly()).isTrue();
            assertThat(r.getDemandPattern()).isEqualTo(DemandPattern.SMOOTH);
            assertThat(r.getThreshold()).isCloseTo(5.8025, within(1e-3));
        });
        // Only the onset row carries fresh diagnostics
        assertThat(shift.get(0).getCov2()).isNotNaN();
        assertThat(shift.subList(1, shift.size())).allSatisfy(r -> {
            assertThat(r.getCov2()).isNaN();
            assertThat(r.getAdi()).isNaN();
            assertThat(r.getScore()).isCloseTo(3770.6, withinPercentage(0.01));
        });
        // Reclassifying the frozen window now would say otherwise
        assertThat(DemandClassifier.classify(lifecycle.window(), records.size() - 1))
                .isEqualTo(DemandPattern.INTERMITTENT);

        List<AnomalyEpisode> episodes = EpisodeExtractor.extract(records);
        assertThat(episodes).hasSize(1);
        assertThat(episodes.get(0).getStartIndex()).isEqualTo(62);
        assertThat(episodes.get(0).getEndIndex()).isEqualTo(records.size() - 1);
    }

    @Test
    @DisplayName("A short burst returns to normal and is folded back into the baseline")
    void shouldReturnToNormal() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<Double> values = baseline();
        values.add(5.0);
        values.add(5.0);
        values.addAll(Collections.nCopies(5, 1000.0));
        values.addAll(Collections.nCopies(10, 5.0));

        List<AnnotatedRecord> records = lifecycle.run(series(values));

        List<AnomalyEpisode> episodes = EpisodeExtractor.extract(records);
        assertThat(episodes).hasSize(1);
        AnomalyEpisode episode = episodes.get(0);
        assertThat(episode.getStartIndex()).isEqualTo(62);
        assertThat(episode.getEndIndex()).isEqualTo(66);
        assertThat(episode.getStart()).isEqualTo(START.plusDays(62));
        assertThat(episode.getImpact()).isCloseTo(5 * (1000 - 5.8025), within(5e-3));

        AnnotatedRecord exit = records.get(67);
        assertThat(exit.isAnomaly()).isFalse();
        assertThat(exit.getThreshold()).isNaN();

        // Burst standardized back onto the old mean and spread
        assertThat(lifecycle.window().size()).isEqualTo(60);
        assertThat(lifecycle.window().mean()).isCloseTo(5.0223, within(1e-3));
        assertThat(lifecycle.window().std()).isCloseTo(0.2617, within(1e-3));
        assertThat(lifecycle.isActiveAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Exiting a dense anomaly remaps the window onto the pre-anomaly mean and spread")
    void shouldRestoreWindowMomentsOnExit() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<Double> values = baseline();
        values.add(5.0);
        values.add(5.0);
        values.addAll(Collections.nCopies(5, 1000.0));
        List<SeriesPoint> points = series(values);
        for (SeriesPoint point : points) {
            lifecycle.process(point.getDate(), point.getValue());
        }
        assertThat(lifecycle.isActiveAnomaly()).isTrue();
        double targetMean = lifecycle.window().mean();
        double targetStd = lifecycle.window().std();

        AnnotatedRecord exit = lifecycle.process(START.plusDays(points.size()), 0);

        assertThat(exit.isAnomaly()).isFalse();
        assertThat(lifecycle.window().size()).isEqualTo(60);
        assertThat(lifecycle.window().mean()).isCloseTo(targetMean, within(1e-9));
        assertThat(lifecycle.window().std()).isCloseTo(targetStd, within(1e-9));
    }

    @Test
    @DisplayName("A range-bound oscillation is accepted as a new normal")
    void shouldSettleIntoNewNormal() {
        AnomalyLifecycle lifecycle = chebyshev();
        List<Double> values = baseline();
        values.add(5.0);
        values.add(5.0);
        for (int i = 0; i < 30; i++) {
            values.add(i % 2 == 0 ? 1000.0 : 500.0);
        }

        List<AnnotatedRecord> records = lifecycle.run(series(values));

        assertThat(records.subList(62, 82)).allSatisfy(r -> assertThat(r.isAnomaly()).isTrue());
        assertThat(records.subList(82, records.size())).allSatisfy(r -> assertThat(r.isAnomaly()).isFalse());

        List<AnomalyEpisode> episodes = EpisodeExtractor.extract(records);
        assertThat(episodes).hasSize(1);
        assertThat(episodes.get(0).getEndIndex()).isEqualTo(81);

        assertThat(lifecycle.window().mean()).isCloseTo(958.36, within(0.01));
        assertThat(lifecycle.window().std()).isCloseTo(138.20, within(0.01));
    }

    // ----------------------------------------------------------------
    // Sparse regimes (median method)
    // ----------------------------------------------------------------

    @Test
    @DisplayName("A lone spike amid zeros is a one-point forecast anomaly")
    void shouldFlagLoneSpike() {
        AnomalyLifecycle lifecycle = median();
        List<Double> values = new ArrayList<>(Collections.nCopies(20, 0.0));
        values.add(5.0);
        values.addAll(Collections.nCopies(20, 0.0));

        List<AnnotatedRecord> records = lifecycle.run(series(values));

        AnnotatedRecord spike = records.get(20);
        assertThat(spike.isAnomaly()).isTrue();
        assertThat(spike.getDemandPattern()).isEqualTo(DemandPattern.NONE);
        assertThat(spike.getResidual()).isEqualTo(5);
        assertThat(spike.getThreshold()).isEqualTo(1);

        AnnotatedRecord exit = records.get(21);
        assertThat(exit.isAnomaly()).isFalse();
        assertThat(exit.getScore()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(exit.getResidual()).isEqualTo(Double.POSITIVE_INFINITY);

        List<AnomalyEpisode> episodes = EpisodeExtractor.extract(records);
        assertThat(episodes).hasSize(1);
        assertThat(episodes.get(0).getStart()).isEqualTo(START.plusDays(20));
        assertThat(episodes.get(0).getEnd()).isEqualTo(START.plusDays(20));
        assertThat(episodes.get(0).getPeak()).isEqualTo(START.plusDays(20));
        assertThat(episodes.get(0).getImpact()).isEqualTo(4);

        // Long silence after the spike cleared the window
        assertThat(lifecycle.window().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("An all-zero series never raises an anomaly")
    void shouldIgnoreZeros() {
        AnomalyLifecycle lifecycle = median();
        List<AnnotatedRecord> records = lifecycle.run(series(Collections.nCopies(50, 0.0)));

        assertThat(records).hasSize(50);
        assertThat(records).noneMatch(AnnotatedRecord::isAnomaly);
        assertThat(records).allMatch(r -> r.getDemandPattern() == DemandPattern.NONE);
        assertThat(lifecycle.window().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A spike on a periodic series is scored in units of the window mean")
    void shouldFlagSpikeOnPeriodicSeries() {
        AnomalyLifecycle lifecycle = median();
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            values.add(10.0 + i % 3);
        }
        values.add(100.0);
        for (int i = 0; i < 10; i++) {
            values.add(10.0 + i % 3);
        }

        List<AnnotatedRecord> records = lifecycle.run(series(values));
        List<AnomalyEpisode> episodes = EpisodeExtractor.extract(records);

        // The first scored points still see the warm-up sentinel gap
        assertThat(episodes).hasSize(2);
        assertThat(episodes.get(0).getStartIndex()).isEqualTo(6);
        assertThat(episodes.get(0).getEndIndex()).isEqualTo(8);

        AnnotatedRecord spike = records.get(40);
        assertThat(spike.isAnomaly()).isTrue();
        assertThat(spike.getDemandPattern()).isEqualTo(DemandPattern.SMOOTH);
        assertThat(spike.getScore()).isCloseTo(86.0 / 11, within(1e-9));
        assertThat(spike.getThreshold()).isCloseTo(36, within(1e-9));
        assertThat(episodes.get(1).getStartIndex()).isEqualTo(40);
        assertThat(episodes.get(1).getEndIndex()).isEqualTo(40);
        assertThat(records.get(41).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("A sparse anomaly that settles replaces the window with its ratio-scaled trajectory")
    void shouldRescaleSparseAnomalyIntoNewNormal() {
        AnomalyLifecycle lifecycle = median();
        List<Double> values = sparse(30, 10.0);
        for (int i = 0; i < 21; i++) {
            values.add(i % 2 == 0 ? 100.0 : 50.0);
        }

        List<AnnotatedRecord> records = lifecycle.run(series(values));

        assertThat(records.subList(30, 50)).allSatisfy(r -> {
            assertThat(r.isAnomaly()).isTrue();
            assertThat(r.getDemandPattern()).isEqualTo(DemandPattern.INTERMITTENT);
            assertThat(r.getThreshold()).isCloseTo(25.0 / 6, within(1e-9));
        });
        AnnotatedRecord exit = records.get(50);
        assertThat(exit.isAnomaly()).isFalse();
        assertThat(exit.getThreshold()).isNaN();

        // Trajectory 100, 50, ... has mean 75 and settles at 100
        double ratio = 100.0 / 75;
        assertThat(lifecycle.window().toArray()).containsExactly(new double[] {
                50 * ratio, 100 * ratio, 50 * ratio, 100 * ratio, 50 * ratio, 100 }, within(1e-9));
        assertThat(lifecycle.window().interarrivals()).containsOnly(1L);
        // The trajectory ends at the exit index, followed by the exit value itself
        assertThat(lifecycle.window().lastArrival()).hasValue(51L);

        AnnotatedRecord next = lifecycle.process(START.plusDays(51), 50.0);
        assertThat(next.isAnomaly()).isFalse();
        assertThat(next.getDemandPattern()).isEqualTo(DemandPattern.SMOOTH);
    }

    @Test
    @DisplayName("A sparse anomaly that returns to normal is re-inserted unscaled")
    void shouldReinsertSparseAnomalyUnscaled() {
        AnomalyLifecycle lifecycle = median();
        List<Double> values = sparse(27, 10.0);
        values.add(40.0);
        values.add(0.0);

        List<AnnotatedRecord> records = lifecycle.run(series(values));

        AnnotatedRecord spike = records.get(27);
        assertThat(spike.isAnomaly()).isTrue();
        assertThat(spike.getDemandPattern()).isEqualTo(DemandPattern.INTERMITTENT);
        assertThat(spike.getResidual()).isCloseTo(40 - 19.0 / 6, within(1e-9));
        assertThat(records.get(28).isAnomaly()).isFalse();

        assertThat(lifecycle.window().toArray()).containsExactly(10, 10, 10, 10, 10, 40);
        assertThat(lifecycle.window().interarrivals()).containsOnly(3L);
        assertThat(lifecycle.window().lastArrival()).hasValue(28L);
    }

    // ----------------------------------------------------------------
    // Contract
    // ----------------------------------------------------------------

    @Test
    @DisplayName("Stepwise processing matches a full run")
    void shouldProcessIncrementally() {
        List<Double> values = baseline();
        values.add(1000.0);
        values.add(5.0);
        List<SeriesPoint> points = series(values);

        List<AnnotatedRecord> batch = new AnomalyLifecycle(new ChebyshevDetector(3, 6), 60, 1, 0.05).run(points);
        AnomalyLifecycle stepwise = new AnomalyLifecycle(new ChebyshevDetector(3, 6), 60, 1, 0.05);
        for (int i = 0; i < points.size(); i++) {
            AnnotatedRecord record = stepwise.process(points.get(i).getDate(), points.get(i).getValue());
            assertThat(record.getIndex()).isEqualTo(i);
            assertThat(record).isEqualTo(batch.get(i));
        }
    }

    @Test
    @DisplayName("Should reject invalid construction")
    void shouldRejectInvalidConstruction() {
        assertThatThrownBy(() -> new AnomalyLifecycle(null, 10, 1, 0.05))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new AnomalyLifecycle(new ChebyshevDetector(3, 6), 0, 1, 0.05))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ----------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------

    private static AnomalyLifecycle chebyshev() {
        return new AnomalyLifecycle(new ChebyshevDetector(3, 6), 60, 1, 0.05);
    }

    private static AnomalyLifecycle median() {
        return new AnomalyLifecycle(new MedianMethodDetector(3, 2), 6, 1, 0.05);
    }

    /**
     * Sixty normal quantiles around 5, shuffled by a fixed stride so the
     * window looks stationary.
     */
    private static List<Double> baseline() {
        NormalDistribution normal = new NormalDistribution(5, 0.3);
        double[] quantiles = new double[60];
        for (int i = 0; i < 60; i++) {
            quantiles[i] = normal.inverseCumulativeProbability((i + 0.5) / 60);
        }
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            values.add(quantiles[(i * 7) % 60]);
        }
        return values;
    }

    /**
     * {@code value} on every third day starting at day 0, zero otherwise.
     */
    private static List<Double> sparse(int length, double value) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            values.add(i % 3 == 0 ? value : 0.0);
        }
        return values;
    }

    private static List<SeriesPoint> series(List<Double> values) {
        List<SeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            points.add(new SeriesPoint(START.plusDays(i), values.get(i)));
        }
        return points;
    }
}
