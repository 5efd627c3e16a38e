package com.cenalert.core.detection;

import com.cenalert.core.model.DetectorParameters;
import com.cenalert.core.window.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Local-outlier-factor detector.
 *
 * <p>
 * Computes the LOF of the candidate within the window plus the candidate,
 * using Manhattan distance and {@code nNeighbors} neighbors (capped at the
 * sample size minus one). A LOF well above 1 means the candidate sits in a
 * region much sparser than its neighbors. Candidates at or below the window
 * mean score {@value #NOT_ANOMALOUS}; a sample too small to fit scores NaN.
 * </p>
 *
 * @since 1.0.0
 */
public class LocalOutlierFactorDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LocalOutlierFactorDetector.class);

    static final double DEFAULT_MIN_SCORE = 1;
    static final double NOT_ANOMALOUS = 1;

    /** Added to mean reach distances so duplicates do not divide by zero. */
    static final double REACH_EPSILON = 1e-10;

    private final int nNeighbors;
    private final double minScore;

    /**
     * @param nNeighbors neighbors per point
     * @param minScore   LOF at or above which a value is anomalous
     * @throws IllegalArgumentException if {@code nNeighbors} &lt; 1
     */
    public LocalOutlierFactorDetector(int nNeighbors, double minScore) {
        if (nNeighbors < 1) {
            throw new IllegalArgumentException("nNeighbors must be >= 1, got: " + nNeighbors);
        }
        this.nNeighbors = nNeighbors;
        this.minScore = minScore;
    }

    @Override
    public double score(Window window, double value) {
        double[] sample = IsolationForestDetector.withCandidate(window, value);
        if (sample.length < 2) {
            LOG.debug("Local outlier factor needs at least 2 samples, got: {}", sample.length);
            return Double.NaN;
        }
        double[] factors = localOutlierFactors(sample, Math.min(nNeighbors, sample.length - 1));
        return value > window.mean() ? factors[sample.length - 1] : NOT_ANOMALOUS;
    }

    @Override
    public double threshold(Window window, double initialGuess) {
        return ThresholdSearch.find(x -> score(window, x), minScore, window.mean(), initialGuess);
    }

    /**
     * LOF of every point of a one-dimensional sample.
     *
     * @param sample the points
     * @param k      neighbors per point, 1 &lt;= k &lt; sample.length
     * @return factor per point, in sample order
     */
    static double[] localOutlierFactors(double[] sample, int k) {
        int n = sample.length;
        int[][] neighbors = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            final int p = i;
            neighbors[i] = IntStream.range(0, n)
                    .filter(j -> j != p)
                    .boxed()
                    .sorted(Comparator.comparingDouble((Integer j) -> Math.abs(sample[j] - sample[p]))
                            .thenComparingInt(j -> j))
                    .limit(k)
                    .mapToInt(Integer::intValue)
                    .toArray();
            kDistance[i] = Math.abs(sample[neighbors[i][k - 1]] - sample[i]);
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0;
            for (int o : neighbors[i]) {
                reach += Math.max(kDistance[o], Math.abs(sample[i] - sample[o]));
            }
            lrd[i] = 1.0 / (reach / k + REACH_EPSILON);
        }

        double[] factors = new double[n];
        for (int i = 0; i < n; i++) {
            final int p = i;
            factors[i] = Arrays.stream(neighbors[i]).mapToDouble(o -> lrd[o] / lrd[p]).average().orElse(Double.NaN);
        }
        return factors;
    }

    @Override
    public double minScore() {
        return minScore;
    }

    @Override
    public String getName() {
        return DetectorParameters.LOF;
    }
}
