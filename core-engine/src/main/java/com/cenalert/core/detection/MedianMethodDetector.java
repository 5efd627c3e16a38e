package com.cenalert.core.detection;

import com.cenalert.core.model.DetectorParameters;
import com.cenalert.core.window.Window;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Median-method detector.
 *
 * <p>
 * The baseline is {@code max(median + h × median(Δ), median)} where {@code h}
 * is the half neighborhood and {@code Δ} the successive differences of the
 * window. Scores are expressed in units of the window mean:
 * {@code (x − baseline) / mean}.
 * </p>
 *
 * @since 1.0.0
 */
public class MedianMethodDetector implements AnomalyDetector {

    private final int halfNeighborhood;
    private final double minScore;

    /**
     * @param halfNeighborhood half of the window size
     * @param minScore         score at or above which a value is anomalous
     * @throws IllegalArgumentException if {@code halfNeighborhood} &lt; 1
     */
    public MedianMethodDetector(int halfNeighborhood, double minScore) {
        if (halfNeighborhood < 1) {
            throw new IllegalArgumentException("halfNeighborhood must be >= 1, got: " + halfNeighborhood);
        }
        this.halfNeighborhood = halfNeighborhood;
        this.minScore = minScore;
    }

    @Override
    public double score(Window window, double value) {
        return (value - baseline(window)) / window.mean();
    }

    @Override
    public double threshold(Window window, double initialGuess) {
        return baseline(window) + minScore * window.mean();
    }

    double baseline(Window window) {
        double median = window.median();
        double[] diff = window.diff();
        double differenceMedian = diff.length == 0 ? Double.NaN : new Median().evaluate(diff);
        return Math.max(median + halfNeighborhood * differenceMedian, median);
    }

    public int getHalfNeighborhood() {
        return halfNeighborhood;
    }

    @Override
    public double minScore() {
        return minScore;
    }

    @Override
    public String getName() {
        return DetectorParameters.MEDIAN;
    }
}
