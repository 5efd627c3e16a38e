package com.cenalert.core.detection;

import com.cenalert.core.model.DetectorParameters;
import com.cenalert.core.window.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Isolation-forest detector.
 *
 * <p>
 * Fits a fresh forest on the window plus the candidate on every call and
 * reports the candidate's isolation score. Candidates at or below the window
 * mean are never surges and score {@value #NOT_ANOMALOUS}. A sample too small
 * to fit scores NaN.
 * </p>
 *
 * <p>
 * Refitting per point dominates the cost of a run.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestDetector.class);

    static final double DEFAULT_MIN_SCORE = 0.8;
    static final double NOT_ANOMALOUS = 0;
    static final int NUM_TREES = 10;
    static final long SEED = 1L;

    private final double minScore;

    /**
     * @param minScore isolation score at or above which a value is anomalous
     */
    public IsolationForestDetector(double minScore) {
        this.minScore = minScore;
    }

    @Override
    public double score(Window window, double value) {
        double[] sample = withCandidate(window, value);
        try {
            IsolationForest forest = IsolationForest.fit(sample, NUM_TREES, SEED);
            return value > window.mean() ? forest.score(value) : NOT_ANOMALOUS;
        } catch (IllegalArgumentException e) {
            LOG.debug("Isolation forest fit failed on {} sample(s): {}", sample.length, e.getMessage());
            return Double.NaN;
        }
    }

    @Override
    public double threshold(Window window, double initialGuess) {
        return ThresholdSearch.find(x -> score(window, x), minScore, window.mean(), initialGuess);
    }

    static double[] withCandidate(Window window, double value) {
        double[] current = window.toArray();
        double[] sample = Arrays.copyOf(current, current.length + 1);
        sample[current.length] = value;
        return sample;
    }

    @Override
    public double minScore() {
        return minScore;
    }

    @Override
    public String getName() {
        return DetectorParameters.IFOREST;
    }
}
