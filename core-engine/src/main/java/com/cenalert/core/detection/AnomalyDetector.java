package com.cenalert.core.detection;

import com.cenalert.core.window.Window;

/**
 * Contract for the scoring strategies used by {@link AnomalyLifecycle}.
 *
 * <p>
 * A strategy only answers two questions about a candidate value given the
 * current window: how anomalous is it ({@link #score}), and which value would
 * sit exactly at the anomaly boundary ({@link #threshold}). Everything else
 * (warm-up, demand classification, entry and exit, re-baselining) is shared
 * and lives in {@link AnomalyLifecycle}.
 * </p>
 *
 * <p>
 * Implementations may be <strong>stateful</strong>: the minimum score can be
 * recomputed on every {@link #score} call. An instance belongs to one
 * lifecycle and must not be shared between series.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Score a candidate value against the window.
     *
     * @param window the current window; not modified
     * @param value  the candidate, strictly positive
     * @return the score, or NaN if it cannot be computed
     */
    double score(Window window, double value);

    /**
     * Estimate the smallest value the window would flag.
     *
     * @param window       the current window; not modified
     * @param initialGuess a value known to be anomalous (the onset value)
     * @return the threshold
     */
    double threshold(Window window, double initialGuess);

    /**
     * @return score at or above which a value is anomalous
     */
    double minScore();

    /**
     * @return algorithm name, as accepted by {@link DetectorFactory}
     */
    String getName();
}
