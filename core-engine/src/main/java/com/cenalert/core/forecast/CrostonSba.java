package com.cenalert.core.forecast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Croston's method with the Syntetos-Boylan bias correction.
 *
 * <p>
 * The dense series is split into nonzero demand sizes and the intervals
 * between them; each is smoothed by simple exponential smoothing with
 * {@value #ALPHA}, and the forecast is
 * {@code (1 − α/2) × smoothedSize / smoothedInterval}.
 * </p>
 *
 * <p>
 * The forecast is computed once at construction: a forecaster is a snapshot
 * of the window it was built from.
 * </p>
 *
 * @since 1.0.0
 */
public class CrostonSba {

    /** Smoothing constant for sizes and intervals. */
    static final double ALPHA = 0.1;

    /** Bias correction factor, 1 − α/2. */
    static final double BIAS_CORRECTION = 1 - ALPHA / 2;

    private final double forecast;

    /**
     * @param dense zero-filled series; must not be {@code null}
     */
    public CrostonSba(double[] dense) {
        Objects.requireNonNull(dense, "series must not be null");
        this.forecast = fit(dense);
    }

    /**
     * @return the one-step-ahead point forecast, zero when the series has no
     *         demand
     */
    public double forecast() {
        return forecast;
    }

    private static double fit(double[] dense) {
        List<Double> sizes = new ArrayList<>();
        List<Double> intervals = new ArrayList<>();
        int previous = -1;
        for (int i = 0; i < dense.length; i++) {
            if (dense[i] != 0) {
                sizes.add(dense[i]);
                intervals.add((double) (i - previous));
                previous = i;
            }
        }
        if (sizes.isEmpty()) {
            return 0;
        }

        double size = smooth(sizes);
        double interval = smooth(intervals);
        double classic = interval != 0 ? size / interval : size;
        return BIAS_CORRECTION * classic;
    }

    /**
     * One-step-ahead simple exponential smoothing forecast, initialised at the
     * first observation.
     */
    static double smooth(List<Double> x) {
        double smoothed = x.get(0);
        for (int i = 1; i < x.size(); i++) {
            smoothed = ALPHA * x.get(i - 1) + (1 - ALPHA) * smoothed;
        }
        return ALPHA * x.get(x.size() - 1) + (1 - ALPHA) * smoothed;
    }
}
