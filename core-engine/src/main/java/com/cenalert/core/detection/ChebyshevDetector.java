package com.cenalert.core.detection;

import com.cenalert.core.model.DetectorParameters;
import com.cenalert.core.window.Window;

/**
 * Z-score detector with a bound chosen by Chebyshev's inequality.
 *
 * <p>
 * The score is {@code (x − μ) / σ} over the window. When the window passes a
 * Shapiro-Wilk normality test the tight bound {@code z} applies; otherwise
 * the distribution-free bound {@code k} applies. The bound is re-chosen on
 * every {@link #score} call; until the first call it is +∞.
 * </p>
 *
 * @since 1.0.0
 */
public class ChebyshevDetector implements AnomalyDetector {

    static final double DEFAULT_Z = 3;
    static final double DEFAULT_K = 6;

    private final double z;
    private final double k;

    private double minScore = Double.POSITIVE_INFINITY;

    /**
     * @param z bound used when the window looks normal
     * @param k bound used otherwise
     * @throws IllegalArgumentException if either bound is not positive
     */
    public ChebyshevDetector(double z, double k) {
        if (!(z > 0) || !(k > 0)) {
            throw new IllegalArgumentException("z and k must be > 0, got: z=" + z + ", k=" + k);
        }
        this.z = z;
        this.k = k;
    }

    @Override
    public double score(Window window, double value) {
        double mu = window.mean();
        double sigma = window.std();
        minScore = window.isNormal() ? z : k;
        return (value - mu) / sigma;
    }

    @Override
    public double threshold(Window window, double initialGuess) {
        return window.mean() + minScore * window.std();
    }

    @Override
    public double minScore() {
        return minScore;
    }

    @Override
    public String getName() {
        return DetectorParameters.CHEBYSHEV;
    }
}
