package com.cenalert.core.detection;

import com.cenalert.core.model.DetectorParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that binds {@link DetectorParameters} to a ready-to-run
 * {@link AnomalyLifecycle}.
 *
 * <p>
 * This is the single point of extension when adding new algorithms:
 * register the name here and bind its positional values.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    static final double DEFAULT_WINDOW = 60;
    static final double DEFAULT_MIN_RESIDUAL = 1;
    static final double DEFAULT_EFFICIENCY = 0.05;

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a lifecycle for the given parameters.
     *
     * @param parameters algorithm and positional values; must not be
     *                   {@code null}
     * @return a fresh lifecycle, bound to no series yet
     * @throws NullPointerException  if {@code parameters} is {@code null}
     * @throws IllegalStateException if the parameters are invalid
     */
    public static AnomalyLifecycle create(DetectorParameters parameters) {
        Objects.requireNonNull(parameters, "DetectorParameters must not be null");
        parameters.validate();

        String algorithm = parameters.getAlgorithm();
        double minResidual = parameters.valueAt(algorithm.equals(DetectorParameters.CHEBYSHEV) ? 3 : 2,
                DEFAULT_MIN_RESIDUAL);
        double efficiency = parameters.valueAt(algorithm.equals(DetectorParameters.CHEBYSHEV) ? 4 : 3,
                DEFAULT_EFFICIENCY);

        AnomalyLifecycle lifecycle = switch (algorithm) {
            case DetectorParameters.CHEBYSHEV -> new AnomalyLifecycle(
                    new ChebyshevDetector(
                            parameters.valueAt(1, ChebyshevDetector.DEFAULT_Z),
                            parameters.valueAt(2, ChebyshevDetector.DEFAULT_K)),
                    parameters.getParameters().isEmpty() ? (int) DEFAULT_WINDOW : parameters.windowSize(),
                    minResidual, efficiency);
            case DetectorParameters.MEDIAN -> {
                int halfNeighborhood = parameters.windowSize();
                yield new AnomalyLifecycle(
                        new MedianMethodDetector(halfNeighborhood, parameters.valueAt(1, Double.NaN)),
                        2 * halfNeighborhood, minResidual, efficiency);
            }
            case DetectorParameters.IFOREST -> new AnomalyLifecycle(
                    new IsolationForestDetector(
                            parameters.valueAt(1, IsolationForestDetector.DEFAULT_MIN_SCORE)),
                    parameters.windowSize(), minResidual, efficiency);
            case DetectorParameters.LOF -> {
                int window = parameters.windowSize();
                yield new AnomalyLifecycle(
                        new LocalOutlierFactorDetector(Math.max(1, window - 1),
                                parameters.valueAt(1, LocalOutlierFactorDetector.DEFAULT_MIN_SCORE)),
                        window, minResidual, efficiency);
            }
            default -> throw new IllegalArgumentException(
                    "Unknown algorithm: '" + algorithm + "'. Supported: chebyshev, median, iforest, lof");
        };

        LOG.debug("Created {} detector from {}", algorithm, parameters.getParameters());
        return lifecycle;
    }
}
