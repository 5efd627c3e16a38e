package com.cenalert.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Algorithm choice plus an ordered tuple of constructor arguments.
 *
 * <p>
 * Values are bound positionally to the algorithm's arguments; trailing values
 * may be omitted where the algorithm has defaults. The first value is always
 * the window size (half neighborhood for {@code median}) and is rounded to the
 * nearest integer, halves to even.
 * </p>
 *
 * <ul>
 * <li>{@code chebyshev}: window, z, k, min_residual, efficiency</li>
 * <li>{@code median}: half_neighborhood, min_score, min_residual,
 * efficiency</li>
 * <li>{@code iforest}: window, min_score, min_residual, efficiency</li>
 * <li>{@code lof}: window, min_score, min_residual, efficiency</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorParameters {

    public static final String CHEBYSHEV = "chebyshev";
    public static final String MEDIAN = "median";
    public static final String IFOREST = "iforest";
    public static final String LOF = "lof";

    /** Largest number of positional values any algorithm accepts. */
    static final int MAX_VALUES = 5;

    private String algorithm;

    private List<Number> parameters = new ArrayList<>();

    /** No-arg constructor required by SnakeYAML. */
    public DetectorParameters() {
    }

    /**
     * @param algorithm  algorithm name
     * @param parameters positional values
     */
    public DetectorParameters(String algorithm, List<? extends Number> parameters) {
        setAlgorithm(algorithm);
        setParameters(parameters == null ? null : new ArrayList<>(parameters));
    }

    /**
     * Validate the algorithm name and the number and range of the values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (algorithm == null || algorithm.isBlank()) {
            errors.add("'algorithm' is required");
        } else {
            int required = switch (algorithm) {
                case CHEBYSHEV -> 0;
                case MEDIAN -> 4;
                case IFOREST, LOF -> 1;
                default -> {
                    errors.add("Unknown algorithm: '" + algorithm
                            + "'. Supported: chebyshev, median, iforest, lof");
                    yield -1;
                }
            };
            int max = MEDIAN.equals(algorithm) ? 4 : MAX_VALUES;
            if (required >= 0 && (parameters.size() < required || parameters.size() > max)) {
                errors.add("Algorithm '" + algorithm + "' takes between " + required + " and " + max
                        + " parameters, got: " + parameters.size());
            }
        }

        for (int i = 0; i < parameters.size(); i++) {
            Number n = parameters.get(i);
            if (n == null || !Double.isFinite(n.doubleValue())) {
                errors.add("Parameter at position " + i + " must be a finite number, got: " + n);
            }
        }
        if (!parameters.isEmpty() && parameters.get(0) != null && windowSize() < 1) {
            errors.add("Window size (position 0) must round to >= 1, got: " + parameters.get(0));
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorParameters: " + String.join("; ", errors));
        }
    }

    /**
     * @return the first value rounded to the nearest integer, ties to even
     * @throws IllegalStateException if no values are present
     */
    public int windowSize() {
        if (parameters.isEmpty()) {
            throw new IllegalStateException("No window size present");
        }
        return (int) Math.rint(parameters.get(0).doubleValue());
    }

    /**
     * Value at {@code position}, or {@code defaultValue} when the tuple is
     * shorter.
     *
     * @param position     zero-based position
     * @param defaultValue fallback
     * @return the bound value
     */
    public double valueAt(int position, double defaultValue) {
        return position < parameters.size() ? parameters.get(position).doubleValue() : defaultValue;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * Set the algorithm name, normalised to lowercase.
     *
     * @param algorithm algorithm name
     */
    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm != null ? algorithm.trim().toLowerCase(Locale.ROOT) : null;
    }

    /**
     * @return unmodifiable view of the positional values
     */
    public List<Number> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public void setParameters(List<Number> parameters) {
        this.parameters = parameters != null ? new ArrayList<>(parameters) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorParameters that))
            return false;
        return Objects.equals(algorithm, that.algorithm) && Objects.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, parameters);
    }

    @Override
    public String toString() {
        return "DetectorParameters{algorithm='" + algorithm + "', parameters=" + parameters + '}';
    }
}
