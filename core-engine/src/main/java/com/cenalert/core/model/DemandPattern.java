package com.cenalert.core.model;

import java.util.Locale;

/**
 * Demand regime of the recent, nonzero history of a series.
 *
 * <p>
 * Derived from the squared coefficient of variation (CV²) and the average
 * inter-demand interval (ADI) of the detector's window; see
 * {@link com.cenalert.core.demand.DemandClassifier}.
 * </p>
 *
 * @since 1.0.0
 */
public enum DemandPattern {

    ERRATIC,
    LUMPY,
    SMOOTH,
    INTERMITTENT,
    /** Statistics undefined, e.g. an empty window. */
    NONE;

    /**
     * Whether points in this regime are scored against an intermittent-demand
     * forecast rather than by the configured detector.
     *
     * @return {@code true} for {@code NONE}, {@code LUMPY} and
     *         {@code INTERMITTENT}
     */
    public boolean isForecastDriven() {
        return this == NONE || this == LUMPY || this == INTERMITTENT;
    }

    /**
     * Whether the window may be carrying residue of a sparse regime.
     *
     * @return {@code true} for {@code LUMPY} and {@code INTERMITTENT}
     */
    public boolean isSparse() {
        return this == LUMPY || this == INTERMITTENT;
    }

    /**
     * @return lowercase label used in reports
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a report label back into a pattern.
     *
     * @param label lowercase or uppercase label
     * @return the matching pattern
     * @throws IllegalArgumentException if the label is unknown
     */
    public static DemandPattern fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
