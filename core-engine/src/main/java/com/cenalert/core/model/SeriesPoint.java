package com.cenalert.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One observation of the input series: a date and a non-negative volume.
 *
 * <p>
 * Zero values mean "no demand" and are never inserted into a detector's
 * window.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesPoint {

    private LocalDate date;
    private double value;

    /** No-arg constructor required by Jackson. */
    public SeriesPoint() {
    }

    /**
     * @param date  observation date; must not be {@code null}
     * @param value observed value
     */
    public SeriesPoint(LocalDate date, double value) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && Objects.equals(date, that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value);
    }

    @Override
    public String toString() {
        return "SeriesPoint{date=" + date + ", value=" + value + '}';
    }
}
