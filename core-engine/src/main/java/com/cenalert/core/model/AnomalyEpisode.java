package com.cenalert.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A maximal run of consecutive anomalous records, reduced to its onset, peak
 * and impact.
 *
 * <p>
 * {@code impact} is the sum of observed values over the run minus the sum of
 * the thresholds recorded for the same rows. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "start", "end", "peak", "score", "residual", "impact" })
public final class AnomalyEpisode {

    private final int startIndex;
    private final int endIndex;
    private final LocalDate start;
    private final LocalDate end;
    private final LocalDate peak;
    private final double score;
    private final double residual;
    private final double impact;

    /**
     * @param startIndex row index of the first anomalous record
     * @param endIndex   row index of the last anomalous record (inclusive)
     * @param start      date of the first record
     * @param end        date of the last record
     * @param peak       date of the record with the largest value
     * @param score      score at onset
     * @param residual   residual at onset
     * @param impact     Σ value − Σ threshold over the run
     */
    public AnomalyEpisode(int startIndex, int endIndex, LocalDate start, LocalDate end,
            LocalDate peak, double score, double residual, double impact) {
        if (endIndex < startIndex) {
            throw new IllegalArgumentException(
                    "endIndex must be >= startIndex, got: " + startIndex + ".." + endIndex);
        }
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        this.peak = Objects.requireNonNull(peak, "peak must not be null");
        this.score = score;
        this.residual = residual;
        this.impact = impact;
    }

    @JsonIgnore
    public int getStartIndex() {
        return startIndex;
    }

    @JsonIgnore
    public int getEndIndex() {
        return endIndex;
    }

    /**
     * @return number of records in the run
     */
    public int length() {
        return endIndex - startIndex + 1;
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public LocalDate getPeak() {
        return peak;
    }

    public double getScore() {
        return score;
    }

    public double getResidual() {
        return residual;
    }

    public double getImpact() {
        return impact;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEpisode that))
            return false;
        return startIndex == that.startIndex
                && endIndex == that.endIndex
                && Double.compare(score, that.score) == 0
                && Double.compare(residual, that.residual) == 0
                && Double.compare(impact, that.impact) == 0
                && Objects.equals(start, that.start)
                && Objects.equals(end, that.end)
                && Objects.equals(peak, that.peak);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startIndex, endIndex, start, end, peak, score, residual, impact);
    }

    @Override
    public String toString() {
        return "AnomalyEpisode{" +
                "start=" + start +
                ", end=" + end +
                ", peak=" + peak +
                ", score=" + score +
                ", residual=" + residual +
                ", impact=" + impact +
                '}';
    }
}
