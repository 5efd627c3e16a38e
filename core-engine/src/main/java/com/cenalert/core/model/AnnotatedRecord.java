package com.cenalert.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Per-timestep output of an {@link com.cenalert.core.detection.AnomalyLifecycle}
 * run.
 *
 * <p>
 * One record is emitted for every input point, in input order, so the list of
 * records forms the full audit trail of a run. Fields that are undefined for a
 * given step (for instance the threshold outside an anomaly, or every
 * statistic during warm-up) hold {@link Double#NaN}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code date} and {@code demandPattern} are
 * required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "index", "date", "value", "anomaly", "score", "residual", "threshold",
        "min_score", "cov2", "adi", "demand_pattern" })
public final class AnnotatedRecord {

    private final int index;
    private final LocalDate date;
    private final double value;
    private final boolean anomaly;
    private final double score;
    private final double residual;
    private final double threshold;
    private final double minScore;
    private final double cov2;
    private final double adi;
    private final DemandPattern demandPattern;

    private AnnotatedRecord(Builder builder) {
        this.index = builder.index;
        this.date = Objects.requireNonNull(builder.date, "date must not be null");
        this.value = builder.value;
        this.anomaly = builder.anomaly;
        this.score = builder.score;
        this.residual = builder.residual;
        this.threshold = builder.threshold;
        this.minScore = builder.minScore;
        this.cov2 = builder.cov2;
        this.adi = builder.adi;
        this.demandPattern = Objects.requireNonNull(builder.demandPattern, "demandPattern must not be null");
    }

    /**
     * Create a new {@link Builder}. Every statistic defaults to NaN.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnnotatedRecord} instances.
     */
    public static class Builder {
        private int index;
        private LocalDate date;
        private double value;
        private boolean anomaly;
        private double score = Double.NaN;
        private double residual = Double.NaN;
        private double threshold = Double.NaN;
        private double minScore = Double.NaN;
        private double cov2 = Double.NaN;
        private double adi = Double.NaN;
        private DemandPattern demandPattern = DemandPattern.NONE;

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder residual(double residual) {
            this.residual = residual;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder minScore(double minScore) {
            this.minScore = minScore;
            return this;
        }

        public Builder cov2(double cov2) {
            this.cov2 = cov2;
            return this;
        }

        public Builder adi(double adi) {
            this.adi = adi;
            return this;
        }

        public Builder demandPattern(DemandPattern demandPattern) {
            this.demandPattern = demandPattern;
            return this;
        }

        /**
         * @return a new {@link AnnotatedRecord}
         * @throws NullPointerException if {@code date} or {@code demandPattern}
         *                              is {@code null}
         */
        public AnnotatedRecord build() {
            return new AnnotatedRecord(this);
        }
    }

    public int getIndex() {
        return index;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public double getScore() {
        return score;
    }

    public double getResidual() {
        return residual;
    }

    public double getThreshold() {
        return threshold;
    }

    @JsonProperty("min_score")
    public double getMinScore() {
        return minScore;
    }

    public double getCov2() {
        return cov2;
    }

    public double getAdi() {
        return adi;
    }

    @JsonIgnore
    public DemandPattern getDemandPattern() {
        return demandPattern;
    }

    @JsonProperty("demand_pattern")
    public String getDemandPatternLabel() {
        return demandPattern.label();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnnotatedRecord that))
            return false;
        return index == that.index
                && anomaly == that.anomaly
                && Double.compare(value, that.value) == 0
                && Double.compare(score, that.score) == 0
                && Double.compare(residual, that.residual) == 0
                && Double.compare(threshold, that.threshold) == 0
                && Double.compare(minScore, that.minScore) == 0
                && Double.compare(cov2, that.cov2) == 0
                && Double.compare(adi, that.adi) == 0
                && Objects.equals(date, that.date)
                && demandPattern == that.demandPattern;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, date, value, anomaly, score, residual, threshold, demandPattern);
    }

    @Override
    public String toString() {
        return "AnnotatedRecord{" +
                "index=" + index +
                ", date=" + date +
                ", value=" + value +
                ", anomaly=" + anomaly +
                ", score=" + score +
                ", residual=" + residual +
                ", threshold=" + threshold +
                ", minScore=" + minScore +
                ", demandPattern=" + demandPattern +
                '}';
    }
}
