package com.cenalert.core.detection;

import com.cenalert.core.demand.DemandClassifier;
import com.cenalert.core.forecast.CrostonSba;
import com.cenalert.core.model.AnnotatedRecord;
import com.cenalert.core.model.DemandPattern;
import com.cenalert.core.model.SeriesPoint;
import com.cenalert.core.window.EfficiencyRatio;
import com.cenalert.core.window.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Anomaly lifecycle state machine.
 *
 * <p>
 * Consumes a series one point at a time and decides whether the series is
 * normal or inside an anomaly. Each point is routed by the window's demand
 * pattern: sparse regimes are judged by the residual against a Croston SBA
 * forecast, dense regimes by the configured {@link AnomalyDetector}.
 * </p>
 *
 * <h3>Per point</h3>
 * <ol>
 * <li>Warm-up: the first {@code capacity} points only fill the window.</li>
 * <li>Gap check: a gap of at least {@code capacity} since the last arrival
 * clears the window (only while normal).</li>
 * <li>Demand classification, frozen while an anomaly is active.</li>
 * <li>Forecast residual or detector score.</li>
 * <li>Transitions: {@code newAnomaly}, {@code returnToNormal} and
 * {@code newNormal} are all evaluated against the state before this
 * point.</li>
 * <li>On exit the anomalous trajectory is folded back into the window
 * (re-baselining).</li>
 * <li>An {@link AnnotatedRecord} is emitted.</li>
 * <li>While normal, positive values enter the window.</li>
 * </ol>
 *
 * <h3>State</h3>
 * <p>
 * This is a <strong>stateful</strong>, single-series object. Only O(1) history
 * of previous records is kept (last value, demand pattern and threshold).
 * Independent series need independent instances; those may run in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyLifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyLifecycle.class);

    /** Fraction of the window's upper tail clipped when leaving a sparse regime. */
    static final double REGIME_SWITCH_CLIP = 0.05;

    private final AnomalyDetector detector;
    private final Window window;
    private final EfficiencyRatio trajectory = new EfficiencyRatio();
    private final double minResidual;
    private final double efficiency;

    private CrostonSba forecaster;
    private double forecast;
    private boolean activeAnomaly;
    private boolean intermittentDemandAnomaly;

    // Last emitted record, as far as the next point needs it
    private int index;
    private double lastValue = Double.NaN;
    private DemandPattern lastDemandPattern = DemandPattern.NONE;
    private double lastThreshold = Double.NaN;

    /**
     * @param detector    scoring strategy; must not be {@code null}
     * @param capacity    sliding-window capacity, also the warm-up length
     * @param minResidual forecast residual at or above which a sparse-regime
     *                    point is anomalous
     * @param efficiency  efficiency ratio below which an anomaly is considered
     *                    to have run its course
     * @throws NullPointerException     if {@code detector} is {@code null}
     * @throws IllegalArgumentException if {@code capacity} &lt; 1
     */
    public AnomalyLifecycle(AnomalyDetector detector, int capacity, double minResidual, double efficiency) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.window = Window.sliding(capacity);
        this.minResidual = minResidual;
        this.efficiency = efficiency;
    }

    /**
     * Run the whole series through this lifecycle.
     *
     * @param series points in strictly increasing date order
     * @return one record per point, in input order
     */
    public List<AnnotatedRecord> run(List<SeriesPoint> series) {
        Objects.requireNonNull(series, "series must not be null");
        List<AnnotatedRecord> records = new ArrayList<>(series.size());
        for (SeriesPoint point : series) {
            records.add(process(point.getDate(), point.getValue()));
        }
        LOG.debug("Detector [{}] processed {} point(s)", detector.getName(), series.size());
        return records;
    }

    /**
     * Process the next point of the series.
     *
     * @param date  date of the point
     * @param value observed value
     * @return the annotated record for this point
     */
    public AnnotatedRecord process(LocalDate date, double value) {
        int idx = index++;

        if (idx < window.capacity()) {
            if (value > 0) {
                window.insert(value, idx + 1L);
            }
            lastValue = value;
            return AnnotatedRecord.builder().index(idx).date(date).value(value).build();
        }

        long interarrival = window.lastArrival().isPresent() ? idx - window.lastArrival().getAsLong() : -1;
        if (!activeAnomaly && interarrival >= window.capacity()) {
            LOG.trace("Index {}: gap of {} reached capacity, clearing window", idx, interarrival);
            window.clear();
        }

        double score = activeAnomaly ? Double.POSITIVE_INFINITY : 0;
        double residual = activeAnomaly ? Double.POSITIVE_INFINITY : 0;

        DemandPattern demand = activeAnomaly ? lastDemandPattern : DemandClassifier.classify(window, idx);

        if (value > 0 && demand.isForecastDriven()) {
            if (!activeAnomaly) {
                forecaster = new CrostonSba(window.toDenseArray());
            }
            forecast = window.isEmpty() ? 0 : forecaster.forecast();
            residual = value - forecast;
        } else if (value > 0) {
            if (lastDemandPattern.isSparse()) {
                window.winsorize(0, REGIME_SWITCH_CLIP);
            }
            score = detector.score(window, value);
        }

        double minScore = detector.minScore();
        boolean newAnomaly = !activeAnomaly && (score >= minScore || residual >= minResidual);
        boolean returnToNormal = activeAnomaly
                && (score < minScore || residual < minResidual || isCloseToZero(value));
        boolean newNormal = activeAnomaly && trajectory.efficiencyRatio() < efficiency;

        activeAnomaly = (newAnomaly || activeAnomaly) && !(returnToNormal || newNormal);

        double threshold = Double.NaN;
        if (newAnomaly) {
            intermittentDemandAnomaly = demand.isForecastDriven();
            threshold = intermittentDemandAnomaly
                    ? forecast + minResidual
                    : detector.threshold(window, value);
            trajectory.insert(lastValue);
            LOG.debug("Index {} ({}): anomaly entered, demand={}, score={}, residual={}, threshold={}",
                    idx, date, demand.label(), score, residual, threshold);
        }
        if (activeAnomaly) {
            trajectory.insert(value);
        }

        if (newNormal || returnToNormal) {
            LOG.debug("Index {} ({}): anomaly exited via {}", idx, date,
                    returnToNormal ? "return to normal" : "new normal");
            rebaseline(idx, value, returnToNormal, newNormal);
        }

        boolean refreshDiagnostics = !activeAnomaly || newAnomaly;
        double recordThreshold = newAnomaly ? threshold : (activeAnomaly ? lastThreshold : Double.NaN);
        AnnotatedRecord record = AnnotatedRecord.builder()
                .index(idx)
                .date(date)
                .value(value)
                .anomaly(activeAnomaly)
                .score(score)
                .residual(residual)
                .threshold(recordThreshold)
                .minScore(minScore)
                .cov2(refreshDiagnostics ? window.cv2() : Double.NaN)
                .adi(refreshDiagnostics ? window.averageInterdemandInterval(idx) : Double.NaN)
                .demandPattern(demand)
                .build();

        if (!activeAnomaly && value > 0) {
            window.insert(value, idx + 1L);
        }

        lastValue = value;
        lastDemandPattern = demand;
        lastThreshold = recordThreshold;
        return record;
    }

    /**
     * Fold the finished anomaly back into the window.
     *
     * <p>
     * The target mean is the window mean when the anomaly simply returned to
     * normal and the current value when it settled at a new level. A dense
     * anomaly is re-inserted and the whole window remapped to the target mean
     * and standard deviation. A sparse anomaly that settled replaces the
     * window and is ratio-scaled to the target mean; one that returned to
     * normal is re-inserted unchanged, since the forecaster's smoothing
     * already damps it.
     * </p>
     */
    private void rebaseline(int idx, double value, boolean returnToNormal, boolean newNormal) {
        double[] anomaly = trajectory.withoutSeed();
        double targetMean = returnToNormal ? window.mean() : value;
        double targetStd = window.std();

        if (intermittentDemandAnomaly && newNormal) {
            window.clear();
            window.resetLastArrival(idx - (long) anomaly.length);
        }

        for (int i = 0; i < anomaly.length; i++) {
            window.insert(anomaly[i], idx - anomaly.length + i + 1L);
        }

        if (!intermittentDemandAnomaly) {
            window.standardize(targetMean, targetStd);
        } else if (newNormal) {
            double anomalyMean = 0;
            for (double v : anomaly) {
                anomalyMean += v;
            }
            anomalyMean /= anomaly.length;
            window.scale(targetMean / anomalyMean);
        }

        intermittentDemandAnomaly = false;
        trajectory.clear();
    }

    private static boolean isCloseToZero(double value) {
        return Math.abs(value) <= 1e-8;
    }

    /**
     * @return {@code true} while an anomaly is open
     */
    public boolean isActiveAnomaly() {
        return activeAnomaly;
    }

    /**
     * @return the strategy scoring dense-regime points
     */
    public AnomalyDetector getDetector() {
        return detector;
    }

    /**
     * @return the live window; exposed for inspection
     */
    Window window() {
        return window;
    }
}
