/**
 * Streaming anomaly-detection engine.
 *
 * <p>
 * {@link com.cenalert.core.detection.AnomalyLifecycle} is the state machine
 * that walks a series; it delegates scoring of dense-demand points to an
 * {@link com.cenalert.core.detection.AnomalyDetector} strategy. Built-in
 * strategies:
 * </p>
 * <ul>
 * <li>{@link com.cenalert.core.detection.ChebyshevDetector}: z-score with a
 * normality-dependent bound</li>
 * <li>{@link com.cenalert.core.detection.MedianMethodDetector}: robust
 * median baseline</li>
 * <li>{@link com.cenalert.core.detection.IsolationForestDetector}: isolation
 * score</li>
 * <li>{@link com.cenalert.core.detection.LocalOutlierFactorDetector}: local
 * density ratio</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add an algorithm, implement {@code AnomalyDetector} and bind its
 * parameters in {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.cenalert.core.detection;
