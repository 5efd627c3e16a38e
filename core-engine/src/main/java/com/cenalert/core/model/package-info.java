/**
 * Domain model classes for CenAlert.
 *
 * <ul>
 * <li>{@link com.cenalert.core.model.SeriesPoint}: one input observation</li>
 * <li>{@link com.cenalert.core.model.AnnotatedRecord}: per-point detector
 * output</li>
 * <li>{@link com.cenalert.core.model.AnomalyEpisode}: summarized run of
 * anomalous points</li>
 * <li>{@link com.cenalert.core.model.DemandPattern}: demand regime</li>
 * <li>{@link com.cenalert.core.model.DetectorParameters}: algorithm
 * configuration POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cenalert.core.model;
