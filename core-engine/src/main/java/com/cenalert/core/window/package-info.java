/**
 * Observation buffers and the statistics computed over them.
 *
 * <p>
 * {@link com.cenalert.core.window.Window} holds the recent nonzero history a
 * detector scores against; {@link com.cenalert.core.window.EfficiencyRatio}
 * follows the trajectory of an ongoing anomaly.
 * </p>
 *
 * @since 1.0.0
 */
package com.cenalert.core.window;
