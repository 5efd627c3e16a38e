/**
 * Command-line batch runner for cen-alert.
 *
 * <p>
 * Reads series and known events from CSV, runs one detector lifecycle per
 * series, matches the resulting episodes to events and writes the reports.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.cenalert.runner.CenAlertRunner}: main entry point</li>
 * <li>{@link com.cenalert.runner.SeriesBatch}: parallel multi-series
 * execution</li>
 * <li>{@link com.cenalert.runner.EventMatcher}: nearest-event tagging</li>
 * <li>{@link com.cenalert.runner.RunnerConfig}: command-line
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cenalert.runner;
