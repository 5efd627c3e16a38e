/**
 * Reduction of annotated runs to anomaly episodes.
 *
 * @since 1.0.0
 */
package com.cenalert.core.episode;
