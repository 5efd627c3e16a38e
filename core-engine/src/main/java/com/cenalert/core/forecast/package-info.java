/**
 * Point forecasts for sparse, intermittent demand.
 *
 * @since 1.0.0
 */
package com.cenalert.core.forecast;
