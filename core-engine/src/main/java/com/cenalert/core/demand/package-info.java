/**
 * Demand regime classification.
 *
 * @since 1.0.0
 */
package com.cenalert.core.demand;
