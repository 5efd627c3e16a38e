/**
 * Loading of detector parameters from YAML.
 *
 * @since 1.0.0
 */
package com.cenalert.core.config;
