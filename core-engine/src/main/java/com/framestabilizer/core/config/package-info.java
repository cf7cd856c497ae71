/**
 * Configuration loading and validation for the stabilization engine.
 *
 * <p>
 * The YAML file is bound to
 * {@link com.framestabilizer.core.config.StabilizationSettings} by
 * {@link com.framestabilizer.core.config.StabilizationConfigLoader} and
 * converted into an immutable
 * {@link com.framestabilizer.core.config.StabilizationConfig}. Validation is
 * performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.framestabilizer.core.config;
