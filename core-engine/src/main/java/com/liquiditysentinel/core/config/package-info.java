/**
 * Configuration loading and validation for Liquidity Sentinel.
 *
 * <p>
 * Alert thresholds, regime cutoffs and regime weights are defined in YAML and
 * loaded by {@link com.liquiditysentinel.core.config.ConfigLoader} into an
 * {@link com.liquiditysentinel.core.config.EngineConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.liquiditysentinel.core.config;
