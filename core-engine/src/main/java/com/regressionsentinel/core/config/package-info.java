/**
 * YAML configuration of the analysis and alerting engines.
 *
 * <p>
 * {@link com.regressionsentinel.core.config.SentinelConfigLoader} parses
 * {@code sentinel.yml} into a
 * {@link com.regressionsentinel.core.config.SentinelConfig} and validates it
 * before returning.
 * </p>
 *
 * @since 1.0.0
 */
package com.regressionsentinel.core.config;
