/**
 * Regression Sentinel process and the framework that drives test runs.
 *
 * <p>
 * This package wires the statistical analysis and alerting engines from
 * {@code core-engine} into a single orchestrator that runs workloads,
 * records their results and keeps the data directory in shape.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.regressionsentinel.framework.RegressionSentinelApp} - main
 * entry point</li>
 * <li>{@link com.regressionsentinel.framework.PerformanceRegressionFramework}
 * - test run pipeline, reports, exports and background jobs</li>
 * <li>{@link com.regressionsentinel.framework.FrameworkConfig} -
 * environment-driven configuration</li>
 * <li>{@link com.regressionsentinel.framework.HealthServer} - HTTP
 * health/readiness endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.regressionsentinel.framework;
