/**
 * Domain model shared by the statistical engine, the alerting engine and the
 * framework layer:
 * <ul>
 * <li>{@link com.regressionsentinel.core.model.MetricSample} with its
 * {@link com.regressionsentinel.core.model.PerformanceMetrics} block</li>
 * <li>{@link com.regressionsentinel.core.model.Alert} and its delivery form
 * {@link com.regressionsentinel.core.model.EnhancedAlert}</li>
 * <li>{@link com.regressionsentinel.core.model.BaselineComparison} and
 * {@link com.regressionsentinel.core.model.VisualRegressionResult} as
 * produced by external collaborators</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.regressionsentinel.core.model;
