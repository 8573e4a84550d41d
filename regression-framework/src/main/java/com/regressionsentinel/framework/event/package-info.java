/**
 * Notifications published on the framework's event bus.
 *
 * <p>
 * The framework republishes the engines' own events
 * ({@link com.regressionsentinel.core.event.AnomalyDetectedEvent},
 * {@link com.regressionsentinel.core.event.TrendChangeEvent},
 * {@link com.regressionsentinel.core.event.AlertEscalatedEvent}) next to the
 * ones defined here, so a dashboard subscribes in one place.
 * </p>
 */
package com.regressionsentinel.framework.event;
