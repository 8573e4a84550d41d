/**
 * Seams to the services the framework calls but does not implement:
 * baseline storage, baseline comparison and visual regression testing.
 *
 * <p>
 * {@link com.regressionsentinel.framework.collaborator.InMemoryBaselineRecorder}
 * and {@link com.regressionsentinel.framework.collaborator.RegressionChecker#disabled()}
 * let the process run standalone.
 * </p>
 */
package com.regressionsentinel.framework.collaborator;
