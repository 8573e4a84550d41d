package com.regressionsentinel.framework.collaborator;

import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.PerformanceMetrics;

import java.util.List;
import java.util.Optional;

/**
 * External regression detector comparing a run against its baseline.
 */
public interface RegressionChecker {

    /**
     * @return the regression alert, or empty if the run is within thresholds
     *         (or has no baseline yet)
     */
    Optional<Alert> checkRegression(String testType, String testName, PerformanceMetrics metrics,
            RunMetadata metadata);

    /**
     * @return regressions the detector still considers open
     */
    List<Alert> getActiveAlerts();

    /**
     * Checker that never reports a regression, for processes running without
     * a baseline comparison service.
     */
    static RegressionChecker disabled() {
        return new RegressionChecker() {
            @Override
            public Optional<Alert> checkRegression(String testType, String testName, PerformanceMetrics metrics,
                    RunMetadata metadata) {
                return Optional.empty();
            }

            @Override
            public List<Alert> getActiveAlerts() {
                return List.of();
            }
        };
    }
}
