package com.regressionsentinel.framework.event;

import com.regressionsentinel.core.event.SentinelEvent;
import com.regressionsentinel.core.model.Alert;

import java.time.Instant;
import java.util.Optional;

/**
 * A run has been compared against its baseline, whatever the outcome.
 */
public class ComparisonCompletedEvent extends SentinelEvent {

    private final String testType;
    private final String testName;
    private final Alert alert;

    public ComparisonCompletedEvent(Instant timestamp, String testType, String testName, Alert alert) {
        super(timestamp);
        this.testType = testType;
        this.testName = testName;
        this.alert = alert;
    }

    public String getTestType() {
        return testType;
    }

    public String getTestName() {
        return testName;
    }

    /** @return the regression alert, if the comparison found one */
    public Optional<Alert> getAlert() {
        return Optional.ofNullable(alert);
    }

    public boolean isRegressionDetected() {
        return alert != null;
    }

    @Override
    public String topic() {
        return "comparisonCompleted";
    }
}
