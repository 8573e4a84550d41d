package com.regressionsentinel.framework.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.model.VisualRegressionResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@code runPerformanceTest} call, as stored in the result
 * history and returned to the caller.
 *
 * <p>
 * {@code regressionDetected} reflects the baseline comparison only; a visual
 * regression is reported through {@link #getVisualResults()} and its own
 * alert.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PerformanceTestResult {

    private String testName;
    private String testType;
    private Instant timestamp;
    private long durationMs;
    private PerformanceMetrics metrics;
    private VisualRegressionResult visualResults;
    private boolean regressionDetected;
    private List<Alert> alerts = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public PerformanceTestResult() {
    }

    public PerformanceTestResult(String testName, String testType, Instant timestamp, long durationMs,
            PerformanceMetrics metrics, VisualRegressionResult visualResults, List<Alert> alerts,
            List<String> recommendations) {
        this.testName = Objects.requireNonNull(testName, "testName must not be null");
        this.testType = testType;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.durationMs = durationMs;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.visualResults = visualResults;
        setAlerts(alerts);
        setRecommendations(recommendations);
        this.regressionDetected = !this.alerts.isEmpty();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getTestName() {
        return testName;
    }

    public void setTestName(String testName) {
        this.testName = testName;
    }

    public String getTestType() {
        return testType;
    }

    public void setTestType(String testType) {
        this.testType = testType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public PerformanceMetrics getMetrics() {
        return metrics;
    }

    public void setMetrics(PerformanceMetrics metrics) {
        this.metrics = metrics;
    }

    public VisualRegressionResult getVisualResults() {
        return visualResults;
    }

    public void setVisualResults(VisualRegressionResult visualResults) {
        this.visualResults = visualResults;
    }

    public boolean isRegressionDetected() {
        return regressionDetected;
    }

    public void setRegressionDetected(boolean regressionDetected) {
        this.regressionDetected = regressionDetected;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public void setAlerts(List<Alert> alerts) {
        this.alerts = alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PerformanceTestResult{" +
                "testName='" + testName + '\'' +
                ", testType='" + testType + '\'' +
                ", timestamp=" + timestamp +
                ", durationMs=" + durationMs +
                ", regressionDetected=" + regressionDetected +
                ", alerts=" + alerts.size() +
                '}';
    }
}
