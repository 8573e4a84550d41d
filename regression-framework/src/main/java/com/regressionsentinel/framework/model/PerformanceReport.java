package com.regressionsentinel.framework.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.regressionsentinel.core.model.TimeRange;
import com.regressionsentinel.core.statistics.TrendAnalysisResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of a regression analysis over the stored test results.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PerformanceReport {

    private String id;
    private Instant timestamp;
    private TimeRange timeRange;
    private Summary summary = new Summary();
    private TrendAnalysisResult trendAnalysis;
    private List<String> recommendations = new ArrayList<>();
    private List<ActionItem> actionItems = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public PerformanceReport() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public void setTimeRange(TimeRange timeRange) {
        this.timeRange = timeRange;
    }

    public Summary getSummary() {
        return summary;
    }

    public void setSummary(Summary summary) {
        this.summary = summary;
    }

    public TrendAnalysisResult getTrendAnalysis() {
        return trendAnalysis;
    }

    public void setTrendAnalysis(TrendAnalysisResult trendAnalysis) {
        this.trendAnalysis = trendAnalysis;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>();
    }

    public List<ActionItem> getActionItems() {
        return actionItems;
    }

    public void setActionItems(List<ActionItem> actionItems) {
        this.actionItems = actionItems != null ? new ArrayList<>(actionItems) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PerformanceReport{id='" + id + "', timeRange=" + timeRange + ", summary=" + summary + '}';
    }

    // ---------------------------------------------------------------
    // Nested
    // ---------------------------------------------------------------

    /**
     * Pass/fail counts over the analysed results.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Summary {
        private int totalTests;
        private int passedTests;
        private int failedTests;
        private int regressionsDetected;
        private int alertsTriggered;
        private double averageScore;

        /**
         * Summarize results. The average score counts 100 for a passing run
         * and 50 for a run with a regression; no results score 0.
         */
        public static Summary of(List<PerformanceTestResult> results) {
            Summary summary = new Summary();
            int failed = (int) results.stream().filter(PerformanceTestResult::isRegressionDetected).count();
            summary.totalTests = results.size();
            summary.failedTests = failed;
            summary.passedTests = results.size() - failed;
            summary.regressionsDetected = failed;
            summary.alertsTriggered = results.stream().mapToInt(r -> r.getAlerts().size()).sum();
            summary.averageScore = results.isEmpty()
                    ? 0
                    : results.stream().mapToDouble(r -> r.isRegressionDetected() ? 50 : 100).average().orElse(0);
            return summary;
        }

        public int getTotalTests() {
            return totalTests;
        }

        public void setTotalTests(int totalTests) {
            this.totalTests = totalTests;
        }

        public int getPassedTests() {
            return passedTests;
        }

        public void setPassedTests(int passedTests) {
            this.passedTests = passedTests;
        }

        public int getFailedTests() {
            return failedTests;
        }

        public void setFailedTests(int failedTests) {
            this.failedTests = failedTests;
        }

        public int getRegressionsDetected() {
            return regressionsDetected;
        }

        public void setRegressionsDetected(int regressionsDetected) {
            this.regressionsDetected = regressionsDetected;
        }

        public int getAlertsTriggered() {
            return alertsTriggered;
        }

        public void setAlertsTriggered(int alertsTriggered) {
            this.alertsTriggered = alertsTriggered;
        }

        public double getAverageScore() {
            return averageScore;
        }

        public void setAverageScore(double averageScore) {
            this.averageScore = averageScore;
        }

        @Override
        public String toString() {
            return "Summary{total=" + totalTests + ", passed=" + passedTests + ", failed=" + failedTests
                    + ", alerts=" + alertsTriggered + ", averageScore=" + averageScore + '}';
        }
    }
}
