package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Result of a visual regression comparison as reported by the external
 * capture service. {@code overallScore} is a similarity score from 0 to 100.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VisualRegressionResult {

    private String testName;
    private Instant timestamp;
    private double overallScore;
    private boolean regressionDetected;
    private Summary summary = new Summary();

    public VisualRegressionResult() {
    }

    public VisualRegressionResult(String testName, Instant timestamp, double overallScore,
            boolean regressionDetected) {
        this.testName = testName;
        this.timestamp = timestamp;
        this.overallScore = overallScore;
        this.regressionDetected = regressionDetected;
    }

    public String getTestName() {
        return testName;
    }

    public void setTestName(String testName) {
        this.testName = testName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getOverallScore() {
        return overallScore;
    }

    public void setOverallScore(double overallScore) {
        this.overallScore = overallScore;
    }

    public boolean isRegressionDetected() {
        return regressionDetected;
    }

    public void setRegressionDetected(boolean regressionDetected) {
        this.regressionDetected = regressionDetected;
    }

    public Summary getSummary() {
        return summary;
    }

    public void setSummary(Summary summary) {
        this.summary = summary != null ? summary : new Summary();
    }

    /** Per-page counts of the comparison. */
    public static class Summary {
        private int totalTests;
        private int passedTests;
        private int failedTests;
        private double averageDifference;
        private double maxDifference;

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

        public double getAverageDifference() {
            return averageDifference;
        }

        public void setAverageDifference(double averageDifference) {
            this.averageDifference = averageDifference;
        }

        public double getMaxDifference() {
            return maxDifference;
        }

        public void setMaxDifference(double maxDifference) {
            this.maxDifference = maxDifference;
        }
    }
}
