package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of comparing a run against its baseline, as reported by the
 * external regression detector. The core only reads it to fill alert
 * templates and recommendations.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineComparison {

    private double overallScore;
    private boolean regressionDetected;
    private String severity;
    private Differences differences = new Differences();
    private List<String> recommendations = new ArrayList<>();

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

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public Differences getDifferences() {
        return differences;
    }

    public void setDifferences(Differences differences) {
        this.differences = differences != null ? differences : new Differences();
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>();
    }

    /** Percentage changes relative to the baseline. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Differences {
        private double responseTimeMeanChange;
        private double responseTimeP95Change;
        private double responseTimeP99Change;
        private double throughputRpsChange;
        private double errorRateChange;
        private double cpuChange;
        private double memoryChange;

        public double getResponseTimeMeanChange() {
            return responseTimeMeanChange;
        }

        public void setResponseTimeMeanChange(double responseTimeMeanChange) {
            this.responseTimeMeanChange = responseTimeMeanChange;
        }

        public double getResponseTimeP95Change() {
            return responseTimeP95Change;
        }

        public void setResponseTimeP95Change(double responseTimeP95Change) {
            this.responseTimeP95Change = responseTimeP95Change;
        }

        public double getResponseTimeP99Change() {
            return responseTimeP99Change;
        }

        public void setResponseTimeP99Change(double responseTimeP99Change) {
            this.responseTimeP99Change = responseTimeP99Change;
        }

        public double getThroughputRpsChange() {
            return throughputRpsChange;
        }

        public void setThroughputRpsChange(double throughputRpsChange) {
            this.throughputRpsChange = throughputRpsChange;
        }

        public double getErrorRateChange() {
            return errorRateChange;
        }

        public void setErrorRateChange(double errorRateChange) {
            this.errorRateChange = errorRateChange;
        }

        public double getCpuChange() {
            return cpuChange;
        }

        public void setCpuChange(double cpuChange) {
            this.cpuChange = cpuChange;
        }

        public double getMemoryChange() {
            return memoryChange;
        }

        public void setMemoryChange(double memoryChange) {
            this.memoryChange = memoryChange;
        }
    }
}
