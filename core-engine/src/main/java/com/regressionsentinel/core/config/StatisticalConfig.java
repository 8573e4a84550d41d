package com.regressionsentinel.core.config;

import com.regressionsentinel.core.statistics.AnomalySensitivity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the statistical analysis engine ({@code statistics:} section).
 *
 * @since 1.0.0
 */
public class StatisticalConfig {

    /** Samples older than this many days are dropped on ingest. */
    private int trendWindowDays = 30;

    /** {@code low}, {@code medium} or {@code high}. */
    private String anomalySensitivity = "medium";

    private boolean seasonalityDetection = true;
    private boolean predictionEnabled = true;

    /** Confidence level of prediction intervals: 0.90, 0.95 or 0.99. */
    private double confidenceLevel = 0.95;

    /** Minimum samples in range before a test is analysed. */
    private int minDataPoints = 10;

    /** Number of most recent samples examined when a new sample arrives. */
    private int realTimeWindow = 50;

    /** Interval of the scheduled trend analysis. */
    private int analysisIntervalMinutes = 120;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (trendWindowDays <= 0) {
            errors.add("statistics.trendWindowDays must be > 0, got: " + trendWindowDays);
        }
        try {
            AnomalySensitivity.fromString(anomalySensitivity);
        } catch (IllegalArgumentException e) {
            errors.add("statistics.anomalySensitivity: " + e.getMessage());
        }
        if (confidenceLevel <= 0 || confidenceLevel >= 1) {
            errors.add("statistics.confidenceLevel must be in (0, 1), got: " + confidenceLevel);
        }
        if (minDataPoints < 2) {
            errors.add("statistics.minDataPoints must be >= 2, got: " + minDataPoints);
        }
        if (realTimeWindow < minDataPoints) {
            errors.add("statistics.realTimeWindow must be >= minDataPoints, got: " + realTimeWindow);
        }
        if (analysisIntervalMinutes <= 0) {
            errors.add("statistics.analysisIntervalMinutes must be > 0, got: " + analysisIntervalMinutes);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public AnomalySensitivity sensitivity() {
        return AnomalySensitivity.fromString(anomalySensitivity);
    }

    public Duration trendWindow() {
        return Duration.ofDays(trendWindowDays);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public int getTrendWindowDays() {
        return trendWindowDays;
    }

    public void setTrendWindowDays(int trendWindowDays) {
        this.trendWindowDays = trendWindowDays;
    }

    public String getAnomalySensitivity() {
        return anomalySensitivity;
    }

    public void setAnomalySensitivity(String anomalySensitivity) {
        this.anomalySensitivity = anomalySensitivity;
    }

    public boolean isSeasonalityDetection() {
        return seasonalityDetection;
    }

    public void setSeasonalityDetection(boolean seasonalityDetection) {
        this.seasonalityDetection = seasonalityDetection;
    }

    public boolean isPredictionEnabled() {
        return predictionEnabled;
    }

    public void setPredictionEnabled(boolean predictionEnabled) {
        this.predictionEnabled = predictionEnabled;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public void setMinDataPoints(int minDataPoints) {
        this.minDataPoints = minDataPoints;
    }

    public int getRealTimeWindow() {
        return realTimeWindow;
    }

    public void setRealTimeWindow(int realTimeWindow) {
        this.realTimeWindow = realTimeWindow;
    }

    public int getAnalysisIntervalMinutes() {
        return analysisIntervalMinutes;
    }

    public void setAnalysisIntervalMinutes(int analysisIntervalMinutes) {
        this.analysisIntervalMinutes = analysisIntervalMinutes;
    }

    @Override
    public String toString() {
        return "StatisticalConfig{trendWindowDays=" + trendWindowDays
                + ", anomalySensitivity='" + anomalySensitivity + '\''
                + ", seasonalityDetection=" + seasonalityDetection
                + ", predictionEnabled=" + predictionEnabled
                + ", confidenceLevel=" + confidenceLevel
                + ", minDataPoints=" + minDataPoints + '}';
    }
}
