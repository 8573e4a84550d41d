package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.regressionsentinel.core.model.MetricSample;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted state of the statistical engine: samples per test and the last
 * stored analysis results, each keyed by test name (or {@code overall}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatisticsSnapshot {

    private Map<String, List<MetricSample>> dataPoints = new LinkedHashMap<>();
    private Map<String, List<TrendAnalysis>> trends = new LinkedHashMap<>();
    private Map<String, List<AnomalyDetection>> anomalies = new LinkedHashMap<>();
    private Map<String, List<PerformancePrediction>> predictions = new LinkedHashMap<>();
    private Map<String, List<SeasonalPattern>> seasonalPatterns = new LinkedHashMap<>();

    public Map<String, List<MetricSample>> getDataPoints() {
        return dataPoints;
    }

    public void setDataPoints(Map<String, List<MetricSample>> dataPoints) {
        this.dataPoints = copy(dataPoints);
    }

    public Map<String, List<TrendAnalysis>> getTrends() {
        return trends;
    }

    public void setTrends(Map<String, List<TrendAnalysis>> trends) {
        this.trends = copy(trends);
    }

    public Map<String, List<AnomalyDetection>> getAnomalies() {
        return anomalies;
    }

    public void setAnomalies(Map<String, List<AnomalyDetection>> anomalies) {
        this.anomalies = copy(anomalies);
    }

    public Map<String, List<PerformancePrediction>> getPredictions() {
        return predictions;
    }

    public void setPredictions(Map<String, List<PerformancePrediction>> predictions) {
        this.predictions = copy(predictions);
    }

    public Map<String, List<SeasonalPattern>> getSeasonalPatterns() {
        return seasonalPatterns;
    }

    public void setSeasonalPatterns(Map<String, List<SeasonalPattern>> seasonalPatterns) {
        this.seasonalPatterns = copy(seasonalPatterns);
    }

    /** Deep-copy the map structure so that lists stay mutable and unshared. */
    static <T> Map<String, List<T>> copy(Map<String, List<T>> source) {
        Map<String, List<T>> result = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, list) -> result.put(key, list != null ? new ArrayList<>(list) : new ArrayList<>()));
        }
        return result;
    }
}
