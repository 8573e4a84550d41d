package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a full trend analysis: the overall direction voted from every
 * per-test trend, plus the trends, predictions and anomalies behind it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TrendAnalysisResult {

    private final TrendDirection performance;
    private final List<TrendAnalysis> trends;
    private final List<PerformancePrediction> predictions;
    private final List<AnomalyDetection> anomalies;

    @JsonCreator
    public TrendAnalysisResult(@JsonProperty("performance") TrendDirection performance,
            @JsonProperty("trends") List<TrendAnalysis> trends,
            @JsonProperty("predictions") List<PerformancePrediction> predictions,
            @JsonProperty("anomalies") List<AnomalyDetection> anomalies) {
        this.performance = Objects.requireNonNull(performance, "performance must not be null");
        this.trends = trends != null ? List.copyOf(trends) : List.of();
        this.predictions = predictions != null ? List.copyOf(predictions) : List.of();
        this.anomalies = anomalies != null ? List.copyOf(anomalies) : List.of();
    }

    public TrendDirection getPerformance() {
        return performance;
    }

    public List<TrendAnalysis> getTrends() {
        return trends;
    }

    public List<PerformancePrediction> getPredictions() {
        return predictions;
    }

    public List<AnomalyDetection> getAnomalies() {
        return anomalies;
    }

    public List<AnomalyDetection> highSeverityAnomalies() {
        return anomalies.stream().filter(a -> a.getSeverity() == AnomalySeverity.HIGH).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendAnalysisResult that))
            return false;
        return performance == that.performance
                && trends.equals(that.trends)
                && predictions.equals(that.predictions)
                && anomalies.equals(that.anomalies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(performance, trends, predictions, anomalies);
    }

    @Override
    public String toString() {
        return "TrendAnalysisResult{performance=" + performance.label() + ", trends=" + trends.size()
                + ", predictions=" + predictions.size() + ", anomalies=" + anomalies.size() + '}';
    }
}
