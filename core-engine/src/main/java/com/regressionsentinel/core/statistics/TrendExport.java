package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Stored analysis results, filtered for export. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TrendExport {

    private final List<TrendAnalysis> trends;
    private final List<AnomalyDetection> anomalies;
    private final List<PerformancePrediction> predictions;
    private final List<SeasonalPattern> seasonalPatterns;

    @JsonCreator
    public TrendExport(@JsonProperty("trends") List<TrendAnalysis> trends,
            @JsonProperty("anomalies") List<AnomalyDetection> anomalies,
            @JsonProperty("predictions") List<PerformancePrediction> predictions,
            @JsonProperty("seasonalPatterns") List<SeasonalPattern> seasonalPatterns) {
        this.trends = trends != null ? List.copyOf(trends) : List.of();
        this.anomalies = anomalies != null ? List.copyOf(anomalies) : List.of();
        this.predictions = predictions != null ? List.copyOf(predictions) : List.of();
        this.seasonalPatterns = seasonalPatterns != null ? List.copyOf(seasonalPatterns) : List.of();
    }

    public List<TrendAnalysis> getTrends() {
        return trends;
    }

    public List<AnomalyDetection> getAnomalies() {
        return anomalies;
    }

    public List<PerformancePrediction> getPredictions() {
        return predictions;
    }

    public List<SeasonalPattern> getSeasonalPatterns() {
        return seasonalPatterns;
    }
}
