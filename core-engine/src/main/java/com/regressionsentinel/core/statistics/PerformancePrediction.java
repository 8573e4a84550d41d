package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Linear extrapolation of a metric one sample ahead, reported for a target
 * time 24 hours after the analysis.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PerformancePrediction {

    public static final String LINEAR_MODEL = "linear";

    private final String testName;
    private final MetricKind metric;
    private final Instant timestamp;
    private final double predictedValue;
    private final ConfidenceInterval confidenceInterval;
    private final double confidenceLevel;
    private final double confidence;
    private final String model;

    @JsonCreator
    public PerformancePrediction(@JsonProperty("testName") String testName,
            @JsonProperty("metric") MetricKind metric,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("predictedValue") double predictedValue,
            @JsonProperty("confidenceInterval") ConfidenceInterval confidenceInterval,
            @JsonProperty("confidenceLevel") double confidenceLevel,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("model") String model) {
        this.testName = testName;
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.predictedValue = predictedValue;
        this.confidenceInterval = Objects.requireNonNull(confidenceInterval, "confidenceInterval must not be null");
        this.confidenceLevel = confidenceLevel;
        this.confidence = confidence;
        this.model = model != null ? model : LINEAR_MODEL;
    }

    public String getTestName() {
        return testName;
    }

    public MetricKind getMetric() {
        return metric;
    }

    /**
     * @return the instant the prediction is for
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public double getPredictedValue() {
        return predictedValue;
    }

    public ConfidenceInterval getConfidenceInterval() {
        return confidenceInterval;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getModel() {
        return model;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PerformancePrediction that))
            return false;
        return Double.compare(predictedValue, that.predictedValue) == 0
                && Double.compare(confidenceLevel, that.confidenceLevel) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(testName, that.testName)
                && metric == that.metric
                && timestamp.equals(that.timestamp)
                && confidenceInterval.equals(that.confidenceInterval)
                && model.equals(that.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testName, metric, timestamp, predictedValue);
    }

    @Override
    public String toString() {
        return "PerformancePrediction{" + testName + "/" + metric.key() + " @" + timestamp
                + " predicted=" + predictedValue + " " + confidenceInterval
                + " confidence=" + confidence + '}';
    }

    /** Symmetric interval around the predicted value. */
    public static final class ConfidenceInterval {
        private final double lower;
        private final double upper;

        @JsonCreator
        public ConfidenceInterval(@JsonProperty("lower") double lower, @JsonProperty("upper") double upper) {
            this.lower = lower;
            this.upper = upper;
        }

        public double getLower() {
            return lower;
        }

        public double getUpper() {
            return upper;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ConfidenceInterval that))
                return false;
            return Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lower, upper);
        }

        @Override
        public String toString() {
            return "[" + lower + ", " + upper + "]";
        }
    }
}
