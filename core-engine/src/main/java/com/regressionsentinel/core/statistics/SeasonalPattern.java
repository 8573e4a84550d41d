package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Recurring variation of a metric. {@code periodMs} is the cycle length,
 * {@code phaseMs} the offset of the peak within the cycle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SeasonalPattern {

    private final String testName;
    private final MetricKind metric;
    private final long periodMs;
    private final double amplitude;
    private final long phaseMs;
    private final double confidence;
    private final Instant detectedAt;

    @JsonCreator
    public SeasonalPattern(@JsonProperty("testName") String testName,
            @JsonProperty("metric") MetricKind metric,
            @JsonProperty("periodMs") long periodMs,
            @JsonProperty("amplitude") double amplitude,
            @JsonProperty("phaseMs") long phaseMs,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("detectedAt") Instant detectedAt) {
        this.testName = testName;
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.periodMs = periodMs;
        this.amplitude = amplitude;
        this.phaseMs = phaseMs;
        this.confidence = confidence;
        this.detectedAt = detectedAt;
    }

    public String getTestName() {
        return testName;
    }

    public MetricKind getMetric() {
        return metric;
    }

    public long getPeriodMs() {
        return periodMs;
    }

    public double getAmplitude() {
        return amplitude;
    }

    public long getPhaseMs() {
        return phaseMs;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalPattern that))
            return false;
        return periodMs == that.periodMs
                && Double.compare(amplitude, that.amplitude) == 0
                && phaseMs == that.phaseMs
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(testName, that.testName)
                && metric == that.metric
                && Objects.equals(detectedAt, that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testName, metric, periodMs, amplitude, phaseMs);
    }

    @Override
    public String toString() {
        return "SeasonalPattern{" + testName + "/" + metric.key() + " period=" + periodMs
                + "ms amplitude=" + amplitude + " phase=" + phaseMs + "ms confidence=" + confidence + '}';
    }
}
