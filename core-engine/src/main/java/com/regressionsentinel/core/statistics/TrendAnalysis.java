package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Regression-based trend of one metric of one test.
 * <p>
 * {@code strength} and {@code confidence} are in {@code [0, 1]}; {@code slope}
 * is the change per sample, not per unit of time.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TrendAnalysis {

    private final String testName;
    private final MetricKind metric;
    private final TrendDirection direction;
    private final double strength;
    private final double confidence;
    private final double slope;
    private final double rSquared;
    private final int sampleCount;
    private final long timespanMs;

    @JsonCreator
    public TrendAnalysis(@JsonProperty("testName") String testName,
            @JsonProperty("metric") MetricKind metric,
            @JsonProperty("direction") TrendDirection direction,
            @JsonProperty("strength") double strength,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("slope") double slope,
            @JsonProperty("rSquared") double rSquared,
            @JsonProperty("sampleCount") int sampleCount,
            @JsonProperty("timespanMs") long timespanMs) {
        this.testName = testName;
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.strength = strength;
        this.confidence = confidence;
        this.slope = slope;
        this.rSquared = rSquared;
        this.sampleCount = sampleCount;
        this.timespanMs = timespanMs;
    }

    static TrendAnalysis stable(String testName, MetricKind metric, int sampleCount) {
        return new TrendAnalysis(testName, metric, TrendDirection.STABLE, 0, 0, 0, 0, sampleCount, 0);
    }

    public String getTestName() {
        return testName;
    }

    public MetricKind getMetric() {
        return metric;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getStrength() {
        return strength;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getSlope() {
        return slope;
    }

    @JsonProperty("rSquared")
    public double getRSquared() {
        return rSquared;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public long getTimespanMs() {
        return timespanMs;
    }

    /**
     * @return the trend's contribution to the overall vote
     */
    public double weightedScore() {
        return direction.sign() * confidence * strength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendAnalysis that))
            return false;
        return Double.compare(strength, that.strength) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Double.compare(slope, that.slope) == 0
                && Double.compare(rSquared, that.rSquared) == 0
                && sampleCount == that.sampleCount
                && timespanMs == that.timespanMs
                && Objects.equals(testName, that.testName)
                && metric == that.metric
                && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(testName, metric, direction, strength, confidence, slope, rSquared, sampleCount,
                timespanMs);
    }

    @Override
    public String toString() {
        return "TrendAnalysis{" + testName + "/" + metric.key() + " " + direction.label()
                + ", strength=" + strength + ", confidence=" + confidence
                + ", slope=" + slope + ", rSquared=" + rSquared + ", n=" + sampleCount + '}';
    }
}
