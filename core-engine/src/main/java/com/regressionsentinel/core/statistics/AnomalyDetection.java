package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A sample whose value deviates from its trailing window by more than the
 * configured z-score threshold.
 * <p>
 * {@code deviationInStdDevs} is infinite when the window had no variance.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnomalyDetection {

    private final Instant timestamp;
    private final String testName;
    private final MetricKind metric;
    private final double value;
    private final double expectedValue;
    private final double deviationInStdDevs;
    private final AnomalySeverity severity;
    private final double confidence;
    private final AnomalyContext context;

    @JsonCreator
    public AnomalyDetection(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("testName") String testName,
            @JsonProperty("metric") MetricKind metric,
            @JsonProperty("value") double value,
            @JsonProperty("expectedValue") double expectedValue,
            @JsonProperty("deviationInStdDevs") double deviationInStdDevs,
            @JsonProperty("severity") AnomalySeverity severity,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("context") AnomalyContext context) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.testName = Objects.requireNonNull(testName, "testName must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.value = value;
        this.expectedValue = expectedValue;
        this.deviationInStdDevs = deviationInStdDevs;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.confidence = confidence;
        this.context = context;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getTestName() {
        return testName;
    }

    public MetricKind getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getDeviationInStdDevs() {
        return deviationInStdDevs;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public AnomalyContext getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyDetection that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(expectedValue, that.expectedValue) == 0
                && Double.compare(deviationInStdDevs, that.deviationInStdDevs) == 0
                && Double.compare(confidence, that.confidence) == 0
                && timestamp.equals(that.timestamp)
                && testName.equals(that.testName)
                && metric == that.metric
                && severity == that.severity
                && Objects.equals(context, that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, testName, metric, value, severity);
    }

    @Override
    public String toString() {
        return "AnomalyDetection{" + testName + "/" + metric.key() + " @" + timestamp
                + " value=" + value + " expected=" + expectedValue
                + " z=" + deviationInStdDevs + " " + severity.label() + '}';
    }
}
