package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One timed observation of a named performance test.
 *
 * <p>
 * Samples are immutable once created. The metric block is copied on the way
 * in and on the way out, so neither the caller that supplied it nor a reader
 * of {@link #getMetrics()} can change a stored sample. The statistical engine
 * only ever drops whole samples when they fall out of the trend window.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricSample {

    private final Instant timestamp;
    private final String testName;
    private final String testType;
    private final PerformanceMetrics metrics;
    private final Map<String, Object> metadata;

    /**
     * @param timestamp when the sample was taken; must not be {@code null}
     * @param testName  name of the test; must not be {@code null}
     * @param testType  test type (load, stress, ...); may be {@code null}
     * @param metrics   measured metrics; must not be {@code null}
     * @param metadata  free-form metadata; may be {@code null}
     */
    @JsonCreator
    public MetricSample(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("testName") String testName,
            @JsonProperty("testType") String testType,
            @JsonProperty("metrics") PerformanceMetrics metrics,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.testName = Objects.requireNonNull(testName, "testName must not be null");
        this.testType = testType;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null").copy();
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getTestName() {
        return testName;
    }

    public String getTestType() {
        return testType;
    }

    /**
     * @return a copy of the stored metric block
     */
    public PerformanceMetrics getMetrics() {
        return metrics.copy();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return timestamp.equals(that.timestamp)
                && testName.equals(that.testName)
                && Objects.equals(testType, that.testType)
                && metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, testName, testType, metrics);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "timestamp=" + timestamp +
                ", testName='" + testName + '\'' +
                ", testType='" + testType + '\'' +
                ", metrics=" + metrics +
                '}';
    }
}
