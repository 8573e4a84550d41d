package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.regressionsentinel.core.model.MetricSample;
import com.regressionsentinel.core.model.PerformanceMetrics;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * The metrics tracked per test, each with the way to read it from a sample
 * and whether a rising value is good or bad.
 */
public enum MetricKind {
    RESPONSE_TIME("responseTime", Polarity.LOWER_IS_BETTER, m -> m.getResponseTime().getMean()),
    THROUGHPUT("throughput", Polarity.HIGHER_IS_BETTER, m -> m.getThroughput().getRequestsPerSecond()),
    ERROR_RATE("errorRate", Polarity.LOWER_IS_BETTER, m -> m.getErrorMetrics().getErrorRate()),
    CPU_USAGE("cpuUsage", Polarity.LOWER_IS_BETTER, m -> m.getResourceUtilization().getAvgCpuUsage()),
    MEMORY_USAGE("memoryUsage", Polarity.LOWER_IS_BETTER, m -> m.getResourceUtilization().getAvgMemoryUsage());

    /** Metrics that get a regression trend and a prediction. */
    public static final List<MetricKind> TRENDED = List.of(RESPONSE_TIME, THROUGHPUT, ERROR_RATE);

    /** Metrics scanned for anomalies. */
    public static final List<MetricKind> ANOMALY_SCANNED = List.of(values());

    private final String key;
    private final Polarity polarity;
    private final ToDoubleFunction<PerformanceMetrics> extractor;

    MetricKind(String key, Polarity polarity, ToDoubleFunction<PerformanceMetrics> extractor) {
        this.key = key;
        this.polarity = polarity;
        this.extractor = extractor;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Polarity polarity() {
        return polarity;
    }

    public double valueOf(MetricSample sample) {
        return extractor.applyAsDouble(sample.getMetrics());
    }

    public double[] valuesOf(List<MetricSample> samples) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = valueOf(samples.get(i));
        }
        return values;
    }

    /**
     * Orient a raw change so that a positive result always means "better".
     *
     * @param rawChange change of the raw metric value
     * @return {@code rawChange} for higher-is-better metrics, its negation
     *         otherwise
     */
    public double towardsBetter(double rawChange) {
        return polarity == Polarity.HIGHER_IS_BETTER ? rawChange : -rawChange;
    }

    @JsonCreator
    public static MetricKind fromKey(String key) {
        for (MetricKind kind : values()) {
            if (kind.key.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + key + "'");
    }

    /** Whether an increase of the metric is an improvement. */
    public enum Polarity {
        HIGHER_IS_BETTER,
        LOWER_IS_BETTER
    }
}
