package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.regressionsentinel.core.model.TimeRange;

import java.util.Objects;

/**
 * Descriptive statistics of one metric over a time range. Variance and
 * standard deviation are population figures.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StatisticalSummary {

    private final MetricKind metric;
    private final TimeRange timeRange;
    private final int dataPoints;
    private final double mean;
    private final double median;
    private final double standardDeviation;
    private final double variance;
    private final double min;
    private final double max;
    private final Percentiles percentiles;
    private final double skewness;
    private final double kurtosis;

    @JsonCreator
    public StatisticalSummary(@JsonProperty("metric") MetricKind metric,
            @JsonProperty("timeRange") TimeRange timeRange,
            @JsonProperty("dataPoints") int dataPoints,
            @JsonProperty("mean") double mean,
            @JsonProperty("median") double median,
            @JsonProperty("standardDeviation") double standardDeviation,
            @JsonProperty("variance") double variance,
            @JsonProperty("min") double min,
            @JsonProperty("max") double max,
            @JsonProperty("percentiles") Percentiles percentiles,
            @JsonProperty("skewness") double skewness,
            @JsonProperty("kurtosis") double kurtosis) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.timeRange = timeRange;
        this.dataPoints = dataPoints;
        this.mean = mean;
        this.median = median;
        this.standardDeviation = standardDeviation;
        this.variance = variance;
        this.min = min;
        this.max = max;
        this.percentiles = percentiles != null ? percentiles : Percentiles.ZERO;
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    static StatisticalSummary empty(MetricKind metric, TimeRange timeRange) {
        return new StatisticalSummary(metric, timeRange, 0, 0, 0, 0, 0, 0, 0, Percentiles.ZERO, 0, 0);
    }

    public MetricKind getMetric() {
        return metric;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public double getVariance() {
        return variance;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public Percentiles getPercentiles() {
        return percentiles;
    }

    public double getSkewness() {
        return skewness;
    }

    public double getKurtosis() {
        return kurtosis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatisticalSummary that))
            return false;
        return dataPoints == that.dataPoints
                && Double.compare(mean, that.mean) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(standardDeviation, that.standardDeviation) == 0
                && Double.compare(variance, that.variance) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(skewness, that.skewness) == 0
                && Double.compare(kurtosis, that.kurtosis) == 0
                && metric == that.metric
                && Objects.equals(timeRange, that.timeRange)
                && percentiles.equals(that.percentiles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, timeRange, dataPoints, mean, median, standardDeviation);
    }

    @Override
    public String toString() {
        return "StatisticalSummary{" + metric.key() + " n=" + dataPoints + " mean=" + mean
                + " median=" + median + " sd=" + standardDeviation + " min=" + min + " max=" + max + '}';
    }

    /** Linearly interpolated percentiles. */
    public static final class Percentiles {

        static final Percentiles ZERO = new Percentiles(0, 0, 0, 0, 0, 0);

        private final double p25;
        private final double p50;
        private final double p75;
        private final double p90;
        private final double p95;
        private final double p99;

        @JsonCreator
        public Percentiles(@JsonProperty("p25") double p25, @JsonProperty("p50") double p50,
                @JsonProperty("p75") double p75, @JsonProperty("p90") double p90,
                @JsonProperty("p95") double p95, @JsonProperty("p99") double p99) {
            this.p25 = p25;
            this.p50 = p50;
            this.p75 = p75;
            this.p90 = p90;
            this.p95 = p95;
            this.p99 = p99;
        }

        public double getP25() {
            return p25;
        }

        public double getP50() {
            return p50;
        }

        public double getP75() {
            return p75;
        }

        public double getP90() {
            return p90;
        }

        public double getP95() {
            return p95;
        }

        public double getP99() {
            return p99;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Percentiles that))
                return false;
            return Double.compare(p25, that.p25) == 0 && Double.compare(p50, that.p50) == 0
                    && Double.compare(p75, that.p75) == 0 && Double.compare(p90, that.p90) == 0
                    && Double.compare(p95, that.p95) == 0 && Double.compare(p99, that.p99) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(p25, p50, p75, p90, p95, p99);
        }
    }
}
