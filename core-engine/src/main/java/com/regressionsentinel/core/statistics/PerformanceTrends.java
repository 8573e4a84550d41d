package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Dashboard projection of recent samples: the raw points, a coarse
 * first-half versus second-half trend per metric, and summary statistics.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PerformanceTrends {

    private final String testType;
    private final long timespanMs;
    private final List<Point> dataPoints;
    private final Directions trends;
    private final Statistics statistics;

    @JsonCreator
    public PerformanceTrends(@JsonProperty("testType") String testType,
            @JsonProperty("timespanMs") long timespanMs,
            @JsonProperty("dataPoints") List<Point> dataPoints,
            @JsonProperty("trends") Directions trends,
            @JsonProperty("statistics") Statistics statistics) {
        this.testType = testType;
        this.timespanMs = timespanMs;
        this.dataPoints = dataPoints != null ? List.copyOf(dataPoints) : List.of();
        this.trends = Objects.requireNonNull(trends, "trends must not be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
    }

    /**
     * @return the test name the projection was built for, or {@code "all"}
     */
    public String getTestType() {
        return testType;
    }

    public long getTimespanMs() {
        return timespanMs;
    }

    public List<Point> getDataPoints() {
        return dataPoints;
    }

    public Directions getTrends() {
        return trends;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PerformanceTrends that))
            return false;
        return timespanMs == that.timespanMs
                && Objects.equals(testType, that.testType)
                && dataPoints.equals(that.dataPoints)
                && trends.equals(that.trends)
                && statistics.equals(that.statistics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testType, timespanMs, dataPoints, trends, statistics);
    }

    // ---------------------------------------------------------------
    // Nested types
    // ---------------------------------------------------------------

    /** One sample flattened to the tracked metrics. */
    public static final class Point {
        private final Instant timestamp;
        private final double responseTime;
        private final double throughput;
        private final double errorRate;
        private final double cpuUsage;
        private final double memoryUsage;

        @JsonCreator
        public Point(@JsonProperty("timestamp") Instant timestamp,
                @JsonProperty("responseTime") double responseTime,
                @JsonProperty("throughput") double throughput,
                @JsonProperty("errorRate") double errorRate,
                @JsonProperty("cpuUsage") double cpuUsage,
                @JsonProperty("memoryUsage") double memoryUsage) {
            this.timestamp = timestamp;
            this.responseTime = responseTime;
            this.throughput = throughput;
            this.errorRate = errorRate;
            this.cpuUsage = cpuUsage;
            this.memoryUsage = memoryUsage;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public double getResponseTime() {
            return responseTime;
        }

        public double getThroughput() {
            return throughput;
        }

        public double getErrorRate() {
            return errorRate;
        }

        public double getCpuUsage() {
            return cpuUsage;
        }

        public double getMemoryUsage() {
            return memoryUsage;
        }

        /** Mean of CPU and memory usage. */
        public double resourceUsage() {
            return (cpuUsage + memoryUsage) / 2;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Point that))
                return false;
            return Objects.equals(timestamp, that.timestamp)
                    && Double.compare(responseTime, that.responseTime) == 0
                    && Double.compare(throughput, that.throughput) == 0
                    && Double.compare(errorRate, that.errorRate) == 0
                    && Double.compare(cpuUsage, that.cpuUsage) == 0
                    && Double.compare(memoryUsage, that.memoryUsage) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(timestamp, responseTime, throughput, errorRate, cpuUsage, memoryUsage);
        }
    }

    public static final class Directions {
        private final TrendDirection responseTime;
        private final TrendDirection throughput;
        private final TrendDirection errorRate;
        private final TrendDirection resourceUsage;

        @JsonCreator
        public Directions(@JsonProperty("responseTime") TrendDirection responseTime,
                @JsonProperty("throughput") TrendDirection throughput,
                @JsonProperty("errorRate") TrendDirection errorRate,
                @JsonProperty("resourceUsage") TrendDirection resourceUsage) {
            this.responseTime = responseTime;
            this.throughput = throughput;
            this.errorRate = errorRate;
            this.resourceUsage = resourceUsage;
        }

        public TrendDirection getResponseTime() {
            return responseTime;
        }

        public TrendDirection getThroughput() {
            return throughput;
        }

        public TrendDirection getErrorRate() {
            return errorRate;
        }

        public TrendDirection getResourceUsage() {
            return resourceUsage;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Directions that))
                return false;
            return responseTime == that.responseTime && throughput == that.throughput
                    && errorRate == that.errorRate && resourceUsage == that.resourceUsage;
        }

        @Override
        public int hashCode() {
            return Objects.hash(responseTime, throughput, errorRate, resourceUsage);
        }

        @Override
        public String toString() {
            return "Directions{responseTime=" + responseTime + ", throughput=" + throughput
                    + ", errorRate=" + errorRate + ", resourceUsage=" + resourceUsage + '}';
        }
    }

    public static final class Statistics {
        private final StatisticalSummary responseTime;
        private final StatisticalSummary throughput;
        private final StatisticalSummary errorRate;

        @JsonCreator
        public Statistics(@JsonProperty("responseTime") StatisticalSummary responseTime,
                @JsonProperty("throughput") StatisticalSummary throughput,
                @JsonProperty("errorRate") StatisticalSummary errorRate) {
            this.responseTime = responseTime;
            this.throughput = throughput;
            this.errorRate = errorRate;
        }

        public StatisticalSummary getResponseTime() {
            return responseTime;
        }

        public StatisticalSummary getThroughput() {
            return throughput;
        }

        public StatisticalSummary getErrorRate() {
            return errorRate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Statistics that))
                return false;
            return Objects.equals(responseTime, that.responseTime)
                    && Objects.equals(throughput, that.throughput)
                    && Objects.equals(errorRate, that.errorRate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(responseTime, throughput, errorRate);
        }
    }
}
