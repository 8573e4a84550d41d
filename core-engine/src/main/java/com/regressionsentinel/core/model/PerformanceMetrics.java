package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Metric block produced by one performance test run.
 *
 * <p>
 * The structure mirrors what the external baseline collaborator records, so
 * the same instance can be handed to baseline recording, regression checking
 * and statistical analysis without conversion.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Jackson uses the no-arg constructor and setters. Code that only cares about
 * the analysed figures should use {@link #of(double, double, double, double, double, double)}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PerformanceMetrics {

    private ResponseTime responseTime = new ResponseTime();
    private Throughput throughput = new Throughput();
    private ErrorMetrics errorMetrics = new ErrorMetrics();
    private ResourceUtilization resourceUtilization = new ResourceUtilization();

    /** No-arg constructor required by Jackson. */
    public PerformanceMetrics() {
    }

    /**
     * Build a metric block from the figures the analysis engine looks at.
     * Secondary figures (median, p95, totals...) are derived or left at zero.
     *
     * @param meanResponseTime  mean response time in milliseconds
     * @param p99ResponseTime   99th percentile response time in milliseconds
     * @param requestsPerSecond throughput
     * @param errorRate         error rate in percent
     * @param cpuUsage          average CPU usage in percent
     * @param memoryUsage       average memory usage in percent
     * @return a populated metric block
     */
    public static PerformanceMetrics of(double meanResponseTime, double p99ResponseTime,
            double requestsPerSecond, double errorRate, double cpuUsage, double memoryUsage) {
        PerformanceMetrics metrics = new PerformanceMetrics();
        metrics.responseTime.setMean(meanResponseTime);
        metrics.responseTime.setMedian(meanResponseTime);
        metrics.responseTime.setP95(p99ResponseTime);
        metrics.responseTime.setP99(p99ResponseTime);
        metrics.responseTime.setMin(meanResponseTime);
        metrics.responseTime.setMax(p99ResponseTime);
        metrics.throughput.setRequestsPerSecond(requestsPerSecond);
        metrics.errorMetrics.setErrorRate(errorRate);
        metrics.errorMetrics.setSuccessRate(100 - errorRate);
        metrics.resourceUtilization.setAvgCpuUsage(cpuUsage);
        metrics.resourceUtilization.setMaxCpuUsage(cpuUsage);
        metrics.resourceUtilization.setAvgMemoryUsage(memoryUsage);
        metrics.resourceUtilization.setMaxMemoryUsage(memoryUsage);
        return metrics;
    }

    /**
     * @return a deep copy; changes to either instance do not affect the other
     */
    public PerformanceMetrics copy() {
        PerformanceMetrics copy = new PerformanceMetrics();
        copy.responseTime = responseTime.copy();
        copy.throughput = throughput.copy();
        copy.errorMetrics = errorMetrics.copy();
        copy.resourceUtilization = resourceUtilization.copy();
        return copy;
    }

    public ResponseTime getResponseTime() {
        return responseTime;
    }

    public void setResponseTime(ResponseTime responseTime) {
        this.responseTime = responseTime != null ? responseTime : new ResponseTime();
    }

    public Throughput getThroughput() {
        return throughput;
    }

    public void setThroughput(Throughput throughput) {
        this.throughput = throughput != null ? throughput : new Throughput();
    }

    public ErrorMetrics getErrorMetrics() {
        return errorMetrics;
    }

    public void setErrorMetrics(ErrorMetrics errorMetrics) {
        this.errorMetrics = errorMetrics != null ? errorMetrics : new ErrorMetrics();
    }

    public ResourceUtilization getResourceUtilization() {
        return resourceUtilization;
    }

    public void setResourceUtilization(ResourceUtilization resourceUtilization) {
        this.resourceUtilization = resourceUtilization != null ? resourceUtilization : new ResourceUtilization();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PerformanceMetrics that))
            return false;
        return Objects.equals(responseTime, that.responseTime)
                && Objects.equals(throughput, that.throughput)
                && Objects.equals(errorMetrics, that.errorMetrics)
                && Objects.equals(resourceUtilization, that.resourceUtilization);
    }

    @Override
    public int hashCode() {
        return Objects.hash(responseTime, throughput, errorMetrics, resourceUtilization);
    }

    @Override
    public String toString() {
        return "PerformanceMetrics{" +
                "responseTime.mean=" + responseTime.mean +
                ", throughput.rps=" + throughput.requestsPerSecond +
                ", errorRate=" + errorMetrics.errorRate +
                ", cpu=" + resourceUtilization.avgCpuUsage +
                ", memory=" + resourceUtilization.avgMemoryUsage +
                '}';
    }

    // ---------------------------------------------------------------
    // Nested blocks
    // ---------------------------------------------------------------

    /** Response time distribution in milliseconds. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseTime {
        private double mean;
        private double median;
        private double p95;
        private double p99;
        private double min;
        private double max;
        private double stddev;

        ResponseTime copy() {
            ResponseTime copy = new ResponseTime();
            copy.mean = mean;
            copy.median = median;
            copy.p95 = p95;
            copy.p99 = p99;
            copy.min = min;
            copy.max = max;
            copy.stddev = stddev;
            return copy;
        }

        public double getMean() {
            return mean;
        }

        public void setMean(double mean) {
            this.mean = mean;
        }

        public double getMedian() {
            return median;
        }

        public void setMedian(double median) {
            this.median = median;
        }

        public double getP95() {
            return p95;
        }

        public void setP95(double p95) {
            this.p95 = p95;
        }

        public double getP99() {
            return p99;
        }

        public void setP99(double p99) {
            this.p99 = p99;
        }

        public double getMin() {
            return min;
        }

        public void setMin(double min) {
            this.min = min;
        }

        public double getMax() {
            return max;
        }

        public void setMax(double max) {
            this.max = max;
        }

        public double getStddev() {
            return stddev;
        }

        public void setStddev(double stddev) {
            this.stddev = stddev;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ResponseTime that))
                return false;
            return mean == that.mean && median == that.median && p95 == that.p95
                    && p99 == that.p99 && min == that.min && max == that.max && stddev == that.stddev;
        }

        @Override
        public int hashCode() {
            return Objects.hash(mean, median, p95, p99, min, max, stddev);
        }
    }

    /** Request throughput. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Throughput {
        private double requestsPerSecond;
        private long totalRequests;
        private long durationMs;

        Throughput copy() {
            Throughput copy = new Throughput();
            copy.requestsPerSecond = requestsPerSecond;
            copy.totalRequests = totalRequests;
            copy.durationMs = durationMs;
            return copy;
        }

        public double getRequestsPerSecond() {
            return requestsPerSecond;
        }

        public void setRequestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
        }

        public long getTotalRequests() {
            return totalRequests;
        }

        public void setTotalRequests(long totalRequests) {
            this.totalRequests = totalRequests;
        }

        public long getDurationMs() {
            return durationMs;
        }

        public void setDurationMs(long durationMs) {
            this.durationMs = durationMs;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Throughput that))
                return false;
            return requestsPerSecond == that.requestsPerSecond
                    && totalRequests == that.totalRequests && durationMs == that.durationMs;
        }

        @Override
        public int hashCode() {
            return Objects.hash(requestsPerSecond, totalRequests, durationMs);
        }
    }

    /** Error figures; rates are percentages. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorMetrics {
        private double errorRate;
        private long errorCount;
        private long timeoutCount;
        private double successRate;

        ErrorMetrics copy() {
            ErrorMetrics copy = new ErrorMetrics();
            copy.errorRate = errorRate;
            copy.errorCount = errorCount;
            copy.timeoutCount = timeoutCount;
            copy.successRate = successRate;
            return copy;
        }

        public double getErrorRate() {
            return errorRate;
        }

        public void setErrorRate(double errorRate) {
            this.errorRate = errorRate;
        }

        public long getErrorCount() {
            return errorCount;
        }

        public void setErrorCount(long errorCount) {
            this.errorCount = errorCount;
        }

        public long getTimeoutCount() {
            return timeoutCount;
        }

        public void setTimeoutCount(long timeoutCount) {
            this.timeoutCount = timeoutCount;
        }

        public double getSuccessRate() {
            return successRate;
        }

        public void setSuccessRate(double successRate) {
            this.successRate = successRate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ErrorMetrics that))
                return false;
            return errorRate == that.errorRate && errorCount == that.errorCount
                    && timeoutCount == that.timeoutCount && successRate == that.successRate;
        }

        @Override
        public int hashCode() {
            return Objects.hash(errorRate, errorCount, timeoutCount, successRate);
        }
    }

    /** Host resource usage in percent. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResourceUtilization {
        private double avgCpuUsage;
        private double maxCpuUsage;
        private double avgMemoryUsage;
        private double maxMemoryUsage;

        ResourceUtilization copy() {
            ResourceUtilization copy = new ResourceUtilization();
            copy.avgCpuUsage = avgCpuUsage;
            copy.maxCpuUsage = maxCpuUsage;
            copy.avgMemoryUsage = avgMemoryUsage;
            copy.maxMemoryUsage = maxMemoryUsage;
            return copy;
        }

        public double getAvgCpuUsage() {
            return avgCpuUsage;
        }

        public void setAvgCpuUsage(double avgCpuUsage) {
            this.avgCpuUsage = avgCpuUsage;
        }

        public double getMaxCpuUsage() {
            return maxCpuUsage;
        }

        public void setMaxCpuUsage(double maxCpuUsage) {
            this.maxCpuUsage = maxCpuUsage;
        }

        public double getAvgMemoryUsage() {
            return avgMemoryUsage;
        }

        public void setAvgMemoryUsage(double avgMemoryUsage) {
            this.avgMemoryUsage = avgMemoryUsage;
        }

        public double getMaxMemoryUsage() {
            return maxMemoryUsage;
        }

        public void setMaxMemoryUsage(double maxMemoryUsage) {
            this.maxMemoryUsage = maxMemoryUsage;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ResourceUtilization that))
                return false;
            return avgCpuUsage == that.avgCpuUsage && maxCpuUsage == that.maxCpuUsage
                    && avgMemoryUsage == that.avgMemoryUsage && maxMemoryUsage == that.maxMemoryUsage;
        }

        @Override
        public int hashCode() {
            return Objects.hash(avgCpuUsage, maxCpuUsage, avgMemoryUsage, maxMemoryUsage);
        }
    }
}
