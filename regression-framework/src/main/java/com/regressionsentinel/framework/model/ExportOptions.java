package com.regressionsentinel.framework.model;

import com.regressionsentinel.core.model.TimeRange;

import java.util.Objects;

/**
 * Options of {@code exportPerformanceData}.
 */
public final class ExportOptions {

    private final ExportFormat format;
    private final TimeRange timeRange;
    private final boolean includeBaselines;
    private final boolean includeAlerts;

    private ExportOptions(Builder b) {
        this.format = Objects.requireNonNull(b.format, "format must not be null");
        this.timeRange = b.timeRange;
        this.includeBaselines = b.includeBaselines;
        this.includeAlerts = b.includeAlerts;
    }

    /** JSON export of everything, without baselines or alerts. */
    public static ExportOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExportFormat getFormat() {
        return format;
    }

    /** @return the filter range, or {@code null} for every stored result */
    public TimeRange getTimeRange() {
        return timeRange;
    }

    public boolean isIncludeBaselines() {
        return includeBaselines;
    }

    public boolean isIncludeAlerts() {
        return includeAlerts;
    }

    public static class Builder {
        private ExportFormat format = ExportFormat.JSON;
        private TimeRange timeRange;
        private boolean includeBaselines;
        private boolean includeAlerts;

        public Builder format(ExportFormat v) {
            this.format = v;
            return this;
        }

        public Builder timeRange(TimeRange v) {
            this.timeRange = v;
            return this;
        }

        public Builder includeBaselines(boolean v) {
            this.includeBaselines = v;
            return this;
        }

        public Builder includeAlerts(boolean v) {
            this.includeAlerts = v;
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(this);
        }
    }
}
