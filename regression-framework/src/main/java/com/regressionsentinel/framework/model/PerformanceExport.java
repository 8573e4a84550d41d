package com.regressionsentinel.framework.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.TimeRange;
import com.regressionsentinel.core.statistics.TrendExport;
import com.regressionsentinel.framework.collaborator.BaselineRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Document written by a performance data export. Baselines and alerts are
 * omitted unless requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PerformanceExport {

    private final Metadata metadata;
    private final List<PerformanceTestResult> testResults;
    private final List<BaselineRecord> baselines;
    private final List<Alert> alerts;
    private final TrendExport trends;

    public PerformanceExport(Metadata metadata, List<PerformanceTestResult> testResults,
            List<BaselineRecord> baselines, List<Alert> alerts, TrendExport trends) {
        this.metadata = metadata;
        this.testResults = List.copyOf(testResults);
        this.baselines = baselines != null ? List.copyOf(baselines) : null;
        this.alerts = alerts != null ? List.copyOf(alerts) : null;
        this.trends = trends;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public List<PerformanceTestResult> getTestResults() {
        return testResults;
    }

    public List<BaselineRecord> getBaselines() {
        return baselines;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public TrendExport getTrends() {
        return trends;
    }

    /**
     * When and with which configuration the export was taken.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Metadata {
        private final Instant exportTimestamp;
        private final Map<String, Object> config;
        private final TimeRange timeRange;

        public Metadata(Instant exportTimestamp, Map<String, Object> config, TimeRange timeRange) {
            this.exportTimestamp = exportTimestamp;
            this.config = config;
            this.timeRange = timeRange;
        }

        public Instant getExportTimestamp() {
            return exportTimestamp;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public TimeRange getTimeRange() {
            return timeRange;
        }
    }
}
