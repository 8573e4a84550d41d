package com.regressionsentinel.framework.event;

import com.regressionsentinel.core.event.SentinelEvent;
import com.regressionsentinel.framework.model.PerformanceReport;

import java.time.Instant;

public class AnalysisCompletedEvent extends SentinelEvent {

    private final PerformanceReport report;

    public AnalysisCompletedEvent(Instant timestamp, PerformanceReport report) {
        super(timestamp);
        this.report = report;
    }

    public PerformanceReport getReport() {
        return report;
    }

    @Override
    public String topic() {
        return "analysisCompleted";
    }
}
