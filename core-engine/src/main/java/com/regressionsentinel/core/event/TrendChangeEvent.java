package com.regressionsentinel.core.event;

import com.regressionsentinel.core.statistics.TrendAnalysisResult;
import com.regressionsentinel.core.statistics.TrendDirection;

import java.time.Instant;

public class TrendChangeEvent extends SentinelEvent {

    private final TrendDirection direction;
    private final TrendAnalysisResult analysis;

    public TrendChangeEvent(Instant timestamp, TrendDirection direction, TrendAnalysisResult analysis) {
        super(timestamp);
        this.direction = direction;
        this.analysis = analysis;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public TrendAnalysisResult getAnalysis() {
        return analysis;
    }

    @Override
    public String topic() {
        return "trendChange";
    }
}
