package com.regressionsentinel.framework.event;

import com.regressionsentinel.core.event.SentinelEvent;
import com.regressionsentinel.framework.model.PerformanceTestResult;

import java.time.Instant;

public class TestCompletedEvent extends SentinelEvent {

    private final PerformanceTestResult result;

    public TestCompletedEvent(Instant timestamp, PerformanceTestResult result) {
        super(timestamp);
        this.result = result;
    }

    public PerformanceTestResult getResult() {
        return result;
    }

    @Override
    public String topic() {
        return "testCompleted";
    }
}
