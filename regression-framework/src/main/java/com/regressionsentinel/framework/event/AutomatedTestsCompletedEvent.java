package com.regressionsentinel.framework.event;

import com.regressionsentinel.core.event.SentinelEvent;

import java.time.Instant;
import java.util.List;

/**
 * A run of the registered automated tests finished.
 */
public class AutomatedTestsCompletedEvent extends SentinelEvent {

    private final int executed;
    private final List<String> failedTests;

    public AutomatedTestsCompletedEvent(Instant timestamp, int executed, List<String> failedTests) {
        super(timestamp);
        this.executed = executed;
        this.failedTests = List.copyOf(failedTests);
    }

    public int getExecuted() {
        return executed;
    }

    /** @return names of the tests whose workload threw */
    public List<String> getFailedTests() {
        return failedTests;
    }

    @Override
    public String topic() {
        return "automatedTestsCompleted";
    }
}
