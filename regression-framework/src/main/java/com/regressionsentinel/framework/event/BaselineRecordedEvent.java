package com.regressionsentinel.framework.event;

import com.regressionsentinel.core.event.SentinelEvent;
import com.regressionsentinel.framework.collaborator.BaselineRecord;

import java.time.Instant;

public class BaselineRecordedEvent extends SentinelEvent {

    private final BaselineRecord baseline;

    public BaselineRecordedEvent(Instant timestamp, BaselineRecord baseline) {
        super(timestamp);
        this.baseline = baseline;
    }

    public BaselineRecord getBaseline() {
        return baseline;
    }

    @Override
    public String topic() {
        return "baselineRecorded";
    }
}
