package com.regressionsentinel.core.event;

import com.regressionsentinel.core.model.EnhancedAlert;

import java.time.Instant;

public class AlertAcknowledgedEvent extends SentinelEvent {

    private final EnhancedAlert alert;

    public AlertAcknowledgedEvent(Instant timestamp, EnhancedAlert alert) {
        super(timestamp);
        this.alert = alert;
    }

    public EnhancedAlert getAlert() {
        return alert;
    }

    @Override
    public String topic() {
        return "alertAcknowledged";
    }
}
