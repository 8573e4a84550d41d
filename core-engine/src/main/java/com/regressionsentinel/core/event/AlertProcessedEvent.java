package com.regressionsentinel.core.event;

import com.regressionsentinel.core.model.AlertDeliveryResult;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.time.Instant;
import java.util.List;

/** An alert went through the delivery pipeline. */
public class AlertProcessedEvent extends SentinelEvent {

    private final EnhancedAlert alert;
    private final List<AlertDeliveryResult> results;

    public AlertProcessedEvent(Instant timestamp, EnhancedAlert alert, List<AlertDeliveryResult> results) {
        super(timestamp);
        this.alert = alert;
        this.results = List.copyOf(results);
    }

    public EnhancedAlert getAlert() {
        return alert;
    }

    public List<AlertDeliveryResult> getResults() {
        return results;
    }

    @Override
    public String topic() {
        return "alertProcessed";
    }
}
