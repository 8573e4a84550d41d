package com.regressionsentinel.framework.event;

import com.regressionsentinel.core.event.SentinelEvent;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertDeliveryResult;

import java.time.Instant;
import java.util.List;

/**
 * A baseline comparison reported a regression. Carries the delivery results
 * of the alert it raised.
 */
public class RegressionDetectedEvent extends SentinelEvent {

    private final Alert alert;
    private final List<AlertDeliveryResult> deliveries;

    public RegressionDetectedEvent(Instant timestamp, Alert alert, List<AlertDeliveryResult> deliveries) {
        super(timestamp);
        this.alert = alert;
        this.deliveries = List.copyOf(deliveries);
    }

    public Alert getAlert() {
        return alert;
    }

    public List<AlertDeliveryResult> getDeliveries() {
        return deliveries;
    }

    @Override
    public String topic() {
        return "regressionDetected";
    }
}
