package com.regressionsentinel.framework.event;

import com.regressionsentinel.core.event.SentinelEvent;
import com.regressionsentinel.core.model.AlertDeliveryResult;
import com.regressionsentinel.core.model.VisualRegressionResult;

import java.time.Instant;
import java.util.List;

public class VisualRegressionDetectedEvent extends SentinelEvent {

    private final VisualRegressionResult result;
    private final List<AlertDeliveryResult> deliveries;

    public VisualRegressionDetectedEvent(Instant timestamp, VisualRegressionResult result,
            List<AlertDeliveryResult> deliveries) {
        super(timestamp);
        this.result = result;
        this.deliveries = List.copyOf(deliveries);
    }

    public VisualRegressionResult getResult() {
        return result;
    }

    public List<AlertDeliveryResult> getDeliveries() {
        return deliveries;
    }

    @Override
    public String topic() {
        return "visualRegressionDetected";
    }
}
