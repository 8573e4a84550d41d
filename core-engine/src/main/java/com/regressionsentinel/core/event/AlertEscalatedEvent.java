package com.regressionsentinel.core.event;

import com.regressionsentinel.core.model.AlertDeliveryResult;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.time.Instant;
import java.util.List;

/**
 * An unacknowledged alert was re-delivered to the escalation channels.
 * {@code escalation} is the escalation-flavoured copy that was sent.
 */
public class AlertEscalatedEvent extends SentinelEvent {

    private final EnhancedAlert escalation;
    private final List<AlertDeliveryResult> results;

    public AlertEscalatedEvent(Instant timestamp, EnhancedAlert escalation, List<AlertDeliveryResult> results) {
        super(timestamp);
        this.escalation = escalation;
        this.results = List.copyOf(results);
    }

    public EnhancedAlert getEscalation() {
        return escalation;
    }

    public List<AlertDeliveryResult> getResults() {
        return results;
    }

    @Override
    public String topic() {
        return "alertEscalated";
    }
}
