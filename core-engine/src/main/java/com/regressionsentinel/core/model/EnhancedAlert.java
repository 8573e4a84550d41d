package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An {@link Alert} enriched for delivery: the channel it went out on, its
 * escalation level, the data fed to the message template and its delivery
 * status. Aggregated alerts also carry the raw alerts they combine.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnhancedAlert extends Alert {

    private String channel;
    private int escalationLevel;
    private List<Alert> aggregatedAlerts;
    private Map<String, Object> templateData = new LinkedHashMap<>();
    private DeliveryStatus deliveryStatus = new DeliveryStatus();

    /** No-arg constructor required by Jackson. */
    public EnhancedAlert() {
    }

    private EnhancedAlert(Alert source) {
        super(source);
    }

    /**
     * Enrich a plain alert. When {@code source} is already enhanced its
     * enrichment is copied too.
     *
     * @param source alert to enrich
     * @return a new enhanced alert sharing the source's identity
     */
    public static EnhancedAlert from(Alert source) {
        EnhancedAlert enhanced = new EnhancedAlert(source);
        if (source instanceof EnhancedAlert other) {
            enhanced.channel = other.channel;
            enhanced.escalationLevel = other.escalationLevel;
            enhanced.aggregatedAlerts = other.aggregatedAlerts != null
                    ? new ArrayList<>(other.aggregatedAlerts)
                    : null;
            enhanced.templateData = new LinkedHashMap<>(other.templateData);
        }
        return enhanced;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public int getEscalationLevel() {
        return escalationLevel;
    }

    public void setEscalationLevel(int escalationLevel) {
        this.escalationLevel = escalationLevel;
    }

    /**
     * @return the raw alerts combined into this one, or {@code null} when the
     *         alert is not an aggregate
     */
    public List<Alert> getAggregatedAlerts() {
        return aggregatedAlerts;
    }

    public void setAggregatedAlerts(List<Alert> aggregatedAlerts) {
        this.aggregatedAlerts = aggregatedAlerts;
    }

    public Map<String, Object> getTemplateData() {
        return templateData;
    }

    public void setTemplateData(Map<String, Object> templateData) {
        this.templateData = templateData != null ? templateData : new LinkedHashMap<>();
    }

    public DeliveryStatus getDeliveryStatus() {
        return deliveryStatus;
    }

    public void setDeliveryStatus(DeliveryStatus deliveryStatus) {
        this.deliveryStatus = deliveryStatus != null ? deliveryStatus : new DeliveryStatus();
    }

    public boolean isAggregated() {
        return aggregatedAlerts != null && !aggregatedAlerts.isEmpty();
    }
}
