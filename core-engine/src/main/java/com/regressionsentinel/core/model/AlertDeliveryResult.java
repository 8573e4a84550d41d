package com.regressionsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one delivery attempt of one alert to one channel.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AlertDeliveryResult {

    private final boolean success;
    private final String channel;
    private final String alertId;
    private final Instant timestamp;
    private final String error;
    private final Map<String, Object> metadata;

    @JsonCreator
    public AlertDeliveryResult(@JsonProperty("success") boolean success,
            @JsonProperty("channel") String channel,
            @JsonProperty("alertId") String alertId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("error") String error,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.success = success;
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.error = error;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public static AlertDeliveryResult success(String channel, String alertId, Instant timestamp,
            Map<String, Object> metadata) {
        return new AlertDeliveryResult(true, channel, alertId, timestamp, null, metadata);
    }

    public static AlertDeliveryResult failure(String channel, String alertId, Instant timestamp, String error) {
        return new AlertDeliveryResult(false, channel, alertId, timestamp, error, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getChannel() {
        return channel;
    }

    public String getAlertId() {
        return alertId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "AlertDeliveryResult{" +
                "success=" + success +
                ", channel='" + channel + '\'' +
                ", alertId='" + alertId + '\'' +
                ", timestamp=" + timestamp +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
