package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Posts the full alert as JSON to {@code config.url}.
 */
public class WebhookAlertChannel implements AlertChannel {

    static final String SOURCE = "performance-regression-framework";

    private final AlertChannelConfig config;
    private final WebhookTransport transport;
    private final Clock clock;
    private final String environment;
    private final String url;

    public WebhookAlertChannel(AlertChannelConfig config, WebhookTransport transport, Clock clock,
                               String environment) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.environment = environment;
        this.url = config.getString("url");
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Webhook channel '" + config.getName() + "' requires 'url'");
        }
    }

    @Override
    public Map<String, Object> deliver(EnhancedAlert alert, AlertMessage message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", clock.instant().toString());
        metadata.put("source", SOURCE);
        metadata.put("environment", environment);
        metadata.put("alertId", alert.getId());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertType", "visual".equals(alert.getTestType())
                ? "visual_regression"
                : "performance_regression");
        payload.put("severity", alert.getSeverity().label());
        payload.put("alert", alert);
        payload.put("metadata", metadata);

        transport.post(url, payload);
        return Map.of("webhookUrl", url);
    }

    @Override
    public AlertChannelConfig getConfig() {
        return config;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.WEBHOOK;
    }
}
