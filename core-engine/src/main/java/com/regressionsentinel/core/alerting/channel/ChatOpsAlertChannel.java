package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.EnhancedAlert;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Posts a chat message with a single colored attachment to an incoming
 * webhook in the Slack message format.
 */
public class ChatOpsAlertChannel implements AlertChannel {

    static final String USERNAME = "Performance Monitor";
    static final String ICON = ":warning:";
    static final String FOOTER = "Performance Regression Framework";

    private final AlertChannelConfig config;
    private final WebhookTransport transport;
    private final Clock clock;
    private final String webhookUrl;
    private final String channel;

    public ChatOpsAlertChannel(AlertChannelConfig config, WebhookTransport transport, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.webhookUrl = config.getString("webhookUrl");
        this.channel = config.getString("channel");
        if (webhookUrl == null || webhookUrl.isBlank() || channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("ChatOps channel '" + config.getName()
                    + "' requires 'webhookUrl' and 'channel'");
        }
    }

    @Override
    public Map<String, Object> deliver(EnhancedAlert alert, AlertMessage message) {
        transport.post(webhookUrl, buildMessage(alert, message));
        return Map.of("slackChannel", channel);
    }

    Map<String, Object> buildMessage(EnhancedAlert alert, AlertMessage message) {
        Object score = alert.getComparison() != null
                ? String.format(Locale.ROOT, "%.1f", alert.getComparison().getOverallScore())
                : "N/A";

        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Test", alert.getTestName()));
        fields.add(field("Severity", alert.getSeverity().label().toUpperCase(Locale.ROOT)));
        fields.add(field("Score", score));
        fields.add(field("Time", alert.getTimestamp().toString()));

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", alert.getSeverity().color());
        attachment.put("title", message.getSubject());
        attachment.put("text", message.getTextBody());
        attachment.put("fields", fields);
        attachment.put("footer", FOOTER);
        attachment.put("ts", clock.instant().getEpochSecond());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("username", USERNAME);
        payload.put("icon_emoji", ICON);
        payload.put("attachments", List.of(attachment));
        return payload;
    }

    private static Map<String, Object> field(String title, Object value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }

    @Override
    public AlertChannelConfig getConfig() {
        return config;
    }

    @Override
    public ChannelType getType() {
        return ChannelType.CHATOPS;
    }
}
