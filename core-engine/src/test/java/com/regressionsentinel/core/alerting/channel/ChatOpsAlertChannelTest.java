package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.model.BaselineComparison;
import com.regressionsentinel.core.model.EnhancedAlert;
import com.regressionsentinel.core.schedule.ManualClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChatOpsAlertChannel}.
 */
class ChatOpsAlertChannelTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final AlertMessage MESSAGE = new AlertMessage("Performance Regression Detected: checkout",
            "<p>body</p>", "line one\nline two", true);

    private final List<Object> posted = new ArrayList<>();
    private final ChatOpsAlertChannel channel = new ChatOpsAlertChannel(config(),
            (url, payload) -> posted.add(payload), new ManualClock(NOW));

    @Test
    @DisplayName("Should build a single colored attachment with the alert fields")
    @SuppressWarnings("unchecked")
    void shouldBuildSlackStylePayload() {
        Map<String, Object> payload = channel.buildMessage(alert(AlertSeverity.CRITICAL, 12.345), MESSAGE);

        assertThat(payload).containsEntry("channel", "#perf-alerts")
                .containsEntry("username", "Performance Monitor")
                .containsEntry("icon_emoji", ":warning:");
        List<Map<String, Object>> attachments = (List<Map<String, Object>>) payload.get("attachments");
        assertThat(attachments).hasSize(1);
        Map<String, Object> attachment = attachments.get(0);
        assertThat(attachment).containsEntry("color", "#d32f2f")
                .containsEntry("title", MESSAGE.getSubject())
                .containsEntry("text", "line one\nline two")
                .containsEntry("footer", "Performance Regression Framework")
                .containsEntry("ts", NOW.getEpochSecond());

        List<Map<String, Object>> fields = (List<Map<String, Object>>) attachment.get("fields");
        assertThat(fields).extracting(f -> f.get("title")).containsExactly("Test", "Severity", "Score", "Time");
        assertThat(fields).extracting(f -> f.get("value"))
                .containsExactly("checkout", "CRITICAL", "12.3", "2024-03-01T11:00:00Z");
        assertThat(fields).allMatch(f -> Boolean.TRUE.equals(f.get("short")));
    }

    @Test
    @DisplayName("Should show N/A as score when the alert has no comparison")
    @SuppressWarnings("unchecked")
    void shouldShowNotAvailableScore() {
        EnhancedAlert alert = alert(AlertSeverity.MINOR, 0);
        alert.setComparison(null);

        Map<String, Object> attachment = ((List<Map<String, Object>>) channel.buildMessage(alert, MESSAGE)
                .get("attachments")).get(0);

        assertThat(attachment).containsEntry("color", "#388e3c");
        assertThat((List<Map<String, Object>>) attachment.get("fields"))
                .anySatisfy(f -> assertThat(f).containsEntry("title", "Score").containsEntry("value", "N/A"));
    }

    @Test
    @DisplayName("Should post to the webhook URL and report the chat channel")
    void shouldDeliver() {
        Map<String, Object> metadata = channel.deliver(alert(AlertSeverity.MAJOR, 50), MESSAGE);

        assertThat(posted).hasSize(1);
        assertThat(metadata).containsEntry("slackChannel", "#perf-alerts");
    }

    @Test
    @DisplayName("Should require webhookUrl and channel")
    void shouldRequireSettings() {
        AlertChannelConfig config = new AlertChannelConfig();
        config.setName("chat");
        config.setType("chatops");
        config.setConfig(new LinkedHashMap<>(Map.of("webhookUrl", "http://hooks.test/chat")));

        assertThatThrownBy(() -> new ChatOpsAlertChannel(config, (url, payload) -> { }, new ManualClock(NOW)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'webhookUrl' and 'channel'");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AlertChannelConfig config() {
        AlertChannelConfig config = new AlertChannelConfig();
        config.setName("oncall");
        config.setType("slack");
        config.setConfig(new LinkedHashMap<>(Map.of("webhookUrl", "http://hooks.test/chat",
                "channel", "#perf-alerts")));
        return config;
    }

    private static EnhancedAlert alert(AlertSeverity severity, double score) {
        BaselineComparison comparison = new BaselineComparison();
        comparison.setOverallScore(score);
        return EnhancedAlert.from(Alert.builder()
                .id("a-1")
                .timestamp(Instant.parse("2024-03-01T11:00:00Z"))
                .severity(severity)
                .testType("load")
                .testName("checkout")
                .comparison(comparison)
                .build());
    }
}
