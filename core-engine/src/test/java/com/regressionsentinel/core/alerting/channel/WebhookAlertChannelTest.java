package com.regressionsentinel.core.alerting.channel;

import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.model.EnhancedAlert;
import com.regressionsentinel.core.schedule.ManualClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WebhookAlertChannel}.
 */
class WebhookAlertChannelTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final AlertMessage MESSAGE = new AlertMessage("subject", "body", "body", false);

    private String postedUrl;
    private Object postedPayload;

    @Test
    @DisplayName("Should wrap the alert with type, severity and delivery metadata")
    @SuppressWarnings("unchecked")
    void shouldBuildPayload() {
        WebhookAlertChannel channel = channel();
        EnhancedAlert alert = alert("load");

        Map<String, Object> result = channel.deliver(alert, MESSAGE);

        assertThat(postedUrl).isEqualTo("http://hooks.test/alerts");
        assertThat(result).containsEntry("webhookUrl", "http://hooks.test/alerts");
        Map<String, Object> payload = (Map<String, Object>) postedPayload;
        assertThat(payload).containsEntry("alertType", "performance_regression")
                .containsEntry("severity", "moderate")
                .containsEntry("alert", alert);
        assertThat((Map<String, Object>) payload.get("metadata"))
                .containsEntry("timestamp", NOW.toString())
                .containsEntry("source", "performance-regression-framework")
                .containsEntry("environment", "staging")
                .containsEntry("alertId", "a-1");
    }

    @Test
    @DisplayName("Should label visual alerts as visual_regression")
    @SuppressWarnings("unchecked")
    void shouldLabelVisualAlerts() {
        channel().deliver(alert("visual"), MESSAGE);

        assertThat((Map<String, Object>) postedPayload).containsEntry("alertType", "visual_regression");
    }

    @Test
    @DisplayName("Should propagate transport failures")
    void shouldPropagateFailure() {
        WebhookAlertChannel channel = new WebhookAlertChannel(config("http://hooks.test/alerts"),
                (url, payload) -> {
                    throw new AlertDeliveryException("HTTP 500 from " + url);
                }, new ManualClock(NOW), "staging");

        assertThatThrownBy(() -> channel.deliver(alert("load"), MESSAGE))
                .isInstanceOf(AlertDeliveryException.class)
                .hasMessage("HTTP 500 from http://hooks.test/alerts");
    }

    @Test
    @DisplayName("Should require url")
    void shouldRequireUrl() {
        assertThatThrownBy(() -> new WebhookAlertChannel(config(" "), (url, payload) -> { },
                new ManualClock(NOW), "staging"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires 'url'");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private WebhookAlertChannel channel() {
        return new WebhookAlertChannel(config("http://hooks.test/alerts"), (url, payload) -> {
            postedUrl = url;
            postedPayload = payload;
        }, new ManualClock(NOW), "staging");
    }

    private static AlertChannelConfig config(String url) {
        AlertChannelConfig config = new AlertChannelConfig();
        config.setName("hook");
        config.setType("webhook");
        config.setConfig(new LinkedHashMap<>(Map.of("url", url)));
        return config;
    }

    private static EnhancedAlert alert(String testType) {
        return EnhancedAlert.from(Alert.builder()
                .id("a-1")
                .timestamp(NOW)
                .severity(AlertSeverity.MODERATE)
                .testType(testType)
                .testName("checkout")
                .build());
    }
}
