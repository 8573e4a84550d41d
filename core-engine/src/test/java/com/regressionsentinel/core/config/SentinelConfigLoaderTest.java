package com.regressionsentinel.core.config;

import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.statistics.AnomalySensitivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SentinelConfigLoader}.
 */
class SentinelConfigLoaderTest {

    @Test
    @DisplayName("Should load statistics and alerting sections from classpath")
    void shouldLoadFromClasspath() {
        SentinelConfig config = SentinelConfigLoader.fromClasspath("test-sentinel.yml");

        StatisticalConfig statistics = config.getStatistics();
        assertThat(statistics.getTrendWindowDays()).isEqualTo(14);
        assertThat(statistics.sensitivity()).isEqualTo(AnomalySensitivity.HIGH);
        assertThat(statistics.getConfidenceLevel()).isEqualTo(0.99);
        assertThat(statistics.getMinDataPoints()).isEqualTo(8);
        assertThat(statistics.isPredictionEnabled()).isTrue();

        AlertingConfig alerting = config.getAlerting();
        assertThat(alerting.getEnvironment()).isEqualTo("test");
        assertThat(alerting.getDeliveryRetries()).isEqualTo(2);
        assertThat(alerting.getChannels()).extracting(AlertChannelConfig::getName)
                .containsExactly("console", "audit-log", "oncall", "email");
        assertThat(alerting.getEscalation().timeToEscalate()).isEqualTo(Duration.ofMinutes(30));
        assertThat(alerting.getEscalation().getMaxEscalations()).isEqualTo(2);
        assertThat(alerting.getRateLimit().getMaxAlertsPerHour()).isEqualTo(5);
        assertThat(alerting.getAggregation().window()).isEqualTo(Duration.ofMinutes(15));
        assertThat(alerting.getAggregation().getMaxAlertsToAggregate()).isEqualTo(5);
        assertThat(alerting.getTemplates()).containsKey("performanceRegression");
        assertThat(alerting.getTemplates().get("performanceRegression").isHtml()).isFalse();
    }

    @Test
    @DisplayName("Should read channel-specific settings and severity filters")
    void shouldReadChannelSettings() {
        AlertingConfig alerting = SentinelConfigLoader.fromClasspath("test-sentinel.yml").getAlerting();

        AlertChannelConfig console = alerting.getChannels().get(0);
        assertThat(console.acceptsSeverity(AlertSeverity.CRITICAL)).isTrue();
        assertThat(console.acceptsSeverity(AlertSeverity.MINOR)).isFalse();

        AlertChannelConfig oncall = alerting.getChannels().get(2);
        assertThat(oncall.getString("channel")).isEqualTo("#perf-alerts");
        assertThat(oncall.acceptsSeverity(AlertSeverity.MINOR)).isTrue();

        AlertChannelConfig email = alerting.getChannels().get(3);
        assertThat(email.isEnabled()).isFalse();
        assertThat(email.getStringList("recipients"))
                .containsExactly("perf-team@example.com", "sre@example.com");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        SentinelConfig config = SentinelConfigLoader.parseAndValidate(
                new ByteArrayInputStream(new byte[0]));

        assertThat(config.getStatistics().getTrendWindowDays()).isEqualTo(30);
        assertThat(config.getStatistics().sensitivity()).isEqualTo(AnomalySensitivity.MEDIUM);
        assertThat(config.getAlerting().getRateLimit().getMaxAlertsPerHour()).isEqualTo(20);
        assertThat(config.getAlerting().getRateLimit().getMaxAlertsPerDay()).isEqualTo(100);
        assertThat(config.getAlerting().getEscalation().getEscalationChannels())
                .isEqualTo(List.of("email", "chatops"));
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("invalid-sentinel.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("anomalySensitivity")
                .hasMessageContaining("confidenceLevel")
                .hasMessageContaining("requires config 'url'")
                .hasMessageContaining("unknown type 'pager'")
                .hasMessageContaining("Duplicate channel name 'hook'");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("duplicate-keys.yml"))
                .isInstanceOf(YAMLException.class);
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sentinel.yml");
        Files.writeString(file, "statistics:\n  anomalySensitivity: low\n", StandardCharsets.UTF_8);

        SentinelConfig config = SentinelConfigLoader.fromFile(file.toString());

        assertThat(config.getStatistics().sensitivity()).isEqualTo(AnomalySensitivity.LOW);
    }

    @Test
    @DisplayName("Should throw when file or classpath resource does not exist")
    void shouldThrowForMissingSources() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromFile("/no/such/sentinel.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
