package com.regressionsentinel.framework;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FrameworkConfig}.
 */
class FrameworkConfigTest {

    @Test
    @DisplayName("Should apply defaults when nothing is set")
    void shouldApplyDefaults() {
        FrameworkConfig config = FrameworkConfig.builder().build();

        assertThat(config.getDataDirectory()).isEqualTo("performance-data");
        assertThat(config.dataPath()).isEqualTo(Path.of("performance-data"));
        assertThat(config.retention()).isEqualTo(Duration.ofDays(90));
        assertThat(config.getMaxResultsPerTest()).isEqualTo(100);
        assertThat(config.maintenanceInterval()).isEqualTo(Duration.ofHours(6));
        assertThat(config.automatedTestInterval()).isEqualTo(Duration.ofHours(4));
        assertThat(config.isAutomatedTestingEnabled()).isFalse();
        assertThat(config.isVisualRegressionEnabled()).isTrue();
        assertThat(config.isAlertOnAnomalies()).isTrue();
        assertThat(config.reportLookback()).isEqualTo(Duration.ofDays(7));
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getEnvironment()).isEqualTo("development");
    }

    @Test
    @DisplayName("Should keep values set on the builder")
    void shouldKeepBuilderValues() {
        FrameworkConfig config = FrameworkConfig.builder()
                .dataDirectory("/var/lib/sentinel")
                .retentionDays(14)
                .maintenanceIntervalMinutes(60)
                .automatedTestingEnabled(true)
                .healthPort(9090)
                .environment("staging")
                .build();

        assertThat(config.dataPath()).isEqualTo(Path.of("/var/lib/sentinel"));
        assertThat(config.getRetentionDays()).isEqualTo(14);
        assertThat(config.getMaintenanceIntervalMinutes()).isEqualTo(60);
        assertThat(config.isAutomatedTestingEnabled()).isTrue();
        assertThat(config.toString()).contains("environment='staging'").contains("healthPort=9090");
    }

    @Test
    @DisplayName("Should reject a retention below one day")
    void shouldRejectZeroRetention() {
        assertThatThrownBy(() -> FrameworkConfig.builder().retentionDays(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("retentionDays must be >= 1, got: 0");
    }

    @Test
    @DisplayName("Should reject a non-positive history size or interval")
    void shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> FrameworkConfig.builder().maxResultsPerTest(0).build())
                .hasMessageContaining("maxResultsPerTest");
        assertThatThrownBy(() -> FrameworkConfig.builder().maintenanceIntervalMinutes(-5).build())
                .hasMessageContaining("maintenanceIntervalMinutes");
        assertThatThrownBy(() -> FrameworkConfig.builder().automatedTestIntervalMinutes(0).build())
                .hasMessageContaining("automatedTestIntervalMinutes");
        assertThatThrownBy(() -> FrameworkConfig.builder().reportLookbackDays(0).build())
                .hasMessageContaining("reportLookbackDays");
    }

    @Test
    @DisplayName("Should reject a health port outside [1, 65535]")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> FrameworkConfig.builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("healthPort must be in [1, 65535], got: 70000");
    }

    @Test
    @DisplayName("Should reject a blank data directory or environment")
    void shouldRejectBlankStrings() {
        assertThatThrownBy(() -> FrameworkConfig.builder().dataDirectory(" ").build())
                .hasMessage("dataDirectory must not be null or blank");
        assertThatThrownBy(() -> FrameworkConfig.builder().environment(null).build())
                .hasMessage("environment must not be null or blank");
    }
}
