package com.regressionsentinel.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.model.EnhancedAlert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileSnapshotStore}.
 */
class JsonFileSnapshotStoreTest {

    private static final TypeReference<Map<String, List<EnhancedAlert>>> HISTORY =
            new TypeReference<>() {
            };

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should report no snapshot when the file does not exist")
    void shouldLoadNothingWhenMissing() {
        JsonFileSnapshotStore<Map<String, List<EnhancedAlert>>> store =
                new JsonFileSnapshotStore<>(tempDir.resolve("missing.json"), HISTORY);

        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("Should write ISO timestamps and read the snapshot back")
    void shouldRoundTripAlertHistory() throws IOException {
        Path path = tempDir.resolve("data/alerts.json");
        JsonFileSnapshotStore<Map<String, List<EnhancedAlert>>> store = new JsonFileSnapshotStore<>(path, HISTORY);
        EnhancedAlert alert = EnhancedAlert.from(Alert.builder()
                .id("a-1")
                .timestamp(Instant.parse("2024-03-01T10:00:00Z"))
                .severity(AlertSeverity.MAJOR)
                .testType("load")
                .testName("checkout")
                .alertChannels(List.of("hook"))
                .build());
        alert.setEscalationLevel(2);
        alert.getTemplateData().put("score", "42.0");
        alert.getDeliveryStatus().markSent(Instant.parse("2024-03-01T10:00:01Z"));
        Map<String, List<EnhancedAlert>> history = new LinkedHashMap<>();
        history.put("load-checkout", List.of(alert));

        store.save(history);

        assertThat(Files.readString(path, StandardCharsets.UTF_8)).contains("\"2024-03-01T10:00:00Z\"");
        assertThat(Files.exists(path.resolveSibling("alerts.json.tmp"))).isFalse();
        EnhancedAlert restored = store.load().orElseThrow().get("load-checkout").get(0);
        assertThat(restored.getId()).isEqualTo("a-1");
        assertThat(restored.getSeverity()).isEqualTo(AlertSeverity.MAJOR);
        assertThat(restored.getEscalationLevel()).isEqualTo(2);
        assertThat(restored.getTemplateData()).containsEntry("score", "42.0");
        assertThat(restored.getDeliveryStatus().getSentAt()).isEqualTo(Instant.parse("2024-03-01T10:00:01Z"));
        assertThat(restored.getAlertChannels()).containsExactly("hook");
    }

    @Test
    @DisplayName("Should fail with SnapshotStoreException on a corrupt file")
    void shouldFailOnCorruptFile() throws IOException {
        Path path = tempDir.resolve("alerts.json");
        Files.writeString(path, "{not json", StandardCharsets.UTF_8);
        JsonFileSnapshotStore<Map<String, List<EnhancedAlert>>> store = new JsonFileSnapshotStore<>(path, HISTORY);

        assertThatThrownBy(store::load)
                .isInstanceOf(SnapshotStoreException.class)
                .hasMessageContaining("Cannot read snapshot");
        assertThat(store.describe()).isEqualTo(path.toString());
    }
}
