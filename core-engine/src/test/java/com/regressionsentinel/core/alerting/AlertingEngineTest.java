package com.regressionsentinel.core.alerting;

import com.fasterxml.jackson.core.type.TypeReference;
import com.regressionsentinel.core.alerting.channel.AlertDeliveryException;
import com.regressionsentinel.core.alerting.channel.ChannelFactory;
import com.regressionsentinel.core.alerting.channel.EmailMessage;
import com.regressionsentinel.core.alerting.channel.MailTransport;
import com.regressionsentinel.core.alerting.channel.WebhookTransport;
import com.regressionsentinel.core.config.AlertChannelConfig;
import com.regressionsentinel.core.config.AlertTemplate;
import com.regressionsentinel.core.config.AlertingConfig;
import com.regressionsentinel.core.event.AlertEscalatedEvent;
import com.regressionsentinel.core.event.AlertProcessedEvent;
import com.regressionsentinel.core.metrics.SentinelMetrics;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertDeliveryResult;
import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.model.BaselineComparison;
import com.regressionsentinel.core.model.EnhancedAlert;
import com.regressionsentinel.core.model.VisualRegressionResult;
import com.regressionsentinel.core.schedule.ManualClock;
import com.regressionsentinel.core.schedule.ManualTaskScheduler;
import com.regressionsentinel.core.store.InMemorySnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertingEngine}.
 */
class AlertingEngineTest {

    private static final Instant START = Instant.parse("2024-03-01T09:00:00Z");
    private static final String HOOK_URL = "http://hooks.test/alerts";
    private static final String BROKEN_URL = "http://hooks.test/broken";

    private ManualClock clock;
    private ManualTaskScheduler scheduler;
    private InMemorySnapshotStore<Map<String, List<EnhancedAlert>>> store;
    private SentinelMetrics metrics;
    private RecordingWebhookTransport webhooks;
    private RecordingMailTransport mail;
    private ByteArrayOutputStream consoleBytes;
    private AlertingConfig config;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(START);
        scheduler = new ManualTaskScheduler(clock);
        store = new InMemorySnapshotStore<>(new TypeReference<Map<String, List<EnhancedAlert>>>() {
        });
        metrics = new SentinelMetrics();
        webhooks = new RecordingWebhookTransport();
        mail = new RecordingMailTransport();
        consoleBytes = new ByteArrayOutputStream();

        config = new AlertingConfig();
        config.setChannels(new ArrayList<>(List.of(
                channel("hook", "webhook", Map.of("url", HOOK_URL)),
                channel("ops-email", "email", Map.of("recipients", List.of("oncall@example.com"))),
                channel("console", "console", Map.of()))));
        config.getEscalation().setEnabled(false);
        config.getEscalation().setEscalationChannels(List.of("ops-email"));
        config.getAggregation().setEnabled(false);
        config.setDeliveryRetries(0);
    }

    // ------------------------------------------------------------------
    // Delivery
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should deliver an alert to each listed channel and record it")
    void shouldDeliverToListedChannels() {
        AlertingEngine engine = engine();
        List<AlertProcessedEvent> events = new ArrayList<>();
        engine.events().subscribe(AlertProcessedEvent.class, events::add);

        List<AlertDeliveryResult> results = engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR,
                List.of("hook", "console")));

        assertThat(results).extracting(AlertDeliveryResult::getChannel).containsExactly("hook", "console");
        assertThat(results).allMatch(AlertDeliveryResult::isSuccess);
        assertThat(results.get(0).getMetadata()).containsEntry("webhookUrl", HOOK_URL);
        assertThat(mail.sent).isEmpty();

        Map<String, Object> payload = webhooks.payloads(HOOK_URL).get(0);
        assertThat(payload).containsEntry("alertType", "performance_regression")
                .containsEntry("severity", "major");
        EnhancedAlert delivered = (EnhancedAlert) payload.get("alert");
        assertThat(delivered.getTemplateData())
                .containsEntry("score", "42.0")
                .containsEntry("responseTimeChange", "35.5")
                .containsEntry("throughputChange", "-10.0")
                .containsEntry("errorRateChange", "0.4");
        assertThat((List<?>) delivered.getTemplateData().get("recommendations")).hasSize(3);

        assertThat(console()).contains("PERFORMANCE ALERT [MAJOR] Performance Regression Detected: checkout");

        EnhancedAlert stored = engine.getAlert("a-1").orElseThrow();
        assertThat(stored.getChannel()).isEqualTo("hook");
        assertThat(stored.getDeliveryStatus().isSent()).isTrue();
        assertThat(stored.getDeliveryStatus().getSentAt()).isEqualTo(START);
        assertThat(events).hasSize(1);
        assertThat(store.rawJson()).contains("a-1");
        assertThat(counter("sentinel.alerts.delivered")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should skip channels whose severity filter excludes the alert or that are disabled")
    void shouldHonourSeverityFilterAndEnabledFlag() {
        AlertChannelConfig criticalOnly = channel("pager", "webhook", Map.of("url", "http://hooks.test/pager"));
        criticalOnly.setSeverityFilter(List.of("critical"));
        AlertChannelConfig disabled = channel("muted", "webhook", Map.of("url", "http://hooks.test/muted"));
        disabled.setEnabled(false);
        addChannels(criticalOnly, disabled);
        AlertingEngine engine = engine();

        List<AlertDeliveryResult> results = engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR,
                List.of("hook", "pager", "muted")));

        assertThat(results).extracting(AlertDeliveryResult::getChannel).containsExactly("hook");
        assertThat(webhooks.payloads("http://hooks.test/pager")).isEmpty();
        assertThat(webhooks.payloads("http://hooks.test/muted")).isEmpty();
    }

    @Test
    @DisplayName("Should keep delivering to healthy channels when one channel fails")
    void shouldIsolateChannelFailures() {
        addChannels(channel("broken", "webhook", Map.of("url", BROKEN_URL)));
        config.setDeliveryRetries(2);
        webhooks.failing.add(BROKEN_URL);
        AlertingEngine engine = engine();

        List<AlertDeliveryResult> results = engine.processAlert(alert("a-1", "checkout", AlertSeverity.CRITICAL,
                List.of("broken", "hook")));

        assertThat(results).extracting(AlertDeliveryResult::getChannel).containsExactly("hook", "broken");
        assertThat(results.get(0).isSuccess()).isTrue();
        AlertDeliveryResult failure = results.get(1);
        assertThat(failure.isSuccess()).isFalse();
        assertThat(failure.getError()).isEqualTo("HTTP 503 from " + BROKEN_URL);
        assertThat(webhooks.attempts(BROKEN_URL)).isEqualTo(3);

        EnhancedAlert stored = engine.getAlert("a-1").orElseThrow();
        assertThat(stored.getDeliveryStatus().getRetryCount()).isEqualTo(2);
        assertThat(stored.getDeliveryStatus().isFailed()).isTrue();
        assertThat(stored.getDeliveryStatus().isSent()).isTrue();
        assertThat(counter("sentinel.alerts.delivery.failures")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should succeed on a retry after a transient failure")
    void shouldRetryTransientFailure() {
        config.setDeliveryRetries(1);
        webhooks.failuresBeforeSuccess = 1;
        AlertingEngine engine = engine();

        List<AlertDeliveryResult> results = engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR,
                List.of("hook")));

        assertThat(results).singleElement().satisfies(r -> assertThat(r.isSuccess()).isTrue());
        EnhancedAlert stored = engine.getAlert("a-1").orElseThrow();
        assertThat(stored.getDeliveryStatus().getRetryCount()).isEqualTo(1);
        assertThat(stored.getDeliveryStatus().isFailed()).isFalse();
    }

    @Test
    @DisplayName("Should render a configured template override")
    void shouldUseTemplateOverride() {
        config.setTemplates(new LinkedHashMap<>(Map.of(AlertTemplates.PERFORMANCE_REGRESSION,
                new AlertTemplate("[{{severity}}] {{testName}}",
                        "score={{score}} id={{alertId}}", "text"))));
        AlertingEngine engine = engine();
        engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("ops-email")));

        assertThat(mail.sent).singleElement().satisfies(message -> {
            assertThat(message.getSubject()).isEqualTo("[major] checkout");
            assertThat(message.getBody()).isEqualTo("score=42.0 id=a-1");
            assertThat(message.isHtml()).isFalse();
            assertThat(message.getTo()).containsExactly("oncall@example.com");
        });
    }

    // ------------------------------------------------------------------
    // Rate limiting
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Twenty-one minor alerts within an hour produce twenty deliveries")
    void shouldRateLimitPerTypeAndSeverity() {
        AlertingEngine engine = engine();

        int empty = 0;
        for (int i = 0; i < 21; i++) {
            if (engine.processAlert(alert("a-" + i, "test-" + i, AlertSeverity.MINOR, List.of("hook"))).isEmpty()) {
                empty++;
            }
            clock.advance(Duration.ofSeconds(30));
        }

        assertThat(webhooks.payloads(HOOK_URL)).hasSize(20);
        assertThat(empty).isEqualTo(1);
        assertThat(engine.getAlert("a-20")).isEmpty();
        assertThat(counter("sentinel.alerts.rate_limited")).isEqualTo(1.0);

        // a different severity has its own budget
        assertThat(engine.processAlert(alert("b-1", "test-x", AlertSeverity.MAJOR, List.of("hook")))).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Aggregation
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Three alerts for one test within the window yield one aggregated delivery")
    void shouldAggregateAlertsWithinWindow() {
        config.getAggregation().setEnabled(true);
        config.getAggregation().setWindowMinutes(10);
        AlertingEngine engine = engine();

        assertThat(engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")))).isEmpty();
        clock.advance(Duration.ofSeconds(1));
        assertThat(engine.processAlert(alert("a-2", "checkout", AlertSeverity.MAJOR, List.of("hook")))).isEmpty();
        clock.advance(Duration.ofSeconds(1));
        assertThat(engine.processAlert(alert("a-3", "checkout", AlertSeverity.MAJOR, List.of("hook")))).isEmpty();
        assertThat(scheduler.isScheduled("aggregation:load-checkout")).isTrue();
        assertThat(webhooks.alerts(HOOK_URL)).isEmpty();

        scheduler.advanceBy(Duration.ofMinutes(10));

        List<EnhancedAlert> delivered = webhooks.alerts(HOOK_URL);
        assertThat(delivered).hasSize(1);
        EnhancedAlert aggregate = delivered.get(0);
        assertThat(aggregate.isAggregated()).isTrue();
        assertThat(aggregate.getId()).startsWith("aggregated-load-checkout-");
        assertThat(aggregate.getAggregatedAlerts()).extracting(Alert::getId).containsExactly("a-1", "a-2", "a-3");
        assertThat(aggregate.getTemplateData()).containsEntry("aggregatedCount", 3);
        @SuppressWarnings("unchecked")
        Map<String, Object> timeRange = (Map<String, Object>) aggregate.getTemplateData().get("timeRange");
        assertThat(timeRange).containsEntry("start", START.toString())
                .containsEntry("end", START.plusSeconds(2).toString());
        assertThat(engine.getAlert(aggregate.getId())).isPresent();
        assertThat(engine.getAlert("a-1")).isEmpty();
        assertThat(counter("sentinel.alerts.aggregated")).isEqualTo(1.0);
        assertThat(scheduler.isScheduled("aggregation:load-checkout")).isFalse();
    }

    @Test
    @DisplayName("Should flush as soon as the buffer reaches the maximum size")
    void shouldFlushWhenBufferIsFull() {
        config.getAggregation().setEnabled(true);
        config.getAggregation().setMaxAlertsToAggregate(3);
        AlertingEngine engine = engine();

        engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        engine.processAlert(alert("a-2", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        engine.processAlert(alert("a-3", "checkout", AlertSeverity.MAJOR, List.of("hook")));

        assertThat(webhooks.alerts(HOOK_URL)).singleElement()
                .satisfies(a -> assertThat(a.getAggregatedAlerts()).hasSize(3));
        assertThat(scheduler.isScheduled("aggregation:load-checkout")).isFalse();

        // the next alert opens a fresh buffer
        assertThat(engine.processAlert(alert("a-4", "checkout", AlertSeverity.MAJOR, List.of("hook")))).isEmpty();
        assertThat(scheduler.isScheduled("aggregation:load-checkout")).isTrue();
    }

    @Test
    @DisplayName("A buffer holding a single alert is delivered as a plain alert")
    void shouldDeliverSingleBufferedAlertAsIs() {
        config.getAggregation().setEnabled(true);
        AlertingEngine engine = engine();

        assertThat(engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")))).isEmpty();
        assertThat(engine.processAlert(alert("b-1", "search", AlertSeverity.MAJOR, List.of("hook")))).isEmpty();

        scheduler.advanceBy(Duration.ofMinutes(10));

        assertThat(webhooks.alerts(HOOK_URL)).extracting(EnhancedAlert::getId).containsExactly("a-1", "b-1");
        assertThat(webhooks.alerts(HOOK_URL)).noneMatch(EnhancedAlert::isAggregated);
        assertThat(engine.getAlert("a-1")).isPresent();
        assertThat(counter("sentinel.alerts.aggregated")).isZero();
    }

    @Test
    @DisplayName("Periodic sweep flushes a stale buffer")
    void shouldFlushStaleBuffersOnSweep() {
        config.getAggregation().setEnabled(true);
        AlertingEngine engine = engine();
        engine.initialize();
        assertThat(scheduler.isScheduled(AlertingEngine.AGGREGATION_SWEEP_JOB)).isTrue();

        engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        clock.advance(Duration.ofMinutes(1));
        engine.processAlert(alert("a-2", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        scheduler.cancel("aggregation:load-checkout");

        clock.advance(Duration.ofMinutes(11));
        engine.flushAggregationBuffers();

        assertThat(webhooks.alerts(HOOK_URL)).filteredOn(EnhancedAlert::isAggregated).singleElement()
                .satisfies(a -> assertThat(a.getTemplateData()).containsEntry("aggregatedCount", 2));
    }

    // ------------------------------------------------------------------
    // Escalation
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Unacknowledged alert escalates exactly once at the configured time")
    void shouldEscalateUnacknowledgedAlert() {
        config.getEscalation().setEnabled(true);
        config.getEscalation().setTimeToEscalateMinutes(60);
        config.getEscalation().setMaxEscalations(1);
        AlertingEngine engine = engine();
        List<AlertEscalatedEvent> events = new ArrayList<>();
        engine.events().subscribe(AlertEscalatedEvent.class, events::add);

        engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        scheduler.advanceBy(Duration.ofMinutes(59));
        assertThat(mail.sent).isEmpty();

        scheduler.advanceBy(Duration.ofMinutes(1));
        assertThat(mail.sent).singleElement().satisfies(message -> {
            assertThat(message.getSubject()).isEqualTo("ESCALATION: Unacknowledged Performance Alert - checkout");
            assertThat(message.getBody()).contains("<strong>Hours Unacknowledged:</strong> 1.0")
                    .contains("<strong>Escalation Level:</strong> 1");
        });
        assertThat(webhooks.payloads(HOOK_URL)).hasSize(1);

        scheduler.advanceBy(Duration.ofHours(5));
        assertThat(mail.sent).hasSize(1);

        assertThat(engine.getAlert("a-1").orElseThrow().getEscalationLevel()).isEqualTo(1);
        assertThat(engine.getAlert("escalation-a-1-1")).isEmpty();
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getEscalation().getId()).isEqualTo("escalation-a-1-1");
            @SuppressWarnings("unchecked")
            Map<String, Object> original = (Map<String, Object>) event.getEscalation().getTemplateData()
                    .get("originalAlert");
            assertThat(original).containsEntry("id", "a-1").containsEntry("severity", "major");
        });
        assertThat(counter("sentinel.alerts.escalated")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should stop escalating at the maximum level")
    void shouldCapEscalations() {
        config.getEscalation().setEnabled(true);
        config.getEscalation().setTimeToEscalateMinutes(60);
        config.getEscalation().setMaxEscalations(2);
        AlertingEngine engine = engine();

        engine.processAlert(alert("a-1", "checkout", AlertSeverity.CRITICAL, List.of("hook")));
        scheduler.advanceBy(Duration.ofHours(6));

        assertThat(mail.sent).hasSize(2);
        assertThat(engine.getAlert("a-1").orElseThrow().getEscalationLevel()).isEqualTo(2);
        assertThat(scheduler.isScheduled("escalation:a-1")).isFalse();
        assertThat(engine.getAlertStatistics(24).getEscalationRate()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Acknowledging an alert before the deadline prevents escalation")
    void shouldNotEscalateAcknowledgedAlert() {
        config.getEscalation().setEnabled(true);
        AlertingEngine engine = engine();

        engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        scheduler.advanceBy(Duration.ofMinutes(30));

        assertThat(engine.acknowledgeAlert("a-1", "alice", "looking into it")).isTrue();
        scheduler.advanceBy(Duration.ofHours(4));

        assertThat(mail.sent).isEmpty();
        EnhancedAlert stored = engine.getAlert("a-1").orElseThrow();
        assertThat(stored.isAcknowledged()).isTrue();
        assertThat(stored.getAcknowledgedBy()).isEqualTo("alice");
        assertThat(stored.getAcknowledgedAt()).isEqualTo(START.plus(Duration.ofMinutes(30)));
        assertThat(stored.getNotes()).isEqualTo("looking into it");
        assertThat(engine.getActiveAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Resolving an alert cancels its escalation")
    void shouldNotEscalateResolvedAlert() {
        config.getEscalation().setEnabled(true);
        AlertingEngine engine = engine();

        engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        assertThat(engine.resolveAlert("a-1")).isTrue();
        scheduler.advanceBy(Duration.ofHours(4));

        assertThat(mail.sent).isEmpty();
        assertThat(engine.getAlert("a-1").orElseThrow().getResolvedAt()).isEqualTo(START);
        assertThat(engine.resolveAlert("missing")).isFalse();
        assertThat(engine.acknowledgeAlert("missing", "bob")).isFalse();
    }

    // ------------------------------------------------------------------
    // Visual regressions
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should map the visual score to a severity and render the visual template")
    void shouldProcessVisualRegression() {
        AlertingEngine engine = engine();
        VisualRegressionResult result = new VisualRegressionResult("homepage", START, 25.0, true);
        result.getSummary().setTotalTests(10);
        result.getSummary().setFailedTests(3);
        result.getSummary().setAverageDifference(4.257);
        result.getSummary().setMaxDifference(12.5);

        List<AlertDeliveryResult> results = engine.processVisualRegression(result);

        assertThat(results).extracting(AlertDeliveryResult::getChannel)
                .containsExactly("hook", "ops-email", "console");
        Map<String, Object> payload = webhooks.payloads(HOOK_URL).get(0);
        assertThat(payload).containsEntry("alertType", "visual_regression")
                .containsEntry("severity", "critical");
        assertThat(mail.sent).singleElement().satisfies(message -> {
            assertThat(message.getSubject()).isEqualTo("Visual Regression Detected: homepage");
            assertThat(message.getBody()).contains("<strong>Failed Tests:</strong> 3/10")
                    .contains("<strong>Average Difference:</strong> 4.26%")
                    .contains("<strong>Overall Score:</strong> 25.0/100");
        });
        assertThat(engine.getActiveAlerts()).singleElement()
                .satisfies(a -> assertThat(a.getId()).startsWith("visual-homepage-"));
    }

    @Test
    @DisplayName("Should ignore a visual result without a regression")
    void shouldIgnoreVisualResultWithoutRegression() {
        AlertingEngine engine = engine();

        assertThat(engine.processVisualRegression(new VisualRegressionResult("homepage", START, 95.0, false)))
                .isEmpty();
        assertThat(webhooks.payloads(HOOK_URL)).isEmpty();
        assertThat(engine.getActiveAlerts()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Test delivery, statistics, maintenance
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Test delivery to an unknown channel reports 'Channel not found'")
    void shouldReportUnknownTestChannel() {
        AlertingEngine engine = engine();

        AlertDeliveryResult result = engine.testAlertDelivery("nope");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Channel not found");
        assertThat(result.getAlertId()).isEqualTo("test");
    }

    @Test
    @DisplayName("Test delivery sends a sample alert without recording it")
    void shouldDeliverTestAlert() {
        AlertingEngine engine = engine();

        AlertDeliveryResult result = engine.testAlertDelivery("hook");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAlertId()).isEqualTo("test-" + START.toEpochMilli());
        EnhancedAlert sent = webhooks.alerts(HOOK_URL).get(0);
        assertThat(sent.getTestName()).isEqualTo(AlertingEngine.TEST_ALERT_NAME);
        assertThat(sent.getTemplateData()).containsEntry("score", 75);
        assertThat(engine.getActiveAlerts()).isEmpty();
        assertThat(engine.getAlertStatistics(24).getTotalAlerts()).isZero();
    }

    @Test
    @DisplayName("Should summarize recent alerts by severity and channel")
    void shouldComputeStatistics() {
        addChannels(channel("broken", "webhook", Map.of("url", BROKEN_URL)));
        webhooks.failing.add(BROKEN_URL);
        AlertingEngine engine = engine();
        engine.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        engine.processAlert(alert("a-2", "search", AlertSeverity.MINOR, List.of("hook")));
        engine.processAlert(alert("a-3", "login", AlertSeverity.CRITICAL, List.of("broken")));
        clock.advance(Duration.ofHours(30));
        engine.processAlert(alert("a-4", "cart", AlertSeverity.MINOR, List.of("console")));

        AlertStatistics day = engine.getAlertStatistics(24);
        assertThat(day.getTotalAlerts()).isEqualTo(1);

        AlertStatistics all = engine.getAlertStatistics(48);
        assertThat(all.getTotalAlerts()).isEqualTo(4);
        assertThat(all.getAlertsBySeverity()).containsEntry("minor", 2).containsEntry("major", 1)
                .containsEntry("critical", 1).containsEntry("moderate", 0);
        assertThat(all.getAlertsByChannel()).containsEntry("hook", 2).containsEntry("broken", 1)
                .containsEntry("console", 1);
        assertThat(all.getDeliverySuccessRate()).isEqualTo(75.0);
        assertThat(all.getAverageDeliveryTimeMs()).isZero();
        assertThat(all.getEscalationRate()).isZero();
    }

    @Test
    @DisplayName("Empty history yields zeroed statistics")
    void shouldHandleEmptyStatistics() {
        AlertStatistics stats = engine().getAlertStatistics(24);

        assertThat(stats.getTotalAlerts()).isZero();
        assertThat(stats.getDeliverySuccessRate()).isZero();
        assertThat(stats.getAlertsBySeverity()).containsOnlyKeys("minor", "moderate", "major", "critical");
    }

    @Test
    @DisplayName("Should drop alerts older than the retention period")
    void shouldCleanupOldAlerts() {
        config.setHistoryRetentionDays(7);
        AlertingEngine engine = engine();
        engine.processAlert(alert("old", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        clock.advance(Duration.ofDays(6));
        engine.processAlert(alert("new", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        clock.advance(Duration.ofDays(2));

        assertThat(engine.cleanupOldAlerts()).isEqualTo(1);
        assertThat(engine.getAlert("old")).isEmpty();
        assertThat(engine.getAlert("new")).isPresent();
        assertThat(store.rawJson()).doesNotContain("\"old\"");
    }

    @Test
    @DisplayName("Should reload history on initialize and keep acting on it")
    void shouldRestoreHistoryAcrossRestarts() {
        AlertingEngine first = engine();
        first.initialize();
        first.processAlert(alert("a-1", "checkout", AlertSeverity.MAJOR, List.of("hook")));
        first.shutdown();
        assertThat(scheduler.pendingCount()).isZero();

        AlertingEngine second = engine();
        second.initialize();

        EnhancedAlert restored = second.getAlert("a-1").orElseThrow();
        assertThat(restored.getTestName()).isEqualTo("checkout");
        assertThat(restored.getComparison().getOverallScore()).isEqualTo(42.0);
        assertThat(restored.getDeliveryStatus().isSent()).isTrue();
        assertThat(second.acknowledgeAlert("a-1", "carol")).isTrue();
        assertThat(scheduler.isScheduled(AlertingEngine.CLEANUP_JOB)).isTrue();
    }

    @Test
    @DisplayName("Should reject an invalid configuration up front")
    void shouldRejectInvalidConfig() {
        addChannels(channel("hook", "webhook", Map.of("url", HOOK_URL)));

        assertThatThrownBy(this::engine)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate channel name 'hook'");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertingEngine engine() {
        ChannelFactory factory = new ChannelFactory(webhooks, mail,
                new PrintStream(consoleBytes, true, StandardCharsets.UTF_8), clock, "test");
        return new AlertingEngine(config, store, factory, scheduler, clock, metrics);
    }

    private Alert alert(String id, String testName, AlertSeverity severity, List<String> channels) {
        BaselineComparison comparison = new BaselineComparison();
        comparison.setOverallScore(42.0);
        comparison.setRegressionDetected(true);
        comparison.setSeverity(severity.label());
        comparison.getDifferences().setResponseTimeMeanChange(35.5);
        comparison.getDifferences().setThroughputRpsChange(-10.0);
        comparison.getDifferences().setErrorRateChange(0.4);
        comparison.setRecommendations(List.of("Check the slow query log", "Review connection pool size",
                "Compare GC pauses", "Inspect cache hit ratio"));
        return Alert.builder()
                .id(id)
                .timestamp(clock.instant())
                .severity(severity)
                .testType("load")
                .testName(testName)
                .comparison(comparison)
                .alertChannels(channels)
                .build();
    }

    private void addChannels(AlertChannelConfig... extra) {
        List<AlertChannelConfig> channels = new ArrayList<>(config.getChannels());
        channels.addAll(List.of(extra));
        config.setChannels(channels);
    }

    private static AlertChannelConfig channel(String name, String type, Map<String, Object> settings) {
        AlertChannelConfig channel = new AlertChannelConfig();
        channel.setName(name);
        channel.setType(type);
        channel.setConfig(new LinkedHashMap<>(settings));
        return channel;
    }

    private double counter(String name) {
        return metrics.getRegistry().counter(name).count();
    }

    private String console() {
        return consoleBytes.toString(StandardCharsets.UTF_8);
    }

    private static final class RecordingWebhookTransport implements WebhookTransport {
        private final List<String> urls = new ArrayList<>();
        private final List<Object> bodies = new ArrayList<>();
        private final Set<String> failing = new HashSet<>();
        private final Map<String, Integer> attempts = new LinkedHashMap<>();
        private int failuresBeforeSuccess;

        @Override
        public void post(String url, Object payload) {
            attempts.merge(url, 1, Integer::sum);
            if (failing.contains(url)) {
                throw new AlertDeliveryException("HTTP 503 from " + url);
            }
            if (failuresBeforeSuccess > 0) {
                failuresBeforeSuccess--;
                throw new AlertDeliveryException("connection reset");
            }
            urls.add(url);
            bodies.add(payload);
        }

        int attempts(String url) {
            return attempts.getOrDefault(url, 0);
        }

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> payloads(String url) {
            List<Map<String, Object>> result = new ArrayList<>();
            for (int i = 0; i < urls.size(); i++) {
                if (urls.get(i).equals(url)) {
                    result.add((Map<String, Object>) bodies.get(i));
                }
            }
            return result;
        }

        List<EnhancedAlert> alerts(String url) {
            return payloads(url).stream().map(p -> (EnhancedAlert) p.get("alert")).toList();
        }
    }

    private static final class RecordingMailTransport implements MailTransport {
        private final List<EmailMessage> sent = new ArrayList<>();

        @Override
        public void send(EmailMessage message) {
            sent.add(message);
        }
    }
}
