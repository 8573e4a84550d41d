package com.regressionsentinel.core.alerting;

import com.regressionsentinel.core.alerting.channel.AlertChannel;
import com.regressionsentinel.core.alerting.channel.AlertMessage;
import com.regressionsentinel.core.alerting.channel.ChannelFactory;
import com.regressionsentinel.core.config.AlertTemplate;
import com.regressionsentinel.core.config.AlertingConfig;
import com.regressionsentinel.core.event.AlertAcknowledgedEvent;
import com.regressionsentinel.core.event.AlertEscalatedEvent;
import com.regressionsentinel.core.event.AlertProcessedEvent;
import com.regressionsentinel.core.event.EventBus;
import com.regressionsentinel.core.metrics.SentinelMetrics;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertDeliveryResult;
import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.model.BaselineComparison;
import com.regressionsentinel.core.model.EnhancedAlert;
import com.regressionsentinel.core.model.VisualRegressionResult;
import com.regressionsentinel.core.schedule.TaskScheduler;
import com.regressionsentinel.core.store.SnapshotStore;
import com.regressionsentinel.core.store.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns regression alerts into channel deliveries.
 *
 * <h3>Pipeline</h3>
 * <p>
 * {@link #processAlert} rate-limits the alert, holds it in its aggregation
 * buffer when aggregation is on, enriches it with template data, delivers it to
 * every matching channel, arms the escalation timer and records it in the
 * history. Visual regressions enter through {@link #processVisualRegression}
 * and follow the same pipeline.
 * </p>
 *
 * <h3>Timers</h3>
 * <p>
 * Escalation and aggregation timers live in the shared {@link TaskScheduler}
 * under the keys {@code escalation:<alertId>} and
 * {@code aggregation:<bufferKey>}, so acknowledging an alert or shutting the
 * engine down cancels them.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * All public methods are {@code synchronized}. Timer callbacks re-enter the
 * engine through the same monitor.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertingEngine.class);

    static final String CLEANUP_JOB = "job:alert-cleanup";
    static final String AGGREGATION_SWEEP_JOB = "job:aggregation-sweep";
    static final String DEFAULT_CHANNEL = "console";
    static final String TEST_ALERT_NAME = "Alert System Test";

    private final AlertingConfig config;
    private final SnapshotStore<Map<String, List<EnhancedAlert>>> store;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final SentinelMetrics metrics;
    private final EventBus events = new EventBus();
    private final List<AlertChannel> channels;
    private final AlertTemplates templates;
    private final RateLimiter rateLimiter;
    private final AlertAggregator aggregator;

    /** History keyed by {@code <testType>-<testName>}, oldest first. */
    private Map<String, List<EnhancedAlert>> history = new LinkedHashMap<>();

    private boolean initialized;

    public AlertingEngine(AlertingConfig config, SnapshotStore<Map<String, List<EnhancedAlert>>> store,
            ChannelFactory channelFactory, TaskScheduler scheduler, Clock clock, SentinelMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(channelFactory, "channelFactory must not be null");
        config.validate();
        this.channels = channelFactory.createAll(config.getChannels());
        this.templates = AlertTemplates.withOverrides(config.getTemplates());
        this.rateLimiter = new RateLimiter(config.getRateLimit().getMaxAlertsPerHour(),
                config.getRateLimit().getMaxAlertsPerDay(), clock);
        this.aggregator = new AlertAggregator(config.getAggregation().window(),
                config.getAggregation().getMaxAlertsToAggregate(), clock);
    }

    /**
     * @return the bus this engine publishes {@link AlertProcessedEvent},
     *         {@link AlertAcknowledgedEvent} and {@link AlertEscalatedEvent} on
     */
    public EventBus events() {
        return events;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Load the alert history and start the cleanup and aggregation sweep
     * jobs. Calling it again has no effect.
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        loadHistory();
        scheduler.scheduleAtFixedRate(CLEANUP_JOB, Duration.ofMinutes(config.getCleanupIntervalMinutes()),
                this::cleanupOldAlerts);
        if (config.getAggregation().isEnabled()) {
            scheduler.scheduleAtFixedRate(AGGREGATION_SWEEP_JOB,
                    Duration.ofMinutes(config.getAggregationSweepMinutes()), this::flushAggregationBuffers);
        }
        initialized = true;
        LOG.info("Alerting engine initialized: {} channel(s), {} alert(s) in history",
                channels.size(), history.values().stream().mapToInt(List::size).sum());
    }

    /**
     * Cancel every timer this engine owns and write a final history snapshot.
     * Alerts still held in aggregation buffers are dropped.
     */
    public synchronized void shutdown() {
        scheduler.cancel(CLEANUP_JOB);
        scheduler.cancel(AGGREGATION_SWEEP_JOB);
        for (String key : aggregator.keys()) {
            scheduler.cancel(aggregationKey(key));
        }
        aggregator.clear();
        history.values().stream()
                .flatMap(List::stream)
                .forEach(alert -> scheduler.cancel(escalationKey(alert.getId())));
        persist();
        initialized = false;
        LOG.info("Alerting engine shut down");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Run a regression alert through the pipeline.
     *
     * @return one result per channel the alert was delivered to; empty when
     *         the alert was rate-limited or buffered for aggregation
     */
    public synchronized List<AlertDeliveryResult> processAlert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        LOG.info("Processing alert {} ({}) for test [{}]", alert.getId(), alert.getSeverity().label(),
                alert.getTestName());

        if (!rateLimiter.tryAcquire(alertType(alert), alert.getSeverity())) {
            LOG.warn("Rate limit exceeded for {} {} alerts, dropping {}", alertType(alert),
                    alert.getSeverity().label(), alert.getId());
            metrics.incrementRateLimited();
            return List.of();
        }

        if (config.getAggregation().isEnabled()) {
            bufferForAggregation(alert);
            return List.of();
        }
        return dispatch(alert);
    }

    private List<AlertDeliveryResult> dispatch(Alert alert) {
        EnhancedAlert enhanced = enhance(alert, templateData(alert));
        List<AlertDeliveryResult> results = send(enhanced);
        if (config.getEscalation().isEnabled()) {
            armEscalation(enhanced.getId());
        }
        store(enhanced);
        events.publish(new AlertProcessedEvent(clock.instant(), enhanced, results));
        return results;
    }

    /**
     * Raise an alert for a failing visual comparison. Results without a
     * detected regression are ignored.
     */
    public synchronized List<AlertDeliveryResult> processVisualRegression(VisualRegressionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (!result.isRegressionDetected()) {
            return List.of();
        }
        Instant timestamp = result.getTimestamp() != null ? result.getTimestamp() : clock.instant();
        Alert alert = Alert.builder()
                .id("visual-" + result.getTestName() + "-" + clock.millis())
                .timestamp(timestamp)
                .severity(AlertSeverity.fromVisualScore(result.getOverallScore()))
                .testType("visual")
                .testName(result.getTestName())
                .alertChannels(channels.stream().map(AlertChannel::getName).toList())
                .build();
        LOG.info("Processing visual regression for test [{}]: score={}", result.getTestName(),
                result.getOverallScore());

        if (!rateLimiter.tryAcquire(alertType(alert), alert.getSeverity())) {
            LOG.warn("Rate limit exceeded for visual {} alerts, dropping {}", alert.getSeverity().label(),
                    alert.getId());
            metrics.incrementRateLimited();
            return List.of();
        }

        Map<String, Object> data = baseTemplateData(alert);
        VisualRegressionResult.Summary summary = result.getSummary();
        if (summary != null) {
            data.put("failedTests", summary.getFailedTests());
            data.put("totalTests", summary.getTotalTests());
            data.put("averageDifference", format(summary.getAverageDifference(), 2));
            data.put("maxDifference", format(summary.getMaxDifference(), 2));
        }
        data.put("overallScore", format(result.getOverallScore(), 1));

        EnhancedAlert enhanced = enhance(alert, data);
        List<AlertDeliveryResult> results = send(enhanced);
        if (config.getEscalation().isEnabled()) {
            armEscalation(enhanced.getId());
        }
        store(enhanced);
        events.publish(new AlertProcessedEvent(clock.instant(), enhanced, results));
        return results;
    }

    /**
     * Mark an alert acknowledged and cancel its escalation.
     *
     * @return {@code false} if no alert has that id
     */
    public synchronized boolean acknowledgeAlert(String alertId, String acknowledgedBy, String notes) {
        Optional<EnhancedAlert> found = findAlert(alertId);
        if (found.isEmpty()) {
            return false;
        }
        EnhancedAlert alert = found.get();
        alert.setAcknowledged(true);
        alert.setAcknowledgedBy(acknowledgedBy);
        alert.setAcknowledgedAt(clock.instant());
        if (notes != null) {
            alert.setNotes(notes);
        }
        scheduler.cancel(escalationKey(alertId));
        persist();
        events.publish(new AlertAcknowledgedEvent(clock.instant(), alert));
        LOG.info("Alert {} acknowledged by {}", alertId, acknowledgedBy);
        return true;
    }

    public boolean acknowledgeAlert(String alertId, String acknowledgedBy) {
        return acknowledgeAlert(alertId, acknowledgedBy, null);
    }

    /**
     * Mark an alert resolved and cancel its escalation.
     *
     * @return {@code false} if no alert has that id
     */
    public synchronized boolean resolveAlert(String alertId) {
        Optional<EnhancedAlert> found = findAlert(alertId);
        if (found.isEmpty()) {
            return false;
        }
        found.get().setResolvedAt(clock.instant());
        scheduler.cancel(escalationKey(alertId));
        persist();
        LOG.info("Alert {} resolved", alertId);
        return true;
    }

    /**
     * Deliver a synthetic alert to one channel, bypassing rate limiting and
     * aggregation. Nothing is recorded in the history.
     */
    public synchronized AlertDeliveryResult testAlertDelivery(String channelName) {
        Optional<AlertChannel> channel = channels.stream()
                .filter(c -> c.getName().equals(channelName))
                .findFirst();
        if (channel.isEmpty()) {
            return AlertDeliveryResult.failure(channelName, "test", clock.instant(), "Channel not found");
        }

        Alert alert = Alert.builder()
                .id("test-" + clock.millis())
                .timestamp(clock.instant())
                .severity(AlertSeverity.MINOR)
                .testType("test")
                .testName(TEST_ALERT_NAME)
                .alertChannels(List.of(channelName))
                .build();
        Map<String, Object> data = baseTemplateData(alert);
        data.put("score", 75);
        data.put("responseTimeChange", 5.2);
        data.put("throughputChange", -2.1);
        data.put("errorRateChange", 0.3);
        data.put("recommendations", List.of("This is a test alert to verify delivery"));
        EnhancedAlert enhanced = enhance(alert, data);
        enhanced.setChannel(channelName);
        return deliver(enhanced, channel.get(), render(enhanced));
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Summarize the alerts raised in the last {@code hours} hours.
     */
    public synchronized AlertStatistics getAlertStatistics(int hours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        List<EnhancedAlert> recent = history.values().stream()
                .flatMap(List::stream)
                .filter(a -> !a.getTimestamp().isBefore(cutoff))
                .toList();

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (AlertSeverity severity : AlertSeverity.values()) {
            bySeverity.put(severity.label(), 0);
        }
        Map<String, Integer> byChannel = new LinkedHashMap<>();
        int delivered = 0;
        long totalDeliveryMs = 0;
        int escalated = 0;

        for (EnhancedAlert alert : recent) {
            bySeverity.merge(alert.getSeverity().label(), 1, Integer::sum);
            byChannel.merge(String.valueOf(alert.getChannel()), 1, Integer::sum);
            if (alert.getDeliveryStatus().isSent()) {
                delivered++;
                if (alert.getDeliveryStatus().getSentAt() != null) {
                    totalDeliveryMs += Duration.between(alert.getTimestamp(),
                            alert.getDeliveryStatus().getSentAt()).toMillis();
                }
            }
            if (alert.getEscalationLevel() > 0) {
                escalated++;
            }
        }

        int total = recent.size();
        return new AlertStatistics(total, bySeverity, byChannel,
                total > 0 ? delivered * 100.0 / total : 0.0,
                delivered > 0 ? (double) totalDeliveryMs / delivered : 0.0,
                total > 0 ? escalated * 100.0 / total : 0.0);
    }

    /**
     * @return unacknowledged, unresolved alerts, newest first
     */
    public synchronized List<EnhancedAlert> getActiveAlerts() {
        return history.values().stream()
                .flatMap(List::stream)
                .filter(a -> !a.isAcknowledged() && a.getResolvedAt() == null)
                .sorted(Comparator.comparing(Alert::getTimestamp).reversed())
                .toList();
    }

    public synchronized Optional<EnhancedAlert> getAlert(String alertId) {
        return findAlert(alertId);
    }

    public List<AlertChannel> getChannels() {
        return channels;
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * Flush every aggregation buffer whose oldest alert is older than the
     * aggregation window.
     */
    public synchronized void flushAggregationBuffers() {
        for (String key : aggregator.staleKeys()) {
            flushAggregationBuffer(key);
        }
    }

    /**
     * Drop alerts older than the history retention.
     *
     * @return number of alerts removed
     */
    public synchronized int cleanupOldAlerts() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.getHistoryRetentionDays()));
        int removed = 0;
        for (List<EnhancedAlert> alerts : history.values()) {
            int before = alerts.size();
            alerts.removeIf(a -> !a.getTimestamp().isAfter(cutoff));
            removed += before - alerts.size();
        }
        history.values().removeIf(List::isEmpty);
        if (removed > 0) {
            LOG.info("Removed {} alert(s) older than {} day(s)", removed, config.getHistoryRetentionDays());
        }
        persist();
        return removed;
    }

    // ---------------------------------------------------------------
    // Aggregation
    // ---------------------------------------------------------------

    /**
     * Hold the alert in its buffer. The first alert for a key arms the flush
     * timer; a full buffer is flushed at once.
     */
    private void bufferForAggregation(Alert alert) {
        String key = AlertAggregator.keyOf(alert);
        if (aggregator.isStale(key)) {
            flushAggregationBuffer(key);
        }
        int size = aggregator.add(alert);
        if (size == 1) {
            scheduler.schedule(aggregationKey(key), config.getAggregation().window(),
                    () -> flushAggregationBuffer(key));
        }
        LOG.debug("Alert {} buffered for aggregation under {} ({} alert(s))", alert.getId(), key, size);
        if (aggregator.isFull(key)) {
            flushAggregationBuffer(key);
        }
    }

    private synchronized void flushAggregationBuffer(String key) {
        scheduler.cancel(aggregationKey(key));
        List<Alert> buffer = aggregator.drain(key);
        if (buffer.isEmpty()) {
            return;
        }
        if (buffer.size() == 1) {
            LOG.debug("Buffer {} held a single alert, delivering it as is", key);
            dispatch(buffer.get(0));
            return;
        }

        Alert first = buffer.get(0);
        EnhancedAlert aggregated = enhance(first, templateData(first));
        aggregated.setId("aggregated-" + key + "-" + clock.millis());
        aggregated.setAggregatedAlerts(new ArrayList<>(buffer));
        aggregated.getTemplateData().put("alertId", aggregated.getId());
        aggregated.getTemplateData().put("aggregatedCount", buffer.size());
        Map<String, Object> timeRange = new LinkedHashMap<>();
        timeRange.put("start", buffer.stream().map(Alert::getTimestamp).min(Comparator.naturalOrder())
                .orElseThrow().toString());
        timeRange.put("end", buffer.stream().map(Alert::getTimestamp).max(Comparator.naturalOrder())
                .orElseThrow().toString());
        aggregated.getTemplateData().put("timeRange", timeRange);

        LOG.info("Flushing {} aggregated alert(s) for {}", buffer.size(), key);
        List<AlertDeliveryResult> results = send(aggregated);
        store(aggregated);
        metrics.incrementAggregated();
        events.publish(new AlertProcessedEvent(clock.instant(), aggregated, results));
    }

    // ---------------------------------------------------------------
    // Escalation
    // ---------------------------------------------------------------

    private void armEscalation(String alertId) {
        scheduler.schedule(escalationKey(alertId), config.getEscalation().timeToEscalate(),
                () -> escalate(alertId));
    }

    private synchronized void escalate(String alertId) {
        Optional<EnhancedAlert> found = findAlert(alertId);
        if (found.isEmpty()) {
            return;
        }
        EnhancedAlert alert = found.get();
        int maxEscalations = config.getEscalation().getMaxEscalations();
        if (alert.isAcknowledged() || alert.getResolvedAt() != null || alert.getEscalationLevel() >= maxEscalations) {
            return;
        }

        alert.setEscalationLevel(alert.getEscalationLevel() + 1);
        int level = alert.getEscalationLevel();

        EnhancedAlert escalation = EnhancedAlert.from(alert);
        escalation.setId("escalation-" + alertId + "-" + level);
        escalation.setEscalationLevel(level);
        escalation.setAcknowledged(false);
        Map<String, Object> data = baseTemplateData(escalation);
        double hours = Duration.between(alert.getTimestamp(), clock.instant()).toMillis() / 3_600_000.0;
        data.put("hoursUnacknowledged", format(hours, 1));
        data.put("originalAlert", summarize(alert));
        data.put("escalationLevel", level);
        escalation.setTemplateData(data);

        AlertMessage message = render(escalation);
        List<String> targets = config.getEscalation().getEscalationChannels();
        List<AlertDeliveryResult> results = new ArrayList<>();
        for (AlertChannel channel : channels) {
            if (channel.getConfig().isEnabled() && targets.contains(channel.getName())) {
                results.add(deliver(escalation, channel, message));
            }
        }

        metrics.incrementEscalated();
        LOG.warn("Alert {} escalated to level {} on {} channel(s)", alertId, level, results.size());
        persist();
        events.publish(new AlertEscalatedEvent(clock.instant(), escalation, results));

        if (level < maxEscalations) {
            armEscalation(alertId);
        }
    }

    // ---------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------

    private List<AlertDeliveryResult> send(EnhancedAlert alert) {
        AlertMessage message = render(alert);
        List<AlertDeliveryResult> results = new ArrayList<>();
        for (AlertChannel channel : channels) {
            if (channel.getConfig().isEnabled()
                    && channel.getConfig().acceptsSeverity(alert.getSeverity())
                    && alert.getAlertChannels().contains(channel.getName())) {
                results.add(deliver(alert, channel, message));
            }
        }
        if (results.isEmpty()) {
            LOG.warn("Alert {} matched no enabled channel", alert.getId());
        }
        return results;
    }

    /**
     * Deliver to one channel, retrying up to {@code deliveryRetries} times.
     * Never throws.
     */
    private AlertDeliveryResult deliver(EnhancedAlert alert, AlertChannel channel, AlertMessage message) {
        int attempts = 1 + Math.max(0, config.getDeliveryRetries());
        String error = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Instant started = clock.instant();
            try {
                Map<String, Object> metadata = channel.deliver(alert, message);
                Instant now = clock.instant();
                alert.getDeliveryStatus().markSent(now);
                metrics.incrementAlertsDelivered();
                metrics.recordDeliveryLatency(Duration.between(started, now));
                LOG.debug("Alert {} delivered via {} on attempt {}", alert.getId(), channel.getName(), attempt);
                return AlertDeliveryResult.success(channel.getName(), alert.getId(), now, metadata);
            } catch (RuntimeException e) {
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                if (attempt < attempts) {
                    alert.getDeliveryStatus().setRetryCount(alert.getDeliveryStatus().getRetryCount() + 1);
                    LOG.warn("Delivery of alert {} via {} failed (attempt {}/{}), retrying: {}",
                            alert.getId(), channel.getName(), attempt, attempts, error);
                } else {
                    LOG.warn("Delivery of alert {} via {} failed after {} attempt(s): {}",
                            alert.getId(), channel.getName(), attempts, error, e);
                }
            }
        }
        alert.getDeliveryStatus().markFailed(error);
        metrics.incrementDeliveryFailures();
        return AlertDeliveryResult.failure(channel.getName(), alert.getId(), clock.instant(), error);
    }

    AlertMessage render(EnhancedAlert alert) {
        AlertTemplate template = templateFor(alert);
        Map<String, Object> data = alert.getTemplateData();
        String subject = TemplateRenderer.render(template.getSubject(), data);
        String body = TemplateRenderer.render(template.getBody(), data);
        String text = template.isHtml() ? TemplateRenderer.toText(body) : body;
        return new AlertMessage(subject, body, text, template.isHtml());
    }

    private AlertTemplate templateFor(EnhancedAlert alert) {
        if (alert.getEscalationLevel() > 0) {
            return templates.get(AlertTemplates.ESCALATION);
        }
        if ("visual".equals(alert.getTestType())) {
            return templates.get(AlertTemplates.VISUAL_REGRESSION);
        }
        return templates.get(AlertTemplates.PERFORMANCE_REGRESSION);
    }

    // ---------------------------------------------------------------
    // Enrichment
    // ---------------------------------------------------------------

    private EnhancedAlert enhance(Alert alert, Map<String, Object> templateData) {
        EnhancedAlert enhanced = EnhancedAlert.from(alert);
        List<String> targets = alert.getAlertChannels();
        enhanced.setChannel(targets.isEmpty() ? DEFAULT_CHANNEL : targets.get(0));
        enhanced.setEscalationLevel(0);
        enhanced.setAggregatedAlerts(null);
        enhanced.setTemplateData(templateData);
        enhanced.setDeliveryStatus(null);
        return enhanced;
    }

    private Map<String, Object> templateData(Alert alert) {
        Map<String, Object> data = baseTemplateData(alert);
        BaselineComparison comparison = alert.getComparison();
        if (comparison != null && comparison.getDifferences() != null) {
            BaselineComparison.Differences diff = comparison.getDifferences();
            data.put("score", format(comparison.getOverallScore(), 1));
            data.put("responseTimeChange", format(diff.getResponseTimeMeanChange(), 1));
            data.put("throughputChange", format(diff.getThroughputRpsChange(), 1));
            data.put("errorRateChange", format(diff.getErrorRateChange(), 1));
            List<String> recommendations = comparison.getRecommendations() != null
                    ? comparison.getRecommendations()
                    : List.of();
            data.put("recommendations", List.copyOf(recommendations.subList(0, Math.min(3, recommendations.size()))));
        }
        return data;
    }

    private Map<String, Object> baseTemplateData(Alert alert) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("testName", alert.getTestName());
        data.put("severity", alert.getSeverity().label());
        data.put("timestamp", alert.getTimestamp().toString());
        data.put("alertId", alert.getId());
        return data;
    }

    private static Map<String, Object> summarize(Alert alert) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", alert.getId());
        summary.put("testName", alert.getTestName());
        summary.put("testType", alert.getTestType());
        summary.put("severity", alert.getSeverity().label());
        summary.put("timestamp", alert.getTimestamp().toString());
        return summary;
    }

    private static String format(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    // ---------------------------------------------------------------
    // History
    // ---------------------------------------------------------------

    private Optional<EnhancedAlert> findAlert(String alertId) {
        return history.values().stream()
                .flatMap(List::stream)
                .filter(a -> a.getId().equals(alertId))
                .findFirst();
    }

    private void store(EnhancedAlert alert) {
        history.computeIfAbsent(alert.getTestType() + "-" + alert.getTestName(), k -> new ArrayList<>())
                .add(alert);
        persist();
    }

    private static String alertType(Alert alert) {
        return "visual".equals(alert.getTestType()) ? "visual" : "performance";
    }

    private static String escalationKey(String alertId) {
        return "escalation:" + alertId;
    }

    private static String aggregationKey(String bufferKey) {
        return "aggregation:" + bufferKey;
    }

    private void loadHistory() {
        try {
            store.load().ifPresent(loaded -> {
                Map<String, List<EnhancedAlert>> copy = new LinkedHashMap<>();
                loaded.forEach((key, alerts) -> copy.put(key, new ArrayList<>(alerts)));
                history = copy;
                LOG.info("Loaded alert history from {}", store.describe());
            });
        } catch (SnapshotStoreException e) {
            LOG.warn("Failed to load alert history from {}, starting empty: {}", store.describe(),
                    e.getMessage(), e);
        }
    }

    private void persist() {
        try {
            store.save(history);
        } catch (SnapshotStoreException e) {
            LOG.warn("Failed to persist alert history to {}, keeping in-memory state: {}", store.describe(),
                    e.getMessage(), e);
        }
    }
}
