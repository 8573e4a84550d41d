package com.regressionsentinel.framework;

import com.regressionsentinel.core.alerting.AlertingEngine;
import com.regressionsentinel.core.alerting.channel.AlertChannel;
import com.regressionsentinel.core.event.AnomalyDetectedEvent;
import com.regressionsentinel.core.event.EventBus;
import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertDeliveryResult;
import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.model.TimeRange;
import com.regressionsentinel.core.model.VisualRegressionResult;
import com.regressionsentinel.core.schedule.TaskScheduler;
import com.regressionsentinel.core.statistics.AnomalyDetection;
import com.regressionsentinel.core.statistics.AnomalySeverity;
import com.regressionsentinel.core.statistics.PerformanceTrends;
import com.regressionsentinel.core.statistics.StatisticalAnalysisEngine;
import com.regressionsentinel.core.statistics.TrendAnalysisResult;
import com.regressionsentinel.core.store.JsonFileSnapshotStore;
import com.regressionsentinel.core.store.SnapshotStore;
import com.regressionsentinel.framework.collaborator.BaselineRecord;
import com.regressionsentinel.framework.collaborator.BaselineRecorder;
import com.regressionsentinel.framework.collaborator.PerformanceTestFunction;
import com.regressionsentinel.framework.collaborator.RegressionChecker;
import com.regressionsentinel.framework.collaborator.RunMetadata;
import com.regressionsentinel.framework.collaborator.TestDescriptor;
import com.regressionsentinel.framework.collaborator.VisualRegressionRunner;
import com.regressionsentinel.framework.collaborator.VisualTestOptions;
import com.regressionsentinel.framework.event.AnalysisCompletedEvent;
import com.regressionsentinel.framework.event.AutomatedTestsCompletedEvent;
import com.regressionsentinel.framework.event.BaselineRecordedEvent;
import com.regressionsentinel.framework.event.ComparisonCompletedEvent;
import com.regressionsentinel.framework.event.RegressionDetectedEvent;
import com.regressionsentinel.framework.event.TestCompletedEvent;
import com.regressionsentinel.framework.event.VisualRegressionDetectedEvent;
import com.regressionsentinel.framework.history.TestResultHistory;
import com.regressionsentinel.framework.model.ExportOptions;
import com.regressionsentinel.framework.model.PerformanceExport;
import com.regressionsentinel.framework.model.PerformanceReport;
import com.regressionsentinel.framework.model.PerformanceTestResult;
import com.regressionsentinel.framework.model.TestOptions;
import com.regressionsentinel.framework.report.PerformanceDataExporter;
import com.regressionsentinel.framework.report.RecommendationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives performance test runs through baseline recording, regression
 * checking, statistical analysis and alerting.
 *
 * <h3>Test run</h3>
 *
 * <pre>
 *   workload            → metrics (exceptions propagate to the caller)
 *     → visual test      (optional) → visual regression alert
 *     → baseline record  (unless skipped)
 *     → regression check → regression alert
 *     → statistical analysis → anomaly alert (high severity)
 *     → recommendations  → stored result → TestCompletedEvent
 * </pre>
 *
 * <h3>Background jobs</h3>
 * <p>
 * Maintenance ({@code job:maintenance}) and, when enabled, automated tests
 * ({@code job:automated-tests}) run on the shared {@link TaskScheduler}. The
 * statistical engine schedules its own periodic trend analysis.
 * </p>
 *
 * <h3>Events</h3>
 * <p>
 * {@link #events()} carries the framework's own events plus everything the
 * two engines publish.
 * </p>
 *
 * @since 1.0.0
 */
public class PerformanceRegressionFramework {

    private static final Logger LOG = LoggerFactory.getLogger(PerformanceRegressionFramework.class);

    static final String MAINTENANCE_JOB = "job:maintenance";
    static final String AUTOMATED_TESTS_JOB = "job:automated-tests";
    static final String DEFAULT_TEST_TYPE = "load";
    static final int RECENT_ANOMALY_HOURS = 24;

    static final List<String> DATA_DIRECTORIES = List.of("baselines", "screenshots", "alerts", "statistics",
            "reports");

    private final FrameworkConfig config;
    private final StatisticalAnalysisEngine statisticalEngine;
    private final AlertingEngine alertingEngine;
    private final BaselineRecorder baselineRecorder;
    private final RegressionChecker regressionChecker;
    private final VisualRegressionRunner visualRunner;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final TestResultHistory history;
    private final PerformanceDataExporter exporter;
    private final EventBus events = new EventBus();
    private final Map<String, AutomatedTest> automatedTests = new LinkedHashMap<>();

    private volatile boolean initialized;

    private PerformanceRegressionFramework(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config must not be null");
        this.statisticalEngine = Objects.requireNonNull(b.statisticalEngine, "statisticalEngine must not be null");
        this.alertingEngine = Objects.requireNonNull(b.alertingEngine, "alertingEngine must not be null");
        this.baselineRecorder = Objects.requireNonNull(b.baselineRecorder, "baselineRecorder must not be null");
        this.regressionChecker = Objects.requireNonNull(b.regressionChecker, "regressionChecker must not be null");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.visualRunner = b.visualRunner;
        this.exporter = b.exporter != null ? b.exporter : new PerformanceDataExporter();
        SnapshotStore<Map<String, List<PerformanceTestResult>>> resultStore = b.resultStore != null
                ? b.resultStore
                : new JsonFileSnapshotStore<>(config.dataPath().resolve("test-results.json"),
                        TestResultHistory.SNAPSHOT_TYPE);
        this.history = new TestResultHistory(resultStore, config.getMaxResultsPerTest());

        statisticalEngine.events().forwardTo(events);
        alertingEngine.events().forwardTo(events);
        statisticalEngine.events().subscribe(AnomalyDetectedEvent.class, this::onAnomaliesDetected);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the bus carrying framework and engine events
     */
    public EventBus events() {
        return events;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Create the data directories, initialize both engines, load stored
     * results and start the background jobs. Calling it again has no effect.
     *
     * @throws IllegalStateException if the data directories cannot be created
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        LOG.info("Initializing performance regression framework: {}", config);
        createDataDirectories();
        statisticalEngine.initialize();
        alertingEngine.initialize();
        history.load();
        startBackgroundJobs();
        initialized = true;
        LOG.info("Performance regression framework initialized: {} stored result(s)", history.size());
    }

    /**
     * Stop the background jobs, save the results and shut both engines down.
     */
    public synchronized void shutdown() {
        LOG.info("Shutting down performance regression framework");
        scheduler.cancel(MAINTENANCE_JOB);
        scheduler.cancel(AUTOMATED_TESTS_JOB);
        history.persist();
        alertingEngine.shutdown();
        statisticalEngine.shutdown();
        initialized = false;
        LOG.info("Performance regression framework shut down");
    }

    public boolean isInitialized() {
        return initialized;
    }

    // ---------------------------------------------------------------
    // Test runs
    // ---------------------------------------------------------------

    public PerformanceTestResult runPerformanceTest(String testName, String testType, PerformanceTestFunction test)
            throws Exception {
        return runPerformanceTest(testName, testType, test, TestOptions.defaults());
    }

    /**
     * Run a workload and push its metrics through the pipeline.
     *
     * @param testName name of the test
     * @param testType test type, for example {@code load} or {@code stress}
     * @param test     the workload
     * @param options  run options; {@code null} means defaults
     * @return the stored result
     * @throws Exception whatever the workload throws, unchanged
     */
    public PerformanceTestResult runPerformanceTest(String testName, String testType, PerformanceTestFunction test,
            TestOptions options) throws Exception {
        Objects.requireNonNull(testName, "testName must not be null");
        Objects.requireNonNull(test, "test must not be null");
        TestOptions opts = options != null ? options : TestOptions.defaults();
        LOG.info("Running performance test: {} ({})", testName, testType);

        Instant started = clock.instant();
        try {
            PerformanceMetrics metrics = Objects.requireNonNull(test.run(),
                    "performance test " + testName + " returned no metrics");
            long durationMs = Duration.between(started, clock.instant()).toMillis();
            RunMetadata metadata = opts.toRunMetadata();

            VisualRegressionResult visualResults = null;
            if (opts.isVisualTest()) {
                visualResults = runVisualTest(testName, testType);
            }

            if (!opts.isSkipBaseline()) {
                BaselineRecord baseline = baselineRecorder.recordBaseline(testType,
                        TestDescriptor.of(testName, durationMs), metrics, metadata);
                events.publish(new BaselineRecordedEvent(clock.instant(), baseline));
            }

            Optional<Alert> regression = regressionChecker.checkRegression(testType, testName, metrics, metadata);
            events.publish(new ComparisonCompletedEvent(clock.instant(), testType, testName, regression.orElse(null)));
            regression.ifPresent(this::raiseRegression);

            statisticalEngine.analyzeMetrics(testName, metrics, clock.instant(), testType, analysisMetadata(opts));

            boolean recentAnomalies = !statisticalEngine.getRecentAnomalies(RECENT_ANOMALY_HOURS).isEmpty();
            List<String> recommendations = RecommendationGenerator.forTestRun(metrics, regression.orElse(null),
                    recentAnomalies);

            PerformanceTestResult result = new PerformanceTestResult(testName, testType, clock.instant(), durationMs,
                    metrics, visualResults, regression.map(List::of).orElse(List.of()), recommendations);
            history.record(result);

            LOG.info("Performance test completed: {} in {} ms, regression detected: {}", testName, durationMs,
                    result.isRegressionDetected());
            events.publish(new TestCompletedEvent(clock.instant(), result));
            return result;
        } catch (Exception e) {
            LOG.error("Performance test failed: {}", testName, e);
            throw e;
        }
    }

    /**
     * Run a {@code load} test with default options.
     *
     * @return {@code true} if the run regressed against its baseline
     */
    public boolean runQuickRegressionCheck(String testName, PerformanceTestFunction test) throws Exception {
        return runPerformanceTest(testName, DEFAULT_TEST_TYPE, test, TestOptions.defaults()).isRegressionDetected();
    }

    private VisualRegressionResult runVisualTest(String testName, String testType) {
        if (!config.isVisualRegressionEnabled()) {
            LOG.debug("Visual regression disabled, skipping visual test for {}", testName);
            return null;
        }
        if (visualRunner == null) {
            LOG.warn("Visual test requested for {} but no visual regression runner is configured", testName);
            return null;
        }
        VisualRegressionResult result = visualRunner.runVisualTest(testName, VisualTestOptions.desktop(testType));
        if (result != null && result.isRegressionDetected()) {
            List<AlertDeliveryResult> deliveries = alertingEngine.processVisualRegression(result);
            events.publish(new VisualRegressionDetectedEvent(clock.instant(), result, deliveries));
        }
        return result;
    }

    private void raiseRegression(Alert alert) {
        LOG.warn("Regression detected for {} ({}): alert {}", alert.getTestName(), alert.getSeverity().label(),
                alert.getId());
        List<AlertDeliveryResult> deliveries = alertingEngine.processAlert(alert);
        events.publish(new RegressionDetectedEvent(clock.instant(), alert, deliveries));
    }

    /**
     * High-severity anomalies on an ingested sample become a {@code major}
     * alert. Scheduled-analysis events carry no test name and are only
     * forwarded.
     */
    private void onAnomaliesDetected(AnomalyDetectedEvent event) {
        if (!config.isAlertOnAnomalies() || event.getTestName() == null) {
            return;
        }
        List<AnomalyDetection> high = event.getAnomalies().stream()
                .filter(a -> a.getSeverity() == AnomalySeverity.HIGH)
                .toList();
        if (high.isEmpty()) {
            return;
        }
        String testType = event.getSample() != null ? event.getSample().getTestType() : null;
        Alert alert = Alert.builder()
                .id("anomaly-" + event.getTestName() + "-" + clock.millis())
                .timestamp(clock.instant())
                .severity(AlertSeverity.MAJOR)
                .testType(testType)
                .testName(event.getTestName())
                .alertChannels(alertingEngine.getChannels().stream().map(AlertChannel::getName).toList())
                .build();
        LOG.warn("{} high-severity anomal(ies) for {}, raising alert {}", high.size(), event.getTestName(),
                alert.getId());
        alertingEngine.processAlert(alert);
    }

    private static Map<String, Object> analysisMetadata(TestOptions options) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (options.getVersion() != null) {
            metadata.put("version", options.getVersion());
        }
        if (!options.getTags().isEmpty()) {
            metadata.put("tags", options.getTags());
        }
        return metadata.isEmpty() ? null : metadata;
    }

    // ---------------------------------------------------------------
    // Analysis and reporting
    // ---------------------------------------------------------------

    /**
     * Summarize the stored results in the range, analyse trends and save the
     * report under {@code reports/<id>.json}.
     *
     * @param range results to include; {@code null} means the report
     *              look-back (7 days by default) ending now
     */
    public PerformanceReport runRegressionAnalysis(TimeRange range) {
        LOG.info("Running regression analysis");
        Instant now = clock.instant();
        TimeRange effective = range != null ? range : TimeRange.lookback(now, config.reportLookback());

        List<PerformanceTestResult> relevant = history.inRange(effective);
        TrendAnalysisResult trends = statisticalEngine.analyzeTrends(effective);

        PerformanceReport report = new PerformanceReport();
        report.setId("perf-report-" + now.toEpochMilli());
        report.setTimestamp(now);
        report.setTimeRange(effective);
        report.setSummary(PerformanceReport.Summary.of(relevant));
        report.setTrendAnalysis(trends);
        report.setRecommendations(RecommendationGenerator.forAnalysis(relevant, trends));
        report.setActionItems(RecommendationGenerator.actionItems(relevant, trends));

        try {
            exporter.writeReport(report, reportsDirectory());
        } catch (IllegalStateException e) {
            LOG.warn("Failed to save report {}: {}", report.getId(), e.getMessage(), e);
        }

        LOG.info("Regression analysis completed: {}", report.getSummary());
        events.publish(new AnalysisCompletedEvent(now, report));
        return report;
    }

    /**
     * @param testName a test, or {@code null} for all
     * @param timespan look-back; {@code null} for the trend window
     */
    public PerformanceTrends getPerformanceTrends(String testName, Duration timespan) {
        return statisticalEngine.getPerformanceTrends(testName, timespan);
    }

    /**
     * @return regressions the baseline comparison still considers open
     */
    public List<Alert> getActiveRegressions() {
        return regressionChecker.getActiveAlerts();
    }

    public List<PerformanceTestResult> getTestResults(String testName) {
        return history.forTest(testName);
    }

    /**
     * Export stored results, trend data and optionally baselines and active
     * regressions.
     *
     * @return the exported document
     * @throws IllegalStateException if the file cannot be written
     */
    public PerformanceExport exportPerformanceData(Path outputPath, ExportOptions options) {
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        ExportOptions opts = options != null ? options : ExportOptions.defaults();
        LOG.info("Exporting performance data to {}", outputPath);

        TimeRange range = opts.getTimeRange();
        List<PerformanceTestResult> results = range != null ? history.inRange(range) : history.all();
        PerformanceExport data = new PerformanceExport(
                new PerformanceExport.Metadata(clock.instant(), exportedConfig(), range),
                results,
                opts.isIncludeBaselines() ? baselineRecorder.exportBaselines(range) : null,
                opts.isIncludeAlerts() ? regressionChecker.getActiveAlerts() : null,
                statisticalEngine.exportTrendData(range));

        exporter.export(data, outputPath, opts.getFormat());
        return data;
    }

    private Map<String, Object> exportedConfig() {
        Map<String, Object> exported = new LinkedHashMap<>();
        exported.put("framework", config);
        exported.put("statistics", statisticalEngine.getConfig());
        return exported;
    }

    // ---------------------------------------------------------------
    // Automated tests and maintenance
    // ---------------------------------------------------------------

    /**
     * Register a workload for the automated test job. Registering a name
     * again replaces the previous workload.
     */
    public synchronized void registerAutomatedTest(String testName, String testType, PerformanceTestFunction test,
            TestOptions options) {
        Objects.requireNonNull(testName, "testName must not be null");
        Objects.requireNonNull(test, "test must not be null");
        automatedTests.put(testName, new AutomatedTest(testName, testType, test,
                options != null ? options : TestOptions.defaults()));
        LOG.info("Registered automated test {} ({})", testName, testType);
    }

    public synchronized List<String> getAutomatedTests() {
        return List.copyOf(automatedTests.keySet());
    }

    /**
     * Run every registered automated test. A failing workload is logged and
     * does not stop the others.
     *
     * @return results of the runs that completed
     */
    public List<PerformanceTestResult> runAutomatedTests() {
        List<AutomatedTest> tests;
        synchronized (this) {
            tests = List.copyOf(automatedTests.values());
        }
        LOG.info("Running {} automated performance test(s)", tests.size());

        List<PerformanceTestResult> results = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (AutomatedTest t : tests) {
            try {
                results.add(runPerformanceTest(t.name, t.type, t.function, t.options));
            } catch (Exception e) {
                failed.add(t.name);
                LOG.error("Automated test {} failed: {}", t.name, e.getMessage());
            }
        }
        events.publish(new AutomatedTestsCompletedEvent(clock.instant(), tests.size(), failed));
        return results;
    }

    /**
     * Prune results older than the retention, clean up old screenshots and
     * prune the alert history.
     */
    public void performMaintenance() {
        LOG.info("Performing maintenance");
        Instant cutoff = clock.instant().minus(config.retention());
        int removed = history.pruneOlderThan(cutoff);

        if (config.isVisualRegressionEnabled() && visualRunner != null) {
            try {
                visualRunner.cleanupOldScreenshots(config.getRetentionDays());
            } catch (RuntimeException e) {
                LOG.warn("Screenshot cleanup failed: {}", e.getMessage(), e);
            }
        }
        int prunedAlerts = alertingEngine.cleanupOldAlerts();
        LOG.info("Maintenance completed: {} result(s) and {} alert(s) pruned", removed, prunedAlerts);
    }

    private void startBackgroundJobs() {
        scheduler.scheduleAtFixedRate(MAINTENANCE_JOB, config.maintenanceInterval(), this::performMaintenance);
        if (config.isAutomatedTestingEnabled()) {
            scheduler.scheduleAtFixedRate(AUTOMATED_TESTS_JOB, config.automatedTestInterval(),
                    this::runAutomatedTests);
        }
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    /**
     * @return a snapshot for the health endpoint
     */
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", initialized ? "UP" : "DOWN");
        status.put("environment", config.getEnvironment());
        status.put("trackedTests", statisticalEngine.getTrackedTests().size());
        status.put("storedResults", history.size());
        status.put("activeAlerts", alertingEngine.getActiveAlerts().size());
        return status;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Path reportsDirectory() {
        return config.dataPath().resolve("reports");
    }

    private void createDataDirectories() {
        for (String dir : DATA_DIRECTORIES) {
            Path path = config.dataPath().resolve(dir);
            try {
                Files.createDirectories(path);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to create data directory: " + path, e);
            }
        }
    }

    private static final class AutomatedTest {
        private final String name;
        private final String type;
        private final PerformanceTestFunction function;
        private final TestOptions options;

        private AutomatedTest(String name, String type, PerformanceTestFunction function, TestOptions options) {
            this.name = name;
            this.type = type;
            this.function = function;
            this.options = options;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Builder for {@link PerformanceRegressionFramework}. The visual runner,
     * result store and exporter are optional; results default to
     * {@code <dataDirectory>/test-results.json}.
     */
    public static class Builder {
        private FrameworkConfig config;
        private StatisticalAnalysisEngine statisticalEngine;
        private AlertingEngine alertingEngine;
        private BaselineRecorder baselineRecorder;
        private RegressionChecker regressionChecker;
        private VisualRegressionRunner visualRunner;
        private TaskScheduler scheduler;
        private Clock clock = Clock.systemUTC();
        private SnapshotStore<Map<String, List<PerformanceTestResult>>> resultStore;
        private PerformanceDataExporter exporter;

        public Builder config(FrameworkConfig v) {
            this.config = v;
            return this;
        }

        public Builder statisticalEngine(StatisticalAnalysisEngine v) {
            this.statisticalEngine = v;
            return this;
        }

        public Builder alertingEngine(AlertingEngine v) {
            this.alertingEngine = v;
            return this;
        }

        public Builder baselineRecorder(BaselineRecorder v) {
            this.baselineRecorder = v;
            return this;
        }

        public Builder regressionChecker(RegressionChecker v) {
            this.regressionChecker = v;
            return this;
        }

        public Builder visualRunner(VisualRegressionRunner v) {
            this.visualRunner = v;
            return this;
        }

        public Builder scheduler(TaskScheduler v) {
            this.scheduler = v;
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        public Builder resultStore(SnapshotStore<Map<String, List<PerformanceTestResult>>> v) {
            this.resultStore = v;
            return this;
        }

        public Builder exporter(PerformanceDataExporter v) {
            this.exporter = v;
            return this;
        }

        /**
         * @throws NullPointerException if a required collaborator is missing
         */
        public PerformanceRegressionFramework build() {
            return new PerformanceRegressionFramework(this);
        }
    }
}
