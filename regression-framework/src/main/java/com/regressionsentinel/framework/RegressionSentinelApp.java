package com.regressionsentinel.framework;

import com.fasterxml.jackson.core.type.TypeReference;
import com.regressionsentinel.core.alerting.AlertingEngine;
import com.regressionsentinel.core.alerting.channel.ChannelFactory;
import com.regressionsentinel.core.config.SentinelConfig;
import com.regressionsentinel.core.config.SentinelConfigLoader;
import com.regressionsentinel.core.metrics.SentinelMetrics;
import com.regressionsentinel.core.model.EnhancedAlert;
import com.regressionsentinel.core.schedule.ExecutorTaskScheduler;
import com.regressionsentinel.core.schedule.TaskScheduler;
import com.regressionsentinel.core.statistics.StatisticalAnalysisEngine;
import com.regressionsentinel.core.statistics.StatisticsSnapshot;
import com.regressionsentinel.core.store.JsonFileSnapshotStore;
import com.regressionsentinel.framework.collaborator.InMemoryBaselineRecorder;
import com.regressionsentinel.framework.collaborator.RegressionChecker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Main entry point of the Regression Sentinel process.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   FrameworkConfig (environment) + sentinel.yml
 *     → StatisticalAnalysisEngine  (statistics/historical-data.json)
 *     → AlertingEngine             (alerts/alert-history.json, channels from YAML)
 *     → PerformanceRegressionFramework (test-results.json, reports/)
 *     → HealthServer (/health, /readiness)
 * </pre>
 *
 * <p>
 * Without an attached baseline service the process records baselines in
 * memory and never reports regressions itself; anomaly alerts, trend
 * analysis and maintenance still run. Embedders attach their own
 * collaborators through {@link PerformanceRegressionFramework#builder()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegressionSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(RegressionSentinelApp.class);

    private RegressionSentinelApp() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        FrameworkConfig config = FrameworkConfig.fromEnvironment();
        SentinelConfig sentinelConfig = SentinelConfigLoader.load();
        LOG.info("Starting Regression Sentinel with config: {}", config);
        LOG.info("Analysis and alerting config: {}", sentinelConfig);

        // 2. Build and start the framework
        TaskScheduler scheduler = new ExecutorTaskScheduler("sentinel-scheduler");
        PerformanceRegressionFramework framework = create(config, sentinelConfig, scheduler, Clock.systemUTC());
        framework.initialize();

        // 3. Start health server (for K8s probes) with shutdown hook
        HealthServer healthServer = new HealthServer(framework::status);
        healthServer.start(config.getHealthPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            healthServer.stop();
            framework.shutdown();
            scheduler.close();
        }, "sentinel-shutdown"));

        LOG.info("Regression Sentinel running in environment '{}'", config.getEnvironment());
    }

    // ---------------------------------------------------------------
    // Assembly (extracted for readability and testability)
    // ---------------------------------------------------------------

    /**
     * Wire both engines and the framework on file-backed stores under the
     * configured data directory.
     */
    static PerformanceRegressionFramework create(FrameworkConfig config, SentinelConfig sentinelConfig,
            TaskScheduler scheduler, Clock clock) {
        Path data = config.dataPath();
        SentinelMetrics metrics = new SentinelMetrics(new SimpleMeterRegistry());

        StatisticalAnalysisEngine statisticalEngine = new StatisticalAnalysisEngine(
                sentinelConfig.getStatistics(),
                new JsonFileSnapshotStore<>(data.resolve("statistics").resolve("historical-data.json"),
                        new TypeReference<StatisticsSnapshot>() {
                        }),
                scheduler, clock, metrics);

        AlertingEngine alertingEngine = new AlertingEngine(
                sentinelConfig.getAlerting(),
                new JsonFileSnapshotStore<>(data.resolve("alerts").resolve("alert-history.json"),
                        new TypeReference<Map<String, List<EnhancedAlert>>>() {
                        }),
                ChannelFactory.defaults(clock, sentinelConfig.getAlerting().getEnvironment()),
                scheduler, clock, metrics);

        return PerformanceRegressionFramework.builder()
                .config(config)
                .statisticalEngine(statisticalEngine)
                .alertingEngine(alertingEngine)
                .baselineRecorder(new InMemoryBaselineRecorder(clock))
                .regressionChecker(RegressionChecker.disabled())
                .scheduler(scheduler)
                .clock(clock)
                .build();
    }
}
