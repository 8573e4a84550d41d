package com.regressionsentinel.core.statistics;

import com.regressionsentinel.core.config.StatisticalConfig;
import com.regressionsentinel.core.event.AnomalyDetectedEvent;
import com.regressionsentinel.core.event.EventBus;
import com.regressionsentinel.core.event.TrendChangeEvent;
import com.regressionsentinel.core.metrics.SentinelMetrics;
import com.regressionsentinel.core.model.MetricSample;
import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.model.TimeRange;
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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keeps a rolling window of metric samples per test and analyses them.
 *
 * <h3>Ingest</h3>
 * <p>
 * {@link #analyzeMetrics} appends a sample, drops samples older than the
 * trend window and, once the test has enough samples, checks the newest
 * sample for anomalies against its recent history. Every call writes the
 * snapshot through to the store.
 * </p>
 *
 * <h3>Analysis</h3>
 * <p>
 * {@link #analyzeTrends} fits regression trends, predictions, anomalies and
 * (optionally) daily seasonality for every test with enough samples in the
 * range, and votes an overall direction. {@link #getPerformanceTrends} is an
 * independent, coarser projection for dashboards.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * All public methods are {@code synchronized}; the engine's maps are never
 * exposed.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalAnalysisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalAnalysisEngine.class);

    static final String OVERALL_KEY = "overall";
    static final String ANALYSIS_JOB = "job:statistical-analysis";
    static final Duration PREDICTION_HORIZON = Duration.ofHours(24);

    private static final List<MetricKind> SEASONAL_METRICS = List.of(MetricKind.RESPONSE_TIME, MetricKind.THROUGHPUT);

    private final StatisticalConfig config;
    private final SnapshotStore<StatisticsSnapshot> store;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final SentinelMetrics metrics;
    private final EventBus events = new EventBus();
    private final ZScoreAnomalyDetector detector;
    private final Predictor predictor;

    private Map<String, List<MetricSample>> dataPoints = new LinkedHashMap<>();
    private Map<String, List<TrendAnalysis>> trends = new LinkedHashMap<>();
    private Map<String, List<AnomalyDetection>> anomalies = new LinkedHashMap<>();
    private Map<String, List<PerformancePrediction>> predictions = new LinkedHashMap<>();
    private Map<String, List<SeasonalPattern>> seasonalPatterns = new LinkedHashMap<>();

    private boolean initialized;

    public StatisticalAnalysisEngine(StatisticalConfig config, SnapshotStore<StatisticsSnapshot> store,
            TaskScheduler scheduler, Clock clock, SentinelMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        config.validate();
        this.detector = new ZScoreAnomalyDetector(config.sensitivity());
        this.predictor = new Predictor(config.getConfidenceLevel());
    }

    /**
     * @return the bus this engine publishes {@link AnomalyDetectedEvent} and
     *         {@link TrendChangeEvent} on
     */
    public EventBus events() {
        return events;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Load the stored snapshot and start the periodic analysis. Calling it
     * again has no effect.
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        loadSnapshot();
        scheduler.scheduleAtFixedRate(ANALYSIS_JOB, Duration.ofMinutes(config.getAnalysisIntervalMinutes()),
                this::performScheduledAnalysis);
        initialized = true;
        LOG.info("Statistical analysis engine initialized: {} test(s) tracked, sensitivity={}",
                dataPoints.size(), config.sensitivity());
    }

    /**
     * Stop the periodic analysis and write a final snapshot.
     */
    public synchronized void shutdown() {
        scheduler.cancel(ANALYSIS_JOB);
        persist();
        initialized = false;
        LOG.info("Statistical analysis engine shut down");
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    public List<AnomalyDetection> analyzeMetrics(String testName, PerformanceMetrics metrics, Instant timestamp,
            String testType) {
        return analyzeMetrics(testName, metrics, timestamp, testType, null);
    }

    /**
     * Record a sample and check it for anomalies.
     *
     * @param testName  test the sample belongs to
     * @param metrics   measured metrics
     * @param timestamp when the sample was taken
     * @param testType  test type; may be {@code null}
     * @param metadata  free-form metadata; may be {@code null}
     * @return anomalies found on this sample; empty while the test has fewer
     *         than {@code minDataPoints} samples
     */
    public synchronized List<AnomalyDetection> analyzeMetrics(String testName, PerformanceMetrics metrics,
            Instant timestamp, String testType, Map<String, Object> metadata) {
        MetricSample sample = new MetricSample(timestamp, testName, testType, metrics, metadata);

        List<MetricSample> series = dataPoints.computeIfAbsent(testName, k -> new ArrayList<>());
        series.add(sample);
        Instant cutoff = clock.instant().minus(config.trendWindow());
        series.removeIf(s -> s.getTimestamp().isBefore(cutoff));
        List<AnomalyDetection> stored = anomalies.get(testName);
        if (stored != null) {
            stored.removeIf(a -> a.getTimestamp().isBefore(cutoff));
        }
        this.metrics.incrementSamplesIngested();

        List<AnomalyDetection> found = List.of();
        if (series.size() >= config.getMinDataPoints()) {
            found = realTimeAnalysis(testName, series, sample);
        }
        persist();
        return found;
    }

    private List<AnomalyDetection> realTimeAnalysis(String testName, List<MetricSample> series,
            MetricSample newest) {
        int from = Math.max(0, series.size() - config.getRealTimeWindow());
        List<AnomalyDetection> found = detector.detect(testName, series.subList(from, series.size())).stream()
                .filter(a -> a.getTimestamp().equals(newest.getTimestamp()))
                .toList();
        if (found.isEmpty()) {
            LOG.debug("Test [{}]: no anomaly on sample at {}", testName, newest.getTimestamp());
            return found;
        }

        List<AnomalyDetection> stored = anomalies.computeIfAbsent(testName, k -> new ArrayList<>());
        for (AnomalyDetection anomaly : found) {
            if (!stored.contains(anomaly)) {
                stored.add(anomaly);
            }
        }
        metrics.incrementAnomaliesDetected(found.size());
        LOG.info("Test [{}]: {} anomal(ies) on sample at {}", testName, found.size(), newest.getTimestamp());
        events.publish(new AnomalyDetectedEvent(clock.instant(), testName, found, newest));
        return found;
    }

    // ---------------------------------------------------------------
    // Analysis
    // ---------------------------------------------------------------

    /**
     * Full trend analysis over the given range.
     *
     * @param range samples to consider; {@code null} means the trend window
     *              ending now
     * @return overall direction with the trends, predictions and anomalies
     *         behind it
     */
    public synchronized TrendAnalysisResult analyzeTrends(TimeRange range) {
        Instant now = clock.instant();
        TimeRange effective = range != null ? range : TimeRange.lookback(now, config.trendWindow());

        List<TrendAnalysis> allTrends = new ArrayList<>();
        List<PerformancePrediction> allPredictions = new ArrayList<>();
        List<AnomalyDetection> allAnomalies = new ArrayList<>();

        for (Map.Entry<String, List<MetricSample>> entry : dataPoints.entrySet()) {
            String testName = entry.getKey();
            List<MetricSample> relevant = entry.getValue().stream()
                    .filter(s -> effective.contains(s.getTimestamp()))
                    .toList();
            if (relevant.size() < config.getMinDataPoints()) {
                continue;
            }

            for (MetricKind metric : MetricKind.TRENDED) {
                allTrends.add(TrendCalculator.regressionTrend(testName, metric, relevant));
            }
            if (config.isPredictionEnabled()) {
                for (MetricKind metric : MetricKind.TRENDED) {
                    allPredictions.add(predictor.predict(testName, metric, relevant, now.plus(PREDICTION_HORIZON)));
                }
            }
            allAnomalies.addAll(detector.detect(testName, relevant));

            if (config.isSeasonalityDetection()) {
                List<SeasonalPattern> patterns = new ArrayList<>();
                for (MetricKind metric : SEASONAL_METRICS) {
                    SeasonalityDetector.detectDaily(testName, metric, relevant, now).ifPresent(patterns::add);
                }
                if (patterns.isEmpty()) {
                    seasonalPatterns.remove(testName);
                } else {
                    seasonalPatterns.put(testName, patterns);
                }
            }
        }

        TrendDirection overall = TrendCalculator.overallDirection(allTrends);
        trends.put(OVERALL_KEY, new ArrayList<>(allTrends));
        predictions.put(OVERALL_KEY, new ArrayList<>(allPredictions));
        anomalies.put(OVERALL_KEY, new ArrayList<>(allAnomalies));
        persist();

        LOG.info("Trend analysis over {}: overall={}, trends={}, predictions={}, anomalies={}",
                effective, overall.label(), allTrends.size(), allPredictions.size(), allAnomalies.size());
        return new TrendAnalysisResult(overall, allTrends, allPredictions, allAnomalies);
    }

    /**
     * Dashboard projection over the most recent {@code timespan}.
     *
     * @param testName test to project, or {@code null} for every test
     * @param timespan look-back; {@code null} means the trend window
     * @return points, two-half trends and summary statistics
     */
    public synchronized PerformanceTrends getPerformanceTrends(String testName, Duration timespan) {
        Duration window = timespan != null ? timespan : config.trendWindow();
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);

        List<MetricSample> relevant = new ArrayList<>();
        if (testName != null) {
            for (MetricSample s : dataPoints.getOrDefault(testName, List.of())) {
                if (!s.getTimestamp().isBefore(cutoff)) {
                    relevant.add(s);
                }
            }
        } else {
            for (List<MetricSample> series : dataPoints.values()) {
                for (MetricSample s : series) {
                    if (!s.getTimestamp().isBefore(cutoff)) {
                        relevant.add(s);
                    }
                }
            }
        }

        List<PerformanceTrends.Point> points = relevant.stream()
                .map(s -> new PerformanceTrends.Point(s.getTimestamp(),
                        MetricKind.RESPONSE_TIME.valueOf(s), MetricKind.THROUGHPUT.valueOf(s),
                        MetricKind.ERROR_RATE.valueOf(s), MetricKind.CPU_USAGE.valueOf(s),
                        MetricKind.MEMORY_USAGE.valueOf(s)))
                .toList();

        double[] responseTimes = MetricKind.RESPONSE_TIME.valuesOf(relevant);
        double[] throughputs = MetricKind.THROUGHPUT.valuesOf(relevant);
        double[] errorRates = MetricKind.ERROR_RATE.valuesOf(relevant);
        double[] resourceUsage = points.stream().mapToDouble(PerformanceTrends.Point::resourceUsage).toArray();

        PerformanceTrends.Directions directions = new PerformanceTrends.Directions(
                TrendCalculator.twoHalfTrend(responseTimes, MetricKind.RESPONSE_TIME.polarity()),
                TrendCalculator.twoHalfTrend(throughputs, MetricKind.THROUGHPUT.polarity()),
                TrendCalculator.twoHalfTrend(errorRates, MetricKind.ERROR_RATE.polarity()),
                TrendCalculator.twoHalfTrend(resourceUsage, MetricKind.Polarity.LOWER_IS_BETTER));

        TimeRange range = new TimeRange(cutoff, now);
        PerformanceTrends.Statistics statistics = new PerformanceTrends.Statistics(
                SummaryStatistics.summarize(MetricKind.RESPONSE_TIME, responseTimes, range),
                SummaryStatistics.summarize(MetricKind.THROUGHPUT, throughputs, range),
                SummaryStatistics.summarize(MetricKind.ERROR_RATE, errorRates, range));

        return new PerformanceTrends(testName != null ? testName : "all", window.toMillis(), points, directions,
                statistics);
    }

    /**
     * @param hours look-back in hours
     * @return stored anomalies newer than the look-back, each reported once,
     *         oldest first
     */
    public synchronized List<AnomalyDetection> getRecentAnomalies(int hours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        Set<String> seen = new HashSet<>();
        List<AnomalyDetection> result = new ArrayList<>();
        for (List<AnomalyDetection> list : anomalies.values()) {
            for (AnomalyDetection anomaly : list) {
                if (anomaly.getTimestamp().isBefore(cutoff)) {
                    continue;
                }
                String key = anomaly.getTestName() + '|' + anomaly.getMetric().key() + '|' + anomaly.getTimestamp();
                if (seen.add(key)) {
                    result.add(anomaly);
                }
            }
        }
        result.sort(Comparator.comparing(AnomalyDetection::getTimestamp));
        return result;
    }

    /**
     * @param testName a test name, or {@code null} for every test
     */
    public synchronized List<SeasonalPattern> getSeasonalPatterns(String testName) {
        if (testName != null) {
            return List.copyOf(seasonalPatterns.getOrDefault(testName, List.of()));
        }
        List<SeasonalPattern> all = new ArrayList<>();
        seasonalPatterns.values().forEach(all::addAll);
        return all;
    }

    /**
     * Stored results for export. Anomalies and predictions are filtered by
     * the range; trends and seasonal patterns are returned in full.
     *
     * @param range filter range; {@code null} means the trend window ending
     *              now
     */
    public synchronized TrendExport exportTrendData(TimeRange range) {
        TimeRange effective = range != null ? range : TimeRange.lookback(clock.instant(), config.trendWindow());
        List<TrendAnalysis> allTrends = new ArrayList<>();
        trends.values().forEach(allTrends::addAll);

        List<AnomalyDetection> filteredAnomalies = new ArrayList<>();
        anomalies.values().forEach(list -> list.stream()
                .filter(a -> effective.contains(a.getTimestamp()))
                .forEach(filteredAnomalies::add));

        List<PerformancePrediction> filteredPredictions = new ArrayList<>();
        predictions.values().forEach(list -> list.stream()
                .filter(p -> effective.contains(p.getTimestamp()))
                .forEach(filteredPredictions::add));

        List<SeasonalPattern> allPatterns = new ArrayList<>();
        seasonalPatterns.values().forEach(allPatterns::addAll);
        return new TrendExport(allTrends, filteredAnomalies, filteredPredictions, allPatterns);
    }

    /**
     * Periodic job: analyse the trend window and publish significant
     * findings. Failures are logged, never thrown.
     */
    public void performScheduledAnalysis() {
        LOG.info("Performing scheduled statistical analysis");
        try {
            TrendAnalysisResult analysis = analyzeTrends(null);
            List<AnomalyDetection> high = analysis.highSeverityAnomalies();
            if (!high.isEmpty()) {
                events.publish(new AnomalyDetectedEvent(clock.instant(), null, high, null));
            }
            if (analysis.getPerformance() == TrendDirection.DEGRADING) {
                events.publish(new TrendChangeEvent(clock.instant(), TrendDirection.DEGRADING, analysis));
            }
            LOG.info("Scheduled analysis completed: {} anomal(ies), {} high severity",
                    analysis.getAnomalies().size(), high.size());
        } catch (RuntimeException e) {
            LOG.error("Scheduled analysis failed: {}", e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public synchronized List<String> getTrackedTests() {
        return List.copyOf(dataPoints.keySet());
    }

    /**
     * @return a copy of the test's samples in ingest order
     */
    public synchronized List<MetricSample> getSamples(String testName) {
        return List.copyOf(dataPoints.getOrDefault(testName, List.of()));
    }

    public synchronized int getSampleCount() {
        return dataPoints.values().stream().mapToInt(List::size).sum();
    }

    public StatisticalConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    private void loadSnapshot() {
        try {
            store.load().ifPresent(snapshot -> {
                dataPoints = StatisticsSnapshot.copy(snapshot.getDataPoints());
                trends = StatisticsSnapshot.copy(snapshot.getTrends());
                anomalies = StatisticsSnapshot.copy(snapshot.getAnomalies());
                predictions = StatisticsSnapshot.copy(snapshot.getPredictions());
                seasonalPatterns = StatisticsSnapshot.copy(snapshot.getSeasonalPatterns());
                LOG.info("Loaded historical statistics from {}", store.describe());
            });
        } catch (SnapshotStoreException e) {
            LOG.warn("Failed to load historical statistics from {}, starting empty: {}", store.describe(),
                    e.getMessage(), e);
        }
    }

    private void persist() {
        StatisticsSnapshot snapshot = new StatisticsSnapshot();
        snapshot.setDataPoints(dataPoints);
        snapshot.setTrends(trends);
        snapshot.setAnomalies(anomalies);
        snapshot.setPredictions(predictions);
        snapshot.setSeasonalPatterns(seasonalPatterns);
        try {
            store.save(snapshot);
        } catch (SnapshotStoreException e) {
            LOG.warn("Failed to persist statistics to {}, keeping in-memory state: {}", store.describe(),
                    e.getMessage(), e);
        }
    }
}
