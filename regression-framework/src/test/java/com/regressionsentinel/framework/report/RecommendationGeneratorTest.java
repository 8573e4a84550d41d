package com.regressionsentinel.framework.report;

import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.AlertSeverity;
import com.regressionsentinel.core.model.BaselineComparison;
import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.statistics.TrendAnalysisResult;
import com.regressionsentinel.core.statistics.TrendDirection;
import com.regressionsentinel.framework.model.ActionItem;
import com.regressionsentinel.framework.model.PerformanceTestResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.regressionsentinel.framework.report.RecommendationGenerator.DEGRADING_TREND;
import static com.regressionsentinel.framework.report.RecommendationGenerator.FREQUENT_HIGH_RESOURCES;
import static com.regressionsentinel.framework.report.RecommendationGenerator.HIGH_CPU;
import static com.regressionsentinel.framework.report.RecommendationGenerator.HIGH_ERROR_RATE;
import static com.regressionsentinel.framework.report.RecommendationGenerator.HIGH_MEMORY;
import static com.regressionsentinel.framework.report.RecommendationGenerator.HIGH_REGRESSION_RATE;
import static com.regressionsentinel.framework.report.RecommendationGenerator.RECENT_ANOMALIES;
import static com.regressionsentinel.framework.report.RecommendationGenerator.SLOW_RESPONSE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RecommendationGenerator}.
 */
class RecommendationGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");
    private static final TrendAnalysisResult STABLE = trends(TrendDirection.STABLE);
    private static final TrendAnalysisResult DEGRADING = trends(TrendDirection.DEGRADING);

    @Test
    @DisplayName("Healthy run without alert or anomalies yields nothing")
    void shouldStayQuietForHealthyRun() {
        assertThat(RecommendationGenerator.forTestRun(metrics(200, 400, 0.2, 30, 40), null, false)).isEmpty();
    }

    @Test
    @DisplayName("Thresholds are exclusive")
    void shouldNotFireAtThresholds() {
        assertThat(RecommendationGenerator.forTestRun(metrics(1000, 2000, 1.0, 80, 80), null, false)).isEmpty();
    }

    @Test
    @DisplayName("Each exceeded threshold adds its advice, then alert advice, then the anomaly hint")
    void shouldListAdviceInOrder() {
        BaselineComparison comparison = new BaselineComparison();
        comparison.setRecommendations(List.of("Review the new ORM mapping"));
        Alert alert = Alert.builder()
                .id("a-1")
                .timestamp(NOW)
                .severity(AlertSeverity.MAJOR)
                .testName("checkout")
                .comparison(comparison)
                .build();

        List<String> advice = RecommendationGenerator.forTestRun(metrics(1200, 2400, 3.0, 85, 90), alert, true);

        assertThat(advice).containsExactly(SLOW_RESPONSE, HIGH_ERROR_RATE, HIGH_CPU, HIGH_MEMORY,
                "Review the new ORM mapping", RECENT_ANOMALIES);
    }

    @Test
    @DisplayName("No results and a degrading trend yields only the trend advice")
    void shouldAdviseOnTrendWithoutResults() {
        assertThat(RecommendationGenerator.forAnalysis(List.of(), DEGRADING)).containsExactly(DEGRADING_TREND);
        assertThat(RecommendationGenerator.forAnalysis(List.of(), STABLE)).isEmpty();
    }

    @Test
    @DisplayName("Regression rate above 20% and frequent high resource use are reported")
    void shouldAdviseOnRegressionRateAndResources() {
        List<PerformanceTestResult> results = new ArrayList<>();
        results.add(result(metrics(200, 400, 0.1, 90, 40), true));
        results.add(result(metrics(200, 400, 0.1, 30, 95), false));
        results.add(result(metrics(200, 400, 0.1, 30, 40), false));

        assertThat(RecommendationGenerator.forAnalysis(results, STABLE))
                .containsExactly(HIGH_REGRESSION_RATE, FREQUENT_HIGH_RESOURCES);
    }

    @Test
    @DisplayName("A regression rate of exactly 20% is not reported")
    void shouldNotReportRegressionRateAtThreshold() {
        List<PerformanceTestResult> results = new ArrayList<>();
        results.add(result(metrics(200, 400, 0.1, 30, 40), true));
        for (int i = 0; i < 4; i++) {
            results.add(result(metrics(200, 400, 0.1, 30, 40), false));
        }

        assertThat(RecommendationGenerator.forAnalysis(results, STABLE)).isEmpty();
    }

    @Test
    @DisplayName("Critical runs and a degrading trend put urgent items first")
    void shouldOrderActionItemsByPriority() {
        List<PerformanceTestResult> results = List.of(result(metrics(800, 5200, 0.3, 30, 40), false));

        List<ActionItem> items = RecommendationGenerator.actionItems(results, DEGRADING);

        assertThat(items).extracting(ActionItem::getPriority).containsExactly(
                ActionItem.Priority.CRITICAL, ActionItem.Priority.HIGH,
                ActionItem.Priority.MEDIUM, ActionItem.Priority.LOW);
        assertThat(items.get(0).getEffort()).isEqualTo(ActionItem.Effort.HIGH);
    }

    @Test
    @DisplayName("Baseline review and monitoring items are always present")
    void shouldAlwaysIncludeRoutineItems() {
        List<ActionItem> items = RecommendationGenerator.actionItems(List.of(), STABLE);

        assertThat(items).extracting(ActionItem::getAction).containsExactly(
                "Review and update performance baselines quarterly",
                "Enhance performance monitoring coverage");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static PerformanceMetrics metrics(double mean, double p99, double errorRate, double cpu, double memory) {
        return PerformanceMetrics.of(mean, p99, 500, errorRate, cpu, memory);
    }

    private static PerformanceTestResult result(PerformanceMetrics metrics, boolean regression) {
        List<Alert> alerts = regression
                ? List.of(Alert.builder().id("a").timestamp(NOW).severity(AlertSeverity.MINOR).testName("t").build())
                : List.of();
        return new PerformanceTestResult("t", "load", NOW, 100, metrics, null, alerts, List.of());
    }

    private static TrendAnalysisResult trends(TrendDirection direction) {
        return new TrendAnalysisResult(direction, List.of(), List.of(), List.of());
    }
}
