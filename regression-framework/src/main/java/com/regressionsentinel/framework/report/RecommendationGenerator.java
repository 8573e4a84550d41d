package com.regressionsentinel.framework.report;

import com.regressionsentinel.core.model.Alert;
import com.regressionsentinel.core.model.PerformanceMetrics;
import com.regressionsentinel.core.statistics.TrendAnalysisResult;
import com.regressionsentinel.core.statistics.TrendDirection;
import com.regressionsentinel.framework.model.ActionItem;
import com.regressionsentinel.framework.model.ActionItem.Effort;
import com.regressionsentinel.framework.model.ActionItem.Priority;
import com.regressionsentinel.framework.model.PerformanceTestResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold rules that turn metrics and analysis results into advice.
 *
 * <h3>Per run</h3>
 * <ul>
 * <li>mean response time above 1000 ms</li>
 * <li>error rate above 1%</li>
 * <li>average CPU or memory usage above 80%</li>
 * </ul>
 * followed by the regression alert's own recommendations and a hint when
 * anomalies were detected recently.
 *
 * <h3>Per report</h3>
 * <p>
 * A degrading trend, a regression rate above 20% and frequent high resource
 * usage produce recommendations. Action items always include the baseline
 * review and the monitoring follow-up; critical runs (p99 above 5000 ms or
 * error rate above 5%) and a degrading trend add higher-priority items.
 * </p>
 */
public final class RecommendationGenerator {

    static final double SLOW_RESPONSE_MS = 1000;
    static final double ERROR_RATE_PERCENT = 1;
    static final double RESOURCE_PERCENT = 80;
    static final double REGRESSION_RATE_PERCENT = 20;
    static final double HIGH_RESOURCE_SHARE = 0.3;
    static final double CRITICAL_P99_MS = 5000;
    static final double CRITICAL_ERROR_RATE_PERCENT = 5;

    public static final String SLOW_RESPONSE =
            "Response time exceeds 1 second - consider optimizing critical paths";
    public static final String HIGH_ERROR_RATE =
            "Error rate above 1% - investigate error patterns and root causes";
    public static final String HIGH_CPU =
            "High CPU usage detected - profile and optimize CPU-intensive operations";
    public static final String HIGH_MEMORY =
            "High memory usage - check for memory leaks and optimize memory allocation";
    public static final String RECENT_ANOMALIES =
            "Statistical anomalies detected - review recent changes and system behavior";

    public static final String DEGRADING_TREND =
            "Overall performance trend is degrading - conduct comprehensive performance review";
    public static final String HIGH_REGRESSION_RATE =
            "High regression rate detected - strengthen performance gates in CI/CD pipeline";
    public static final String FREQUENT_HIGH_RESOURCES =
            "Frequent high resource usage - consider infrastructure scaling or optimization";

    private RecommendationGenerator() {
    }

    /**
     * @param metrics          the run's metrics
     * @param alert            the regression alert of the run; may be {@code null}
     * @param recentAnomalies  whether anomalies were detected in the last 24 hours
     */
    public static List<String> forTestRun(PerformanceMetrics metrics, Alert alert, boolean recentAnomalies) {
        List<String> recommendations = new ArrayList<>();

        if (metrics.getResponseTime().getMean() > SLOW_RESPONSE_MS) {
            recommendations.add(SLOW_RESPONSE);
        }
        if (metrics.getErrorMetrics().getErrorRate() > ERROR_RATE_PERCENT) {
            recommendations.add(HIGH_ERROR_RATE);
        }
        if (metrics.getResourceUtilization().getAvgCpuUsage() > RESOURCE_PERCENT) {
            recommendations.add(HIGH_CPU);
        }
        if (metrics.getResourceUtilization().getAvgMemoryUsage() > RESOURCE_PERCENT) {
            recommendations.add(HIGH_MEMORY);
        }

        if (alert != null && alert.getComparison() != null && alert.getComparison().getRecommendations() != null) {
            recommendations.addAll(alert.getComparison().getRecommendations());
        }

        if (recentAnomalies) {
            recommendations.add(RECENT_ANOMALIES);
        }
        return recommendations;
    }

    public static List<String> forAnalysis(List<PerformanceTestResult> results, TrendAnalysisResult trends) {
        List<String> recommendations = new ArrayList<>();

        if (isDegrading(trends)) {
            recommendations.add(DEGRADING_TREND);
        }
        if (results.isEmpty()) {
            return recommendations;
        }

        long regressions = results.stream().filter(PerformanceTestResult::isRegressionDetected).count();
        if (regressions * 100.0 / results.size() > REGRESSION_RATE_PERCENT) {
            recommendations.add(HIGH_REGRESSION_RATE);
        }

        long highResource = results.stream().filter(RecommendationGenerator::usesHighResources).count();
        if (highResource > results.size() * HIGH_RESOURCE_SHARE) {
            recommendations.add(FREQUENT_HIGH_RESOURCES);
        }
        return recommendations;
    }

    /**
     * @return action items, highest priority first
     */
    public static List<ActionItem> actionItems(List<PerformanceTestResult> results, TrendAnalysisResult trends) {
        List<ActionItem> items = new ArrayList<>();

        if (results.stream().anyMatch(RecommendationGenerator::isCritical)) {
            items.add(new ActionItem(Priority.CRITICAL,
                    "Address critical performance issues (response time >5s or error rate >5%)",
                    "User experience significantly impacted", Effort.HIGH));
        }
        if (isDegrading(trends)) {
            items.add(new ActionItem(Priority.HIGH,
                    "Investigate root cause of performance degradation trend",
                    "Prevents further performance decline", Effort.MEDIUM));
        }
        items.add(new ActionItem(Priority.MEDIUM,
                "Review and update performance baselines quarterly",
                "Ensures accurate regression detection", Effort.LOW));
        items.add(new ActionItem(Priority.LOW,
                "Enhance performance monitoring coverage",
                "Better visibility into performance trends", Effort.MEDIUM));
        return items;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static boolean isDegrading(TrendAnalysisResult trends) {
        return trends != null && trends.getPerformance() == TrendDirection.DEGRADING;
    }

    private static boolean usesHighResources(PerformanceTestResult result) {
        PerformanceMetrics.ResourceUtilization usage = result.getMetrics().getResourceUtilization();
        return usage.getAvgCpuUsage() > RESOURCE_PERCENT || usage.getAvgMemoryUsage() > RESOURCE_PERCENT;
    }

    private static boolean isCritical(PerformanceTestResult result) {
        PerformanceMetrics metrics = result.getMetrics();
        return metrics.getResponseTime().getP99() > CRITICAL_P99_MS
                || metrics.getErrorMetrics().getErrorRate() > CRITICAL_ERROR_RATE_PERCENT;
    }
}
