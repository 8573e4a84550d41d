package com.regressionsentinel.core.statistics;

import com.regressionsentinel.core.model.TimeRange;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Descriptive statistics helpers over commons-math {@link DescriptiveStatistics}.
 * <p>
 * Percentiles use the R-7 estimator (linear interpolation between the
 * closest ranks). Skewness and kurtosis are the bias-corrected G1 and G2
 * estimators and read 0 where they are undefined.
 * </p>
 */
public final class SummaryStatistics {

    private SummaryStatistics() {
    }

    /**
     * @param metric    metric the values belong to
     * @param values    values in any order
     * @param timeRange range the values were drawn from
     * @return the summary; all zero for an empty input
     */
    public static StatisticalSummary summarize(MetricKind metric, double[] values, TimeRange timeRange) {
        if (values.length == 0) {
            return StatisticalSummary.empty(metric, timeRange);
        }
        DescriptiveStatistics stats = describe(values);
        double variance = stats.getPopulationVariance();

        StatisticalSummary.Percentiles percentiles = new StatisticalSummary.Percentiles(
                stats.getPercentile(25), stats.getPercentile(50), stats.getPercentile(75),
                stats.getPercentile(90), stats.getPercentile(95), stats.getPercentile(99));

        return new StatisticalSummary(metric, timeRange, values.length, stats.getMean(), stats.getPercentile(50),
                Math.sqrt(variance), variance, stats.getMin(), stats.getMax(), percentiles,
                definedOrZero(stats.getSkewness()), definedOrZero(stats.getKurtosis()));
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0 : StatUtils.mean(values);
    }

    /** Variance dividing by {@code n}. */
    public static double populationVariance(double[] values, double mean) {
        return values.length == 0 ? 0 : StatUtils.populationVariance(values, mean);
    }

    /**
     * Adjusted Fisher-Pearson sample skewness (G1).
     *
     * @return 0 for fewer than three values or no spread
     */
    public static double skewness(double[] values) {
        return values.length < 3 ? 0 : definedOrZero(describe(values).getSkewness());
    }

    /**
     * Sample excess kurtosis (G2).
     *
     * @return 0 for fewer than four values or no spread
     */
    public static double kurtosis(double[] values) {
        return values.length < 4 ? 0 : definedOrZero(describe(values).getKurtosis());
    }

    private static DescriptiveStatistics describe(double[] values) {
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        stats.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
        return stats;
    }

    private static double definedOrZero(double value) {
        return Double.isNaN(value) ? 0 : value;
    }
}
