package com.regressionsentinel.core.statistics;

import com.regressionsentinel.core.model.MetricSample;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Trend computations over a metric series.
 * <p>
 * Two methods with different sensitivities live side by side:
 * {@link #regressionTrend} fits a line and reports a slope-based direction
 * with strength and confidence, while {@link #twoHalfTrend} compares the
 * average of the first and last halves against a 5% band.
 * </p>
 */
public final class TrendCalculator {

    /** Slope (per sample) beyond which a series is directional. */
    static final double SLOPE_THRESHOLD = 0.1;

    /** Relative change (percent) beyond which a two-half comparison is directional. */
    static final double TWO_HALF_THRESHOLD_PERCENT = 5.0;

    /** Sample count at which a perfect fit reaches full confidence. */
    private static final double FULL_CONFIDENCE_SAMPLES = 100;

    private TrendCalculator() {
    }

    /**
     * Fit a regression trend to one metric of a test's samples.
     *
     * @param testName test the samples belong to
     * @param metric   metric to analyse
     * @param samples  samples in any order; they are sorted by timestamp
     * @return the trend; {@code stable} with zero strength and confidence for
     *         fewer than two samples
     */
    public static TrendAnalysis regressionTrend(String testName, MetricKind metric, List<MetricSample> samples) {
        if (samples.size() < 2) {
            return TrendAnalysis.stable(testName, metric, samples.size());
        }
        List<MetricSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(MetricSample::getTimestamp));

        double[] y = metric.valuesOf(sorted);
        int n = y.length;
        LinearRegression fit = LinearRegression.fit(y);

        double mean = 0;
        for (double v : y) {
            mean += v;
        }
        mean /= n;

        double strength = mean == 0 ? 0 : Math.min(Math.abs(fit.getSlope()) / Math.abs(mean) * 10, 1);
        TrendDirection direction = TrendDirection.of(metric.towardsBetter(fit.getSlope()), SLOPE_THRESHOLD);
        double confidence = clamp(fit.getRSquared() * (Math.log(n) / Math.log(FULL_CONFIDENCE_SAMPLES)));
        long timespanMs = Duration.between(sorted.get(0).getTimestamp(), sorted.get(n - 1).getTimestamp())
                .toMillis();

        return new TrendAnalysis(testName, metric, direction, strength, confidence, fit.getSlope(),
                fit.getRSquared(), n, timespanMs);
    }

    /**
     * Compare the average of the first {@code ⌊n/2⌋} values with the average of
     * the last {@code ⌊n/2⌋} values.
     *
     * @param values   series in time order
     * @param polarity decides whether a rise is an improvement
     * @return {@code stable} for fewer than three values or a relative change
     *         under 5%
     */
    public static TrendDirection twoHalfTrend(double[] values, MetricKind.Polarity polarity) {
        if (values.length < 3) {
            return TrendDirection.STABLE;
        }
        int mid = values.length / 2;
        double firstAvg = 0;
        double secondAvg = 0;
        for (int i = 0; i < mid; i++) {
            firstAvg += values[i];
            secondAvg += values[values.length - mid + i];
        }
        firstAvg /= mid;
        secondAvg /= mid;

        double changePercent;
        if (firstAvg == 0) {
            // no baseline to scale by: only the sign of the change is meaningful
            changePercent = secondAvg == 0 ? 0 : Math.signum(secondAvg) * Double.POSITIVE_INFINITY;
        } else {
            changePercent = (secondAvg - firstAvg) / Math.abs(firstAvg) * 100;
        }
        if (Math.abs(changePercent) < TWO_HALF_THRESHOLD_PERCENT) {
            return TrendDirection.STABLE;
        }
        boolean rising = changePercent > 0;
        boolean better = polarity == MetricKind.Polarity.HIGHER_IS_BETTER ? rising : !rising;
        return better ? TrendDirection.IMPROVING : TrendDirection.DEGRADING;
    }

    /**
     * Confidence- and strength-weighted vote over many trends.
     *
     * @param trends per-test, per-metric trends
     * @return {@code improving} above a mean score of 0.1, {@code degrading}
     *         below -0.1, else {@code stable}
     */
    public static TrendDirection overallDirection(List<TrendAnalysis> trends) {
        if (trends.isEmpty()) {
            return TrendDirection.STABLE;
        }
        double score = 0;
        for (TrendAnalysis trend : trends) {
            score += trend.weightedScore();
        }
        return TrendDirection.of(score / trends.size(), 0.1);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0;
        }
        return Math.min(value, 1);
    }
}
