package com.regressionsentinel.core.statistics;

import com.regressionsentinel.core.model.MetricSample;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Daily seasonality by hour-of-day buckets.
 * <p>
 * Samples are grouped by their UTC hour. With at least two hours holding two
 * or more samples each, the amplitude is half the spread between the highest
 * and lowest hourly mean and the phase is the offset of the peak hour.
 * Confidence is the amplitude relative to the overall standard deviation,
 * capped at 1; patterns below {@value #MIN_CONFIDENCE} are discarded.
 * </p>
 */
public final class SeasonalityDetector {

    static final double MIN_CONFIDENCE = 0.5;
    static final Duration DAILY = Duration.ofHours(24);

    private static final int MIN_SAMPLES_PER_BUCKET = 2;
    private static final int MIN_BUCKETS = 2;

    private SeasonalityDetector() {
    }

    /**
     * @param testName   test the samples belong to
     * @param metric     metric to examine
     * @param samples    samples in any order
     * @param detectedAt timestamp recorded on the pattern
     * @return the daily pattern, if a strong enough one exists
     */
    public static Optional<SeasonalPattern> detectDaily(String testName, MetricKind metric,
            List<MetricSample> samples, Instant detectedAt) {
        double[] sums = new double[24];
        int[] counts = new int[24];
        double[] all = new double[samples.size()];
        for (int i = 0; i < all.length; i++) {
            MetricSample sample = samples.get(i);
            int hour = sample.getTimestamp().atZone(ZoneOffset.UTC).getHour();
            double value = metric.valueOf(sample);
            sums[hour] += value;
            counts[hour]++;
            all[i] = value;
        }

        int buckets = 0;
        double maxMean = Double.NEGATIVE_INFINITY;
        double minMean = Double.POSITIVE_INFINITY;
        int peakHour = 0;
        for (int hour = 0; hour < 24; hour++) {
            if (counts[hour] < MIN_SAMPLES_PER_BUCKET) {
                continue;
            }
            buckets++;
            double mean = sums[hour] / counts[hour];
            if (mean > maxMean) {
                maxMean = mean;
                peakHour = hour;
            }
            minMean = Math.min(minMean, mean);
        }
        if (buckets < MIN_BUCKETS) {
            return Optional.empty();
        }

        double amplitude = (maxMean - minMean) / 2;
        double stdDev = Math.sqrt(SummaryStatistics.populationVariance(all, SummaryStatistics.mean(all)));
        if (stdDev == 0 || amplitude == 0) {
            return Optional.empty();
        }
        double confidence = Math.min(amplitude / stdDev, 1);
        if (confidence < MIN_CONFIDENCE) {
            return Optional.empty();
        }
        return Optional.of(new SeasonalPattern(testName, metric, DAILY.toMillis(), amplitude,
                Duration.ofHours(peakHour).toMillis(), confidence, detectedAt));
    }
}
