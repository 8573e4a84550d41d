package com.regressionsentinel.core.statistics;

import com.regressionsentinel.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sliding-window z-score anomaly detector.
 *
 * <p>
 * Each value at index {@code i >= w} is compared with the {@code w} values
 * before it, where {@code w = min(20, ⌊0.8 × n⌋)}. A value is anomalous when
 * {@code |value - mean| / σ} exceeds the sensitivity threshold
 * (σ is the population standard deviation of the window).
 * </p>
 *
 * <h3>Severity</h3>
 * <ul>
 * <li>{@code high} above 1.5 × threshold</li>
 * <li>{@code medium} above 1.2 × threshold</li>
 * <li>{@code low} otherwise</li>
 * </ul>
 *
 * <h3>Flat windows</h3>
 * <p>
 * When every value in the window is identical, a value equal to the window
 * mean is normal and any other value is an anomaly with an infinite z-score,
 * severity {@code high} and full confidence.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreAnomalyDetector.class);

    /** Upper bound on the trailing window. */
    static final int MAX_WINDOW_SIZE = 20;

    /** Fewer window values than this make σ meaningless. */
    static final int MIN_WINDOW_SIZE = 2;

    private static final double EPSILON = 1e-10;

    private final AnomalySensitivity sensitivity;

    public ZScoreAnomalyDetector(AnomalySensitivity sensitivity) {
        this.sensitivity = Objects.requireNonNull(sensitivity, "sensitivity must not be null");
    }

    public AnomalySensitivity getSensitivity() {
        return sensitivity;
    }

    /**
     * @param seriesLength number of values in the series
     * @return the trailing window size used for a series of that length
     */
    public static int windowSizeFor(int seriesLength) {
        return Math.min(MAX_WINDOW_SIZE, (int) Math.floor(seriesLength * 0.8));
    }

    /**
     * Scan every tracked metric of a test's samples.
     *
     * @param testName test the samples belong to
     * @param samples  samples in time order
     * @return anomalies grouped by metric, in sample order within each metric
     */
    public List<AnomalyDetection> detect(String testName, List<MetricSample> samples) {
        List<AnomalyDetection> anomalies = new ArrayList<>();
        for (MetricKind metric : MetricKind.ANOMALY_SCANNED) {
            for (Outlier outlier : detect(metric.valuesOf(samples))) {
                MetricSample sample = samples.get(outlier.index());
                anomalies.add(new AnomalyDetection(sample.getTimestamp(), testName, metric,
                        outlier.value(), outlier.expected(), outlier.deviation(), outlier.severity(),
                        outlier.confidence(), outlier.context()));
            }
        }
        if (!anomalies.isEmpty()) {
            LOG.debug("Test [{}]: {} anomal(ies) across {} sample(s)", testName, anomalies.size(), samples.size());
        }
        return anomalies;
    }

    /**
     * Scan a single series.
     *
     * @param values series in time order
     * @return one entry per anomalous index
     */
    public List<Outlier> detect(double[] values) {
        List<Outlier> outliers = new ArrayList<>();
        int windowSize = windowSizeFor(values.length);
        if (windowSize < MIN_WINDOW_SIZE) {
            return outliers;
        }
        double threshold = sensitivity.threshold();

        for (int i = windowSize; i < values.length; i++) {
            double mean = 0;
            for (int j = i - windowSize; j < i; j++) {
                mean += values[j];
            }
            mean /= windowSize;

            double sumSquaredDiff = 0;
            for (int j = i - windowSize; j < i; j++) {
                double diff = values[j] - mean;
                sumSquaredDiff += diff * diff;
            }
            double stdDev = Math.sqrt(sumSquaredDiff / windowSize);

            double current = values[i];
            double diff = Math.abs(current - mean);
            double zScore;
            if (stdDev < EPSILON) {
                if (diff < EPSILON) {
                    continue;
                }
                zScore = Double.POSITIVE_INFINITY;
            } else {
                zScore = diff / stdDev;
            }

            if (zScore > threshold) {
                outliers.add(new Outlier(i, current, mean, zScore, severityOf(zScore, threshold),
                        Math.min(zScore / threshold, 1), new AnomalyContext(windowSize, mean, stdDev)));
            }
        }
        return outliers;
    }

    private static AnomalySeverity severityOf(double zScore, double threshold) {
        if (zScore > threshold * 1.5) {
            return AnomalySeverity.HIGH;
        }
        if (zScore > threshold * 1.2) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    /**
     * An anomalous index within a series.
     */
    public static final class Outlier {
        private final int index;
        private final double value;
        private final double expected;
        private final double deviation;
        private final AnomalySeverity severity;
        private final double confidence;
        private final AnomalyContext context;

        Outlier(int index, double value, double expected, double deviation, AnomalySeverity severity,
                double confidence, AnomalyContext context) {
            this.index = index;
            this.value = value;
            this.expected = expected;
            this.deviation = deviation;
            this.severity = severity;
            this.confidence = confidence;
            this.context = context;
        }

        public int index() {
            return index;
        }

        public double value() {
            return value;
        }

        public double expected() {
            return expected;
        }

        public double deviation() {
            return deviation;
        }

        public AnomalySeverity severity() {
            return severity;
        }

        public double confidence() {
            return confidence;
        }

        public AnomalyContext context() {
            return context;
        }
    }
}
