package com.regressionsentinel.core.statistics;

import com.regressionsentinel.core.model.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Linear extrapolation one index past the end of a series, with an interval
 * of {@code ± z × RMSE} around the prediction.
 */
public final class Predictor {

    private final double confidenceLevel;
    private final double zMultiplier;

    public Predictor(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
        this.zMultiplier = multiplierFor(confidenceLevel);
    }

    /**
     * Two-sided normal quantile for the common confidence levels.
     *
     * @param confidenceLevel 0.90, 0.95 or 0.99
     * @return 1.645, 1.96 or 2.576; 1.96 for any other level
     */
    public static double multiplierFor(double confidenceLevel) {
        if (Math.abs(confidenceLevel - 0.90) < 1e-9) {
            return 1.645;
        }
        if (Math.abs(confidenceLevel - 0.99) < 1e-9) {
            return 2.576;
        }
        return 1.96;
    }

    /**
     * @param testName   test the samples belong to
     * @param metric     metric to predict
     * @param samples    samples in time order
     * @param targetTime instant the prediction is reported for
     * @return the prediction; confidence never drops below 0.1
     */
    public PerformancePrediction predict(String testName, MetricKind metric, List<MetricSample> samples,
            Instant targetTime) {
        double[] values = metric.valuesOf(samples);
        LinearRegression fit = LinearRegression.fit(values);
        double predicted = fit.predict(values.length);
        double error = fit.getRmse();
        double margin = zMultiplier * error;

        double confidence;
        if (predicted == 0) {
            confidence = 0.1;
        } else {
            confidence = Math.max(0.1, 1 - error / Math.abs(predicted));
        }

        return new PerformancePrediction(testName, metric, targetTime, predicted,
                new PerformancePrediction.ConfidenceInterval(predicted - margin, predicted + margin),
                confidenceLevel, confidence, PerformancePrediction.LINEAR_MODEL);
    }
}
