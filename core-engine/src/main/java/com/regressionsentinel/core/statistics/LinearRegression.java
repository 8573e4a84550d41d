package com.regressionsentinel.core.statistics;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Ordinary least squares of a series against its index {@code 0..n-1}.
 * <p>
 * Index spacing is treated as uniform regardless of the actual sample
 * timestamps.
 * </p>
 */
public final class LinearRegression {

    private final int n;
    private final double slope;
    private final double intercept;
    private final double rSquared;
    private final double rmse;

    private LinearRegression(int n, double slope, double intercept, double rSquared, double rmse) {
        this.n = n;
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.rmse = rmse;
    }

    /**
     * Fit {@code y} against its index.
     * <p>
     * With fewer than two points the slope is 0 and the intercept is the only
     * value (or 0). {@code R²} is 0 when {@code y} has no variance. The RMSE
     * divides the residual sum of squares by {@code n}.
     * </p>
     *
     * @param y observed values
     * @return the fitted line
     */
    public static LinearRegression fit(double[] y) {
        int n = y.length;
        if (n == 0) {
            return new LinearRegression(0, 0, 0, 0, 0);
        }
        if (n == 1) {
            return new LinearRegression(1, 0, y[0], 0, 0);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, y[i]);
        }
        double ssResidual = regression.getSumSquaredErrors();
        double rSquared = regression.getTotalSumSquares() == 0 ? 0 : regression.getRSquare();
        return new LinearRegression(n, regression.getSlope(), regression.getIntercept(),
                Double.isNaN(rSquared) ? 0 : rSquared, Math.sqrt(ssResidual / n));
    }

    /**
     * @param x index, may lie outside the fitted range
     * @return the fitted value at {@code x}
     */
    public double predict(double x) {
        return slope * x + intercept;
    }

    public int getN() {
        return n;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getRSquared() {
        return rSquared;
    }

    /**
     * @return root mean square of the residuals
     */
    public double getRmse() {
        return rmse;
    }
}
