package com.regressionsentinel.core.statistics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Trailing window an anomaly was measured against. */
public final class AnomalyContext {

    private final int windowSize;
    private final double historicalMean;
    private final double historicalStdDev;

    @JsonCreator
    public AnomalyContext(@JsonProperty("windowSize") int windowSize,
            @JsonProperty("historicalMean") double historicalMean,
            @JsonProperty("historicalStdDev") double historicalStdDev) {
        this.windowSize = windowSize;
        this.historicalMean = historicalMean;
        this.historicalStdDev = historicalStdDev;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getHistoricalMean() {
        return historicalMean;
    }

    public double getHistoricalStdDev() {
        return historicalStdDev;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyContext that))
            return false;
        return windowSize == that.windowSize
                && Double.compare(historicalMean, that.historicalMean) == 0
                && Double.compare(historicalStdDev, that.historicalStdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowSize, historicalMean, historicalStdDev);
    }
}
