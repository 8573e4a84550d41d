package com.regressionsentinel.core.statistics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreAnomalyDetector}.
 */
class ZScoreAnomalyDetectorTest {

    @Test
    @DisplayName("Window is 80% of the series, capped at 20")
    void shouldSizeWindow() {
        assertThat(ZScoreAnomalyDetector.windowSizeFor(15)).isEqualTo(12);
        assertThat(ZScoreAnomalyDetector.windowSizeFor(21)).isEqualTo(16);
        assertThat(ZScoreAnomalyDetector.windowSizeFor(100)).isEqualTo(20);
        assertThat(ZScoreAnomalyDetector.windowSizeFor(2)).isEqualTo(1);
    }

    @Test
    @DisplayName("z = 2.6 is flagged at medium sensitivity but not at low")
    void shouldRespectSensitivityThreshold() {
        // 20 values alternating 95/105: mean 100, population stddev 5
        double[] series = new double[26];
        for (int i = 0; i < 25; i++) {
            series[i] = i % 2 == 0 ? 95 : 105;
        }
        series[25] = 100 + 5 * 2.6;

        List<ZScoreAnomalyDetector.Outlier> medium =
                new ZScoreAnomalyDetector(AnomalySensitivity.MEDIUM).detect(series);
        List<ZScoreAnomalyDetector.Outlier> low =
                new ZScoreAnomalyDetector(AnomalySensitivity.LOW).detect(series);

        assertThat(medium).hasSize(1);
        assertThat(medium.get(0).index()).isEqualTo(25);
        assertThat(medium.get(0).deviation()).isCloseTo(2.6, within(1e-9));
        assertThat(medium.get(0).expected()).isCloseTo(100, within(1e-9));
        assertThat(medium.get(0).severity()).isEqualTo(AnomalySeverity.LOW);
        assertThat(low).isEmpty();
    }

    @Test
    @DisplayName("A jump after a constant window has infinite deviation and high severity")
    void shouldFlagJumpAfterConstantWindow() {
        double[] series = new double[15];
        java.util.Arrays.fill(series, 100);
        series[14] = 500;

        List<ZScoreAnomalyDetector.Outlier> outliers =
                new ZScoreAnomalyDetector(AnomalySensitivity.HIGH).detect(series);

        assertThat(outliers).hasSize(1);
        ZScoreAnomalyDetector.Outlier outlier = outliers.get(0);
        assertThat(outlier.index()).isEqualTo(14);
        assertThat(outlier.deviation()).isInfinite();
        assertThat(outlier.severity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(outlier.confidence()).isEqualTo(1.0);
        assertThat(outlier.context().getWindowSize()).isEqualTo(12);
    }

    @Test
    @DisplayName("Constant series produces no anomalies")
    void shouldIgnoreConstantSeries() {
        double[] series = new double[30];
        java.util.Arrays.fill(series, 42);

        assertThat(new ZScoreAnomalyDetector(AnomalySensitivity.HIGH).detect(series)).isEmpty();
    }

    @Test
    @DisplayName("Series too short for a window of two produces no anomalies")
    void shouldSkipShortSeries() {
        assertThat(new ZScoreAnomalyDetector(AnomalySensitivity.HIGH).detect(new double[] {1, 1000}))
                .isEmpty();
    }

    @Test
    @DisplayName("Severity escalates at 1.2x and 1.5x the threshold")
    void shouldGradeSeverity() {
        ZScoreAnomalyDetector detector = new ZScoreAnomalyDetector(AnomalySensitivity.HIGH);

        assertThat(detector.detect(alternatingThen(100 + 5 * 2.2)).get(0).severity())
                .isEqualTo(AnomalySeverity.LOW);
        assertThat(detector.detect(alternatingThen(100 + 5 * 2.6)).get(0).severity())
                .isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(detector.detect(alternatingThen(100 + 5 * 3.5)).get(0).severity())
                .isEqualTo(AnomalySeverity.HIGH);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** 25 values alternating 95/105 followed by {@code last}. */
    private static double[] alternatingThen(double last) {
        double[] series = new double[26];
        for (int i = 0; i < 25; i++) {
            series[i] = i % 2 == 0 ? 95 : 105;
        }
        series[25] = last;
        return series;
    }
}
