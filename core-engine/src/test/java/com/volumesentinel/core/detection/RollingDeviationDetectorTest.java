package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.RollingDeviationFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.volumesentinel.core.SeriesFixtures.baseline;
import static com.volumesentinel.core.SeriesFixtures.constant;
import static com.volumesentinel.core.SeriesFixtures.day;
import static com.volumesentinel.core.SeriesFixtures.series;
import static com.volumesentinel.core.SeriesFixtures.with;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RollingDeviationDetector}.
 */
class RollingDeviationDetectorTest {

    private final RollingDeviationDetector detector = new RollingDeviationDetector(5, 0.5);

    @Test
    @DisplayName("Should return nothing when the series is shorter than the window")
    void shouldSkipShortSeries() {
        assertThat(detector.detect(series(10, 10, 10, 100))).isEmpty();
    }

    @Test
    @DisplayName("Should never flag points inside the warm-up window")
    void shouldSkipWarmUpPositions() {
        assertThat(detector.detect(series(10, 10, 1_000, 10, 10))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing for a constant series")
    void shouldSkipConstantSeries() {
        assertThat(detector.detect(series(constant(40, 100)))).isEmpty();
    }

    @Test
    @DisplayName("Should flag a spike against the mean of the preceding window")
    void shouldFlagSpike() {
        List<Finding> findings = detector.detect(series(10, 10, 10, 10, 10, 16, 10));

        assertThat(findings).hasSize(1);
        RollingDeviationFinding finding = (RollingDeviationFinding) findings.get(0);
        assertThat(finding.getDate()).isEqualTo(day(5));
        assertThat(finding.getRollingMean()).isEqualTo(10.0);
        assertThat(finding.getDeviationFraction()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("Should flag a drop")
    void shouldFlagDrop() {
        List<Finding> findings = detector.detect(series(10, 10, 10, 10, 10, 4));

        assertThat(findings).extracting(Finding::getDate).containsExactly(day(5));
    }

    @Test
    @DisplayName("Should NOT flag a deviation of exactly 50%")
    void shouldUseStrictThreshold() {
        assertThat(detector.detect(series(10, 10, 10, 10, 10, 15))).isEmpty();
    }

    @Test
    @DisplayName("Should exclude points whose trailing mean is zero")
    void shouldExcludeZeroBaseline() {
        List<Finding> findings = detector.detect(series(0, 0, 0, 0, 0, 5, 5));

        // day 5 has a zero baseline; day 6 compares against mean 1.0
        assertThat(findings).extracting(Finding::getDate).containsExactly(day(6));
    }

    @Test
    @DisplayName("Default 30-day window flags a doubled value")
    void shouldFlagWithDefaultWindow() {
        List<Finding> findings = new RollingDeviationDetector().detect(series(with(baseline(90), 50, 200)));

        assertThat(findings).hasSize(1);
        assertThat(((RollingDeviationFinding) findings.get(0)).getRollingMean()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new RollingDeviationDetector(0, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("window");
        assertThatThrownBy(() -> new RollingDeviationDetector(5, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deviationThreshold");
    }
}
