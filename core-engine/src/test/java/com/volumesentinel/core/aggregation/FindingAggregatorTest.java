package com.volumesentinel.core.aggregation;

import com.volumesentinel.core.model.AnomalyType;
import com.volumesentinel.core.model.DetectionMethod;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.IqrFinding;
import com.volumesentinel.core.model.MetricSeries;
import com.volumesentinel.core.model.RollingDeviationFinding;
import com.volumesentinel.core.model.ValidatedAnomaly;
import com.volumesentinel.core.model.ZScoreFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.volumesentinel.core.SeriesFixtures.METRIC;
import static com.volumesentinel.core.SeriesFixtures.PARTITION;
import static com.volumesentinel.core.SeriesFixtures.constant;
import static com.volumesentinel.core.SeriesFixtures.day;
import static com.volumesentinel.core.SeriesFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FindingAggregator}.
 */
class FindingAggregatorTest {

    /** Ten points at 100, so the series mean is exactly 100. */
    private final MetricSeries series = series(constant(10, 100));
    private final FindingAggregator aggregator = new FindingAggregator();

    @Test
    @DisplayName("Should return nothing when there are no findings")
    void shouldHandleNoFindings() {
        assertThat(aggregator.aggregate(List.of(), series)).isEmpty();
    }

    @Test
    @DisplayName("Should discard a date flagged by exactly one method")
    void shouldDiscardSingleMethodCandidates() {
        List<Finding> findings = List.of(
                z(day(1), 150, 4.0),
                iqr(day(2), 150),
                rolling(day(3), 150, 100));

        assertThat(aggregator.aggregate(findings, series)).isEmpty();
    }

    @Test
    @DisplayName("Should validate a date flagged by two methods")
    void shouldValidateTwoMethods() {
        List<ValidatedAnomaly> result = aggregator.aggregate(
                List.of(z(day(4), 150, 4.0), iqr(day(4), 150)), series);

        assertThat(result).hasSize(1);
        ValidatedAnomaly anomaly = result.get(0);
        assertThat(anomaly.getDate()).isEqualTo(day(4));
        assertThat(anomaly.getValue()).isEqualTo(150.0);
        assertThat(anomaly.getDetectionMethods()).containsExactly(DetectionMethod.Z_SCORE, DetectionMethod.IQR);
        assertThat(anomaly.getPartition()).isEqualTo(PARTITION);
        assertThat(anomaly.getMetricName()).isEqualTo(METRIC);
    }

    @Test
    @DisplayName("Two findings of the same method count once")
    void shouldCountDistinctMethods() {
        List<Finding> findings = List.of(z(day(4), 150, 4.0), z(day(4), 150, 4.5));

        assertThat(aggregator.aggregate(findings, series)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Severity
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Severity is the z-score rounded to two decimals")
    void severityFromZScore() {
        ValidatedAnomaly anomaly = single(z(day(4), 150, 3.14159), iqr(day(4), 150));
        assertThat(anomaly.getSeverityScore()).isEqualTo(3.14);
    }

    @Test
    @DisplayName("Severity rounds half up")
    void severityRoundsHalfUp() {
        ValidatedAnomaly anomaly = single(z(day(4), 150, 4.005), iqr(day(4), 150));
        assertThat(anomaly.getSeverityScore()).isEqualTo(4.01);
    }

    @Test
    @DisplayName("Severity is capped at 10")
    void severityCappedAtTen() {
        ValidatedAnomaly anomaly = single(z(day(4), 900, 14.2), rolling(day(4), 900, 100));
        assertThat(anomaly.getSeverityScore()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Severity defaults to 5 when the z-score method did not fire")
    void severityDefaultsWithoutZScore() {
        ValidatedAnomaly anomaly = single(iqr(day(4), 150), rolling(day(4), 150, 100));

        assertThat(anomaly.getSeverityScore()).isEqualTo(FindingAggregator.DEFAULT_SEVERITY);
        assertThat(anomaly.getDetectionMethodNames()).containsExactly("iqr", "rolling_deviation");
    }

    // ------------------------------------------------------------------
    // Direction
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Rolling mean wins over the series mean: below series mean but above rolling mean is a spike")
    void rollingMeanTakesPrecedenceForSpike() {
        ValidatedAnomaly anomaly = single(iqr(day(4), 90), rolling(day(4), 90, 50));
        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.SPIKE);
    }

    @Test
    @DisplayName("Rolling mean wins over the series mean: above series mean but below rolling mean is a drop")
    void rollingMeanTakesPrecedenceForDrop() {
        ValidatedAnomaly anomaly = single(z(day(4), 110, 3.5), rolling(day(4), 110, 300));
        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.DROP);
    }

    @Test
    @DisplayName("Without a rolling finding the series mean decides direction")
    void seriesMeanFallback() {
        assertThat(single(z(day(4), 90, 3.5), iqr(day(4), 90)).getAnomalyType())
                .isEqualTo(AnomalyType.DROP);
        assertThat(single(z(day(4), 110, 3.5), iqr(day(4), 110)).getAnomalyType())
                .isEqualTo(AnomalyType.SPIKE);
    }

    @Test
    @DisplayName("A value equal to the reference mean is a spike")
    void equalityIsSpike() {
        assertThat(single(z(day(4), 100, 3.5), iqr(day(4), 100)).getAnomalyType())
                .isEqualTo(AnomalyType.SPIKE);
        assertThat(single(iqr(day(4), 80), rolling(day(4), 80, 80)).getAnomalyType())
                .isEqualTo(AnomalyType.SPIKE);
    }

    @Test
    @DisplayName("Should keep dates independent")
    void shouldGroupByDate() {
        List<Finding> findings = List.of(
                z(day(2), 300, 6.0), iqr(day(2), 300),
                iqr(day(7), 10), rolling(day(7), 10, 100),
                z(day(8), 150, 3.2));

        List<ValidatedAnomaly> result = aggregator.aggregate(findings, series);

        assertThat(result).extracting(ValidatedAnomaly::getDate).containsExactlyInAnyOrder(day(2), day(7));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ValidatedAnomaly single(Finding... findings) {
        List<ValidatedAnomaly> result = aggregator.aggregate(List.of(findings), series);
        assertThat(result).hasSize(1);
        return result.get(0);
    }

    private static ZScoreFinding z(LocalDate date, double value, double zScore) {
        return new ZScoreFinding(date, value, zScore);
    }

    private static IqrFinding iqr(LocalDate date, double value) {
        return new IqrFinding(date, value, 90, 110);
    }

    private static RollingDeviationFinding rolling(LocalDate date, double value, double rollingMean) {
        return new RollingDeviationFinding(date, value, rollingMean,
                Math.abs(value - rollingMean) / rollingMean);
    }
}
