package com.volumesentinel.core.aggregation;

import com.volumesentinel.core.model.AnomalyType;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.MetricSeries;
import com.volumesentinel.core.model.RollingDeviationFinding;
import com.volumesentinel.core.model.ValidatedAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-validates per-method findings into {@link ValidatedAnomaly} records.
 *
 * <h3>Validation</h3>
 * <p>
 * Findings are grouped by date. A date survives only if at least
 * {@value #MIN_AGREEING_METHODS} distinct methods flagged it; single-method
 * signals are discarded as noise.
 * </p>
 *
 * <h3>Direction</h3>
 * <p>
 * If the rolling-deviation method fired for the date, the value is compared
 * with that finding's trailing mean. Otherwise it is compared with the mean of
 * the whole input series. Strictly below the reference is a
 * {@link AnomalyType#DROP}; anything else, including equality, is a
 * {@link AnomalyType#SPIKE}.
 * </p>
 *
 * <h3>Severity</h3>
 * <p>
 * {@code min(10, |z|)} when the z-score method fired, otherwise
 * {@value #DEFAULT_SEVERITY}. Rounded half-up to two decimals.
 * </p>
 *
 * <p>
 * The output is in no particular order. Sorting is the caller's job.
 * This class holds no state and is thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class FindingAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(FindingAggregator.class);

    public static final int MIN_AGREEING_METHODS = 2;
    public static final double DEFAULT_SEVERITY = 5.0;

    /**
     * Group, validate, classify and score.
     *
     * @param findings findings from every detector run over {@code series}
     * @param series   the series the detectors ran over; supplies the partition,
     *                 the metric name and the fallback mean
     * @return one anomaly per validated date, unordered
     */
    public List<ValidatedAnomaly> aggregate(Collection<? extends Finding> findings, MetricSeries series) {
        Objects.requireNonNull(findings, "findings must not be null");
        Objects.requireNonNull(series, "MetricSeries must not be null");

        if (findings.isEmpty()) {
            return List.of();
        }

        Map<LocalDate, AggregatedCandidate> candidates = new HashMap<>();
        for (Finding finding : findings) {
            AggregatedCandidate candidate = candidates.computeIfAbsent(finding.getDate(),
                    date -> new AggregatedCandidate(date, finding.getValue()));
            if (!candidate.add(finding)) {
                LOG.debug("Duplicate {} finding for {} on {} replaced the earlier one",
                        finding.getMethod(), series.getPartition(), finding.getDate());
            }
        }

        double seriesMean = series.mean();
        List<ValidatedAnomaly> validated = new ArrayList<>();

        for (AggregatedCandidate candidate : candidates.values()) {
            if (candidate.methodCount() < MIN_AGREEING_METHODS) {
                LOG.trace("Discarding single-method candidate {}", candidate);
                continue;
            }

            ValidatedAnomaly anomaly = ValidatedAnomaly.builder()
                    .date(candidate.getDate())
                    .metricName(series.getMetricName())
                    .value(candidate.getValue())
                    .severityScore(severity(candidate))
                    .anomalyType(classify(candidate, seriesMean))
                    .detectionMethods(candidate.methods())
                    .partition(series.getPartition())
                    .build();
            validated.add(anomaly);
        }

        LOG.debug("Aggregated {} finding(s) into {} candidate(s), {} validated for {}",
                findings.size(), candidates.size(), validated.size(), series.getPartition());
        return validated;
    }

    // ---------------------------------------------------------------
    // Classification and scoring
    // ---------------------------------------------------------------

    static AnomalyType classify(AggregatedCandidate candidate, double seriesMean) {
        double reference = candidate.rollingDeviation()
                .map(RollingDeviationFinding::getRollingMean)
                .orElse(seriesMean);
        return candidate.getValue() < reference ? AnomalyType.DROP : AnomalyType.SPIKE;
    }

    static double severity(AggregatedCandidate candidate) {
        double raw = candidate.zScore()
                .map(z -> Math.min(ValidatedAnomaly.MAX_SEVERITY, z.getZScore()))
                .orElse(DEFAULT_SEVERITY);
        return round2(Math.max(ValidatedAnomaly.MIN_SEVERITY, raw));
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
