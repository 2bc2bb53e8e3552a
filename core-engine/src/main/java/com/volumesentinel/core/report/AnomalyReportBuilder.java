package com.volumesentinel.core.report;

import com.volumesentinel.core.aggregation.FindingAggregator;
import com.volumesentinel.core.config.DetectionSettings;
import com.volumesentinel.core.detection.AnomalyDetector;
import com.volumesentinel.core.detection.DetectorFactory;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.MetricSeries;
import com.volumesentinel.core.model.PartitionKey;
import com.volumesentinel.core.model.ValidatedAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs every detector over one series and turns the cross-validated findings
 * into a date-ordered alert list.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   MetricSeries
 *     → {z-score, IQR, rolling deviation}   (independent)
 *     → FindingAggregator                    (waits for all three)
 *     → sort by date
 * </pre>
 *
 * <p>
 * With an {@link Executor} the detectors run concurrently and the aggregator
 * starts only after all of them complete. Without one they run one after the
 * other on the calling thread. Both modes produce the same output.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyReportBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyReportBuilder.class);

    private static final Comparator<ValidatedAnomaly> BY_DATE = Comparator.comparing(ValidatedAnomaly::getDate);

    private final List<AnomalyDetector> detectors;
    private final FindingAggregator aggregator;
    private final Executor detectorExecutor;

    /**
     * @param detectors        detectors to run; must not be {@code null} or empty
     * @param aggregator       aggregator for the combined findings
     * @param detectorExecutor executor for concurrent detection, or {@code null}
     *                         to run on the calling thread
     */
    public AnomalyReportBuilder(List<AnomalyDetector> detectors, FindingAggregator aggregator,
            Executor detectorExecutor) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("detectors must not be empty");
        }
        this.detectors = List.copyOf(detectors);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.detectorExecutor = detectorExecutor;
    }

    /**
     * Sequential builder with one detector per method.
     */
    public AnomalyReportBuilder(DetectionSettings settings) {
        this(DetectorFactory.createAll(settings), new FindingAggregator(), null);
    }

    /**
     * Concurrent builder with one detector per method.
     */
    public AnomalyReportBuilder(DetectionSettings settings, Executor detectorExecutor) {
        this(DetectorFactory.createAll(settings), new FindingAggregator(),
                Objects.requireNonNull(detectorExecutor, "detectorExecutor must not be null"));
    }

    /**
     * Detect, cross-validate and sort.
     *
     * @param series series to analyse; may be empty
     * @return validated anomalies in ascending date order
     */
    public List<ValidatedAnomaly> build(MetricSeries series) {
        Objects.requireNonNull(series, "MetricSeries must not be null");
        if (series.isEmpty()) {
            return List.of();
        }

        List<Finding> findings = detectorExecutor == null
                ? detectSequentially(series)
                : detectConcurrently(series);

        List<ValidatedAnomaly> anomalies = new ArrayList<>(aggregator.aggregate(findings, series));
        anomalies.sort(BY_DATE);

        LOG.debug("Series {} ({} points): {} finding(s), {} validated anomaly(ies)",
                series.getPartition(), series.size(), findings.size(), anomalies.size());
        return anomalies;
    }

    /**
     * Fetch one partition from {@code provider} and build its report.
     *
     * @throws MetricFetchException if the provider fails or returns
     *                              {@code null}
     */
    public List<ValidatedAnomaly> build(PartitionKey partition, MetricSeriesProvider provider, int days) {
        Objects.requireNonNull(partition, "partition must not be null");
        Objects.requireNonNull(provider, "provider must not be null");

        MetricSeries series = provider.fetch(partition, days);
        if (series == null) {
            throw new MetricFetchException("Provider returned no series for " + partition);
        }
        return build(series);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Finding> detectSequentially(MetricSeries series) {
        List<Finding> findings = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            findings.addAll(detector.detect(series));
        }
        return findings;
    }

    private List<Finding> detectConcurrently(MetricSeries series) {
        List<CompletableFuture<List<Finding>>> futures = new ArrayList<>(detectors.size());
        for (AnomalyDetector detector : detectors) {
            futures.add(CompletableFuture.supplyAsync(() -> detector.detect(series), detectorExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        List<Finding> findings = new ArrayList<>();
        for (CompletableFuture<List<Finding>> future : futures) {
            findings.addAll(future.join());
        }
        return findings;
    }
}
