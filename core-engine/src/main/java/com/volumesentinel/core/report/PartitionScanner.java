package com.volumesentinel.core.report;

import com.volumesentinel.core.config.ScanSettings;
import com.volumesentinel.core.model.PartitionKey;
import com.volumesentinel.core.model.ValidatedAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the full fetch → detect → aggregate pipeline for many partitions and
 * hands the combined alerts to an {@link AlertSink}.
 *
 * <h3>Isolation</h3>
 * <p>
 * Partitions share no mutable state. A failure while fetching or analysing
 * one partition is logged, recorded in the {@link ScanResult} as skipped, and
 * does not affect the others.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Partitions are processed on a fixed pool of
 * {@link ScanSettings#getParallelism()} threads, which bounds the load on the
 * provider. The pool lives for the duration of one {@link #scan(List)} call.
 * </p>
 *
 * <h3>Cancellation</h3>
 * <p>
 * {@link #cancel()} is cooperative: partitions already running finish, the
 * rest are reported as cancelled. A cancelled scanner stays cancelled.
 * Interrupting the thread blocked in {@link #scan(List)} cancels the scanner;
 * the call still waits for running partitions, persists their alerts and
 * returns with the interrupt flag set.
 * </p>
 *
 * <h3>Persistence</h3>
 * <p>
 * All alerts are written in one sink call after the last partition. Sink
 * errors do not escape {@link #scan(List)}; they show up as
 * {@link ScanResult#getUnpersistedCount()}.
 * </p>
 *
 * @since 1.0.0
 */
public class PartitionScanner {

    private static final Logger LOG = LoggerFactory.getLogger(PartitionScanner.class);

    private final MetricSeriesProvider provider;
    private final AlertSink sink;
    private final AnomalyReportBuilder reportBuilder;
    private final ScanSettings settings;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public PartitionScanner(MetricSeriesProvider provider, AlertSink sink,
            AnomalyReportBuilder reportBuilder, ScanSettings settings) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.reportBuilder = Objects.requireNonNull(reportBuilder, "reportBuilder must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Scan every partition and persist the resulting alerts.
     *
     * @param partitions partitions to scan; duplicates are scanned once
     * @return per-partition outcome and persistence counts
     */
    public ScanResult scan(List<PartitionKey> partitions) {
        Objects.requireNonNull(partitions, "partitions must not be null");
        List<PartitionKey> distinct = partitions.stream().distinct().toList();

        LOG.info("Scanning {} partition(s) for '{}' over {} day(s) with parallelism {}",
                distinct.size(), settings.getMetricName(), settings.fetchDays(), settings.getParallelism());

        Map<PartitionKey, List<ValidatedAnomaly>> analysed = new LinkedHashMap<>();
        Map<PartitionKey, String> skipped = new LinkedHashMap<>();
        List<PartitionKey> notStarted = new ArrayList<>();

        AtomicBoolean interrupted = new AtomicBoolean(false);
        if (!distinct.isEmpty()) {
            for (PartitionOutcome outcome : runAll(distinct, interrupted)) {
                switch (outcome.status) {
                    case ANALYSED -> analysed.put(outcome.partition, outcome.anomalies);
                    case FAILED -> skipped.put(outcome.partition, outcome.failure);
                    case CANCELLED -> notStarted.add(outcome.partition);
                }
            }
        }

        List<ValidatedAnomaly> all = new ArrayList<>();
        analysed.values().forEach(all::addAll);

        int persisted = 0;
        int unpersisted = 0;
        if (!all.isEmpty()) {
            try {
                SinkResult result = sink.persist(all);
                persisted = Math.min(result.getPersisted(), all.size());
                unpersisted = all.size() - persisted;
                if (unpersisted > 0) {
                    LOG.error("Alert sink stored {} of {} alert(s); {} unpersisted",
                            persisted, all.size(), unpersisted);
                }
            } catch (RuntimeException e) {
                unpersisted = all.size();
                LOG.error("Alert sink failed, {} alert(s) unpersisted", unpersisted, e);
            }
        }

        ScanResult result = new ScanResult(analysed, skipped, notStarted, persisted, unpersisted);
        LOG.info("Scan finished: {}", result);
        if (interrupted.get()) {
            Thread.currentThread().interrupt();
        }
        return result;
    }

    /**
     * Stop starting new partitions. Running partitions complete normally.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("Scan cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Run every partition and collect its outcome. An interrupt is recorded
     * in {@code interrupted} and cleared so the sink call can still do I/O.
     */
    private List<PartitionOutcome> runAll(List<PartitionKey> partitions, AtomicBoolean interrupted) {
        int threads = Math.min(settings.getParallelism(), partitions.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, namedThreads());
        try {
            List<Future<PartitionOutcome>> futures = new ArrayList<>(partitions.size());
            for (PartitionKey partition : partitions) {
                futures.add(pool.submit(() -> scanOne(partition)));
            }

            List<PartitionOutcome> outcomes = new ArrayList<>(partitions.size());
            for (int i = 0; i < futures.size(); i++) {
                while (true) {
                    try {
                        outcomes.add(await(futures.get(i), partitions.get(i)));
                        break;
                    } catch (InterruptedException e) {
                        // queued partitions see the flag and return at once
                        if (interrupted.compareAndSet(false, true)) {
                            LOG.warn("Scan interrupted, waiting for running partitions to finish");
                        }
                        cancel();
                    }
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private PartitionOutcome scanOne(PartitionKey partition) {
        if (cancelled.get()) {
            return PartitionOutcome.cancelled(partition);
        }
        try {
            List<ValidatedAnomaly> anomalies = reportBuilder.build(partition, provider, settings.fetchDays());
            LOG.debug("Partition {} produced {} anomaly(ies)", partition, anomalies.size());
            return PartitionOutcome.analysed(partition, anomalies);
        } catch (RuntimeException e) {
            LOG.warn("Skipping partition {}: {}", partition, e.getMessage(), e);
            return PartitionOutcome.failed(partition, describe(e));
        }
    }

    private PartitionOutcome await(Future<PartitionOutcome> future, PartitionKey partition)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            LOG.error("Partition {} failed unexpectedly", partition, e.getCause());
            return PartitionOutcome.failed(partition, describe(e.getCause()));
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "partition-scan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------------------------------
    // Per-partition outcome
    // ---------------------------------------------------------------

    private enum Status {
        ANALYSED, FAILED, CANCELLED
    }

    private static final class PartitionOutcome {
        private final PartitionKey partition;
        private final Status status;
        private final List<ValidatedAnomaly> anomalies;
        private final String failure;

        private PartitionOutcome(PartitionKey partition, Status status,
                List<ValidatedAnomaly> anomalies, String failure) {
            this.partition = partition;
            this.status = status;
            this.anomalies = anomalies;
            this.failure = failure;
        }

        static PartitionOutcome analysed(PartitionKey partition, List<ValidatedAnomaly> anomalies) {
            return new PartitionOutcome(partition, Status.ANALYSED, List.copyOf(anomalies), null);
        }

        static PartitionOutcome failed(PartitionKey partition, String failure) {
            return new PartitionOutcome(partition, Status.FAILED, List.of(), failure);
        }

        static PartitionOutcome cancelled(PartitionKey partition) {
            return new PartitionOutcome(partition, Status.CANCELLED, List.of(), null);
        }
    }
}
