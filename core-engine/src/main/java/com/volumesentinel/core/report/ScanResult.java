package com.volumesentinel.core.report;

import com.volumesentinel.core.model.PartitionKey;
import com.volumesentinel.core.model.ValidatedAnomaly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link PartitionScanner#scan(List)} run.
 *
 * <p>
 * Every input partition ends up in exactly one of three groups: analysed
 * ({@link #getAnomaliesByPartition()}, possibly with an empty list), skipped
 * after a failure ({@link #getSkippedPartitions()}), or not started because
 * the scan was cancelled ({@link #getCancelledPartitions()}).
 * </p>
 *
 * @since 1.0.0
 */
public final class ScanResult {

    private final Map<PartitionKey, List<ValidatedAnomaly>> anomaliesByPartition;
    private final Map<PartitionKey, String> skippedPartitions;
    private final List<PartitionKey> cancelledPartitions;
    private final int persistedCount;
    private final int unpersistedCount;

    ScanResult(Map<PartitionKey, List<ValidatedAnomaly>> anomaliesByPartition,
            Map<PartitionKey, String> skippedPartitions,
            List<PartitionKey> cancelledPartitions,
            int persistedCount,
            int unpersistedCount) {
        this.anomaliesByPartition = Collections.unmodifiableMap(new LinkedHashMap<>(anomaliesByPartition));
        this.skippedPartitions = Collections.unmodifiableMap(new LinkedHashMap<>(skippedPartitions));
        this.cancelledPartitions = List.copyOf(cancelledPartitions);
        this.persistedCount = persistedCount;
        this.unpersistedCount = unpersistedCount;
    }

    /**
     * @return analysed partitions, in input order, with their anomalies
     */
    public Map<PartitionKey, List<ValidatedAnomaly>> getAnomaliesByPartition() {
        return anomaliesByPartition;
    }

    /**
     * @return failed partitions, in input order, with the failure message
     */
    public Map<PartitionKey, String> getSkippedPartitions() {
        return skippedPartitions;
    }

    public List<PartitionKey> getCancelledPartitions() {
        return cancelledPartitions;
    }

    /**
     * @return every anomaly found, grouped by partition in input order and by
     *         date within a partition
     */
    public List<ValidatedAnomaly> allAnomalies() {
        List<ValidatedAnomaly> all = new ArrayList<>();
        anomaliesByPartition.values().forEach(all::addAll);
        return all;
    }

    public int getPersistedCount() {
        return persistedCount;
    }

    /**
     * @return alerts the sink reported as failed or never acknowledged
     */
    public int getUnpersistedCount() {
        return unpersistedCount;
    }

    public boolean hasUnpersistedAlerts() {
        return unpersistedCount > 0;
    }

    @Override
    public String toString() {
        return "ScanResult{" +
                "analysed=" + anomaliesByPartition.size() +
                ", skipped=" + skippedPartitions.size() +
                ", cancelled=" + cancelledPartitions.size() +
                ", anomalies=" + anomaliesByPartition.values().stream().mapToInt(List::size).sum() +
                ", persisted=" + persistedCount +
                ", unpersisted=" + unpersistedCount +
                '}';
    }
}
