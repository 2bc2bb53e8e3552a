package com.volumesentinel.job;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.volumesentinel.core.model.MetricPoint;
import com.volumesentinel.core.model.MetricSeries;
import com.volumesentinel.core.model.PartitionKey;
import com.volumesentinel.core.report.MetricFetchException;
import com.volumesentinel.core.report.MetricSeriesProvider;
import com.volumesentinel.core.report.PartitionCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link MetricSeriesProvider} and {@link PartitionCatalog} backed by a JSON
 * export of daily enrollment records.
 *
 * <h3>Input format</h3>
 *
 * <pre>
 * [
 *   {"date": "2024-03-01", "state": "Kerala", "district": "Kollam",
 *    "age_0_5": 12, "age_5_17": 40, "age_18_greater": 210},
 *   ...
 * ]
 * </pre>
 *
 * <p>
 * The daily value of a partition is the sum of the three age buckets, summed
 * again over every record that shares the partition and date. Malformed
 * records, including rows without a state or district, are logged and dropped
 * so that one bad row does not fail the scan.
 * </p>
 *
 * <h3>Wildcards</h3>
 * <p>
 * The catalog lists district partitions only. {@link #fetch} also accepts
 * keys with a {@code null} component: {@code (state, null)} sums every
 * district of the state and {@code (null, null)} sums the whole file, date by
 * date.
 * </p>
 *
 * <p>
 * The file is read once, on first use, and cached. A failed read is not
 * cached: the next call tries again.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileMetricStore implements MetricSeriesProvider, PartitionCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileMetricStore.class);

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<PartitionKey> PARTITION_ORDER = Comparator
            .comparing(PartitionKey::getState, NULLS_FIRST)
            .thenComparing(PartitionKey::getDistrict, NULLS_FIRST);

    private final Path file;
    private final String metricName;
    private final ObjectMapper mapper;

    private volatile Map<PartitionKey, NavigableMap<LocalDate, Double>> totals;

    /**
     * @param file       JSON array of enrollment records
     * @param metricName name carried by every series this store returns
     */
    public JsonFileMetricStore(Path file, String metricName) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ---------------------------------------------------------------
    // PartitionCatalog
    // ---------------------------------------------------------------

    /**
     * @return every (state, district) pair with at least one valid record,
     *         ordered by state then district
     * @throws MetricFetchException if the file cannot be read
     */
    @Override
    public List<PartitionKey> listPartitions() {
        List<PartitionKey> partitions = new ArrayList<>(totals().keySet());
        partitions.sort(PARTITION_ORDER);
        return partitions;
    }

    // ---------------------------------------------------------------
    // MetricSeriesProvider
    // ---------------------------------------------------------------

    /**
     * @return the latest {@code days} dates recorded for the partition, in
     *         ascending order; empty for an unknown partition. A {@code null}
     *         state or district matches every value of that component.
     * @throws MetricFetchException if the file cannot be read
     */
    @Override
    public MetricSeries fetch(PartitionKey partition, int days) {
        Objects.requireNonNull(partition, "partition must not be null");
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1, got: " + days);
        }

        NavigableMap<LocalDate, Double> daily = dailyTotals(partition);
        if (daily.isEmpty()) {
            LOG.debug("No records for partition {}", partition);
            return MetricSeries.empty(partition, metricName);
        }

        List<MetricPoint> points = new ArrayList<>(Math.min(days, daily.size()));
        for (Map.Entry<LocalDate, Double> entry : daily.descendingMap().entrySet()) {
            if (points.size() == days) {
                break;
            }
            points.add(new MetricPoint(entry.getKey(), entry.getValue()));
        }
        points.sort(Comparator.comparing(MetricPoint::getDate));
        return new MetricSeries(partition, metricName, points);
    }

    private NavigableMap<LocalDate, Double> dailyTotals(PartitionKey partition) {
        Map<PartitionKey, NavigableMap<LocalDate, Double>> all = totals();
        if (partition.getState() != null && partition.getDistrict() != null) {
            NavigableMap<LocalDate, Double> daily = all.get(partition);
            return daily != null ? daily : new TreeMap<>();
        }

        NavigableMap<LocalDate, Double> merged = new TreeMap<>();
        int matched = 0;
        for (Map.Entry<PartitionKey, NavigableMap<LocalDate, Double>> entry : all.entrySet()) {
            if (matches(partition, entry.getKey())) {
                matched++;
                entry.getValue().forEach((date, value) -> merged.merge(date, value, Double::sum));
            }
        }
        LOG.debug("Partition {} covers {} district partition(s)", partition, matched);
        return merged;
    }

    private static boolean matches(PartitionKey pattern, PartitionKey partition) {
        return (pattern.getState() == null || pattern.getState().equals(partition.getState()))
                && (pattern.getDistrict() == null || pattern.getDistrict().equals(partition.getDistrict()));
    }

    // ---------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------

    private Map<PartitionKey, NavigableMap<LocalDate, Double>> totals() {
        Map<PartitionKey, NavigableMap<LocalDate, Double>> loaded = totals;
        if (loaded == null) {
            synchronized (this) {
                loaded = totals;
                if (loaded == null) {
                    loaded = load();
                    totals = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<PartitionKey, NavigableMap<LocalDate, Double>> load() {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new MetricFetchException("Failed to read metrics file " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new MetricFetchException("Metrics file " + file + " must contain a JSON array");
        }

        Map<PartitionKey, NavigableMap<LocalDate, Double>> result = new HashMap<>();
        int dropped = 0;
        int index = 0;
        for (JsonNode node : root) {
            EnrollmentRecord record = parse(node, index++);
            if (record == null) {
                dropped++;
                continue;
            }
            PartitionKey partition = PartitionKey.of(record.getState(), record.getDistrict());
            result.computeIfAbsent(partition, p -> new TreeMap<>())
                    .merge(record.getDate(), record.total(), Double::sum);
        }

        LOG.info("Loaded {} record(s) for {} partition(s) from {}, dropped {} malformed",
                index - dropped, result.size(), file, dropped);
        return result;
    }

    private EnrollmentRecord parse(JsonNode node, int index) {
        EnrollmentRecord record;
        try {
            record = mapper.treeToValue(node, EnrollmentRecord.class);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Dropping record #{} in {}: {}", index, file, e.getMessage());
            return null;
        }
        String problem = record == null ? "not an object" : record.problem();
        if (problem != null) {
            LOG.warn("Dropping record #{} in {}: {}", index, file, problem);
            return null;
        }
        return record;
    }
}
