package com.volumesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, read-only sequence of {@link MetricPoint}s for one partition and
 * one metric.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>Dates are strictly ascending. Callers sort before constructing.</li>
 * <li>Every value is finite (enforced by {@link MetricPoint}).</li>
 * </ul>
 *
 * <p>
 * A series is built once per detection run and discarded afterwards. It may be
 * empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final PartitionKey partition;
    private final String metricName;
    private final List<MetricPoint> points;

    /**
     * @param partition  partition the series belongs to; must not be {@code null}
     * @param metricName name of the metric; must not be {@code null}
     * @param points     observations in strictly ascending date order; must not be
     *                   {@code null}
     * @throws IllegalArgumentException if the dates are not strictly ascending
     */
    public MetricSeries(PartitionKey partition, String metricName, List<MetricPoint> points) {
        this.partition = Objects.requireNonNull(partition, "partition must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(points, "points must not be null");

        List<MetricPoint> copy = new ArrayList<>(points.size());
        MetricPoint previous = null;
        for (MetricPoint point : points) {
            Objects.requireNonNull(point, "points must not contain null");
            if (previous != null && !point.getDate().isAfter(previous.getDate())) {
                throw new IllegalArgumentException(
                        "Dates must be strictly ascending in series " + partition + "/" + metricName
                                + ": " + point.getDate() + " follows " + previous.getDate());
            }
            copy.add(point);
            previous = point;
        }
        this.points = Collections.unmodifiableList(copy);
    }

    /**
     * Empty series for a partition that returned no data.
     */
    public static MetricSeries empty(PartitionKey partition, String metricName) {
        return new MetricSeries(partition, metricName, List.of());
    }

    public PartitionKey getPartition() {
        return partition;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return unmodifiable view of the points
     */
    public List<MetricPoint> getPoints() {
        return points;
    }

    public MetricPoint get(int index) {
        return points.get(index);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return a fresh array with the values in series order
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /**
     * Arithmetic mean over the whole series.
     *
     * @return the mean, or {@code NaN} when the series is empty
     */
    public double mean() {
        if (points.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0;
        for (MetricPoint point : points) {
            sum += point.getValue();
        }
        return sum / points.size();
    }

    @Override
    public String toString() {
        return "MetricSeries{" +
                "partition=" + partition +
                ", metricName='" + metricName + '\'' +
                ", size=" + points.size() +
                '}';
    }
}
