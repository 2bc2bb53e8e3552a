package com.volumesentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One detector's verdict on one date.
 *
 * <p>
 * Each concrete subclass carries the statistics its method computed, so the
 * aggregator can read them without string lookups. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class Finding {

    private final LocalDate date;
    private final double value;

    protected Finding(LocalDate date, double value) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return the method that produced this finding
     */
    public abstract DetectionMethod getMethod();

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Finding that = (Finding) o;
        return Double.compare(value, that.value) == 0 && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getMethod(), date, value);
    }
}
