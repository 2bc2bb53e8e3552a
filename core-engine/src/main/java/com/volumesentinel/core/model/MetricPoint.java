package com.volumesentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One observation of a daily count metric.
 *
 * @since 1.0.0
 */
public final class MetricPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDate date;
    private final double value;

    /**
     * @param date  observation date; must not be {@code null}
     * @param value observed value; must be finite
     * @throws NullPointerException     if {@code date} is {@code null}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public MetricPoint(LocalDate date, double value) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "value must be finite for " + date + ", got: " + value);
        }
        this.value = value;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value);
    }

    @Override
    public String toString() {
        return date + "=" + value;
    }
}
