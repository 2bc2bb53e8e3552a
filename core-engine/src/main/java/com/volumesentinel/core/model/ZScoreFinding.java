package com.volumesentinel.core.model;

import java.time.LocalDate;

/**
 * Z-score finding. Carries the absolute z-score of the flagged point.
 */
public final class ZScoreFinding extends Finding {

    private final double zScore;

    public ZScoreFinding(LocalDate date, double value, double zScore) {
        super(date, value);
        this.zScore = zScore;
    }

    /**
     * @return {@code |value - mean| / stddev}, always non-negative
     */
    public double getZScore() {
        return zScore;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.Z_SCORE;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Double.compare(zScore, ((ZScoreFinding) o).zScore) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Double.hashCode(zScore);
    }

    @Override
    public String toString() {
        return String.format("ZScoreFinding{date=%s, value=%.2f, zScore=%.3f}",
                getDate(), getValue(), zScore);
    }
}
