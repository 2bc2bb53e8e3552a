package com.volumesentinel.core.model;

import java.time.LocalDate;

/**
 * Rolling-deviation finding. Carries the trailing mean the point was compared
 * against and the relative deviation from it.
 */
public final class RollingDeviationFinding extends Finding {

    private final double rollingMean;
    private final double deviationFraction;

    public RollingDeviationFinding(LocalDate date, double value, double rollingMean,
            double deviationFraction) {
        super(date, value);
        this.rollingMean = rollingMean;
        this.deviationFraction = deviationFraction;
    }

    public double getRollingMean() {
        return rollingMean;
    }

    /**
     * @return {@code |value - rollingMean| / |rollingMean|}
     */
    public double getDeviationFraction() {
        return deviationFraction;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ROLLING_DEVIATION;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o))
            return false;
        RollingDeviationFinding that = (RollingDeviationFinding) o;
        return Double.compare(rollingMean, that.rollingMean) == 0
                && Double.compare(deviationFraction, that.deviationFraction) == 0;
    }

    @Override
    public int hashCode() {
        int result = super.hashCode();
        result = 31 * result + Double.hashCode(rollingMean);
        return 31 * result + Double.hashCode(deviationFraction);
    }

    @Override
    public String toString() {
        return String.format("RollingDeviationFinding{date=%s, value=%.2f, rollingMean=%.2f, deviation=%.3f}",
                getDate(), getValue(), rollingMean, deviationFraction);
    }
}
