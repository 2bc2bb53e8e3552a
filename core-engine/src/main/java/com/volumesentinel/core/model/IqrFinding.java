package com.volumesentinel.core.model;

import java.time.LocalDate;

/**
 * IQR finding. Carries the fences the point fell outside of.
 */
public final class IqrFinding extends Finding {

    private final double lowerBound;
    private final double upperBound;

    public IqrFinding(LocalDate date, double value, double lowerBound, double upperBound) {
        super(date, value);
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.IQR;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o))
            return false;
        IqrFinding that = (IqrFinding) o;
        return Double.compare(lowerBound, that.lowerBound) == 0
                && Double.compare(upperBound, that.upperBound) == 0;
    }

    @Override
    public int hashCode() {
        int result = super.hashCode();
        result = 31 * result + Double.hashCode(lowerBound);
        return 31 * result + Double.hashCode(upperBound);
    }

    @Override
    public String toString() {
        return String.format("IqrFinding{date=%s, value=%.2f, bounds=[%.2f, %.2f]}",
                getDate(), getValue(), lowerBound, upperBound);
    }
}
