package com.volumesentinel.core.detection;

import java.util.Arrays;

/**
 * Descriptive statistics shared by the detectors.
 *
 * <p>
 * Standard deviation is the population form (divide by n): the detectors
 * look at the whole fetched window, not a sample of it.
 * </p>
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
        // utility class, not instantiable
    }

    /**
     * Mean of {@code values[from, to)}.
     *
     * @throws IllegalArgumentException if the range is empty
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            throw new IllegalArgumentException("Empty range [" + from + ", " + to + ")");
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    public static double populationStdDev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Percentile with linear interpolation between the two closest ranks, at
     * zero-based position {@code p * (n - 1)} of the sorted values.
     *
     * @param values unsorted input; not modified
     * @param p      fraction in [0, 1]
     * @return the interpolated percentile
     * @throws IllegalArgumentException if {@code values} is empty or {@code p}
     *                                  is outside [0, 1]
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take a percentile of no values");
        }
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("p must be in [0, 1], got: " + p);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sortedPercentile(sorted, p);
    }

    static double sortedPercentile(double[] sorted, double p) {
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
