package com.volumesentinel.core.config;

import java.util.List;

/**
 * Parameters of a multi-partition scan.
 *
 * @since 1.0.0
 */
public class ScanSettings {

    public static final String DEFAULT_METRIC_NAME = "daily_enrollments";

    /** Name stamped on every alert produced by the scan. */
    private String metricName = DEFAULT_METRIC_NAME;

    /** Days of data under analysis. */
    private int lookbackDays = 90;

    /**
     * Extra days fetched before the analysis window so the rolling detector
     * has history.
     */
    private int warmupBufferDays = 60;

    /** Worker threads used to scan partitions concurrently. */
    private int parallelism = 4;

    void collectErrors(List<String> errors) {
        if (metricName == null || metricName.isBlank()) {
            errors.add("scan.metricName is required");
        }
        if (lookbackDays < 1) {
            errors.add("scan.lookbackDays must be >= 1, got: " + lookbackDays);
        }
        if (warmupBufferDays < 0) {
            errors.add("scan.warmupBufferDays must be >= 0, got: " + warmupBufferDays);
        }
        if (parallelism < 1) {
            errors.add("scan.parallelism must be >= 1, got: " + parallelism);
        }
    }

    /**
     * @return total number of days a provider should return per partition
     */
    public int fetchDays() {
        return lookbackDays + warmupBufferDays;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
        this.lookbackDays = lookbackDays;
    }

    public int getWarmupBufferDays() {
        return warmupBufferDays;
    }

    public void setWarmupBufferDays(int warmupBufferDays) {
        this.warmupBufferDays = warmupBufferDays;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    @Override
    public String toString() {
        return "ScanSettings{" +
                "metricName='" + metricName + '\'' +
                ", lookbackDays=" + lookbackDays +
                ", warmupBufferDays=" + warmupBufferDays +
                ", parallelism=" + parallelism +
                '}';
    }
}
