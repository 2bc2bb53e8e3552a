package com.volumesentinel.job;

import com.volumesentinel.core.config.SettingsLoader;

import java.util.Objects;

/**
 * Typed, immutable configuration object for the Volume Sentinel scan job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a cron entry, a container {@code -e} flag or a
 * shell environment without a command line.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_METRICS_INPUT_PATH = "METRICS_INPUT_PATH";
    public static final String ENV_ALERTS_OUTPUT_PATH = "ALERTS_OUTPUT_PATH";
    public static final String ENV_SCAN_PARALLELISM = "SCAN_PARALLELISM";
    public static final String ENV_PARTITION_LIMIT = "PARTITION_LIMIT";

    // ---------------------------------------------------------------
    // Engine settings
    // ---------------------------------------------------------------
    private final String engineConfigPath;

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String metricsInputPath;
    private final String alertsOutputPath;

    // ---------------------------------------------------------------
    // Scan overrides (0 = not set)
    // ---------------------------------------------------------------
    private final int scanParallelism;
    private final int partitionLimit;

    private JobConfig(Builder b) {
        this.engineConfigPath = b.engineConfigPath;
        this.metricsInputPath = b.metricsInputPath;
        this.alertsOutputPath = b.alertsOutputPath;
        this.scanParallelism = b.scanParallelism;
        this.partitionLimit = b.partitionLimit;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .engineConfigPath(env(SettingsLoader.ENV_CONFIG_PATH, ""))
                    .metricsInputPath(env(ENV_METRICS_INPUT_PATH, "metrics.json"))
                    .alertsOutputPath(env(ENV_ALERTS_OUTPUT_PATH, "alerts.jsonl"))
                    .scanParallelism(parseIntEnv(ENV_SCAN_PARALLELISM, "0"))
                    .partitionLimit(parseIntEnv(ENV_PARTITION_LIMIT, "0"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return explicit settings file, or an empty string to fall back to
     *         {@link SettingsLoader#load()}
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public String getMetricsInputPath() {
        return metricsInputPath;
    }

    public String getAlertsOutputPath() {
        return alertsOutputPath;
    }

    /**
     * @return parallelism override, or 0 to keep the configured scan parallelism
     */
    public int getScanParallelism() {
        return scanParallelism;
    }

    /**
     * @return maximum number of partitions to scan, or 0 for all
     */
    public int getPartitionLimit() {
        return partitionLimit;
    }

    public boolean hasEngineConfigPath() {
        return !engineConfigPath.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that paths are non-blank and that
     * the numeric overrides are not negative.
     * </p>
     */
    public static class Builder {
        private String engineConfigPath = "";
        private String metricsInputPath = "metrics.json";
        private String alertsOutputPath = "alerts.jsonl";
        private int scanParallelism = 0;
        private int partitionLimit = 0;

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder metricsInputPath(String v) {
            this.metricsInputPath = v;
            return this;
        }

        public Builder alertsOutputPath(String v) {
            this.alertsOutputPath = v;
            return this;
        }

        public Builder scanParallelism(int v) {
            this.scanParallelism = v;
            return this;
        }

        public Builder partitionLimit(int v) {
            this.partitionLimit = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(engineConfigPath, "engineConfigPath required");
            requireNonBlank(metricsInputPath, "metricsInputPath");
            requireNonBlank(alertsOutputPath, "alertsOutputPath");

            if (scanParallelism < 0) {
                throw new IllegalArgumentException(
                        "scanParallelism must be >= 0, got: " + scanParallelism);
            }
            if (partitionLimit < 0) {
                throw new IllegalArgumentException(
                        "partitionLimit must be >= 0, got: " + partitionLimit);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "engineConfigPath='" + engineConfigPath + '\'' +
                ", metricsInputPath='" + metricsInputPath + '\'' +
                ", alertsOutputPath='" + alertsOutputPath + '\'' +
                ", scanParallelism=" + scanParallelism +
                ", partitionLimit=" + partitionLimit +
                '}';
    }
}
