package com.volumesentinel.job;

import com.volumesentinel.core.config.EngineSettings;
import com.volumesentinel.core.config.SettingsLoader;
import com.volumesentinel.core.model.PartitionKey;
import com.volumesentinel.core.report.AnomalyReportBuilder;
import com.volumesentinel.core.report.PartitionScanner;
import com.volumesentinel.core.report.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Main entry point for the Volume Sentinel daily scan.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   metrics JSON file
 *     → JsonFileMetricStore (partition catalog + series provider)
 *     → PartitionScanner (bounded pool, one report per partition)
 *     → JsonLinesAlertSink
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * File locations and overrides come from environment variables via
 * {@link JobConfig}; detector and scan tuning from {@link SettingsLoader}.
 * </p>
 *
 * <h3>Exit status</h3>
 * <p>
 * The process exits with status 1 when the sink could not store every alert,
 * so a scheduler can retry the run. Skipped partitions are logged but do not
 * change the exit status.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyScanJob {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyScanJob.class);

    static final int EXIT_UNPERSISTED = 1;

    private AnomalyScanJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Volume Sentinel scan with config: {}", config);

        // 2. Scan, stopping new partitions on shutdown
        ScanResult result = run(config, scanner -> Runtime.getRuntime()
                .addShutdownHook(new Thread(scanner::cancel, "scan-shutdown")));

        // 3. Report
        if (result.hasUnpersistedAlerts()) {
            LOG.error("{} alert(s) were not persisted", result.getUnpersistedCount());
            System.exit(EXIT_UNPERSISTED);
        }
    }

    // ---------------------------------------------------------------
    // Scan assembly (extracted for testability)
    // ---------------------------------------------------------------

    /**
     * Run one scan over every partition in the metrics file.
     */
    static ScanResult run(JobConfig config) {
        return run(config, scanner -> { });
    }

    /**
     * Run one scan, handing the scanner to {@code onStart} before scanning so
     * the caller can wire up cancellation.
     */
    static ScanResult run(JobConfig config, Consumer<PartitionScanner> onStart) {
        EngineSettings settings = loadSettings(config);

        JsonFileMetricStore store = new JsonFileMetricStore(
                Path.of(config.getMetricsInputPath()), settings.getScan().getMetricName());
        JsonLinesAlertSink sink = new JsonLinesAlertSink(Path.of(config.getAlertsOutputPath()));
        AnomalyReportBuilder reportBuilder = new AnomalyReportBuilder(settings.getDetection());

        PartitionScanner scanner = new PartitionScanner(store, sink, reportBuilder, settings.getScan());
        onStart.accept(scanner);

        List<PartitionKey> partitions = selectPartitions(store.listPartitions(), config.getPartitionLimit());
        ScanResult result = scanner.scan(partitions);

        LOG.info("Scanned {} partition(s): {} analysed, {} skipped, {} cancelled, {} alert(s) written to {}",
                partitions.size(),
                result.getAnomaliesByPartition().size(),
                result.getSkippedPartitions().size(),
                result.getCancelledPartitions().size(),
                result.getPersistedCount(),
                sink.getOutput());
        result.getSkippedPartitions().forEach((partition, reason) ->
                LOG.warn("Partition {} was skipped: {}", partition, reason));
        return result;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static EngineSettings loadSettings(JobConfig config) {
        EngineSettings settings = config.hasEngineConfigPath()
                ? SettingsLoader.fromFile(config.getEngineConfigPath())
                : SettingsLoader.load();

        if (config.getScanParallelism() > 0) {
            LOG.info("Overriding scan parallelism {} -> {}",
                    settings.getScan().getParallelism(), config.getScanParallelism());
            settings.getScan().setParallelism(config.getScanParallelism());
        }
        return settings;
    }

    static List<PartitionKey> selectPartitions(List<PartitionKey> partitions, int limit) {
        if (limit > 0 && partitions.size() > limit) {
            LOG.info("Limiting scan to the first {} of {} partition(s)", limit, partitions.size());
            return List.copyOf(partitions.subList(0, limit));
        }
        return partitions;
    }
}
