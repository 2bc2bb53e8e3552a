package com.volumesentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * detection:
 *   zscoreThreshold: 3.0
 *   iqrMultiplier: 1.5
 *   rollingWindow: 30
 *   rollingDeviationThreshold: 0.5
 * scan:
 *   metricName: daily_enrollments
 *   lookbackDays: 90
 *   warmupBufferDays: 60
 *   parallelism: 4
 * </pre>
 *
 * @since 1.0.0
 */
public class EngineSettings {

    private DetectionSettings detection = new DetectionSettings();
    private ScanSettings scan = new ScanSettings();

    public DetectionSettings getDetection() {
        return detection;
    }

    /**
     * @param detection detection section; {@code null} restores defaults
     */
    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public ScanSettings getScan() {
        return scan;
    }

    /**
     * @param scan scan section; {@code null} restores defaults
     */
    public void setScan(ScanSettings scan) {
        this.scan = scan != null ? scan : new ScanSettings();
    }

    /**
     * Validate both sections, reporting every problem in one exception.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        detection.collectErrors(errors);
        scan.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{detection=" + detection + ", scan=" + scan + '}';
    }
}
