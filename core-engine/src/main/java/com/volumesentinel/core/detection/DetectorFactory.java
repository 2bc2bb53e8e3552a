package com.volumesentinel.core.detection;

import com.volumesentinel.core.config.DetectionSettings;
import com.volumesentinel.core.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectionSettings}.
 *
 * <p>
 * This is the single point of extension when adding a detection method:
 * add the {@link DetectionMethod} constant and map it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the detector for one method.
     *
     * @param method   detection method; must not be {@code null}
     * @param settings tuning parameters; must not be {@code null}
     * @return a configured detector
     */
    public static AnomalyDetector create(DetectionMethod method, DetectionSettings settings) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        Objects.requireNonNull(settings, "DetectionSettings must not be null");

        return switch (method) {
            case Z_SCORE -> new ZScoreDetector(settings);
            case IQR -> new IqrDetector(settings);
            case ROLLING_DEVIATION -> new RollingDeviationDetector(settings);
        };
    }

    /**
     * Create one detector per {@link DetectionMethod}, in declaration order.
     *
     * @param settings tuning parameters; must not be {@code null}
     * @return unmodifiable list of detectors
     * @throws IllegalStateException if the settings are invalid
     */
    public static List<AnomalyDetector> createAll(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        settings.validate();
        LOG.info("Creating detectors from {}", settings);
        return Arrays.stream(DetectionMethod.values())
                .map(method -> create(method, settings))
                .toList();
    }
}
