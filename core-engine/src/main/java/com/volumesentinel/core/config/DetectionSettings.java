package com.volumesentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning parameters for the three detectors.
 *
 * <p>
 * Defaults reproduce the production policy: z-score above 3, Tukey fences at
 * 1.5 IQR, and a 50% deviation from a 30-day trailing mean.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    public static final double DEFAULT_Z_SCORE_THRESHOLD = 3.0;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    public static final int DEFAULT_ROLLING_WINDOW = 30;
    public static final double DEFAULT_ROLLING_DEVIATION_THRESHOLD = 0.5;

    /** Minimum |z| (exclusive) for a z-score finding. */
    private double zscoreThreshold = DEFAULT_Z_SCORE_THRESHOLD;

    /** Fence width in multiples of the interquartile range. */
    private double iqrMultiplier = DEFAULT_IQR_MULTIPLIER;

    /** Number of preceding points in the trailing mean. */
    private int rollingWindow = DEFAULT_ROLLING_WINDOW;

    /** Minimum relative deviation (exclusive) from the trailing mean. */
    private double rollingDeviationThreshold = DEFAULT_ROLLING_DEVIATION_THRESHOLD;

    /**
     * Collect validation errors into {@code errors}.
     *
     * @param errors sink for human-readable messages
     */
    void collectErrors(List<String> errors) {
        if (!(zscoreThreshold > 0)) {
            errors.add("detection.zscoreThreshold must be > 0, got: " + zscoreThreshold);
        }
        if (!(iqrMultiplier > 0)) {
            errors.add("detection.iqrMultiplier must be > 0, got: " + iqrMultiplier);
        }
        if (rollingWindow < 1) {
            errors.add("detection.rollingWindow must be >= 1, got: " + rollingWindow);
        }
        if (!(rollingDeviationThreshold > 0)) {
            errors.add("detection.rollingDeviationThreshold must be > 0, got: "
                    + rollingDeviationThreshold);
        }
    }

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid detection settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public int getRollingWindow() {
        return rollingWindow;
    }

    public void setRollingWindow(int rollingWindow) {
        this.rollingWindow = rollingWindow;
    }

    public double getRollingDeviationThreshold() {
        return rollingDeviationThreshold;
    }

    public void setRollingDeviationThreshold(double rollingDeviationThreshold) {
        this.rollingDeviationThreshold = rollingDeviationThreshold;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "zscoreThreshold=" + zscoreThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                ", rollingWindow=" + rollingWindow +
                ", rollingDeviationThreshold=" + rollingDeviationThreshold +
                '}';
    }
}
