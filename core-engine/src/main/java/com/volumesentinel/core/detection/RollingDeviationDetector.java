package com.volumesentinel.core.detection;

import com.volumesentinel.core.config.DetectionSettings;
import com.volumesentinel.core.model.DetectionMethod;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.MetricSeries;
import com.volumesentinel.core.model.RollingDeviationFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Trailing moving-average deviation detector.
 *
 * <p>
 * For every position {@code i >= window} the baseline is the mean of the
 * {@code window} points before it ({@code i - window .. i - 1}). A point is
 * flagged when {@code |value - baseline| / |baseline|} exceeds the deviation
 * threshold (default 0.5, i.e. 50%). The evaluated point is not part of its
 * own baseline, unlike an inclusive trailing mean such as pandas
 * {@code rolling(window).mean()}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * The first {@code window} positions have no baseline and are never flagged.
 * A series shorter than the window produces no findings at all, so providers
 * fetch a warm-up buffer ahead of the analysis window.
 * </p>
 *
 * <h3>Zero baseline</h3>
 * <p>
 * When the trailing mean is exactly zero the relative deviation is undefined
 * and the point is excluded.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingDeviationDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RollingDeviationDetector.class);

    private final int window;
    private final double deviationThreshold;

    /**
     * @param window             number of preceding points in the baseline;
     *                           must be &gt;= 1
     * @param deviationThreshold minimum relative deviation (exclusive); must be
     *                           &gt; 0
     * @throws IllegalArgumentException if either argument is out of range
     */
    public RollingDeviationDetector(int window, double deviationThreshold) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got: " + window);
        }
        if (!(deviationThreshold > 0)) {
            throw new IllegalArgumentException(
                    "deviationThreshold must be > 0, got: " + deviationThreshold);
        }
        this.window = window;
        this.deviationThreshold = deviationThreshold;
    }

    public RollingDeviationDetector(DetectionSettings settings) {
        this(Objects.requireNonNull(settings, "DetectionSettings must not be null").getRollingWindow(),
                settings.getRollingDeviationThreshold());
    }

    public RollingDeviationDetector() {
        this(DetectionSettings.DEFAULT_ROLLING_WINDOW, DetectionSettings.DEFAULT_ROLLING_DEVIATION_THRESHOLD);
    }

    @Override
    public List<Finding> detect(MetricSeries series) {
        Objects.requireNonNull(series, "MetricSeries must not be null");

        if (series.size() < window) {
            LOG.trace("Series {} has {} point(s), window is {}, skipping", series.getPartition(),
                    series.size(), window);
            return List.of();
        }

        double[] values = series.values();
        List<Finding> findings = new ArrayList<>();

        for (int i = window; i < values.length; i++) {
            double rollingMean = SeriesStatistics.mean(values, i - window, i);
            if (rollingMean == 0) {
                LOG.trace("Zero baseline for {} on {}, excluded", series.getPartition(),
                        series.get(i).getDate());
                continue;
            }

            double deviation = Math.abs(values[i] - rollingMean) / Math.abs(rollingMean);
            if (deviation > deviationThreshold) {
                LOG.debug("Rolling deviation fired for {} on {}: value={} rollingMean={} deviation={}",
                        series.getPartition(), series.get(i).getDate(), values[i], rollingMean, deviation);
                findings.add(new RollingDeviationFinding(
                        series.get(i).getDate(), values[i], rollingMean, deviation));
            }
        }
        return findings;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ROLLING_DEVIATION;
    }

    public int getWindow() {
        return window;
    }

    public double getDeviationThreshold() {
        return deviationThreshold;
    }
}
