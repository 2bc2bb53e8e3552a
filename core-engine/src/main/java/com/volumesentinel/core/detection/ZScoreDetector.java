package com.volumesentinel.core.detection;

import com.volumesentinel.core.config.DetectionSettings;
import com.volumesentinel.core.model.DetectionMethod;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.MetricSeries;
import com.volumesentinel.core.model.ZScoreFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Global z-score detector.
 *
 * <p>
 * Computes the population mean and standard deviation over the whole window
 * and flags every point whose absolute z-score exceeds the threshold.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * Fewer than {@value #MIN_POINTS} points, or a constant series (zero standard
 * deviation), produces no findings.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    static final int MIN_POINTS = 3;

    private final double threshold;

    /**
     * @param threshold minimum |z| (exclusive); must be &gt; 0
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public ZScoreDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public ZScoreDetector(DetectionSettings settings) {
        this(Objects.requireNonNull(settings, "DetectionSettings must not be null").getZscoreThreshold());
    }

    public ZScoreDetector() {
        this(DetectionSettings.DEFAULT_Z_SCORE_THRESHOLD);
    }

    @Override
    public List<Finding> detect(MetricSeries series) {
        Objects.requireNonNull(series, "MetricSeries must not be null");

        if (series.size() < MIN_POINTS) {
            LOG.trace("Series {} has {} point(s), need {}, skipping", series.getPartition(),
                    series.size(), MIN_POINTS);
            return List.of();
        }

        double[] values = series.values();
        double mean = SeriesStatistics.mean(values);
        double stddev = SeriesStatistics.populationStdDev(values, mean);

        if (stddev == 0) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / stddev;
            if (z > threshold) {
                LOG.debug("Z-score fired for {} on {}: value={} mean={} stddev={} z={}",
                        series.getPartition(), series.get(i).getDate(), values[i], mean, stddev, z);
                findings.add(new ZScoreFinding(series.get(i).getDate(), values[i], z));
            }
        }
        return findings;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.Z_SCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
