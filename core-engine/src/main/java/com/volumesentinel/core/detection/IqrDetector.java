package com.volumesentinel.core.detection;

import com.volumesentinel.core.config.DetectionSettings;
import com.volumesentinel.core.model.DetectionMethod;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.IqrFinding;
import com.volumesentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Interquartile-range (Tukey fence) detector.
 *
 * <p>
 * Flags points strictly outside {@code [Q1 - k·IQR, Q3 + k·IQR]}, where the
 * quartiles are linearly interpolated over the whole window and {@code k}
 * defaults to 1.5. Needs at least {@value #MIN_POINTS} points.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrDetector.class);

    static final int MIN_POINTS = 5;

    private final double multiplier;

    /**
     * @param multiplier fence width in IQRs; must be &gt; 0
     * @throws IllegalArgumentException if {@code multiplier} is not positive
     */
    public IqrDetector(double multiplier) {
        if (!(multiplier > 0)) {
            throw new IllegalArgumentException("multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    public IqrDetector(DetectionSettings settings) {
        this(Objects.requireNonNull(settings, "DetectionSettings must not be null").getIqrMultiplier());
    }

    public IqrDetector() {
        this(DetectionSettings.DEFAULT_IQR_MULTIPLIER);
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
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double q1 = SeriesStatistics.sortedPercentile(sorted, 0.25);
        double q3 = SeriesStatistics.sortedPercentile(sorted, 0.75);
        double iqr = q3 - q1;
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;

        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] < lowerBound || values[i] > upperBound) {
                LOG.debug("IQR fired for {} on {}: value={} bounds=[{}, {}]",
                        series.getPartition(), series.get(i).getDate(), values[i], lowerBound, upperBound);
                findings.add(new IqrFinding(series.get(i).getDate(), values[i], lowerBound, upperBound));
            }
        }
        return findings;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.IQR;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
