package com.volumesentinel.core.detection;

import com.volumesentinel.core.model.DetectionMethod;
import com.volumesentinel.core.model.Finding;
import com.volumesentinel.core.model.MetricSeries;

import java.util.List;

/**
 * Contract for all series detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: each call to
 * {@link #detect(MetricSeries)} looks only at the series it is given, so one
 * instance may be shared across threads and partitions.
 * </p>
 * <p>
 * A series that is too short for the method, or whose statistics are
 * degenerate (zero spread, zero baseline), yields an empty list. Detectors
 * never throw for such input.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate every point of the series.
     *
     * @param series the series to scan; must not be {@code null}
     * @return findings in series order, possibly empty
     */
    List<Finding> detect(MetricSeries series);

    /**
     * @return the method whose findings this detector produces
     */
    DetectionMethod getMethod();
}
