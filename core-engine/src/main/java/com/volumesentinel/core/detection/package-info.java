/**
 * Independent statistical detectors.
 *
 * <p>
 * Every detector implements
 * {@link com.volumesentinel.core.detection.AnomalyDetector} and is created via
 * {@link com.volumesentinel.core.detection.DetectorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.volumesentinel.core.detection.ZScoreDetector}: distance from
 * the window mean in standard deviations</li>
 * <li>{@link com.volumesentinel.core.detection.IqrDetector}: Tukey fences
 * around the quartiles</li>
 * <li>{@link com.volumesentinel.core.detection.RollingDeviationDetector}:
 * relative deviation from a trailing moving average</li>
 * </ul>
 *
 * <p>
 * A single detector's finding is only a candidate. See
 * {@link com.volumesentinel.core.aggregation.FindingAggregator} for the
 * cross-validation step.
 * </p>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.detection;
