/**
 * Domain model for Volume Sentinel.
 *
 * <ul>
 * <li>{@link com.volumesentinel.core.model.MetricSeries}: ordered daily
 * observations for one {@link com.volumesentinel.core.model.PartitionKey}</li>
 * <li>{@link com.volumesentinel.core.model.Finding}: a single detector's flag
 * for a single date</li>
 * <li>{@link com.volumesentinel.core.model.ValidatedAnomaly}: alert record
 * confirmed by at least two detection methods</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.model;
