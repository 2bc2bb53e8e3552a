package com.volumesentinel.core.report;

import com.volumesentinel.core.model.MetricSeries;
import com.volumesentinel.core.model.PartitionKey;

/**
 * Source of raw metric series, one partition at a time.
 *
 * <p>
 * Implementations return points in ascending date order with no missing
 * values, covering {@code days} days ending at the latest available date.
 * Callers add a warm-up buffer to the analysis window themselves (see
 * {@link com.volumesentinel.core.config.ScanSettings#fetchDays()}). An unknown
 * partition yields an empty series.
 * </p>
 *
 * <p>
 * Timeouts and retries are the implementation's concern.
 * </p>
 */
public interface MetricSeriesProvider {

    /**
     * @param partition partition to fetch
     * @param days      number of most recent days to return
     * @return the series, possibly empty, never {@code null}
     * @throws MetricFetchException if the backing store cannot be read
     */
    MetricSeries fetch(PartitionKey partition, int days);
}
