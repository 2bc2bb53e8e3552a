package com.volumesentinel.core.report;

import com.volumesentinel.core.model.ValidatedAnomaly;

import java.util.List;

/**
 * Durable destination for validated anomalies.
 *
 * <p>
 * Must accept an empty list as a no-op. Deduplication across runs, if
 * wanted, belongs to the implementation.
 * </p>
 */
public interface AlertSink {

    /**
     * @param anomalies alerts to store
     * @return how many were stored and how many were not
     */
    SinkResult persist(List<ValidatedAnomaly> anomalies);
}
