package com.volumesentinel.core.report;

import com.volumesentinel.core.model.PartitionKey;

import java.util.List;

/**
 * Enumerates the partitions a scheduled scan should cover.
 */
public interface PartitionCatalog {

    /**
     * @return distinct partitions in a stable order
     * @throws MetricFetchException if the backing store cannot be read
     */
    List<PartitionKey> listPartitions();
}
