package com.volumesentinel.core.report;

/**
 * Raised by a {@link MetricSeriesProvider} or {@link PartitionCatalog} when
 * the backing store cannot be read.
 */
public class MetricFetchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MetricFetchException(String message) {
        super(message);
    }

    public MetricFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
