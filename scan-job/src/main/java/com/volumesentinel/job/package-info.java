/**
 * Batch entry point that scans a metrics export and writes alerts.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.volumesentinel.job.AnomalyScanJob}: {@code main}</li>
 * <li>{@link com.volumesentinel.job.JobConfig}: environment-driven job
 * settings</li>
 * <li>{@link com.volumesentinel.job.JsonFileMetricStore}: partitions and
 * series from a JSON file</li>
 * <li>{@link com.volumesentinel.job.JsonLinesAlertSink}: alerts as JSON
 * lines</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.volumesentinel.job;
