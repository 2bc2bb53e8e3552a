/**
 * Orchestration of the detection pipeline and its external collaborators.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.volumesentinel.core.report.AnomalyReportBuilder}: one
 * series in, date-ordered validated anomalies out</li>
 * <li>{@link com.volumesentinel.core.report.PartitionScanner}: bounded,
 * failure-isolated scan over many partitions</li>
 * <li>{@link com.volumesentinel.core.report.MetricSeriesProvider},
 * {@link com.volumesentinel.core.report.PartitionCatalog},
 * {@link com.volumesentinel.core.report.AlertSink}: injected I/O
 * boundaries</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.report;
