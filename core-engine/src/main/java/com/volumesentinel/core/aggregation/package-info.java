/**
 * Fan-in of detector findings: grouping by date, multi-method validation,
 * spike/drop classification and severity scoring.
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.aggregation;
