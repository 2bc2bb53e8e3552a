package com.volumesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Alert record for a date flagged by at least two independent detection
 * methods, after direction classification and severity scoring.
 *
 * <p>
 * Serialized by Jackson in the persisted alert shape:
 * </p>
 *
 * <pre>
 * {"date":"2024-02-20","metric_name":"daily_enrollments","value":200.0,
 *  "severity_score":8.94,"anomaly_type":"spike",
 *  "detection_methods":["z_score","iqr","rolling_deviation"],
 *  "state":"S1","district":"D1"}
 * </pre>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. It rejects a missing date, metric name, type or
 * partition, fewer than {@value #MIN_METHODS} distinct detection methods, and
 * a severity outside [{@value #MIN_SEVERITY}, {@value #MAX_SEVERITY}].
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "date", "metric_name", "value", "severity_score", "anomaly_type",
        "detection_methods", "state", "district" })
public final class ValidatedAnomaly {

    public static final int MIN_METHODS = 2;
    public static final double MIN_SEVERITY = 0.0;
    public static final double MAX_SEVERITY = 10.0;

    private final LocalDate date;
    private final String metricName;
    private final double value;
    private final double severityScore;
    private final AnomalyType anomalyType;
    private final Set<DetectionMethod> detectionMethods;
    private final PartitionKey partition;

    private ValidatedAnomaly(Builder builder) {
        this.date = Objects.requireNonNull(builder.date, "date must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.partition = Objects.requireNonNull(builder.partition, "partition must not be null");
        this.value = builder.value;

        if (!(builder.severityScore >= MIN_SEVERITY && builder.severityScore <= MAX_SEVERITY)) {
            throw new IllegalArgumentException(
                    "severityScore must be in [0, 10], got: " + builder.severityScore);
        }
        this.severityScore = builder.severityScore;

        if (builder.detectionMethods.size() < MIN_METHODS) {
            throw new IllegalArgumentException(
                    "At least " + MIN_METHODS + " detection methods required, got: "
                            + builder.detectionMethods);
        }
        this.detectionMethods = Collections.unmodifiableSet(EnumSet.copyOf(builder.detectionMethods));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ValidatedAnomaly} instances.
     */
    public static class Builder {
        private LocalDate date;
        private String metricName;
        private double value;
        private double severityScore;
        private AnomalyType anomalyType;
        private final Set<DetectionMethod> detectionMethods = EnumSet.noneOf(DetectionMethod.class);
        private PartitionKey partition;

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder severityScore(double severityScore) {
            this.severityScore = severityScore;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder detectionMethods(Collection<DetectionMethod> methods) {
            this.detectionMethods.clear();
            this.detectionMethods.addAll(methods);
            return this;
        }

        public Builder partition(PartitionKey partition) {
            this.partition = partition;
            return this;
        }

        /**
         * @return a new {@link ValidatedAnomaly}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if severity or method count is invalid
         */
        public ValidatedAnomaly build() {
            return new ValidatedAnomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    public LocalDate getDate() {
        return date;
    }

    @JsonProperty("metric_name")
    public String getMetricName() {
        return metricName;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @JsonProperty("severity_score")
    public double getSeverityScore() {
        return severityScore;
    }

    @JsonProperty("anomaly_type")
    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    /**
     * @return unmodifiable set, iterated in {@link DetectionMethod} declaration
     *         order
     */
    @JsonIgnore
    public Set<DetectionMethod> getDetectionMethods() {
        return detectionMethods;
    }

    /**
     * @return wire names of the detection methods, in declaration order
     */
    @JsonProperty("detection_methods")
    public List<String> getDetectionMethodNames() {
        return detectionMethods.stream()
                .map(DetectionMethod::getWireName)
                .toList();
    }

    @JsonIgnore
    public PartitionKey getPartition() {
        return partition;
    }

    @JsonProperty("state")
    public String getState() {
        return partition.getState();
    }

    @JsonProperty("district")
    public String getDistrict() {
        return partition.getDistrict();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidatedAnomaly that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(severityScore, that.severityScore) == 0
                && date.equals(that.date)
                && metricName.equals(that.metricName)
                && anomalyType == that.anomalyType
                && detectionMethods.equals(that.detectionMethods)
                && partition.equals(that.partition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, metricName, value, severityScore, anomalyType, detectionMethods, partition);
    }

    @Override
    public String toString() {
        return "ValidatedAnomaly{" +
                "date=" + date +
                ", partition=" + partition +
                ", metricName='" + metricName + '\'' +
                ", value=" + value +
                ", severityScore=" + severityScore +
                ", anomalyType=" + anomalyType +
                ", detectionMethods=" + detectionMethods +
                '}';
    }
}
