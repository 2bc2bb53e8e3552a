package com.volumesentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ValidatedAnomaly}.
 */
class ValidatedAnomalyTest {

    @Test
    @DisplayName("Should reject a single detection method")
    void shouldRejectSingleMethod() {
        ValidatedAnomaly.Builder builder = validBuilder()
                .detectionMethods(Set.of(DetectionMethod.IQR));

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("detection methods");
    }

    @Test
    @DisplayName("Should reject severity outside [0, 10]")
    void shouldRejectSeverityOutOfRange() {
        assertThatThrownBy(() -> validBuilder().severityScore(10.01).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validBuilder().severityScore(-0.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> validBuilder().severityScore(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should require partition and date")
    void shouldRequireMandatoryFields() {
        assertThatThrownBy(() -> validBuilder().partition(null).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("partition");
        assertThatThrownBy(() -> validBuilder().date(null).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should list methods in declaration order regardless of input order")
    void shouldOrderMethods() {
        ValidatedAnomaly anomaly = validBuilder()
                .detectionMethods(List.of(DetectionMethod.ROLLING_DEVIATION, DetectionMethod.Z_SCORE))
                .build();

        assertThat(anomaly.getDetectionMethodNames()).containsExactly("z_score", "rolling_deviation");
    }

    @Test
    @DisplayName("Should serialize to the persisted alert shape")
    void shouldSerializeToAlertShape() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(validBuilder().build()));

        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactly("date", "metric_name", "value", "severity_score",
                "anomaly_type", "detection_methods", "state", "district");
        assertThat(json.get("date").asText()).isEqualTo("2024-02-20");
        assertThat(json.get("metric_name").asText()).isEqualTo("daily_enrollments");
        assertThat(json.get("value").asDouble()).isEqualTo(200.0);
        assertThat(json.get("severity_score").asDouble()).isEqualTo(8.95);
        assertThat(json.get("anomaly_type").asText()).isEqualTo("spike");
        assertThat(json.get("detection_methods").get(0).asText()).isEqualTo("z_score");
        assertThat(json.get("detection_methods").get(1).asText()).isEqualTo("iqr");
        assertThat(json.get("state").asText()).isEqualTo("S1");
        assertThat(json.get("district").isNull()).isTrue();
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private ValidatedAnomaly.Builder validBuilder() {
        return ValidatedAnomaly.builder()
                .date(LocalDate.of(2024, 2, 20))
                .metricName("daily_enrollments")
                .value(200.0)
                .severityScore(8.95)
                .anomalyType(AnomalyType.SPIKE)
                .detectionMethods(EnumSet.of(DetectionMethod.Z_SCORE, DetectionMethod.IQR))
                .partition(PartitionKey.of("S1", null));
    }
}
