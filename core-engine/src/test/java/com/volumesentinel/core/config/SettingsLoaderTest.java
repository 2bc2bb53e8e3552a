package com.volumesentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SettingsLoader}.
 */
class SettingsLoaderTest {

    @Test
    @DisplayName("Should load every section from classpath")
    void shouldLoadFromClasspath() {
        EngineSettings settings = SettingsLoader.fromClasspath("test-engine.yml");

        DetectionSettings detection = settings.getDetection();
        assertThat(detection.getZscoreThreshold()).isEqualTo(2.5);
        assertThat(detection.getIqrMultiplier()).isEqualTo(3.0);
        assertThat(detection.getRollingWindow()).isEqualTo(14);
        assertThat(detection.getRollingDeviationThreshold()).isEqualTo(0.4);

        ScanSettings scan = settings.getScan();
        assertThat(scan.getMetricName()).isEqualTo("daily_biometric_updates");
        assertThat(scan.getLookbackDays()).isEqualTo(30);
        assertThat(scan.getWarmupBufferDays()).isEqualTo(14);
        assertThat(scan.getParallelism()).isEqualTo(2);
        assertThat(scan.fetchDays()).isEqualTo(44);
    }

    @Test
    @DisplayName("Omitted keys keep their defaults")
    void shouldKeepDefaultsForMissingKeys() {
        EngineSettings settings = SettingsLoader.fromClasspath("partial-engine.yml");

        assertThat(settings.getScan().getParallelism()).isEqualTo(8);
        assertThat(settings.getScan().getMetricName()).isEqualTo(ScanSettings.DEFAULT_METRIC_NAME);
        assertThat(settings.getScan().fetchDays()).isEqualTo(150);
        assertThat(settings.getDetection().getZscoreThreshold())
                .isEqualTo(DetectionSettings.DEFAULT_Z_SCORE_THRESHOLD);
        assertThat(settings.getDetection().getRollingWindow())
                .isEqualTo(DetectionSettings.DEFAULT_ROLLING_WINDOW);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detection.zscoreThreshold")
                .hasMessageContaining("detection.rollingWindow")
                .hasMessageContaining("scan.parallelism");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("engine.yml");
        Files.writeString(file, "detection:\n  rollingWindow: 7\n");

        EngineSettings settings = SettingsLoader.fromFile(file.toString());

        assertThat(settings.getDetection().getRollingWindow()).isEqualTo(7);
        assertThat(settings.getScan().getParallelism()).isEqualTo(4);
    }

    @Test
    @DisplayName("An empty file yields the defaults")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        EngineSettings settings = SettingsLoader.fromFile(file.toString());

        assertThat(settings.getDetection().getIqrMultiplier()).isEqualTo(DetectionSettings.DEFAULT_IQR_MULTIPLIER);
    }

    @Test
    @DisplayName("Unknown keys are rejected as malformed")
    void shouldRejectUnknownKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("typo.yml");
        Files.writeString(file, "detection:\n  zScoreTreshold: 2.0\n");

        assertThatThrownBy(() -> SettingsLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("nope.yml").toString();

        assertThatThrownBy(() -> SettingsLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
