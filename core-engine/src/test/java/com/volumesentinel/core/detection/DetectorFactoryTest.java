package com.volumesentinel.core.detection;

import com.volumesentinel.core.config.DetectionSettings;
import com.volumesentinel.core.model.DetectionMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create ZScoreDetector with the configured threshold")
    void shouldCreateZScoreDetector() {
        DetectionSettings settings = new DetectionSettings();
        settings.setZscoreThreshold(2.5);

        AnomalyDetector detector = DetectorFactory.create(DetectionMethod.Z_SCORE, settings);

        assertThat(detector).isInstanceOf(ZScoreDetector.class);
        assertThat(((ZScoreDetector) detector).getThreshold()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should create IqrDetector with the configured multiplier")
    void shouldCreateIqrDetector() {
        DetectionSettings settings = new DetectionSettings();
        settings.setIqrMultiplier(3.0);

        AnomalyDetector detector = DetectorFactory.create(DetectionMethod.IQR, settings);

        assertThat(detector).isInstanceOf(IqrDetector.class);
        assertThat(((IqrDetector) detector).getMultiplier()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should create RollingDeviationDetector with the configured window")
    void shouldCreateRollingDetector() {
        DetectionSettings settings = new DetectionSettings();
        settings.setRollingWindow(7);
        settings.setRollingDeviationThreshold(0.25);

        RollingDeviationDetector detector = (RollingDeviationDetector) DetectorFactory.create(
                DetectionMethod.ROLLING_DEVIATION, settings);

        assertThat(detector.getWindow()).isEqualTo(7);
        assertThat(detector.getDeviationThreshold()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should create one detector per method in declaration order")
    void shouldCreateAll() {
        List<AnomalyDetector> detectors = DetectorFactory.createAll(new DetectionSettings());

        assertThat(detectors).extracting(AnomalyDetector::getMethod)
                .containsExactly(DetectionMethod.Z_SCORE, DetectionMethod.IQR, DetectionMethod.ROLLING_DEVIATION);
        assertThatThrownBy(() -> detectors.add(new ZScoreDetector()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should fail fast on invalid settings")
    void shouldRejectInvalidSettings() {
        DetectionSettings settings = new DetectionSettings();
        settings.setRollingWindow(0);

        assertThatThrownBy(() -> DetectorFactory.createAll(settings))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("rollingWindow");
    }
}
