package io.github.samzhu.reach.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AnomalyConfigTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        // When
        AnomalyConfig config = AnomalyConfig.defaults();

        // Then
        assertThat(config.lookbackDays()).isEqualTo(56);
        assertThat(config.minDataPoints()).isEqualTo(7);
        assertThat(config.warningZscore()).isEqualTo(2.0);
        assertThat(config.warningPctDelta()).isEqualTo(0.15);
        assertThat(config.criticalZscore()).isEqualTo(2.5);
        assertThat(config.criticalPctDelta()).isEqualTo(0.20);
    }

    @Test
    void shouldRejectShortLookback() {
        assertThatThrownBy(() -> new AnomalyConfig(6, 7, 2.0, 0.15, 2.5, 0.20))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lookbackDays");
    }

    @Test
    void shouldRejectTooFewDataPoints() {
        assertThatThrownBy(() -> new AnomalyConfig(56, 2, 2.0, 0.15, 2.5, 0.20))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("minDataPoints");
    }

    @Test
    void shouldRejectWarningNotBelowCritical() {
        assertThatThrownBy(() -> new AnomalyConfig(56, 7, 2.5, 0.15, 2.5, 0.20))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnomalyConfig(56, 7, 2.0, 0.25, 2.5, 0.20))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
