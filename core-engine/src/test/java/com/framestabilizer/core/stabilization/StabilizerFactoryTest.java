package com.framestabilizer.core.stabilization;

import com.framestabilizer.core.config.InvalidConfigException;
import com.framestabilizer.core.config.StabilizationConfig;
import com.framestabilizer.core.config.StabilizationMode;
import com.framestabilizer.core.model.BoundingBox;
import com.framestabilizer.core.model.Detection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StabilizerFactory} and {@link NoOpStabilizer}.
 */
class StabilizerFactoryTest {

    @Test
    @DisplayName("Should create TemporalHysteresisStabilizer for mode=temporal")
    void shouldCreateTemporalStabilizer() {
        DetectionStabilizer stabilizer = StabilizerFactory.create(StabilizationConfig.defaults());

        assertThat(stabilizer).isInstanceOf(TemporalHysteresisStabilizer.class);
        assertThat(stabilizer.mode()).isEqualTo(StabilizationMode.TEMPORAL);
        assertThat(stabilizer.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should create NoOpStabilizer for mode=none")
    void shouldCreateNoOpStabilizer() {
        DetectionStabilizer stabilizer = StabilizerFactory.create(noneConfig());

        assertThat(stabilizer).isInstanceOf(NoOpStabilizer.class);
        assertThat(stabilizer.mode()).isEqualTo(StabilizationMode.NONE);
    }

    @Test
    @DisplayName("Should fail fast on invalid config")
    void shouldRejectInvalidConfig() {
        StabilizationConfig invalid = StabilizationConfig.builder().minFrames(0).build();

        assertThatThrownBy(() -> StabilizerFactory.create(invalid))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("minFrames");
        assertThatThrownBy(() -> StabilizerFactory.create(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("NoOp stabilizer returns every frame unchanged, enabled or not")
    void shouldPassEverythingThroughInNoneMode() {
        DetectionStabilizer stabilizer = StabilizerFactory.create(noneConfig());
        List<Detection> raw = List.of(Detection.of("person", 0.05, new BoundingBox(1, 1, 1, 1)));

        assertThat(stabilizer.process(raw, "cam-1")).isSameAs(raw);
        assertThat(stabilizer.toggle()).isFalse();
        assertThat(stabilizer.process(raw, "cam-1")).isSameAs(raw);

        StabilizationStats stats = stabilizer.getStats("cam-1");
        assertThat(stats.getMode()).isEqualTo(StabilizationMode.NONE);
        assertThat(stats.isEnabled()).isFalse();
        assertThat(stats.getTotalDetected()).isZero();
        assertThat(stabilizer.knownSources()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private static StabilizationConfig noneConfig() {
        return StabilizationConfig.builder().mode(StabilizationMode.NONE).build();
    }
}
