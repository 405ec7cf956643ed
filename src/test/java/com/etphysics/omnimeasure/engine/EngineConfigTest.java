package com.etphysics.omnimeasure.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void defaults_are_valid() {
        EngineConfig cfg = EngineConfig.defaults().validate();

        assertThat(cfg.getGravityAlpha()).isEqualTo(0.8);
        assertThat(cfg.getVibrationFftSize()).isEqualTo(512);
        assertThat(cfg.getAudioFftSize()).isEqualTo(4096);
    }

    @Test
    void rejects_values_that_cannot_work() {
        assertThatThrownBy(() -> EngineConfig.builder().gravityAlpha(1.0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().audioFftSize(3000).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().zoneCFromMmS(1.0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.builder().faultWarningAmplitude(5.0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
