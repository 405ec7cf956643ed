package com.etphysics.omnimeasure.config;

import com.etphysics.omnimeasure.engine.DiagnosticEngine;
import com.etphysics.omnimeasure.engine.EngineConfig;
import com.etphysics.omnimeasure.engine.fault.GradientFaultModel;
import com.etphysics.omnimeasure.engine.fault.FaultModel;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.PropertyPlaceholderAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class EngineConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PropertyPlaceholderAutoConfiguration.class))
            .withUserConfiguration(EngineConfiguration.class);

    @Test
    void defaults_match_the_engine_defaults() {
        runner.run(ctx -> assertThat(ctx.getBean(EngineConfig.class)).isEqualTo(EngineConfig.defaults()));
    }

    @Test
    void bands_rings_and_model_constants_are_overridable() {
        runner.withPropertyValues(
                        "omnimeasure.vibration.rawMagnitudeRingSize=64",
                        "omnimeasure.vibration.peakDecay=0.95",
                        "omnimeasure.spectral.mains50LowHz=49",
                        "omnimeasure.spectral.motorBandHighHz=80",
                        "omnimeasure.light.luxRingSize=10",
                        "omnimeasure.fault.bearingBaseHours=12",
                        "omnimeasure.fault.model=gradient",
                        "omnimeasure.fault.gradient.scale=2.5",
                        "omnimeasure.state.warmSensorAfterMs=60000")
                .run(ctx -> {
                    EngineConfig cfg = ctx.getBean(EngineConfig.class);
                    assertThat(cfg.getRawMagnitudeRingSize()).isEqualTo(64);
                    assertThat(cfg.getPeakDecay()).isEqualTo(0.95);
                    assertThat(cfg.getMains50LowHz()).isEqualTo(49.0);
                    assertThat(cfg.getMotorBandHighHz()).isEqualTo(80.0);
                    assertThat(cfg.getLuxRingSize()).isEqualTo(10);
                    assertThat(cfg.getBearingBaseHours()).isEqualTo(12.0);
                    assertThat(cfg.getGradientModelScale()).isEqualTo(2.5);
                    assertThat(cfg.getWarmSensorAfterMs()).isEqualTo(60_000L);
                    assertThat(ctx.getBean(FaultModel.class)).isInstanceOf(GradientFaultModel.class);
                    assertThat(ctx.getBean(DiagnosticEngine.class).faultModelName()).isEqualTo("gradient");
                });
    }

    @Test
    void broken_knobs_fall_back_to_defaults() {
        runner.withPropertyValues(
                        "omnimeasure.vibration.rawMagnitudeRingSize=1",
                        "omnimeasure.vibration.gradientDecay=1.5",
                        "omnimeasure.fault.gradient.scale=0",
                        "omnimeasure.audio.fftSize=1000")
                .run(ctx -> {
                    EngineConfig cfg = ctx.getBean(EngineConfig.class);
                    EngineConfig d = EngineConfig.defaults();
                    assertThat(cfg.getRawMagnitudeRingSize()).isEqualTo(d.getRawMagnitudeRingSize());
                    assertThat(cfg.getGradientDecay()).isEqualTo(d.getGradientDecay());
                    assertThat(cfg.getGradientModelScale()).isEqualTo(d.getGradientModelScale());
                    assertThat(cfg.getAudioFftSize()).isEqualTo(d.getAudioFftSize());
                });
    }
}
