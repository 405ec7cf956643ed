package com.etphysics.omnimeasure.power;

import lombok.Builder;
import lombok.Value;

@Value @Builder
public class EcoConfig {
    /** |linear accel| (m/s²) above which the device counts as moving. */
    @Builder.Default double wakeThreshold = 0.12;
    @Builder.Default long ecoTimeoutMs = 8_000;
    @Builder.Default int activeRateHz = 50;
    @Builder.Default int ecoRateHz = 5;
    @Builder.Default int ultraEcoRateHz = 2;
    @Builder.Default double throttleOnCelsius = 45.0;
    @Builder.Default double throttleOffCelsius = 40.0;

    public static EcoConfig defaults() {
        return EcoConfig.builder().build();
    }
}
