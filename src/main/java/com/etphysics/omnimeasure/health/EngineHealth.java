package com.etphysics.omnimeasure.health;

import com.etphysics.omnimeasure.service.StatusService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

@Component
public class EngineHealth implements HealthIndicator {
    private final StatusService status;

    @Value("${omnimeasure.sensor.staleAfterMs:3000}")
    private long staleAfterMs;

    public EngineHealth(StatusService status) { this.status = status; }

    @Override public Health health() {
        var v = status.buildStatusView();
        boolean ok = v.getFrameAgeMs() >= 0 && v.getFrameAgeMs() < staleAfterMs; // frames fresh

        return (ok ? Health.up() : Health.down())
                .withDetail("frameAgeMs", v.getFrameAgeMs())
                .withDetail("frames", v.getFrameCount())
                .withDetail("ecoState", v.getEcoState())
                .withDetail("samplingRateHz", v.getSamplingRateHz())
                .withDetail("audioAvailable", v.getAudio().available())
                .withDetail("engineState", v.getResult().getEngineState().tag())
                .build();
    }
}
