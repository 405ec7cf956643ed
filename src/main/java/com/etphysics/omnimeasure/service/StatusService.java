package com.etphysics.omnimeasure.service;

import com.etphysics.omnimeasure.audio.AudioCaptureService;
import com.etphysics.omnimeasure.domain.DiagnosticResult;
import com.etphysics.omnimeasure.domain.EcoState;
import com.etphysics.omnimeasure.power.EcoController;
import jakarta.annotation.PostConstruct;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.DecimalFormat;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Status aggregation.
 * - Latest diagnostic snapshot from the measurement path.
 * - Power state and sampling rate from the eco controller, audio status from the capture service.
 */
@Slf4j
@Component
public class StatusService {

    private static final DecimalFormat DF2 = new DecimalFormat("#0.00");

    private final ScheduledExecutorService scheduler;
    private final MeasurementService measurement;
    private final EcoController eco;
    private final AudioCaptureService audio;

    public StatusService(ScheduledExecutorService scheduler,
                         MeasurementService measurement,
                         EcoController eco,
                         AudioCaptureService audio) {
        this.scheduler = scheduler;
        this.measurement = measurement;
        this.eco = eco;
        this.audio = audio;
    }

    // Summary log period
    private final int summaryEverySec = 30;

    @PostConstruct
    void startSummaryLogger() {
        scheduler.scheduleAtFixedRate(this::logSummarySafe, 10, summaryEverySec, TimeUnit.SECONDS);
        log.info("Status summary logger started: every {}s", summaryEverySec);
    }

    // ---------------------- Public API ----------------------

    /** Used by controllers, the health indicator and the periodic logger. */
    public StatusView buildStatusView() {
        long now = System.currentTimeMillis();
        long last = measurement.getLastFrameAtMs();
        long frameAgeMs = last == 0L ? -1 : Math.max(0, now - last);
        AudioCaptureService.AudioStatus as = audio.status();

        return StatusView.builder()
                .result(measurement.getLatestResult())
                .frameCount(measurement.frameCount())
                .frameAgeMs(frameAgeMs)
                .frameAgeHuman(humanAge(frameAgeMs))
                .ecoState(eco.state())
                .samplingRateHz(eco.samplingRateHz())
                .throttled(eco.isThrottled())
                .ultraEco(eco.isUltraEco())
                .audio(as)
                .restCalibrating(measurement.isRestCalibrating())
                .faultModel(measurement.faultModelName())
                .build();
    }

    // ---------------------- Log summary ----------------------

    private void logSummarySafe() {
        try {
            StatusView v = buildStatusView();
            DiagnosticResult r = v.result;
            log.info(
                    "Status: frames={} (age {}), {} @ {}Hz{}; tilt={}° vib={}mm/s zone {}; {} dBA (audio {}); " +
                            "lux={} ({}); dom={}Hz {}; fault='{}' ({}); state={}",
                    v.frameCount, v.frameAgeHuman, v.ecoState, v.samplingRateHz, v.throttled ? " THROTTLED" : "",
                    fmt(r.getTiltDegrees()), fmt(r.getVelocityRms()), r.getIsoZone(),
                    fmt(r.getDbA()), v.audio.available() ? "on" : "off",
                    fmt(r.getLux()), r.getLightSource(),
                    fmt(r.getDominantFrequency()), r.getFrequencyLabel(),
                    r.getFaultPrediction(), v.faultModel, r.getEngineState().tag()
            );
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    // ---------------------- formatting helpers ----------------------

    private static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    private static String fmt(double v) { return Double.isNaN(v) ? "-" : DF2.format(v); }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        DiagnosticResult result;
        long   frameCount;
        long   frameAgeMs;
        String frameAgeHuman;

        // Power
        EcoState ecoState;
        int      samplingRateHz;
        boolean  throttled;
        boolean  ultraEco;

        AudioCaptureService.AudioStatus audio;
        boolean restCalibrating;
        String  faultModel;
    }
}
