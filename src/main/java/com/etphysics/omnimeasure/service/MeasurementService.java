package com.etphysics.omnimeasure.service;

import com.etphysics.omnimeasure.alerts.AlertService;
import com.etphysics.omnimeasure.audio.AudioHandoff;
import com.etphysics.omnimeasure.domain.CalibrationProfile;
import com.etphysics.omnimeasure.domain.DiagnosticResult;
import com.etphysics.omnimeasure.domain.EngineState;
import com.etphysics.omnimeasure.domain.SensorFrame;
import com.etphysics.omnimeasure.domain.Vector3;
import com.etphysics.omnimeasure.engine.DiagnosticEngine;
import com.etphysics.omnimeasure.engine.EngineSession;
import com.etphysics.omnimeasure.power.EcoController;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the engine session and is the single writer of frame state.
 *
 * Frames from any producer go through {@link #process(SensorFrame)}; the latest audio block is
 * attached from the {@link AudioHandoff} when the frame carries none. Calibration changes may come
 * from any thread and go straight to the session's atomic profile.
 */
@Slf4j
@Service
public class MeasurementService {

    public static final String ALERT_STALE = "SENSOR_STALE";
    public static final String ALERT_CRITICAL = "ENGINE_CRITICAL";

    // ==== Config ====
    @Value("${omnimeasure.sensor.staleAfterMs:3000}")   private long staleAfterMs;
    @Value("${omnimeasure.sensor.staleCheckMs:1000}")   private long staleCheckMs;

    // ==== Infra ====
    private final DiagnosticEngine engine;
    private final AudioHandoff handoff;
    private final EcoController eco;
    private final AlertService alerts;
    private final ScheduledExecutorService scheduler;
    private final EngineSession session;

    // ==== State ====
    @Getter private volatile DiagnosticResult latestResult = DiagnosticResult.EMPTY;
    @Getter private volatile long lastFrameAtMs = 0L;
    private RestCalibration restCalibration; // guarded by this

    public MeasurementService(DiagnosticEngine engine,
                              AudioHandoff handoff,
                              EcoController eco,
                              AlertService alerts,
                              ScheduledExecutorService scheduler) {
        this.engine = engine;
        this.handoff = handoff;
        this.eco = eco;
        this.alerts = alerts;
        this.scheduler = scheduler;
        this.session = engine.newSession();
    }

    @PostConstruct
    void startStaleWatchdog() {
        scheduler.scheduleAtFixedRate(this::checkStaleSafe, staleCheckMs, staleCheckMs, TimeUnit.MILLISECONDS);
        log.info("Sensor stale watchdog started: stale after {} ms", staleAfterMs);
    }

    // ---------------------- Frame path ----------------------

    public synchronized DiagnosticResult process(SensorFrame frame) {
        // reject before taking the audio block so a bad frame does not consume it
        DiagnosticEngine.requireValid(frame);

        SensorFrame f = frame;
        if (!f.hasPcm()) {
            short[] pcm = handoff.take();
            if (pcm != null) f = f.toBuilder().pcm(pcm).build();
        }

        DiagnosticResult r = engine.process(session, f);
        latestResult = r;
        lastFrameAtMs = System.currentTimeMillis();

        if (alerts.isActive(ALERT_STALE)) alerts.resolve(ALERT_STALE);

        eco.onMotion(r.getVibrationMagnitude(), r.getTimestampNs());

        if (r.getEngineState() == EngineState.CRITICAL) {
            alerts.raise(ALERT_CRITICAL,
                    String.format("Critical vibration: %.2f mm/s zone %s, shimmer %.1f",
                            r.getVelocityRms(), r.getIsoZone(), r.getShimmer()),
                    AlertService.Severity.CRITICAL);
        } else if (alerts.isActive(ALERT_CRITICAL)) {
            alerts.resolve(ALERT_CRITICAL);
        }

        if (restCalibration != null) feedRestCalibration(f);
        return r;
    }

    public long frameCount() {
        return session.frameCount();
    }

    public String faultModelName() {
        return engine.faultModelName();
    }

    // ---------------------- Calibration (control path) ----------------------

    public CalibrationProfile calibration() {
        return session.calibration();
    }

    public CalibrationProfile setCalibration(Vector3 accelZero, Vector3 gyroZero, double splOffsetDb) {
        return session.setCalibration(accelZero, gyroZero, splOffsetDb);
    }

    public CalibrationProfile zeroTilt() {
        return session.zeroTilt();
    }

    public CalibrationProfile setReferenceLevel(double targetDb) {
        return session.setReferenceLevel(targetDb);
    }

    /**
     * Averages the next {@code samples} accelerometer frames (device lying flat) and installs the
     * resulting accel zero. Gyro zero and SPL offset are kept. A running routine is replaced.
     */
    public synchronized CompletableFuture<CalibrationProfile> startRestCalibration(int samples) {
        if (samples <= 0) throw new IllegalArgumentException("samples must be > 0: " + samples);
        if (restCalibration != null) {
            log.info("rest_calibration_restarted after {} of {} samples", restCalibration.count, restCalibration.target);
            restCalibration.future.cancel(false);
        }
        restCalibration = new RestCalibration(samples);
        log.info("rest_calibration_started samples={}", samples);
        return restCalibration.future;
    }

    public synchronized boolean isRestCalibrating() {
        return restCalibration != null;
    }

    private void feedRestCalibration(SensorFrame f) {
        RestCalibration rc = restCalibration;
        rc.sum = rc.sum.plus(f.getRotation().remap(f.getAccel()));
        rc.count++;
        if (rc.count < rc.target) return;

        restCalibration = null;
        Vector3 mean = rc.sum.scale(1.0 / rc.count);
        CalibrationProfile p = session.setAccelZero(CalibrationProfile.accelZeroFromResting(mean));
        log.info("rest_calibration_done mean={} accelZero={}", mean, p.accelZero());
        rc.future.complete(p);
    }

    // ---------------------- Watchdog ----------------------

    private void checkStaleSafe() {
        try {
            long last = lastFrameAtMs;
            if (last == 0L) return; // nothing produced yet
            long age = System.currentTimeMillis() - last;
            if (age > staleAfterMs) {
                alerts.raise(ALERT_STALE, "No sensor frame for " + age + " ms", AlertService.Severity.WARN);
            }
        } catch (Exception e) {
            log.warn("stale_check_failed: {}", e.getMessage());
        }
    }

    private static final class RestCalibration {
        final int target;
        final CompletableFuture<CalibrationProfile> future = new CompletableFuture<>();
        Vector3 sum = Vector3.ZERO;
        int count;

        RestCalibration(int target) {
            this.target = target;
        }
    }
}
