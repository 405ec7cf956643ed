package com.etphysics.omnimeasure.sensor;

import com.etphysics.omnimeasure.domain.DisplayRotation;
import com.etphysics.omnimeasure.domain.EcoState;
import com.etphysics.omnimeasure.domain.Maths;
import com.etphysics.omnimeasure.domain.SensorFrame;
import com.etphysics.omnimeasure.domain.Vector3;
import com.etphysics.omnimeasure.power.EcoController;
import com.etphysics.omnimeasure.power.PowerStateListener;
import com.etphysics.omnimeasure.service.MeasurementService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Stand-in for the device sensor callbacks: produces accel/gyro/lux frames at the power
 * controller's current sampling rate and reschedules itself on every power-state edge.
 *
 * The signal is gravity tilted by a fixed angle, plus a sinusoidal vibration along z, plus noise.
 * Lux flickers at 100 Hz (aliased at low rates) around a mean when a flicker depth is set.
 */
@Slf4j
@Component
public class SimulatedSensorFeed implements PowerStateListener {

    // ==== Config ====
    @Value("${omnimeasure.simulator.enabled:false}")          private boolean enabled;
    @Value("${omnimeasure.simulator.tiltDeg:0}")              private double tiltDeg;
    @Value("${omnimeasure.simulator.vibrationAmplitude:0.0}") private double vibrationAmplitude; // m/s²
    @Value("${omnimeasure.simulator.vibrationHz:25}")         private double vibrationHz;
    @Value("${omnimeasure.simulator.noise:0.005}")            private double noise;              // m/s²
    @Value("${omnimeasure.simulator.lux:300}")                private double lux;
    @Value("${omnimeasure.simulator.luxFlickerDepth:0.0}")    private double luxFlickerDepth;    // fraction of mean
    @Value("${omnimeasure.simulator.rotation:0}")             private int rotationDeg;

    // ==== Infra ====
    private final MeasurementService measurement;
    private final EcoController eco;
    private final ScheduledExecutorService scheduler;
    private final Random random = new Random(7);

    // ==== State ====
    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> task;
    private volatile boolean stopping = false;
    private final long startNs = System.nanoTime();

    public SimulatedSensorFeed(MeasurementService measurement, EcoController eco, ScheduledExecutorService scheduler) {
        this.measurement = measurement;
        this.eco = eco;
        this.scheduler = scheduler;
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("Sensor simulator disabled");
            return;
        }
        eco.addListener(this);
        reschedule(eco.samplingRateHz());
        log.info("Sensor simulator started: tilt={}° vib={} m/s² @ {} Hz lux={}", tiltDeg, vibrationAmplitude, vibrationHz, lux);
    }

    @PreDestroy
    void stop() {
        stopping = true;
        synchronized (scheduleLock) {
            if (task != null) task.cancel(false);
            task = null;
        }
    }

    @Override
    public void onPowerStateChanged(EcoState from, EcoState to, int samplingRateHz) {
        if (stopping) return;
        reschedule(samplingRateHz);
    }

    private void reschedule(int rateHz) {
        long periodUs = 1_000_000L / Math.max(1, rateHz);
        synchronized (scheduleLock) {
            if (task != null) task.cancel(false);
            task = scheduler.scheduleAtFixedRate(this::emitSafe, periodUs, periodUs, TimeUnit.MICROSECONDS);
        }
        log.debug("simulator_rescheduled rate={} Hz", rateHz);
    }

    private void emitSafe() {
        try {
            measurement.process(nextFrame(System.nanoTime()));
        } catch (Exception e) {
            log.warn("simulated_frame_failed: {}", e.getMessage());
        }
    }

    SensorFrame nextFrame(long nowNs) {
        double t = (nowNs - startNs) / 1e9;
        double tilt = Math.toRadians(tiltDeg);
        double g = Maths.STANDARD_GRAVITY;
        double vib = vibrationAmplitude * Math.sin(2 * Math.PI * vibrationHz * t);

        Vector3 accel = new Vector3(
                g * Math.sin(tilt) + gauss(),
                gauss(),
                g * Math.cos(tilt) + vib + gauss());
        Vector3 gyro = new Vector3(gauss() * 0.01, gauss() * 0.01, gauss() * 0.01);
        double l = lux * (1 + luxFlickerDepth * Math.sin(2 * Math.PI * 100 * t));

        return SensorFrame.builder()
                .accel(accel)
                .gyro(gyro)
                .lux(Math.max(0, l))
                .rotation(DisplayRotation.fromDegrees(rotationDeg))
                .timestampNs(nowNs)
                .build();
    }

    private double gauss() {
        return noise * random.nextGaussian();
    }
}
