package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.CalibrationProfile;
import com.etphysics.omnimeasure.domain.RingBuffer;
import com.etphysics.omnimeasure.domain.SpectrumSnapshot;
import com.etphysics.omnimeasure.domain.Vector3;
import com.etphysics.omnimeasure.engine.spectral.DutyCycle;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * All mutable state of one engine instance: smoothed gravity, history rings, spectral snapshots,
 * duty-cycle gates and calibration. Passed explicitly into every frame call.
 *
 * Frame state is single-writer (the frame path). Calibration is the exception: it is changed from
 * a separate control path, so it lives in an {@link AtomicReference} of an immutable profile and
 * every change is an atomic read-modify-write.
 */
@Slf4j
public final class EngineSession {

    final OrientationFuser.State orientation;
    final VibrationAnalyzer.State vibration;
    final AcousticLevelMeter.State acoustic;
    final PhotonicAnalyzer.State light;
    final RingBuffer frameIntervalsNs;
    final DutyCycle vibrationDuty;
    final DutyCycle audioDuty;

    SpectrumSnapshot vibrationSpectrum = SpectrumSnapshot.EMPTY;
    SpectrumSnapshot audioSpectrum = SpectrumSnapshot.EMPTY;

    boolean started = false;
    long firstTimestampNs;
    long lastTimestampNs;
    long frameCount;

    private final AtomicReference<CalibrationProfile> calibration;

    public EngineSession(EngineConfig cfg) {
        this.orientation = new OrientationFuser.State(cfg.getTiltRingSize());
        this.vibration = new VibrationAnalyzer.State(cfg.getRawMagnitudeRingSize(), cfg.getVibrationFftSize());
        this.acoustic = new AcousticLevelMeter.State(cfg.getDbRingSize());
        this.light = new PhotonicAnalyzer.State(cfg.getLuxRingSize());
        this.frameIntervalsNs = new RingBuffer(cfg.getRateRingSize());
        this.vibrationDuty = new DutyCycle(cfg.getVibrationSpectralPeriodMs());
        this.audioDuty = new DutyCycle(cfg.getAudioSpectralPeriodMs());
        this.calibration = new AtomicReference<>(CalibrationProfile.initial(cfg.getDefaultSplOffsetDb()));
    }

    public CalibrationProfile calibration() {
        return calibration.get();
    }

    public long frameCount() { return frameCount; }

    public Vector3 gravity() { return orientation.gravity(); }

    // ---------------------- Calibration entry points ----------------------

    /** Installs sensor offsets; the tilt zero is kept. */
    public CalibrationProfile setCalibration(Vector3 accelZero, Vector3 gyroZero, double splOffsetDb) {
        Vector3 a = accelZero == null ? Vector3.ZERO : accelZero;
        Vector3 g = gyroZero == null ? Vector3.ZERO : gyroZero;
        if (!a.isFinite() || !g.isFinite() || !Double.isFinite(splOffsetDb)) {
            throw new IllegalArgumentException("calibration offsets must be finite");
        }
        CalibrationProfile p = calibration.updateAndGet(c -> c.withSensorOffsets(a, g, splOffsetDb));
        log.info("calibration_set accelZero={} gyroZero={} splOffset={}", a, g, splOffsetDb);
        return p;
    }

    /** Installs only the accel zero; gyro zero, SPL offset and tilt zero are whatever is current. */
    public CalibrationProfile setAccelZero(Vector3 accelZero) {
        if (accelZero == null || !accelZero.isFinite()) {
            throw new IllegalArgumentException("accelZero must be finite: " + accelZero);
        }
        CalibrationProfile p = calibration.updateAndGet(c -> c.withAccelZero(accelZero));
        log.info("accel_zero_set accelZero={}", accelZero);
        return p;
    }

    /**
     * Makes the current attitude read as 0°. Before the first frame the raw attitude is (0, 0),
     * so the zero stays neutral.
     */
    public CalibrationProfile zeroTilt() {
        OrientationFuser.RawTilt raw = orientation.rawTilt();
        CalibrationProfile p = calibration.updateAndGet(c -> c.withTiltZero(raw.pitchDeg(), raw.rollDeg()));
        log.info("tilt_zeroed pitchZero={} rollZero={}", raw.pitchDeg(), raw.rollDeg());
        return p;
    }

    /**
     * Re-derives the SPL offset so that the last block maps to {@code targetDb}:
     * newOffset = target - rawDb, where rawDb is that block's level without any offset. Until audio was
     * seen the current reading counts as 0, i.e. rawDb = -currentOffset.
     */
    public CalibrationProfile setReferenceLevel(double targetDb) {
        if (!Double.isFinite(targetDb)) throw new IllegalArgumentException("targetDb must be finite: " + targetDb);
        boolean measured = acoustic.hasReading();
        double raw = acoustic.lastRawDb();
        CalibrationProfile p = calibration.updateAndGet(c ->
                c.withSplOffset(AcousticLevelMeter.referenceOffset(targetDb, measured ? raw : -c.splOffsetDb())));
        log.info("reference_level_set target={}dB raw={}dB newOffset={}", targetDb, measured ? raw : "n/a", p.splOffsetDb());
        return p;
    }
}
