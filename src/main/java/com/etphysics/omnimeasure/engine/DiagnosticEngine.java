package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.CalibrationProfile;
import com.etphysics.omnimeasure.domain.DiagnosticResult;
import com.etphysics.omnimeasure.domain.EngineState;
import com.etphysics.omnimeasure.domain.FaultPrediction;
import com.etphysics.omnimeasure.domain.SensorFrame;
import com.etphysics.omnimeasure.domain.SpectrumSnapshot;
import com.etphysics.omnimeasure.domain.Vector3;
import com.etphysics.omnimeasure.engine.fault.FaultInputs;
import com.etphysics.omnimeasure.engine.fault.FaultModel;
import com.etphysics.omnimeasure.engine.spectral.SpectralAnalyzer;
import lombok.extern.slf4j.Slf4j;

/**
 * Sensor-fusion and diagnostic pipeline.
 *
 * Per frame: timing → calibration + orientation → vibration → (duty-cycled) vibration spectrum →
 * acoustic level + (duty-cycled) audio spectrum → light → fault model → state classifier.
 *
 * The engine is synchronous and holds no lock: a session must be driven by one caller at a time.
 * It never touches devices; audio arrives as an optional PCM block on the frame.
 */
@Slf4j
public class DiagnosticEngine {

    private final EngineConfig cfg;
    private final OrientationFuser orientation;
    private final VibrationAnalyzer vibration;
    private final SpectralAnalyzer vibrationSpectral;
    private final SpectralAnalyzer audioSpectral;
    private final AcousticLevelMeter acoustic;
    private final PhotonicAnalyzer photonic;
    private final FaultModel faultModel;
    private final EngineStateClassifier classifier;

    public DiagnosticEngine(EngineConfig cfg, FaultModel faultModel) {
        this.cfg = cfg.validate();
        this.orientation = new OrientationFuser(cfg);
        this.vibration = new VibrationAnalyzer(cfg);
        this.vibrationSpectral = new SpectralAnalyzer(cfg.getVibrationFftSize(), cfg);
        this.audioSpectral = new SpectralAnalyzer(cfg.getAudioFftSize(), cfg);
        this.acoustic = new AcousticLevelMeter(cfg);
        this.photonic = new PhotonicAnalyzer(cfg);
        this.faultModel = faultModel;
        this.classifier = new EngineStateClassifier(cfg);
    }

    public String faultModelName() { return faultModel.name(); }

    public EngineSession newSession() {
        return new EngineSession(cfg);
    }

    public DiagnosticResult process(EngineSession s, SensorFrame frame) {
        if (s == null) throw new IllegalArgumentException("session is required");
        requireValid(frame);

        long ts = frame.getTimestampNs();
        double realHz = updateTiming(s, ts);

        // one read: the whole frame sees one calibration profile
        CalibrationProfile cal = s.calibration();

        Vector3 calAccel = orientation.calibrate(frame.getAccel(), frame.getRotation(), cal);
        OrientationFuser.Reading ori = orientation.update(s.orientation, calAccel, cal);

        double angularRate = 0.0;
        if (frame.getGyro() != null && frame.getGyro().isFinite()) {
            angularRate = frame.getGyro().minus(cal.gyroZero()).norm();
        }

        VibrationAnalyzer.Reading vib = vibration.update(s.vibration, calAccel, ori.linearAccel());

        if (s.vibration.window().isFull() && s.vibrationDuty.tryAcquire(ts)) {
            s.vibrationSpectrum = vibrationSpectral.analyze(s.vibration.window().toArray(), realHz, true, ts);
        }

        AcousticLevelMeter.Reading sound = processAudio(s, frame, vib.shimmer(), cal, ts);
        boolean audioAvailable = s.acoustic.hasReading()
                && (ts - s.acoustic.lastPcmAtNs()) <= cfg.getAudioStaleAfterMs() * 1_000_000L;

        SpectrumSnapshot primary = s.audioSpectrum.isEmpty() ? s.vibrationSpectrum : s.audioSpectrum;

        PhotonicAnalyzer.Reading light = s.light.last();
        if (frame.getLux() != null && Double.isFinite(frame.getLux())) {
            light = photonic.update(s.light, frame.getLux(), audioSpectral.isMainsBand(primary.dominantFrequencyHz()));
        }

        FaultPrediction fault = faultModel.predict(new FaultInputs(
                vib.peak(), s.vibrationSpectrum.dominantFrequencyHz(), vib.shimmer(), vib.longTermGradient()));

        EngineState state = classifier.classify(vib.zone().severity(), vib.shimmer(), primary);

        if (log.isTraceEnabled()) {
            log.trace("frame #{} tilt={} vib={} zone={} dBA={} state={}",
                    s.frameCount, ori.tiltDeg(), vib.vibrationMag(), vib.zone(), sound.dbA(), state);
        }

        return DiagnosticResult.builder()
                .timestampNs(ts)
                .realHz(realHz)
                .tiltDegrees(ori.tiltDeg())
                .tiltConfidence(ori.tiltConfidence())
                .pitchDegrees(ori.pitchDeg())
                .rollDegrees(ori.rollDeg())
                .angularRate(angularRate)
                .vibrationMagnitude(vib.vibrationMag())
                .vibrationRms(vib.rms())
                .vibrationPeak(vib.peak())
                .velocityRms(vib.velocityRms())
                .isoZone(vib.zone())
                .severity(vib.zone().severity())
                .shimmer(vib.shimmer())
                .longTermGradient(vib.longTermGradient())
                .dbA(sound.dbA())
                .dbUncertainty(sound.uncertainty())
                .audioAvailable(audioAvailable)
                .lux(light.lux())
                .flickerIndex(light.flickerIndex())
                .lightSource(light.source())
                .dominantFrequency(primary.dominantFrequencyHz())
                .frequencyLabel(primary.label())
                .spectralEntropy(primary.entropy())
                .mechanicalFrequency(s.vibrationSpectrum.dominantFrequencyHz())
                .mechanicalLabel(s.vibrationSpectrum.label())
                .faultPrediction(fault.text())
                .faultConfidence(fault.confidence())
                .ttfHours(fault.ttfHours())
                .engineState(state)
                .statusMessage(statusMessage(s, ts))
                .build();
    }

    /** Throws {@link IllegalArgumentException} for a frame the pipeline cannot consume. */
    public static void requireValid(SensorFrame frame) {
        if (frame == null) throw new IllegalArgumentException("frame is required");
        if (!frame.getAccel().isFinite()) throw new IllegalArgumentException("accel must be finite: " + frame.getAccel());
    }

    /** Measured frame rate from the recent inter-frame intervals; nominal rate until one exists. */
    private double updateTiming(EngineSession s, long ts) {
        if (!s.started) {
            s.started = true;
            s.firstTimestampNs = ts;
        } else {
            long dt = ts - s.lastTimestampNs;
            if (dt > 0) s.frameIntervalsNs.add(dt);
        }
        s.lastTimestampNs = ts;
        s.frameCount++;

        if (s.frameIntervalsNs.isEmpty()) return cfg.getNominalSensorRateHz();
        double meanDt = s.frameIntervalsNs.mean();
        return meanDt > 0 ? 1e9 / meanDt : cfg.getNominalSensorRateHz();
    }

    /**
     * Level for any non-empty block; spectrum only for blocks of at least one FFT length.
     * Without a block the last-known values are kept.
     */
    private AcousticLevelMeter.Reading processAudio(EngineSession s, SensorFrame frame, double shimmer,
                                                    CalibrationProfile cal, long ts) {
        if (!frame.hasPcm()) return s.acoustic.last();

        short[] pcm = frame.getPcm();
        AcousticLevelMeter.Reading r = acoustic.measure(s.acoustic, pcm, shimmer, cal, ts);

        if (pcm.length >= audioSpectral.fftSize()) {
            if (s.audioDuty.tryAcquire(ts)) {
                s.audioSpectrum = audioSpectral.analyzePcm(pcm, cfg.getAudioSampleRate(), ts);
            }
        } else if (log.isDebugEnabled()) {
            log.debug("audio_block_short len={} need={} — spectrum kept", pcm.length, audioSpectral.fftSize());
        }
        return r;
    }

    private String statusMessage(EngineSession s, long ts) {
        long activeMs = (ts - s.firstTimestampNs) / 1_000_000L;
        return activeMs > cfg.getWarmSensorAfterMs() ? "Warm Sensor" : "";
    }
}
