package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.Maths;
import lombok.Builder;
import lombok.Value;

/**
 * Every tunable constant of the diagnostic pipeline. Defaults follow the newer of the two
 * field-tested constant sets; all of them can be overridden from application.yml.
 */
@Value @Builder(toBuilder = true)
public class EngineConfig {

    // ---- Orientation ----
    /** Gravity smoothing factor α in (0,1): gravity = α·prev + (1-α)·sample. */
    @Builder.Default double gravityAlpha = 0.8;
    @Builder.Default int tiltRingSize = 50;

    // ---- Vibration ----
    /** m/s² to mm/s velocity proxy (1000 / (2π·10 Hz)). */
    @Builder.Default double velocityProxyFactor = 15.9;
    @Builder.Default double zoneBFromMmS = 1.8;
    @Builder.Default double zoneCFromMmS = 4.5;
    @Builder.Default double zoneDFromMmS = 11.0;
    @Builder.Default int rawMagnitudeRingSize = 128;
    @Builder.Default double peakDecay = 0.99;
    /** Weight of the previous long-term gradient; the new short-term value gets 1 - this. */
    @Builder.Default double gradientDecay = 0.999;
    @Builder.Default int rateRingSize = 20;
    /** Assumed sensor rate until enough inter-frame intervals have been observed. */
    @Builder.Default double nominalSensorRateHz = 50.0;

    // ---- Spectral ----
    @Builder.Default int vibrationFftSize = 512;
    @Builder.Default long vibrationSpectralPeriodMs = 200;
    @Builder.Default int audioSampleRate = 16_000;
    @Builder.Default int audioFftSize = 4096;
    @Builder.Default long audioSpectralPeriodMs = 100;
    @Builder.Default double mains50LowHz = 48.0;
    @Builder.Default double mains50HighHz = 52.0;
    @Builder.Default double mains60LowHz = 58.0;
    @Builder.Default double mains60HighHz = 62.0;
    @Builder.Default double motorBandLowHz = 13.0;
    @Builder.Default double motorBandHighHz = 60.0;
    @Builder.Default double lowFrequencyBandHz = 5.0;
    /** Spectra with less total magnitude than this are treated as silence. */
    @Builder.Default double spectralEnergyFloor = 1e-6;

    // ---- Acoustic ----
    @Builder.Default int dbRingSize = 40;
    @Builder.Default double aWeightingCutoffHz = 500.0;
    /** Brings the 1 kHz response of the high-pass stage back to 0 dB. */
    @Builder.Default double aWeightingGain = 1.118;
    @Builder.Default double defaultSplOffsetDb = 90.0;
    /** dB added per unit of ln(1 + shimmer). */
    @Builder.Default double shimmerCouplingDb = 0.5;
    @Builder.Default double dbEpsilon = 1e-12;
    /** Audio counts as unavailable when no PCM block arrived for this long (frame time). */
    @Builder.Default long audioStaleAfterMs = 2000;

    // ---- Light ----
    @Builder.Default int luxRingSize = 50;
    @Builder.Default double darkLuxThreshold = 5.0;
    @Builder.Default double naturalFlickerThreshold = 0.01;

    // ---- Fault prediction ----
    @Builder.Default double faultHighAmplitude = 4.0;
    @Builder.Default double faultWarningAmplitude = 1.5;
    @Builder.Default double bearingFrequencyCutoffHz = 20.0;
    @Builder.Default double bearingBaseHours = 24.0;
    @Builder.Default double bearingDecay = 0.5;
    @Builder.Default double imbalanceBaseHours = 7 * 24.0;
    @Builder.Default double imbalanceDecay = 0.3;
    @Builder.Default double warningBaseHours = 30 * 24.0;
    @Builder.Default double warningDecay = 0.1;
    @Builder.Default double gradientModelEpsilon = 1e-6;
    @Builder.Default double gradientModelScale = 1.0;

    // ---- State classification ----
    @Builder.Default double tonalEntropyThreshold = 0.35;
    @Builder.Default double criticalShimmer = 25.0;

    // ---- Misc ----
    @Builder.Default long warmSensorAfterMs = 20 * 60 * 1000L;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    /** Fails fast on values the pipeline cannot run with. */
    public EngineConfig validate() {
        if (!(gravityAlpha > 0.0 && gravityAlpha < 1.0)) {
            throw new IllegalArgumentException("gravityAlpha must be in (0,1): " + gravityAlpha);
        }
        if (!Maths.isPowerOfTwo(vibrationFftSize)) {
            throw new IllegalArgumentException("vibrationFftSize must be a power of two: " + vibrationFftSize);
        }
        if (!Maths.isPowerOfTwo(audioFftSize)) {
            throw new IllegalArgumentException("audioFftSize must be a power of two: " + audioFftSize);
        }
        if (!(zoneBFromMmS < zoneCFromMmS && zoneCFromMmS < zoneDFromMmS)) {
            throw new IllegalArgumentException("zone thresholds must be strictly ascending: "
                    + zoneBFromMmS + " / " + zoneCFromMmS + " / " + zoneDFromMmS);
        }
        if (faultWarningAmplitude >= faultHighAmplitude) {
            throw new IllegalArgumentException("faultWarningAmplitude must be below faultHighAmplitude");
        }
        if (tiltRingSize < 2 || dbRingSize < 2 || luxRingSize < 1 || rateRingSize < 1 || rawMagnitudeRingSize < 2) {
            throw new IllegalArgumentException("ring buffer sizes too small");
        }
        if (audioSampleRate <= 0) {
            throw new IllegalArgumentException("audioSampleRate must be > 0: " + audioSampleRate);
        }
        return this;
    }
}
