package com.etphysics.omnimeasure.config;

import com.etphysics.omnimeasure.audio.AudioHandoff;
import com.etphysics.omnimeasure.audio.AudioSource;
import com.etphysics.omnimeasure.audio.JavaSoundAudioSource;
import com.etphysics.omnimeasure.audio.NoAudioSource;
import com.etphysics.omnimeasure.audio.SyntheticAudioSource;
import com.etphysics.omnimeasure.domain.Maths;
import com.etphysics.omnimeasure.engine.DiagnosticEngine;
import com.etphysics.omnimeasure.engine.EngineConfig;
import com.etphysics.omnimeasure.engine.fault.DecayFaultModel;
import com.etphysics.omnimeasure.engine.fault.FaultModel;
import com.etphysics.omnimeasure.engine.fault.GradientFaultModel;
import com.etphysics.omnimeasure.power.EcoConfig;
import com.etphysics.omnimeasure.power.EcoController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Binds {@code omnimeasure.*} properties into the immutable engine and power configs.
 * Bad knobs are repaired with a warning where a safe fallback exists.
 */
@Slf4j
@Configuration
public class EngineConfiguration {

    // ==== Orientation ====
    @Value("${omnimeasure.orientation.gravityAlpha:0.8}")    private double gravityAlpha;
    @Value("${omnimeasure.orientation.tiltRingSize:50}")     private int tiltRingSize;

    // ==== Vibration ====
    @Value("${omnimeasure.vibration.velocityProxyFactor:15.9}") private double velocityProxyFactor;
    @Value("${omnimeasure.vibration.zoneBFromMmS:1.8}")         private double zoneB;
    @Value("${omnimeasure.vibration.zoneCFromMmS:4.5}")         private double zoneC;
    @Value("${omnimeasure.vibration.zoneDFromMmS:11.0}")        private double zoneD;
    @Value("${omnimeasure.vibration.fftSize:512}")              private int vibrationFftSize;
    @Value("${omnimeasure.vibration.spectralPeriodMs:200}")     private long vibrationSpectralPeriodMs;
    @Value("${omnimeasure.vibration.nominalRateHz:50}")         private double nominalSensorRateHz;
    @Value("${omnimeasure.vibration.rawMagnitudeRingSize:128}") private int rawMagnitudeRingSize;
    @Value("${omnimeasure.vibration.rateRingSize:20}")          private int rateRingSize;
    @Value("${omnimeasure.vibration.peakDecay:0.99}")           private double peakDecay;
    @Value("${omnimeasure.vibration.gradientDecay:0.999}")      private double gradientDecay;

    // ==== Spectral bands ====
    @Value("${omnimeasure.spectral.mains50LowHz:48}")           private double mains50LowHz;
    @Value("${omnimeasure.spectral.mains50HighHz:52}")          private double mains50HighHz;
    @Value("${omnimeasure.spectral.mains60LowHz:58}")           private double mains60LowHz;
    @Value("${omnimeasure.spectral.mains60HighHz:62}")          private double mains60HighHz;
    @Value("${omnimeasure.spectral.motorBandLowHz:13}")         private double motorBandLowHz;
    @Value("${omnimeasure.spectral.motorBandHighHz:60}")        private double motorBandHighHz;
    @Value("${omnimeasure.spectral.lowFrequencyBandHz:5}")      private double lowFrequencyBandHz;
    @Value("${omnimeasure.spectral.energyFloor:1e-6}")          private double spectralEnergyFloor;

    // ==== Audio ====
    @Value("${omnimeasure.audio.sampleRate:16000}")             private int audioSampleRate;
    @Value("${omnimeasure.audio.fftSize:4096}")                 private int audioFftSize;
    @Value("${omnimeasure.audio.spectralPeriodMs:100}")         private long audioSpectralPeriodMs;
    @Value("${omnimeasure.audio.splOffsetDb:90}")               private double splOffsetDb;
    @Value("${omnimeasure.audio.aWeightingCutoffHz:500}")       private double aWeightingCutoffHz;
    @Value("${omnimeasure.audio.aWeightingGain:1.118}")         private double aWeightingGain;
    @Value("${omnimeasure.audio.shimmerCouplingDb:0.5}")        private double shimmerCouplingDb;
    @Value("${omnimeasure.audio.staleAfterMs:2000}")            private long audioStaleAfterMs;
    @Value("${omnimeasure.audio.dbRingSize:40}")                private int dbRingSize;
    @Value("${omnimeasure.audio.dbEpsilon:1e-12}")              private double dbEpsilon;
    @Value("${omnimeasure.audio.source:none}")                  private String audioSource;
    @Value("${omnimeasure.audio.synthetic.toneHz:50}")          private double synthToneHz;
    @Value("${omnimeasure.audio.synthetic.toneAmplitude:0.2}")  private double synthToneAmplitude;
    @Value("${omnimeasure.audio.synthetic.noiseAmplitude:0.01}") private double synthNoiseAmplitude;

    // ==== Light ====
    @Value("${omnimeasure.light.luxRingSize:50}")               private int luxRingSize;
    @Value("${omnimeasure.light.darkLuxThreshold:5.0}")         private double darkLuxThreshold;
    @Value("${omnimeasure.light.naturalFlickerThreshold:0.01}") private double naturalFlickerThreshold;

    // ==== Fault / state ====
    @Value("${omnimeasure.fault.model:decay}")                  private String faultModel;
    @Value("${omnimeasure.fault.highAmplitude:4.0}")            private double faultHighAmplitude;
    @Value("${omnimeasure.fault.warningAmplitude:1.5}")         private double faultWarningAmplitude;
    @Value("${omnimeasure.fault.bearingCutoffHz:20}")           private double bearingFrequencyCutoffHz;
    @Value("${omnimeasure.fault.bearingBaseHours:24}")          private double bearingBaseHours;
    @Value("${omnimeasure.fault.bearingDecay:0.5}")             private double bearingDecay;
    @Value("${omnimeasure.fault.imbalanceBaseHours:168}")       private double imbalanceBaseHours;
    @Value("${omnimeasure.fault.imbalanceDecay:0.3}")           private double imbalanceDecay;
    @Value("${omnimeasure.fault.warningBaseHours:720}")         private double warningBaseHours;
    @Value("${omnimeasure.fault.warningDecay:0.1}")             private double warningDecay;
    @Value("${omnimeasure.fault.gradient.epsilon:1e-6}")        private double gradientModelEpsilon;
    @Value("${omnimeasure.fault.gradient.scale:1.0}")           private double gradientModelScale;
    @Value("${omnimeasure.state.tonalEntropyThreshold:0.35}")   private double tonalEntropyThreshold;
    @Value("${omnimeasure.state.criticalShimmer:25.0}")         private double criticalShimmer;
    @Value("${omnimeasure.state.warmSensorAfterMs:1200000}")    private long warmSensorAfterMs;

    // ==== Power ====
    @Value("${omnimeasure.power.wakeThreshold:0.12}")           private double wakeThreshold;
    @Value("${omnimeasure.power.ecoTimeoutMs:8000}")            private long ecoTimeoutMs;
    @Value("${omnimeasure.power.activeRateHz:50}")              private int activeRateHz;
    @Value("${omnimeasure.power.ecoRateHz:5}")                  private int ecoRateHz;
    @Value("${omnimeasure.power.ultraEcoRateHz:2}")             private int ultraEcoRateHz;
    @Value("${omnimeasure.power.throttleOnCelsius:45}")         private double throttleOnCelsius;
    @Value("${omnimeasure.power.throttleOffCelsius:40}")        private double throttleOffCelsius;

    @Bean
    public EngineConfig engineConfig() {
        EngineConfig d = EngineConfig.defaults();

        // --- sanitize knobs ---
        if (!(gravityAlpha > 0 && gravityAlpha < 1)) {
            log.warn("omnimeasure.orientation.gravityAlpha={} out of (0,1) → using {}", gravityAlpha, d.getGravityAlpha());
            gravityAlpha = d.getGravityAlpha();
        }
        if (!Maths.isPowerOfTwo(vibrationFftSize)) {
            log.warn("omnimeasure.vibration.fftSize={} is not a power of two → using {}", vibrationFftSize, d.getVibrationFftSize());
            vibrationFftSize = d.getVibrationFftSize();
        }
        if (!Maths.isPowerOfTwo(audioFftSize)) {
            log.warn("omnimeasure.audio.fftSize={} is not a power of two → using {}", audioFftSize, d.getAudioFftSize());
            audioFftSize = d.getAudioFftSize();
        }
        if (!(zoneB < zoneC && zoneC < zoneD)) {
            log.warn("zone thresholds {}/{}/{} are not ascending → using {}/{}/{}", zoneB, zoneC, zoneD,
                    d.getZoneBFromMmS(), d.getZoneCFromMmS(), d.getZoneDFromMmS());
            zoneB = d.getZoneBFromMmS();
            zoneC = d.getZoneCFromMmS();
            zoneD = d.getZoneDFromMmS();
        }
        if (tiltRingSize < 2) tiltRingSize = d.getTiltRingSize();
        if (rawMagnitudeRingSize < 2) {
            log.warn("omnimeasure.vibration.rawMagnitudeRingSize={} too small → using {}", rawMagnitudeRingSize, d.getRawMagnitudeRingSize());
            rawMagnitudeRingSize = d.getRawMagnitudeRingSize();
        }
        if (dbRingSize < 2) dbRingSize = d.getDbRingSize();
        if (luxRingSize < 1) luxRingSize = d.getLuxRingSize();
        if (rateRingSize < 1) rateRingSize = d.getRateRingSize();
        if (!(peakDecay >= 0 && peakDecay < 1)) {
            log.warn("omnimeasure.vibration.peakDecay={} out of [0,1) → using {}", peakDecay, d.getPeakDecay());
            peakDecay = d.getPeakDecay();
        }
        if (!(gradientDecay >= 0 && gradientDecay < 1)) {
            log.warn("omnimeasure.vibration.gradientDecay={} out of [0,1) → using {}", gradientDecay, d.getGradientDecay());
            gradientDecay = d.getGradientDecay();
        }
        if (!(gradientModelScale > 0)) {
            log.warn("omnimeasure.fault.gradient.scale={} must be > 0 → using {}", gradientModelScale, d.getGradientModelScale());
            gradientModelScale = d.getGradientModelScale();
        }

        EngineConfig cfg = EngineConfig.builder()
                .gravityAlpha(gravityAlpha)
                .tiltRingSize(tiltRingSize)
                .velocityProxyFactor(velocityProxyFactor)
                .zoneBFromMmS(zoneB)
                .zoneCFromMmS(zoneC)
                .zoneDFromMmS(zoneD)
                .vibrationFftSize(vibrationFftSize)
                .vibrationSpectralPeriodMs(vibrationSpectralPeriodMs)
                .nominalSensorRateHz(nominalSensorRateHz)
                .rawMagnitudeRingSize(rawMagnitudeRingSize)
                .rateRingSize(rateRingSize)
                .peakDecay(peakDecay)
                .gradientDecay(gradientDecay)
                .mains50LowHz(mains50LowHz)
                .mains50HighHz(mains50HighHz)
                .mains60LowHz(mains60LowHz)
                .mains60HighHz(mains60HighHz)
                .motorBandLowHz(motorBandLowHz)
                .motorBandHighHz(motorBandHighHz)
                .lowFrequencyBandHz(lowFrequencyBandHz)
                .spectralEnergyFloor(spectralEnergyFloor)
                .audioSampleRate(audioSampleRate)
                .audioFftSize(audioFftSize)
                .audioSpectralPeriodMs(audioSpectralPeriodMs)
                .defaultSplOffsetDb(splOffsetDb)
                .aWeightingCutoffHz(aWeightingCutoffHz)
                .aWeightingGain(aWeightingGain)
                .shimmerCouplingDb(shimmerCouplingDb)
                .audioStaleAfterMs(audioStaleAfterMs)
                .dbRingSize(dbRingSize)
                .dbEpsilon(dbEpsilon)
                .luxRingSize(luxRingSize)
                .darkLuxThreshold(darkLuxThreshold)
                .naturalFlickerThreshold(naturalFlickerThreshold)
                .faultHighAmplitude(faultHighAmplitude)
                .faultWarningAmplitude(faultWarningAmplitude)
                .bearingFrequencyCutoffHz(bearingFrequencyCutoffHz)
                .bearingBaseHours(bearingBaseHours)
                .bearingDecay(bearingDecay)
                .imbalanceBaseHours(imbalanceBaseHours)
                .imbalanceDecay(imbalanceDecay)
                .warningBaseHours(warningBaseHours)
                .warningDecay(warningDecay)
                .gradientModelEpsilon(gradientModelEpsilon)
                .gradientModelScale(gradientModelScale)
                .tonalEntropyThreshold(tonalEntropyThreshold)
                .criticalShimmer(criticalShimmer)
                .warmSensorAfterMs(warmSensorAfterMs)
                .build()
                .validate();

        log.info("Engine config: alpha={} zones B/C/D={}/{}/{} mm/s vibFft={} audioFft={}@{}Hz spl={}dB fault={}",
                cfg.getGravityAlpha(), cfg.getZoneBFromMmS(), cfg.getZoneCFromMmS(), cfg.getZoneDFromMmS(),
                cfg.getVibrationFftSize(), cfg.getAudioFftSize(), cfg.getAudioSampleRate(),
                cfg.getDefaultSplOffsetDb(), faultModel);
        return cfg;
    }

    @Bean
    public EcoConfig ecoConfig() {
        EcoConfig d = EcoConfig.defaults();
        if (throttleOffCelsius >= throttleOnCelsius) {
            log.warn("throttle off {}°C must be below on {}°C → using {}/{}", throttleOffCelsius, throttleOnCelsius,
                    d.getThrottleOffCelsius(), d.getThrottleOnCelsius());
            throttleOnCelsius = d.getThrottleOnCelsius();
            throttleOffCelsius = d.getThrottleOffCelsius();
        }
        if (activeRateHz <= 0 || ecoRateHz <= 0 || ultraEcoRateHz <= 0) {
            log.warn("sampling rates must be positive ({}/{}/{}) → using defaults", activeRateHz, ecoRateHz, ultraEcoRateHz);
            activeRateHz = d.getActiveRateHz();
            ecoRateHz = d.getEcoRateHz();
            ultraEcoRateHz = d.getUltraEcoRateHz();
        }
        return EcoConfig.builder()
                .wakeThreshold(wakeThreshold)
                .ecoTimeoutMs(Math.max(0, ecoTimeoutMs))
                .activeRateHz(activeRateHz)
                .ecoRateHz(ecoRateHz)
                .ultraEcoRateHz(ultraEcoRateHz)
                .throttleOnCelsius(throttleOnCelsius)
                .throttleOffCelsius(throttleOffCelsius)
                .build();
    }

    @Bean
    public FaultModel faultModel(EngineConfig cfg) {
        String kind = faultModel == null ? "decay" : faultModel.trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "gradient" -> new GradientFaultModel(cfg);
            case "decay" -> new DecayFaultModel(cfg);
            default -> {
                log.warn("Unknown omnimeasure.fault.model='{}' → using decay", faultModel);
                yield new DecayFaultModel(cfg);
            }
        };
    }

    @Bean
    public DiagnosticEngine diagnosticEngine(EngineConfig cfg, FaultModel faultModel) {
        return new DiagnosticEngine(cfg, faultModel);
    }

    @Bean
    public EcoController ecoController(EcoConfig ecoConfig) {
        return new EcoController(ecoConfig);
    }

    @Bean
    public AudioHandoff audioHandoff() {
        return new AudioHandoff();
    }

    @Bean
    public AudioSource audioSource() {
        String kind = audioSource == null ? "none" : audioSource.trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "javasound" -> new JavaSoundAudioSource();
            case "synthetic" -> new SyntheticAudioSource(synthToneHz, synthToneAmplitude, synthNoiseAmplitude, true);
            case "none" -> new NoAudioSource();
            default -> {
                log.warn("Unknown omnimeasure.audio.source='{}' → no audio", audioSource);
                yield new NoAudioSource();
            }
        };
    }
}
