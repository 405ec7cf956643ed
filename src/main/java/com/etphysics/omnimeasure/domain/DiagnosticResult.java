package com.etphysics.omnimeasure.domain;

import lombok.Builder;
import lombok.Value;

/** Immutable per-frame diagnostic snapshot. */
@Value @Builder
public class DiagnosticResult {
    long timestampNs;
    double realHz;

    // Orientation
    double tiltDegrees;
    double tiltConfidence;     // ± degrees
    double pitchDegrees;
    double rollDegrees;
    double angularRate;        // rad/s, gyro after zero-offset

    // Vibration
    double vibrationMagnitude; // m/s², |linear accel| this frame
    double vibrationRms;       // m/s²
    double vibrationPeak;      // m/s², decaying peak hold
    double velocityRms;        // mm/s proxy
    IsoZone isoZone;
    int severity;
    double shimmer;
    double longTermGradient;

    // Acoustic
    double dbA;
    double dbUncertainty;      // ± dB
    boolean audioAvailable;

    // Light
    double lux;
    double flickerIndex;
    String lightSource;

    // Spectral (audio spectrum when available, vibration spectrum otherwise)
    double dominantFrequency;
    String frequencyLabel;
    double spectralEntropy;
    double mechanicalFrequency;
    String mechanicalLabel;

    // Fault
    String faultPrediction;
    double faultConfidence;
    double ttfHours;           // NaN = no forecast

    EngineState engineState;
    String statusMessage;

    public static final DiagnosticResult EMPTY = DiagnosticResult.builder()
            .isoZone(IsoZone.A)
            .lightSource("Unknown")
            .frequencyLabel(SpectrumSnapshot.UNLABELED)
            .mechanicalLabel(SpectrumSnapshot.UNLABELED)
            .faultPrediction("Healthy")
            .ttfHours(Double.NaN)
            .engineState(EngineState.BASELINE)
            .statusMessage("")
            .build();
}
