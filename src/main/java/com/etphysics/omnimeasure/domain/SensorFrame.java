package com.etphysics.omnimeasure.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One sensor sample set handed to the engine. Gyro, PCM block and lux are optional (null = absent).
 */
@Value @Builder(toBuilder = true)
public class SensorFrame {
    @NonNull Vector3 accel;          // m/s²
    Vector3 gyro;                    // rad/s
    short[] pcm;                     // mono PCM16, length >= audio FFT size to be analysed
    Double lux;
    @Builder.Default
    DisplayRotation rotation = DisplayRotation.ROTATION_0;
    long timestampNs;                // monotonic

    public boolean hasPcm() { return pcm != null && pcm.length > 0; }
}
