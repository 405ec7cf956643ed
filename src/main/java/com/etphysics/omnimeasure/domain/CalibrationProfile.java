package com.etphysics.omnimeasure.domain;

/**
 * Calibration offsets owned by one engine session. Immutable; every change produces a new profile
 * so a frame never sees a half-written vector.
 *
 * @param accelZero   subtracted from the remapped accel vector (m/s²)
 * @param gyroZero    subtracted from the gyro vector (rad/s)
 * @param splOffsetDb added to the weighted level (dB)
 * @param pitchZeroDeg subtracted from pitch (degrees)
 * @param rollZeroDeg  subtracted from roll (degrees)
 */
public record CalibrationProfile(Vector3 accelZero,
                                 Vector3 gyroZero,
                                 double splOffsetDb,
                                 double pitchZeroDeg,
                                 double rollZeroDeg) {

    public static CalibrationProfile initial(double splOffsetDb) {
        return new CalibrationProfile(Vector3.ZERO, Vector3.ZERO, splOffsetDb, 0.0, 0.0);
    }

    /**
     * Accel zero-offset from a reading taken while the device lies flat: the vertical axis keeps
     * standard gravity, only the residual is treated as bias.
     */
    public static Vector3 accelZeroFromResting(Vector3 restingMean) {
        return new Vector3(restingMean.x(), restingMean.y(), restingMean.z() - Maths.STANDARD_GRAVITY);
    }

    public CalibrationProfile withSensorOffsets(Vector3 accel, Vector3 gyro, double spl) {
        return new CalibrationProfile(accel, gyro, spl, pitchZeroDeg, rollZeroDeg);
    }

    public CalibrationProfile withAccelZero(Vector3 accel) {
        return new CalibrationProfile(accel, gyroZero, splOffsetDb, pitchZeroDeg, rollZeroDeg);
    }

    public CalibrationProfile withTiltZero(double pitchDeg, double rollDeg) {
        return new CalibrationProfile(accelZero, gyroZero, splOffsetDb, pitchDeg, rollDeg);
    }

    public CalibrationProfile withSplOffset(double spl) {
        return new CalibrationProfile(accelZero, gyroZero, spl, pitchZeroDeg, rollZeroDeg);
    }
}
