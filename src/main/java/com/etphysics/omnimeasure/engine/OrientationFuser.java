package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.CalibrationProfile;
import com.etphysics.omnimeasure.domain.DisplayRotation;
import com.etphysics.omnimeasure.domain.Maths;
import com.etphysics.omnimeasure.domain.RingBuffer;
import com.etphysics.omnimeasure.domain.Vector3;

/**
 * Gravity estimation and tilt.
 *
 * Per frame:
 *   calAccel    = remap(accel, rotation) - accelZero
 *   gravity     = α·gravity + (1-α)·calAccel     (seeded with the first calAccel)
 *   linearAccel = calAccel - gravity
 *   pitch       = atan2(g.y, g.z),  roll = atan2(-g.x, sqrt(g.y² + g.z²))   minus the tilt zero
 *   tilt        = acos(cos(pitch)·cos(roll))
 */
public class OrientationFuser {

    private final double alpha;

    public OrientationFuser(EngineConfig cfg) {
        this.alpha = cfg.getGravityAlpha();
    }

    public Vector3 calibrate(Vector3 accel, DisplayRotation rotation, CalibrationProfile cal) {
        DisplayRotation r = rotation == null ? DisplayRotation.ROTATION_0 : rotation;
        return r.remap(accel).minus(cal.accelZero());
    }

    public Reading update(State st, Vector3 calAccel, CalibrationProfile cal) {
        Vector3 g = (st.gravity == null)
                ? calAccel
                : st.gravity.scale(alpha).plus(calAccel.scale(1.0 - alpha));
        st.gravity = g;

        Vector3 linear = calAccel.minus(g);

        double rawPitch = Math.toDegrees(Math.atan2(g.y(), g.z()));
        double rawRoll  = Math.toDegrees(Math.atan2(-g.x(), Math.sqrt(g.y() * g.y() + g.z() * g.z())));
        st.rawTilt = new RawTilt(rawPitch, rawRoll);

        double pitch = rawPitch - cal.pitchZeroDeg();
        double roll  = rawRoll - cal.rollZeroDeg();
        double cosTilt = Maths.clamp(Math.cos(Math.toRadians(pitch)) * Math.cos(Math.toRadians(roll)), -1.0, 1.0);
        double tilt = Math.toDegrees(Math.acos(cosTilt));

        st.tiltHistory.add(tilt);
        return new Reading(g, linear, pitch, roll, tilt, st.tiltHistory.sampleStdDev());
    }

    public record Reading(Vector3 gravity,
                          Vector3 linearAccel,
                          double pitchDeg,
                          double rollDeg,
                          double tiltDeg,
                          double tiltConfidence) {}

    /** Pitch and roll before the tilt zero is applied. */
    public record RawTilt(double pitchDeg, double rollDeg) {}

    /** Orientation part of the session state. */
    public static final class State {
        private Vector3 gravity;                 // null until the first frame
        private final RingBuffer tiltHistory;
        // read by the calibration control path, published as one pair
        private volatile RawTilt rawTilt = new RawTilt(0.0, 0.0);

        public State(int tiltRingSize) {
            this.tiltHistory = new RingBuffer(tiltRingSize);
        }

        public Vector3 gravity()     { return gravity == null ? Vector3.ZERO : gravity; }
        public RawTilt rawTilt()     { return rawTilt; }
    }
}
