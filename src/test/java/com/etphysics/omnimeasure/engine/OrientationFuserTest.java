package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.CalibrationProfile;
import com.etphysics.omnimeasure.domain.DisplayRotation;
import com.etphysics.omnimeasure.domain.Vector3;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrientationFuserTest {

    private static final double G = 9.81;

    private final OrientationFuser fuser = new OrientationFuser(EngineConfig.defaults());
    private final CalibrationProfile neutral = CalibrationProfile.initial(90.0);

    private static Vector3 pitched(double deg) {
        double r = Math.toRadians(deg);
        return new Vector3(0, G * Math.sin(r), G * Math.cos(r));
    }

    @Test
    void first_frame_seeds_gravity_so_flat_reads_zero() {
        OrientationFuser.State st = new OrientationFuser.State(50);
        OrientationFuser.Reading r = fuser.update(st, new Vector3(0, 0, G), neutral);

        assertThat(r.tiltDeg()).isCloseTo(0.0, within(1e-9));
        assertThat(r.linearAccel().norm()).isZero();
        assertThat(r.tiltConfidence()).isZero();
    }

    @Test
    void pitch_is_reported_from_gravity() {
        OrientationFuser.State st = new OrientationFuser.State(50);
        OrientationFuser.Reading r = fuser.update(st, pitched(10), neutral);

        assertThat(r.pitchDeg()).isCloseTo(10.0, within(1e-9));
        assertThat(r.rollDeg()).isCloseTo(0.0, within(1e-9));
        assertThat(r.tiltDeg()).isCloseTo(10.0, within(1e-6));
        assertThat(st.rawTilt().pitchDeg()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void gravity_lags_then_converges_after_a_step() {
        OrientationFuser.State st = new OrientationFuser.State(50);
        fuser.update(st, pitched(0), neutral);

        OrientationFuser.Reading first = fuser.update(st, pitched(20), neutral);
        assertThat(first.tiltDeg()).isBetween(1.0, 19.0);
        assertThat(first.linearAccel().norm()).isGreaterThan(0.0);
        assertThat(first.tiltConfidence()).isGreaterThan(0.0);

        OrientationFuser.Reading r = first;
        for (int i = 0; i < 80; i++) r = fuser.update(st, pitched(20), neutral);
        assertThat(r.tiltDeg()).isCloseTo(20.0, within(1e-3));
        assertThat(r.linearAccel().norm()).isLessThan(1e-4);
    }

    @Test
    void tilt_zero_is_subtracted() {
        OrientationFuser.State st = new OrientationFuser.State(50);
        CalibrationProfile zeroed = neutral.withTiltZero(10.0, 0.0);

        OrientationFuser.Reading r = fuser.update(st, pitched(10), zeroed);

        assertThat(r.pitchDeg()).isCloseTo(0.0, within(1e-9));
        assertThat(r.tiltDeg()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void calibrate_remaps_for_rotation_then_removes_offset() {
        CalibrationProfile cal = neutral.withSensorOffsets(new Vector3(0.1, 0.2, 0.3), Vector3.ZERO, 90.0);

        Vector3 out = fuser.calibrate(new Vector3(1, 2, 3), DisplayRotation.ROTATION_90, cal);

        assertThat(out.x()).isCloseTo(-2.1, within(1e-12));
        assertThat(out.y()).isCloseTo(0.8, within(1e-12));
        assertThat(out.z()).isCloseTo(2.7, within(1e-12));
    }
}
