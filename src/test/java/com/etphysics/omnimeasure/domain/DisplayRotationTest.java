package com.etphysics.omnimeasure.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DisplayRotationTest {

    private final Vector3 v = new Vector3(1, 2, 3);

    @Test
    void remaps_axes_for_each_rotation() {
        assertThat(DisplayRotation.ROTATION_0.remap(v)).isEqualTo(new Vector3(1, 2, 3));
        assertThat(DisplayRotation.ROTATION_90.remap(v)).isEqualTo(new Vector3(-2, 1, 3));
        assertThat(DisplayRotation.ROTATION_180.remap(v)).isEqualTo(new Vector3(-1, -2, 3));
        assertThat(DisplayRotation.ROTATION_270.remap(v)).isEqualTo(new Vector3(2, -1, 3));
    }

    @Test
    void unknown_degrees_fall_back_to_natural_orientation() {
        assertThat(DisplayRotation.fromDegrees(270)).isEqualTo(DisplayRotation.ROTATION_270);
        assertThat(DisplayRotation.fromDegrees(45)).isEqualTo(DisplayRotation.ROTATION_0);
    }

}
