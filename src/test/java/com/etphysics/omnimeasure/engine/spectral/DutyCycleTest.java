package com.etphysics.omnimeasure.engine.spectral;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DutyCycleTest {

    @Test
    void first_call_passes_then_once_per_period() {
        DutyCycle d = new DutyCycle(100);
        long ms = 1_000_000L;

        assertThat(d.tryAcquire(5_000 * ms)).isTrue();
        assertThat(d.tryAcquire(5_050 * ms)).isFalse();
        assertThat(d.tryAcquire(5_099 * ms)).isFalse();
        assertThat(d.tryAcquire(5_100 * ms)).isTrue();
        assertThat(d.tryAcquire(5_150 * ms)).isFalse();
    }
}
