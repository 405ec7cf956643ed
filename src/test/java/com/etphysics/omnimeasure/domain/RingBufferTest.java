package com.etphysics.omnimeasure.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RingBufferTest {

    @Test
    void keeps_newest_samples_oldest_first() {
        RingBuffer r = new RingBuffer(3);
        for (int i = 1; i <= 5; i++) r.add(i);

        assertThat(r.isFull()).isTrue();
        assertThat(r.size()).isEqualTo(3);
        assertThat(r.toArray()).containsExactly(3.0, 4.0, 5.0);
        assertThat(r.newest()).isEqualTo(5.0);
        assertThat(r.sum(0, 2)).isEqualTo(7.0);
    }

    @Test
    void statistics_use_population_variance_and_bessel_stddev() {
        RingBuffer r = new RingBuffer(8);
        for (double v : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) r.add(v);

        assertThat(r.mean()).isEqualTo(5.0);
        assertThat(r.variance()).isEqualTo(4.0);
        assertThat(r.sampleStdDev()).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
        assertThat(r.meanSquare()).isEqualTo(29.0);
    }

    @Test
    void empty_and_single_sample_statistics_are_zero() {
        RingBuffer r = new RingBuffer(4);
        assertThat(r.mean()).isZero();
        assertThat(r.variance()).isZero();
        r.add(3.0);
        assertThat(r.sampleStdDev()).isZero();
    }

    @Test
    void clear_resets_and_bad_capacity_is_rejected() {
        RingBuffer r = new RingBuffer(2);
        r.add(1);
        r.clear();
        assertThat(r.isEmpty()).isTrue();
        assertThatThrownBy(() -> r.get(0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> new RingBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
