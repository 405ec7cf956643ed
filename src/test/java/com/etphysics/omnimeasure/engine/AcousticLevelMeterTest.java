package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.CalibrationProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AcousticLevelMeterTest {

    private final EngineConfig cfg = EngineConfig.defaults();
    private final AcousticLevelMeter meter = new AcousticLevelMeter(cfg);
    private final CalibrationProfile cal = CalibrationProfile.initial(90.0);

    private static short[] tone(double hz, double amplitude, int n) {
        short[] pcm = new short[n];
        for (int i = 0; i < n; i++) pcm[i] = (short) Math.round(amplitude * Math.sin(2 * Math.PI * hz * i / 16000.0));
        return pcm;
    }

    @Test
    void silence_reads_zero() {
        AcousticLevelMeter.State st = new AcousticLevelMeter.State(40);
        AcousticLevelMeter.Reading r = meter.measure(st, new short[4096], 0.0, cal, 1L);

        assertThat(r.dbA()).isZero();
        assertThat(st.hasReading()).isTrue();
        assertThat(st.lastPcmAtNs()).isEqualTo(1L);
    }

    @Test
    void halving_amplitude_drops_about_six_db() {
        AcousticLevelMeter.State st = new AcousticLevelMeter.State(40);
        double loud = meter.measure(st, tone(1000, 16000, 4096), 0.0, cal, 0L).dbA();
        double quiet = meter.measure(st, tone(1000, 8000, 4096), 0.0, cal, 0L).dbA();

        assertThat(loud - quiet).isCloseTo(20 * Math.log10(2), within(0.05));
    }

    @Test
    void high_pass_favours_high_frequencies() {
        AcousticLevelMeter.State st = new AcousticLevelMeter.State(40);
        double low = meter.measure(st, tone(50, 8000, 4096), 0.0, cal, 0L).dbA();
        double high = meter.measure(st, tone(2000, 8000, 4096), 0.0, cal, 0L).dbA();

        assertThat(high).isGreaterThan(low + 10.0);
    }

    @Test
    void shimmer_raises_the_level_monotonically() {
        assertThat(meter.correction(0.0)).isZero();
        assertThat(meter.correction(Math.E - 1)).isCloseTo(0.5, within(1e-12));
        assertThat(meter.correction(10.0)).isGreaterThan(meter.correction(1.0));

        AcousticLevelMeter.State st = new AcousticLevelMeter.State(40);
        short[] pcm = tone(1000, 8000, 4096);
        double still = meter.measure(st, pcm, 0.0, cal, 0L).dbA();
        double shaking = meter.measure(st, pcm, 3.0, cal, 0L).dbA();
        assertThat(shaking - still).isCloseTo(0.5 * Math.log(4.0), within(1e-9));
    }

    @Test
    void uncertainty_is_spread_of_recent_readings() {
        AcousticLevelMeter.State st = new AcousticLevelMeter.State(40);
        AcousticLevelMeter.Reading first = meter.measure(st, tone(1000, 8000, 4096), 0.0, cal, 0L);
        AcousticLevelMeter.Reading second = meter.measure(st, tone(1000, 16000, 4096), 0.0, cal, 0L);

        assertThat(first.uncertainty()).isZero();
        assertThat(second.uncertainty()).isGreaterThan(0.0);
    }

    @Test
    void reference_offset_maps_raw_level_to_target() {
        assertThat(AcousticLevelMeter.referenceOffset(40.0, -20.0)).isEqualTo(60.0);
        assertThat(AcousticLevelMeter.referenceOffset(40.0, -90.0)).isEqualTo(130.0);
    }

    @Test
    void raw_level_does_not_depend_on_the_offset() {
        short[] pcm = tone(1000, 8000, 4096);
        AcousticLevelMeter.State a = new AcousticLevelMeter.State(40);
        AcousticLevelMeter.State b = new AcousticLevelMeter.State(40);
        double at90 = meter.measure(a, pcm, 0.0, cal, 0L).dbA();
        meter.measure(b, pcm, 0.0, CalibrationProfile.initial(60.0), 0L);

        assertThat(a.lastRawDb()).isCloseTo(at90 - 90.0, within(1e-9));
        assertThat(b.lastRawDb()).isCloseTo(a.lastRawDb(), within(1e-12));
    }
}
