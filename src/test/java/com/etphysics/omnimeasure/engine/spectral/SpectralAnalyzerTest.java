package com.etphysics.omnimeasure.engine.spectral;

import com.etphysics.omnimeasure.domain.SpectrumSnapshot;
import com.etphysics.omnimeasure.engine.EngineConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SpectralAnalyzerTest {

    private final EngineConfig cfg = EngineConfig.defaults();

    @Test
    void pure_tone_is_found_within_one_bin_and_has_low_entropy() {
        SpectralAnalyzer a = new SpectralAnalyzer(512, cfg);
        double[] s = new double[512];
        for (int i = 0; i < s.length; i++) s[i] = Math.sin(2 * Math.PI * 25 * i / 512.0);

        SpectrumSnapshot snap = a.analyze(s, 512, false, 0L);

        assertThat(snap.dominantFrequencyHz()).isCloseTo(25.0, within(1.0));
        assertThat(snap.entropy()).isLessThan(cfg.getTonalEntropyThreshold());
        assertThat(snap.label()).isEqualTo("Motor/Fan (1500 RPM)");
    }

    @Test
    void white_noise_has_high_entropy() {
        SpectralAnalyzer a = new SpectralAnalyzer(512, cfg);
        Random rnd = new Random(1);
        double[] s = new double[512];
        for (int i = 0; i < s.length; i++) s[i] = rnd.nextGaussian();

        SpectrumSnapshot snap = a.analyze(s, 512, false, 0L);

        assertThat(snap.entropy()).isBetween(0.8, 1.0);
    }

    @Test
    void mains_hum_in_pcm_is_labelled_as_mains() {
        SpectralAnalyzer a = new SpectralAnalyzer(4096, cfg);
        short[] pcm = new short[4096];
        for (int i = 0; i < pcm.length; i++) pcm[i] = (short) (8000 * Math.sin(2 * Math.PI * 50 * i / 16000.0));

        SpectrumSnapshot snap = a.analyzePcm(pcm, 16000, 0L);

        assertThat(snap.dominantFrequencyHz()).isCloseTo(50.0, within(16000.0 / 4096));
        assertThat(snap.label()).isEqualTo("Electrical Mains (50Hz)");
        assertThat(a.isMainsBand(snap.dominantFrequencyHz())).isTrue();
    }

    @Test
    void silence_has_no_energy_and_no_label() {
        SpectralAnalyzer a = new SpectralAnalyzer(512, cfg);
        SpectrumSnapshot snap = a.analyze(new double[512], 50, true, 0L);

        assertThat(snap.totalEnergy()).isZero();
        assertThat(snap.entropy()).isZero();
        assertThat(snap.label()).isEqualTo(SpectrumSnapshot.UNLABELED);
    }

    @Test
    void entropy_is_normalised_to_unit_interval() {
        double[] flat = new double[256];
        Arrays.fill(flat, 1.0);
        double[] spike = new double[256];
        spike[7] = 5.0;

        assertThat(SpectralAnalyzer.spectralEntropy(flat, 1, 256, 512)).isCloseTo(1.0, within(0.01));
        assertThat(SpectralAnalyzer.spectralEntropy(spike, 1, 256, 512)).isZero();
        assertThat(SpectralAnalyzer.spectralEntropy(new double[256], 1, 256, 512)).isZero();
    }

    @Test
    void labels_follow_the_band_table() {
        SpectralAnalyzer a = new SpectralAnalyzer(512, cfg);
        assertThat(a.label(50.0)).isEqualTo("Electrical Mains (50Hz)");
        assertThat(a.label(60.0)).isEqualTo("Electrical Mains (60Hz)");
        assertThat(a.label(20.0)).isEqualTo("Motor/Fan (1200 RPM)");
        assertThat(a.label(2.0)).isEqualTo("Suspension / Human");
        assertThat(a.label(8.0)).isEqualTo(SpectrumSnapshot.UNLABELED);
        assertThat(a.label(120.0)).isEqualTo(SpectrumSnapshot.UNLABELED);
        assertThat(a.label(0.0)).isEqualTo(SpectrumSnapshot.UNLABELED);
    }

    @Test
    void short_input_and_bad_sizes_are_rejected() {
        SpectralAnalyzer a = new SpectralAnalyzer(512, cfg);
        assertThatThrownBy(() -> a.analyze(new double[100], 50, false, 0L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpectralAnalyzer(500, cfg))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
