package com.etphysics.omnimeasure.engine.spectral;

import com.etphysics.omnimeasure.domain.Maths;
import com.etphysics.omnimeasure.domain.SpectrumSnapshot;
import com.etphysics.omnimeasure.engine.EngineConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Windowed FFT stage shared by the vibration and audio paths.
 *
 * Window: Hann, w[i] = 0.5 * (1 - cos(2πi / (N-1))), precomputed once per instance.
 * Peak search and entropy cover bins 1..N/2-1 (DC and Nyquist excluded).
 * One instance per path; the work arrays are reused, so an instance is single-threaded.
 */
@Slf4j
public class SpectralAnalyzer {

    private final int n;
    private final EngineConfig cfg;
    private final double[] window;
    private final double[] re;
    private final double[] im;

    public SpectralAnalyzer(int fftSize, EngineConfig cfg) {
        if (!Maths.isPowerOfTwo(fftSize) || fftSize < 4) {
            throw new IllegalArgumentException("fft size must be a power of two >= 4: " + fftSize);
        }
        this.n = fftSize;
        this.cfg = cfg;
        this.window = new double[n];
        for (int i = 0; i < n; i++) {
            window[i] = 0.5 * (1 - Math.cos(2 * Math.PI * i / (n - 1)));
        }
        this.re = new double[n];
        this.im = new double[n];
    }

    public int fftSize() { return n; }

    /**
     * Analyse the first N samples of {@code samples}.
     *
     * @param detrend subtract the block mean before windowing (magnitude signals carry a large DC part)
     */
    public SpectrumSnapshot analyze(double[] samples, double sampleRateHz, boolean detrend, long timestampNs) {
        if (samples == null || samples.length < n) {
            throw new IllegalArgumentException("need at least " + n + " samples, got "
                    + (samples == null ? 0 : samples.length));
        }
        double mean = 0.0;
        if (detrend) {
            for (int i = 0; i < n; i++) mean += samples[i];
            mean /= n;
        }
        for (int i = 0; i < n; i++) {
            re[i] = (samples[i] - mean) * window[i];
            im[i] = 0.0;
        }
        return transformAndSummarize(sampleRateHz, timestampNs);
    }

    /** PCM16 path: samples are scaled to [-1, 1) before windowing. */
    public SpectrumSnapshot analyzePcm(short[] pcm, double sampleRateHz, long timestampNs) {
        if (pcm == null || pcm.length < n) {
            throw new IllegalArgumentException("need at least " + n + " PCM samples, got "
                    + (pcm == null ? 0 : pcm.length));
        }
        for (int i = 0; i < n; i++) {
            re[i] = (pcm[i] / 32768.0) * window[i];
            im[i] = 0.0;
        }
        return transformAndSummarize(sampleRateHz, timestampNs);
    }

    private SpectrumSnapshot transformAndSummarize(double sampleRateHz, long timestampNs) {
        Fft.forward(re, im);

        int half = n / 2;
        double[] mags = new double[half];
        double total = 0.0;
        double maxMag = 0.0;
        int maxIdx = 0;
        for (int i = 1; i < half; i++) {
            double m = Math.sqrt(re[i] * re[i] + im[i] * im[i]);
            mags[i] = m;
            total += m;
            if (m > maxMag) { maxMag = m; maxIdx = i; }
        }

        double entropy = spectralEntropy(mags, 1, half, n);
        double freq = maxIdx * sampleRateHz / n;
        String label = total < cfg.getSpectralEnergyFloor() ? SpectrumSnapshot.UNLABELED : label(freq);

        if (log.isTraceEnabled()) {
            log.trace("spectrum n={} fs={} peakBin={} freq={}Hz entropy={} label={}",
                    n, sampleRateHz, maxIdx, String.format(Locale.ROOT, "%.2f", freq),
                    String.format(Locale.ROOT, "%.3f", entropy), label);
        }
        return new SpectrumSnapshot(freq, maxMag, entropy, total, label, timestampNs);
    }

    /**
     * Shannon entropy of mags[from..to) treated as a probability distribution, divided by ln(N/2)
     * so the result lies in [0,1]. Zero when the distribution carries no energy.
     */
    public static double spectralEntropy(double[] mags, int from, int to, int fftSize) {
        double total = 0.0;
        for (int i = from; i < to; i++) total += mags[i];
        if (total <= 0.0) return 0.0;

        double h = 0.0;
        for (int i = from; i < to; i++) {
            double p = mags[i] / total;
            if (p > 0) h -= p * Math.log(p);
        }
        return Maths.clamp(h / Math.log(fftSize / 2.0), 0.0, 1.0);
    }

    /** Fixed bands, top-down, first match wins. */
    public String label(double freqHz) {
        if (freqHz >= cfg.getMains50LowHz() && freqHz <= cfg.getMains50HighHz()) return "Electrical Mains (50Hz)";
        if (freqHz >= cfg.getMains60LowHz() && freqHz <= cfg.getMains60HighHz()) return "Electrical Mains (60Hz)";
        if (freqHz >= cfg.getMotorBandLowHz() && freqHz <= cfg.getMotorBandHighHz()) {
            return "Motor/Fan (" + Math.round(freqHz * 60) + " RPM)";
        }
        if (freqHz > 0 && freqHz < cfg.getLowFrequencyBandHz()) return "Suspension / Human";
        return SpectrumSnapshot.UNLABELED;
    }

    public boolean isMainsBand(double freqHz) {
        return (freqHz >= cfg.getMains50LowHz() && freqHz <= cfg.getMains50HighHz())
                || (freqHz >= cfg.getMains60LowHz() && freqHz <= cfg.getMains60HighHz());
    }
}
