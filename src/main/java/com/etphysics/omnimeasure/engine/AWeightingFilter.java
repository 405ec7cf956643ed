package com.etphysics.omnimeasure.engine;

/**
 * Two-stage approximation of the A-weighting curve:
 *   1) one-pole RC high-pass:  y[n] = a·(y[n-1] + x[n] - x[n-1]),  a = τ / (τ + dt),  τ = 1 / (2π·fc)
 *   2) fixed gain shaping stage.
 * State is local to one block; the first sample initialises the high-pass quietly.
 */
public class AWeightingFilter {

    private final double a;
    private final double gain;

    public AWeightingFilter(double cutoffHz, double gain, int sampleRate) {
        double fc = Math.max(1e-6, cutoffHz);
        double tau = 1.0 / (2.0 * Math.PI * fc);
        double dt = 1.0 / Math.max(1, sampleRate);
        this.a = tau / (tau + dt);
        this.gain = gain;
    }

    /** Weighted RMS of a PCM16 block, samples scaled to [-1, 1). */
    public double weightedRms(short[] pcm) {
        if (pcm == null || pcm.length < 2) return 0.0;
        double xPrev = pcm[0] / 32768.0;
        double yPrev = 0.0;
        double sumSq = 0.0;
        for (int i = 1; i < pcm.length; i++) {
            double x = pcm[i] / 32768.0;
            double y = a * (yPrev + x - xPrev);
            xPrev = x;
            yPrev = y;
            double shaped = y * gain;
            sumSq += shaped * shaped;
        }
        return Math.sqrt(sumSq / (pcm.length - 1));
    }
}
