package com.etphysics.omnimeasure.audio;

import java.util.Random;

/**
 * Tone plus white noise, paced in real time. Used by the simulator profile and in tests.
 */
public class SyntheticAudioSource implements AudioSource {

    private final double toneHz;
    private final double toneAmplitude;   // fraction of full scale
    private final double noiseAmplitude;  // fraction of full scale
    private final boolean paced;
    private final Random random = new Random(42);

    private int sampleRate;
    private long sampleIndex;
    private volatile boolean open;

    public SyntheticAudioSource(double toneHz, double toneAmplitude, double noiseAmplitude, boolean paced) {
        this.toneHz = toneHz;
        this.toneAmplitude = toneAmplitude;
        this.noiseAmplitude = noiseAmplitude;
        this.paced = paced;
    }

    @Override
    public void open(int sampleRate) {
        this.sampleRate = sampleRate;
        this.sampleIndex = 0;
        this.open = true;
    }

    @Override
    public int read(short[] buf, int off, int len) throws AudioUnavailableException {
        if (!open) throw new AudioUnavailableException("synthetic source not open");
        for (int i = 0; i < len; i++) {
            double t = (double) sampleIndex++ / sampleRate;
            double v = toneAmplitude * Math.sin(2 * Math.PI * toneHz * t)
                    + noiseAmplitude * (random.nextDouble() * 2 - 1);
            buf[off + i] = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, Math.round(v * 32767)));
        }
        if (paced) {
            try {
                Thread.sleep(Math.max(1L, len * 1000L / sampleRate));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AudioUnavailableException("interrupted", e);
            }
        }
        return len;
    }

    @Override
    public void close() {
        open = false;
    }

    @Override
    public String describe() {
        return "synthetic(" + toneHz + " Hz)";
    }
}
