package com.etphysics.omnimeasure.domain;

/**
 * Result of one spectral pass.
 *
 * @param dominantFrequencyHz bin * sampleRate / N of the strongest bin (DC and Nyquist excluded)
 * @param dominantMagnitude   magnitude of that bin
 * @param entropy             normalized spectral entropy in [0,1]
 * @param totalEnergy         sum of magnitudes over the searched bins
 * @param label               frequency band label
 * @param computedAtNs        frame timestamp of the pass
 */
public record SpectrumSnapshot(double dominantFrequencyHz,
                               double dominantMagnitude,
                               double entropy,
                               double totalEnergy,
                               String label,
                               long computedAtNs) {

    public static final String UNLABELED = "Unknown";

    public static final SpectrumSnapshot EMPTY = new SpectrumSnapshot(0.0, 0.0, 0.0, 0.0, UNLABELED, 0L);

    public boolean isEmpty() { return computedAtNs == 0L && totalEnergy == 0.0; }
}
