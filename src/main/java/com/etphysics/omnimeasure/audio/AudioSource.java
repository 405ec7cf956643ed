package com.etphysics.omnimeasure.audio;

/** Microphone abstraction: mono PCM16 at a fixed sample rate. Used from the capture thread only. */
public interface AudioSource {

    void open(int sampleRate) throws AudioUnavailableException;

    /**
     * Blocks until up to {@code len} samples were read into {@code buf} at {@code off}.
     * @return samples read, possibly fewer than requested
     */
    int read(short[] buf, int off, int len) throws AudioUnavailableException;

    void close();

    String describe();
}
