package com.etphysics.omnimeasure.audio;

/** Stands in when the host has no microphone: every open fails with the recoverable condition. */
public class NoAudioSource implements AudioSource {

    @Override
    public void open(int sampleRate) throws AudioUnavailableException {
        throw new AudioUnavailableException("no audio device configured");
    }

    @Override
    public int read(short[] buf, int off, int len) throws AudioUnavailableException {
        throw new AudioUnavailableException("no audio device configured");
    }

    @Override
    public void close() {
        // nothing open
    }

    @Override
    public String describe() { return "none"; }
}
