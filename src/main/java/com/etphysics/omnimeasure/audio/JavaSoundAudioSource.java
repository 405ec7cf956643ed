package com.etphysics.omnimeasure.audio;

import lombok.extern.slf4j.Slf4j;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;

/**
 * Default capture line of the host (mono, 16-bit signed little-endian PCM).
 */
@Slf4j
public class JavaSoundAudioSource implements AudioSource {

    private TargetDataLine line;
    private byte[] scratch = new byte[0];

    @Override
    public void open(int sampleRate) throws AudioUnavailableException {
        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
        if (!AudioSystem.isLineSupported(info)) {
            throw new AudioUnavailableException("no capture line for " + format);
        }
        try {
            TargetDataLine l = (TargetDataLine) AudioSystem.getLine(info);
            l.open(format);
            l.start();
            line = l;
            log.info("audio_line_opened format={}", format);
        } catch (LineUnavailableException | SecurityException | IllegalArgumentException e) {
            throw new AudioUnavailableException("capture line unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public int read(short[] buf, int off, int len) throws AudioUnavailableException {
        TargetDataLine l = line;
        if (l == null || !l.isOpen()) throw new AudioUnavailableException("capture line closed");
        int bytes = len * 2;
        if (scratch.length < bytes) scratch = new byte[bytes];
        int got = l.read(scratch, 0, bytes);
        int samples = got / 2;
        for (int i = 0; i < samples; i++) {
            buf[off + i] = (short) ((scratch[2 * i] & 0xFF) | (scratch[2 * i + 1] << 8));
        }
        return samples;
    }

    @Override
    public void close() {
        TargetDataLine l = line;
        line = null;
        if (l != null) {
            l.stop();
            l.close();
            log.info("audio_line_closed");
        }
    }

    @Override
    public String describe() { return "javasound"; }
}
