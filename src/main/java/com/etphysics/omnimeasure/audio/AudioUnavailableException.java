package com.etphysics.omnimeasure.audio;

/** No capture device, no permission, or the device went away mid-stream. Recoverable. */
public class AudioUnavailableException extends Exception {

    public AudioUnavailableException(String message) {
        super(message);
    }

    public AudioUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
