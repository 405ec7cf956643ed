package com.etphysics.omnimeasure.audio;

/**
 * Single-slot mailbox between the capture thread and the frame path.
 * Most recent wins: publishing over an unread block discards it. Both sides copy, so the
 * critical section is a reference swap plus an array copy.
 */
public class AudioHandoff {

    private final Object lock = new Object();
    private short[] slot;
    private long published;
    private long taken;
    private long overwritten;

    /** Copies {@code block} into the slot, replacing any unread block. */
    public void publish(short[] block) {
        if (block == null) return;
        short[] copy = block.clone();
        synchronized (lock) {
            if (slot != null) overwritten++;
            slot = copy;
            published++;
        }
    }

    /** Removes and returns the latest block, or null when nothing new arrived since the last take. */
    public short[] take() {
        synchronized (lock) {
            short[] b = slot;
            slot = null;
            if (b != null) taken++;
            return b;
        }
    }

    public Stats stats() {
        synchronized (lock) {
            return new Stats(published, taken, overwritten);
        }
    }

    public record Stats(long published, long taken, long overwritten) {}
}
