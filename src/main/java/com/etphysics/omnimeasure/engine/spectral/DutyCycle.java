package com.etphysics.omnimeasure.engine.spectral;

/**
 * Time-based gate for an expensive stage: lets at most one run through per period of frame time.
 */
public final class DutyCycle {

    private final long periodNs;
    private long lastRunNs = Long.MIN_VALUE;

    public DutyCycle(long periodMs) {
        this.periodNs = Math.max(0L, periodMs) * 1_000_000L;
    }

    /** Returns true and records the run when the period has elapsed since the previous run. */
    public boolean tryAcquire(long nowNs) {
        if (lastRunNs != Long.MIN_VALUE && nowNs - lastRunNs < periodNs) return false;
        lastRunNs = nowNs;
        return true;
    }
}
