package com.etphysics.omnimeasure.domain;

/**
 * Coarse vibration-severity zone, a proxy for the ISO 10816 velocity bands.
 * A = good, B = acceptable, C = unsatisfactory, D = unacceptable.
 */
public enum IsoZone {
    A(0), B(1), C(2), D(3);

    private final int severity;

    IsoZone(int severity) { this.severity = severity; }

    public int severity() { return severity; }

    /**
     * Evaluated high to low; a value sitting exactly on a boundary belongs to the higher zone.
     * Thresholds are velocity RMS in mm/s and must be strictly ascending (b &lt; c &lt; d).
     */
    public static IsoZone classify(double velocityRms, double bFrom, double cFrom, double dFrom) {
        if (velocityRms >= dFrom) return D;
        if (velocityRms >= cFrom) return C;
        if (velocityRms >= bFrom) return B;
        return A;
    }
}
