package com.etphysics.omnimeasure.domain;

public final class Maths {
    public static final double EPS = 1e-9;
    /** Standard gravity (m/s²), used to correct the vertical accel offset at calibration time. */
    public static final double STANDARD_GRAVITY = 9.80665;

    private Maths() {}

    public static double safeDiv(double num, double den) {
        return Math.abs(den) < EPS ? 0.0 : num / den;
    }
    public static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
    public static boolean isPowerOfTwo(int n) {
        return n > 0 && Integer.bitCount(n) == 1;
    }
}
