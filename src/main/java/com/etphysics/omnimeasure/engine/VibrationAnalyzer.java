package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.IsoZone;
import com.etphysics.omnimeasure.domain.RingBuffer;
import com.etphysics.omnimeasure.domain.Vector3;

/**
 * Vibration magnitude, velocity proxy, ISO-proxy zone, shimmer, gradients and peak hold.
 */
public class VibrationAnalyzer {

    private final EngineConfig cfg;

    public VibrationAnalyzer(EngineConfig cfg) {
        this.cfg = cfg;
    }

    public Reading update(State st, Vector3 calAccel, Vector3 linearAccel) {
        double vibrationMag = linearAccel.norm();
        double rawMag = calAccel.norm();

        // shimmer against the history *before* this sample joins it
        double shimmer = 0.0;
        if (!st.rawMagnitudes.isEmpty()) {
            double d = rawMag - st.rawMagnitudes.mean();
            shimmer = d * d;
        }
        st.rawMagnitudes.add(rawMag);

        double shortGradient = shortTermGradient(st.rawMagnitudes);
        st.longTermGradient = cfg.getGradientDecay() * st.longTermGradient
                + (1.0 - cfg.getGradientDecay()) * shortGradient;

        if (vibrationMag > st.peak) st.peak = vibrationMag;
        else st.peak *= cfg.getPeakDecay();

        st.window.add(vibrationMag);
        double rms = Math.sqrt(st.window.meanSquare());

        double velocity = vibrationMag * cfg.getVelocityProxyFactor();
        IsoZone zone = classify(velocity);

        return new Reading(vibrationMag, rawMag, rms, st.peak, velocity, zone,
                shimmer, shortGradient, st.longTermGradient);
    }

    public IsoZone classify(double velocityRmsMmS) {
        return IsoZone.classify(velocityRmsMmS, cfg.getZoneBFromMmS(), cfg.getZoneCFromMmS(), cfg.getZoneDFromMmS());
    }

    /** (sum of newest half - sum of oldest half) / half; 0 until two samples exist. */
    static double shortTermGradient(RingBuffer ring) {
        int half = ring.size() / 2;
        if (half == 0) return 0.0;
        int size = ring.size();
        double newest = ring.sum(size - half, size);
        double oldest = ring.sum(0, half);
        return (newest - oldest) / half;
    }

    public record Reading(double vibrationMag,
                          double rawMag,
                          double rms,
                          double peak,
                          double velocityRms,
                          IsoZone zone,
                          double shimmer,
                          double shortTermGradient,
                          double longTermGradient) {}

    /** Vibration part of the session state. */
    public static final class State {
        private final RingBuffer rawMagnitudes;
        private final RingBuffer window;        // FFT input
        private double peak;
        private double longTermGradient;

        public State(int rawMagnitudeRingSize, int windowSize) {
            this.rawMagnitudes = new RingBuffer(rawMagnitudeRingSize);
            this.window = new RingBuffer(windowSize);
        }

        public RingBuffer window() { return window; }
    }
}
