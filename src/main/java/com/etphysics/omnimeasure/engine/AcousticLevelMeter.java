package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.CalibrationProfile;
import com.etphysics.omnimeasure.domain.RingBuffer;

/**
 * A-weighted level meter.
 *
 *   dBA = 20·log10(weightedRms + ε) + splOffset + correction(shimmer)
 *   correction(shimmer) = shimmerCouplingDb · ln(1 + shimmer)
 *
 * A silent block (weighted RMS of 0) reads 0 dBA. The offset-free part of the last reading is kept
 * so a reference level can be applied regardless of the offset the block was measured under.
 */
public class AcousticLevelMeter {

    private final EngineConfig cfg;
    private final AWeightingFilter filter;

    public AcousticLevelMeter(EngineConfig cfg) {
        this.cfg = cfg;
        this.filter = new AWeightingFilter(cfg.getAWeightingCutoffHz(), cfg.getAWeightingGain(), cfg.getAudioSampleRate());
    }

    public Reading measure(State st, short[] pcm, double shimmer, CalibrationProfile cal, long timestampNs) {
        double rms = filter.weightedRms(pcm);
        double raw = (rms <= 0.0)
                ? -cal.splOffsetDb()
                : 20.0 * Math.log10(rms + cfg.getDbEpsilon()) + correction(shimmer);
        double dba = (rms <= 0.0) ? 0.0 : raw + cal.splOffsetDb();

        st.history.add(dba);
        st.lastDbA = dba;
        st.lastRawDb = raw;
        st.lastPcmAtNs = timestampNs;
        st.hasReading = true;
        return new Reading(dba, st.history.sampleStdDev());
    }

    /** Monotonic in shimmer; 0 for a still device. */
    public double correction(double shimmer) {
        if (!(shimmer > 0.0)) return 0.0;
        return cfg.getShimmerCouplingDb() * Math.log1p(shimmer);
    }

    /** Offset that maps an offset-free level onto {@code targetDb}. */
    public static double referenceOffset(double targetDb, double rawDb) {
        return targetDb - rawDb;
    }

    public record Reading(double dbA, double uncertainty) {}

    /** Acoustic part of the session state. */
    public static final class State {
        private final RingBuffer history;
        private double lastDbA;
        private volatile double lastRawDb;     // read by the calibration control path
        private long lastPcmAtNs;
        private volatile boolean hasReading;

        public State(int dbRingSize) {
            this.history = new RingBuffer(dbRingSize);
        }

        /** Level of the last block without the SPL offset; only meaningful once {@link #hasReading()}. */
        public double lastRawDb() { return lastRawDb; }
        public boolean hasReading() { return hasReading; }
        public long lastPcmAtNs() { return lastPcmAtNs; }
        public Reading last() { return new Reading(lastDbA, history.sampleStdDev()); }
    }
}
