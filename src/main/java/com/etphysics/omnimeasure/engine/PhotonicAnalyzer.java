package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.Maths;
import com.etphysics.omnimeasure.domain.RingBuffer;

/**
 * Lux flicker statistics and light-source classification.
 * Order: Dark (mean below threshold), Natural (flicker below threshold),
 * Grid (dominant frequency in a mains band), otherwise Artificial.
 */
public class PhotonicAnalyzer {

    public static final String DARK = "Dark";
    public static final String NATURAL = "Natural";
    public static final String GRID = "Grid";
    public static final String ARTIFICIAL = "Artificial";
    public static final String UNKNOWN = "Unknown";

    private final EngineConfig cfg;

    public PhotonicAnalyzer(EngineConfig cfg) {
        this.cfg = cfg;
    }

    public Reading update(State st, double lux, boolean dominantInMainsBand) {
        st.history.add(lux);
        double mean = st.history.mean();
        double flicker = Maths.safeDiv(Math.sqrt(st.history.variance()), mean);
        String source = classify(mean, flicker, dominantInMainsBand);
        st.last = new Reading(lux, mean, flicker, source);
        return st.last;
    }

    String classify(double mean, double flicker, boolean dominantInMainsBand) {
        if (mean < cfg.getDarkLuxThreshold()) return DARK;
        if (flicker < cfg.getNaturalFlickerThreshold()) return NATURAL;
        if (dominantInMainsBand) return GRID;
        return ARTIFICIAL;
    }

    public record Reading(double lux, double meanLux, double flickerIndex, String source) {
        static final Reading NONE = new Reading(0.0, 0.0, 0.0, UNKNOWN);
    }

    /** Light part of the session state. */
    public static final class State {
        private final RingBuffer history;
        private Reading last = Reading.NONE;

        public State(int luxRingSize) {
            this.history = new RingBuffer(luxRingSize);
        }

        public Reading last() { return last; }
    }
}
