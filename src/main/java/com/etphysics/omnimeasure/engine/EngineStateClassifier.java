package com.etphysics.omnimeasure.engine;

import com.etphysics.omnimeasure.domain.EngineState;
import com.etphysics.omnimeasure.domain.SpectrumSnapshot;

/**
 * Maps current-frame metrics onto an {@link EngineState}. Guards are evaluated in this order
 * and the first match wins:
 * <ol>
 *   <li>severity &gt;= 3 or shimmer above the critical threshold → CRITICAL</li>
 *   <li>a spectrum with energy whose entropy is below the tonal threshold → TONAL_DOMINANCE</li>
 *   <li>severity &gt;= 1 → DESCRIPTOR</li>
 *   <li>otherwise → BASELINE</li>
 * </ol>
 */
public class EngineStateClassifier {

    private final EngineConfig cfg;

    public EngineStateClassifier(EngineConfig cfg) {
        this.cfg = cfg;
    }

    public EngineState classify(int severity, double shimmer, SpectrumSnapshot spectrum) {
        if (severity >= 3 || shimmer > cfg.getCriticalShimmer()) return EngineState.CRITICAL;
        if (spectrum != null
                && spectrum.totalEnergy() >= cfg.getSpectralEnergyFloor()
                && spectrum.entropy() < cfg.getTonalEntropyThreshold()) {
            return EngineState.TONAL_DOMINANCE;
        }
        if (severity >= 1) return EngineState.DESCRIPTOR;
        return EngineState.BASELINE;
    }
}
