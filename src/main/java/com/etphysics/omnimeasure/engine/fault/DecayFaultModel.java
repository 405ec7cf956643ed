package com.etphysics.omnimeasure.engine.fault;

import com.etphysics.omnimeasure.domain.FaultPrediction;
import com.etphysics.omnimeasure.engine.EngineConfig;

import java.util.Locale;

/**
 * Exponential-decay TTF tiers: T = T_base · e^(-k · excess), where excess is the amplitude above
 * the tier threshold. Confidence grows linearly with the excess from a per-tier floor.
 *
 * <pre>
 *   amplitude > high, f > cutoff  → bearing / gear wear   (24 h base, k = 0.5, 0.90 .. 0.99)
 *   amplitude > high              → structural imbalance  (7 d base,  k = 0.3, 0.85 .. 0.99)
 *   amplitude > warning           → mount check warning   (30 d base, k = 0.1, 0.60 .. 0.79)
 *   otherwise                     → Healthy (0.05)
 * </pre>
 */
public class DecayFaultModel implements FaultModel {

    private final EngineConfig cfg;

    public DecayFaultModel(EngineConfig cfg) {
        this.cfg = cfg;
    }

    @Override
    public FaultPrediction predict(FaultInputs in) {
        double amp = in.amplitude();
        if (amp > cfg.getFaultHighAmplitude()) {
            double excess = amp - cfg.getFaultHighAmplitude();
            if (in.frequencyHz() > cfg.getBearingFrequencyCutoffHz()) {
                double ttf = cfg.getBearingBaseHours() * Math.exp(-cfg.getBearingDecay() * excess);
                return new FaultPrediction(
                        String.format(Locale.ROOT, "CRITICAL: Bearing Wear (Est. Fail %.1f h)", ttf),
                        0.90 + Math.min(0.09, excess * 0.05), ttf);
            }
            double ttf = cfg.getImbalanceBaseHours() * Math.exp(-cfg.getImbalanceDecay() * excess);
            return new FaultPrediction(
                    String.format(Locale.ROOT, "CRITICAL: Imbalance (Est. Fail %.1f d)", ttf / 24.0),
                    0.85 + Math.min(0.14, excess * 0.05), ttf);
        }
        if (amp > cfg.getFaultWarningAmplitude()) {
            double excess = amp - cfg.getFaultWarningAmplitude();
            double ttf = cfg.getWarningBaseHours() * Math.exp(-cfg.getWarningDecay() * excess);
            return new FaultPrediction(
                    String.format(Locale.ROOT, "Warning: Check Mounts (Risk %.1f d)", ttf / 24.0),
                    0.60 + Math.min(0.19, excess * 0.1), ttf);
        }
        return FaultPrediction.healthy(0.05);
    }

    @Override
    public String name() { return "decay"; }
}
