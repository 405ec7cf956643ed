package com.etphysics.omnimeasure.engine.fault;

import com.etphysics.omnimeasure.domain.FaultPrediction;
import com.etphysics.omnimeasure.domain.Maths;
import com.etphysics.omnimeasure.engine.EngineConfig;

import java.util.Locale;

/**
 * Trend model: ttf = ln(1 / shimmer) / (longTermGradient · scale), in hours.
 * Reports "no forecast" unless both the gradient and the shimmer exceed the epsilon, and when
 * the projection is not positive (shimmer of 1 or more).
 */
public class GradientFaultModel implements FaultModel {

    private final double epsilon;
    private final double scale;

    public GradientFaultModel(EngineConfig cfg) {
        this.epsilon = cfg.getGradientModelEpsilon();
        this.scale = cfg.getGradientModelScale();
    }

    @Override
    public FaultPrediction predict(FaultInputs in) {
        double grad = in.longTermGradient();
        double shimmer = in.shimmer();
        if (!(grad > epsilon) || !(shimmer > epsilon)) {
            return FaultPrediction.noForecast();
        }
        double ttf = Math.log(1.0 / shimmer) / (grad * scale);
        // shimmer >= 1 projects no positive horizon
        if (!(ttf > 0.0)) return FaultPrediction.noForecast();
        // faster projected failure → higher confidence
        double confidence = Maths.clamp(1.0 / (1.0 + ttf), 0.05, 0.95);
        return new FaultPrediction(String.format(Locale.ROOT, "Trend: Est. Fail %.1f h", ttf), confidence, ttf);
    }

    @Override
    public String name() { return "gradient"; }
}
