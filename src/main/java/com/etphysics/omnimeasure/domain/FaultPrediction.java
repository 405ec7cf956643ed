package com.etphysics.omnimeasure.domain;

/**
 * Heuristic fault estimate. {@code ttfHours} is NaN when the model has no forecast.
 */
public record FaultPrediction(String text, double confidence, double ttfHours) {

    public static final String NO_FORECAST = "No forecast";

    public static FaultPrediction healthy(double confidence) {
        return new FaultPrediction("Healthy", confidence, Double.NaN);
    }

    public static FaultPrediction noForecast() {
        return new FaultPrediction(NO_FORECAST, 0.0, Double.NaN);
    }

    public boolean hasForecast() { return Double.isFinite(ttfHours); }
}
