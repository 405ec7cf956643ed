package com.etphysics.omnimeasure.engine.fault;

/**
 * @param amplitude        vibration amplitude (m/s², decaying peak hold)
 * @param frequencyHz      dominant mechanical frequency, 0 when no spectrum is available yet
 * @param shimmer          instantaneous raw-magnitude variance
 * @param longTermGradient EMA of the short-term magnitude gradient
 */
public record FaultInputs(double amplitude, double frequencyHz, double shimmer, double longTermGradient) {}
