package com.etphysics.omnimeasure.domain;

/** Sampling-cadence state driven by observed motion. */
public enum EcoState {
    ACTIVE, ECO, ULTRA_ECO
}
