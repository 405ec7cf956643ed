package com.etphysics.omnimeasure.domain;

/** Per-frame engine state, declared in order of escalating severity. */
public enum EngineState {
    BASELINE("Baseline"),
    DESCRIPTOR("Descriptor"),
    TONAL_DOMINANCE("TonalDominance"),
    CRITICAL("Critical");

    private final String tag;

    EngineState(String tag) { this.tag = tag; }

    public String tag() { return tag; }
}
