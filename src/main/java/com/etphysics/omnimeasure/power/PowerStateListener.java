package com.etphysics.omnimeasure.power;

import com.etphysics.omnimeasure.domain.EcoState;

/** Called once per state edge, never for frames that keep the state. */
public interface PowerStateListener {
    void onPowerStateChanged(EcoState from, EcoState to, int samplingRateHz);
}
