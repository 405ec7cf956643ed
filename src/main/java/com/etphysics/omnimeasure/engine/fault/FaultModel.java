package com.etphysics.omnimeasure.engine.fault;

import com.etphysics.omnimeasure.domain.FaultPrediction;

/** Time-to-failure / confidence heuristic. Implementations are pure functions of their inputs. */
public interface FaultModel {

    FaultPrediction predict(FaultInputs in);

    String name();
}
