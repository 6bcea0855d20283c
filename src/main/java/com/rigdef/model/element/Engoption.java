package com.rigdef.model.element;

import lombok.Data;

/**
 * Engine options. Unset values are {@code -1}.
 */
@Data
public class Engoption {
    private float inertia;
    private EngineType type = EngineType.TRUCK;
    private float clutchForce = -1f;
    private float shiftTime = -1f;
    private float clutchTime = -1f;
    private float postShiftTime = -1f;
    private float stallRpm = -1f;
    private float idleRpm = -1f;
    private float maxIdleMixture = -1f;
    private float minIdleMixture = -1f;
    private float brakingTorque = -1f;
}
