package com.rigdef.model.element;

import lombok.Data;

@Data
public class Brakes {
    private float defaultBrakingForce;
    /** {@code -1} when not given. */
    private float parkingBrakeForce = -1f;
}
