package com.rigdef.model.element;

import lombok.Data;

@Data
public class SpeedLimiter {
    private float maxSpeed;
    private boolean enabled;
}
