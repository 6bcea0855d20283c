package com.rigdef.model.element;

import lombok.Data;

@Data
public class AntiLockBrakes {
    private float regulationForce;
    private int minSpeed;
    private float pulsePerSec;
    private boolean noDashboard;
    private boolean noToggle;
    private boolean on = true;
}
