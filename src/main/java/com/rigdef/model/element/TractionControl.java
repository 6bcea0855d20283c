package com.rigdef.model.element;

import lombok.Data;

@Data
public class TractionControl {
    private float regulationForce;
    private float wheelSlip;
    private float fadeSpeed;
    private float pulsePerSec;
    private boolean noDashboard;
    private boolean noToggle;
    private boolean on = true;
}
