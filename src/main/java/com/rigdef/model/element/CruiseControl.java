package com.rigdef.model.element;

import lombok.Data;

@Data
public class CruiseControl {
    private float minSpeed;
    private int autobrake;
}
