package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

@Data
public class Engine {
    private float shiftDownRpm;
    private float shiftUpRpm;
    private float torque;
    private float globalGearRatio;
    private float reverseGearRatio;
    private float neutralGearRatio;
    private List<Float> gearRatios = new ArrayList<>();
}
