package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.Value;

/**
 * Either a predefined curve name or a list of samples.
 */
@Data
public class TorqueCurve {
    private String predefinedFuncName = "";
    private List<Sample> samples = new ArrayList<>();

    @Value
    public static class Sample {
        float power;
        float torquePercent;
    }
}
