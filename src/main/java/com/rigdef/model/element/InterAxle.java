package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Differential between two axles, referenced by zero-based axle index.
 */
@Data
public class InterAxle {
    private int a1;
    private int a2;
    private List<DifferentialType> options = new ArrayList<>();
}
