package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Transfer case; axle indices are zero-based, {@code -1} means none.
 */
@Data
public class TransferCase {
    private int a1;
    private int a2 = -1;
    private boolean has2wd = true;
    private boolean has2wdLo;
    private List<Float> gearRatios = new ArrayList<>();
}
