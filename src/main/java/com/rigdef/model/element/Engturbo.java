package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

@Data
public class Engturbo {
    public static final int MAX_TURBOS = 4;

    private int version;
    private float tinertiaFactor;
    private int nturbos;
    /** Version-specific parameters param1..param11, in file order. */
    private List<Float> parameters = new ArrayList<>();
}
