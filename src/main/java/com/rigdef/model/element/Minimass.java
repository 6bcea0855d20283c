package com.rigdef.model.element;

import lombok.Data;

@Data
public class Minimass {
    private float globalMinMassKg;
    private MinimassOption option = MinimassOption.DUMMY;
}
