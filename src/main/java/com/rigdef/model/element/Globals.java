package com.rigdef.model.element;

import lombok.Data;

@Data
public class Globals {
    private float dryMass;
    private float cargoMass;
    private String materialName = "";
}
