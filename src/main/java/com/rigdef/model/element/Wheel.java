package com.rigdef.model.element;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class Wheel extends BaseWheel {
    private float radius;
    private float width;
    private float springiness;
    private float damping;
    private String faceMaterialName;
    private String bandMaterialName;

    @Override
    protected int nodesPerRay() {
        return 2;
    }
}
