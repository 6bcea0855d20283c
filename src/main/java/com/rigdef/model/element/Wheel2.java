package com.rigdef.model.element;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Wheel with a separate rim and tyre.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class Wheel2 extends BaseWheel {
    private float rimRadius;
    private float tyreRadius;
    private float width;
    private float rimSpringiness;
    private float rimDamping;
    private float tyreSpringiness;
    private float tyreDamping;
    private String faceMaterialName;
    private String bandMaterialName;

    @Override
    protected int nodesPerRay() {
        return 4;
    }
}
