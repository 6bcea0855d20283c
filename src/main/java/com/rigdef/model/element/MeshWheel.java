package com.rigdef.model.element;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Wheel from "meshwheels" or "meshwheels2".
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class MeshWheel extends BaseWheel {
    private boolean meshwheel2;
    private float tyreRadius;
    private float rimRadius;
    private float width;
    private float spring;
    private float damping;
    private WheelSide side = WheelSide.LEFT;
    private String meshName;
    private String materialName;

    @Override
    protected int nodesPerRay() {
        return 2;
    }
}
