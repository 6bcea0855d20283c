package com.rigdef.model.element;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class FlexBodyWheel extends BaseWheel {
    private float tyreRadius;
    private float rimRadius;
    private float width;
    private float tyreSpringiness;
    private float tyreDamping;
    private float rimSpringiness;
    private float rimDamping;
    private WheelSide side = WheelSide.LEFT;
    private String rimMeshName = "";
    private String tyreMeshName = "";

    @Override
    protected int nodesPerRay() {
        return 4;
    }
}
