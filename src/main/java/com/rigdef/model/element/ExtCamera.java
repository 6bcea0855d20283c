package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class ExtCamera {
    private ExtCameraMode mode = ExtCameraMode.CLASSIC;
    /** Camera target in {@link ExtCameraMode#NODE} mode. */
    private NodeRef node;
}
