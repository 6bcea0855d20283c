package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

/**
 * Fuselage drag, either computed from the vehicle size ("autocalc") or from an approximate width.
 */
@Data
public class Fusedrag {
    private NodeRef frontNode;
    private NodeRef rearNode;
    private boolean autocalc;
    private float areaCoefficient = 1f;
    private float approximateWidth;
    private String airfoilName = "NACA0009.afl";
}
