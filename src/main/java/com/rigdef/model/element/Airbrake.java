package com.rigdef.model.element;

import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;

import lombok.Data;

@Data
public class Airbrake {
    private NodeRef referenceNode;
    private NodeRef xAxisNode;
    private NodeRef yAxisNode;
    private NodeRef additionalNode;
    private Vector3 offset = new Vector3();
    private float width;
    private float height;
    private float maxInclinationAngle;
    private float texcoordX1;
    private float texcoordY1;
    private float texcoordX2;
    private float texcoordY2;
}
