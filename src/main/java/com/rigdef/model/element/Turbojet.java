package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Turbojet {
    private NodeRef frontNode;
    private NodeRef backNode;
    private NodeRef sideNode;
    private int reversable;
    private float dryThrust;
    private float wetThrust;
    private float frontDiameter;
    private float backDiameter;
    private float nozzleLength;
}
