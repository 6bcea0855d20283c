package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Pistonprop {
    private NodeRef referenceNode;
    private NodeRef axisNode;
    private List<NodeRef> bladeTipNodes = new ArrayList<>();
    private NodeRef coupleNode;
    private float turbinePowerKw;
    private float pitch;
    private String airfoil;
}
