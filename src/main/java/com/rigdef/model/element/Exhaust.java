package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Exhaust {
    private NodeRef referenceNode;
    private NodeRef directionNode;
    private String particleName = "";
}
