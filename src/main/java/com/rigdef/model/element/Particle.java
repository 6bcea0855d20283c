package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Particle {
    private NodeRef emitterNode;
    private NodeRef referenceNode;
    private String particleSystemName;
}
