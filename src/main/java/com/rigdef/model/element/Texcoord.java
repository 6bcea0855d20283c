package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Texcoord {
    private NodeRef node;
    private float u;
    private float v;
}
