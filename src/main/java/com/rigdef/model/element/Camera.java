package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Camera {
    private NodeRef centerNode;
    private NodeRef backNode;
    private NodeRef leftNode;
}
