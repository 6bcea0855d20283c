package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Screwprop {
    private NodeRef propNode;
    private NodeRef backNode;
    private NodeRef topNode;
    private float power;
}
