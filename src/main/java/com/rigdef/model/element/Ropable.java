package com.rigdef.model.element;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Ropable {
    private NodeRef node;
    private int group = -1;
    private boolean multilock;
}
