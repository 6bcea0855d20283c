package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.NodeRef;

import lombok.Data;

/**
 * Axle between two wheels, each given by its two axis nodes.
 */
@Data
public class Axle {
    private NodeRef[] wheel1 = new NodeRef[2];
    private NodeRef[] wheel2 = new NodeRef[2];
    private List<DifferentialType> options = new ArrayList<>();
}
