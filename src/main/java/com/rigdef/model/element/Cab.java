package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeRef;

import lombok.Data;

/**
 * Triangle of a submesh.
 */
@Data
public class Cab {
    private NodeRef node1;
    private NodeRef node2;
    private NodeRef node3;
    private Set<CabOption> options = EnumSet.noneOf(CabOption.class);
}
