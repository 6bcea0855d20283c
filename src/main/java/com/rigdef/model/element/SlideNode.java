package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.rigdef.model.NodeRef;

import lombok.Data;

/**
 * Node that slides along a rail. Settings left {@code null} were not given.
 */
@Data
public class SlideNode {
    private NodeRef slideNode;
    private List<NodeRef> railNodes = new ArrayList<>();
    private Float springRate;
    private Float breakForce;
    private Float tolerance;
    private Float attachmentRate;
    private Integer railgroupId;
    private Float maxAttachDistance;
    private Set<SlideNodeConstraint> constraints = EnumSet.noneOf(SlideNodeConstraint.class);
}
