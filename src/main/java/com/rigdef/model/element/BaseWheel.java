package com.rigdef.model.element;

import com.rigdef.model.GeneratedNodeRange;
import com.rigdef.model.GeneratesNodes;
import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.NodeDefaults;

import lombok.Data;

/**
 * Fields shared by all wheel sections.
 */
@Data
public abstract class BaseWheel implements GeneratesNodes {
    private int numRays;
    private NodeRef node1;
    private NodeRef node2;

    /** {@code null} when written as "9999". */
    private NodeRef rigidityNode;

    private WheelBraking braking = WheelBraking.NONE;
    private WheelPropulsion propulsion = WheelPropulsion.NONE;
    private NodeRef referenceArmNode;
    private float mass;

    private NodeDefaults nodeDefaults;
    private BeamDefaults beamDefaults;

    /** Legacy node numbers of the rim/tyre nodes; set only for documents using numbered nodes. */
    private GeneratedNodeRange generatedNodes;

    /**
     * Number of nodes each ray generates.
     */
    protected abstract int nodesPerRay();

    @Override
    public int generatedNodeCount() {
        return Math.multiplyExact(Math.max(numRays, 0), nodesPerRay());
    }
}
