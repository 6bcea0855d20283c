package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.GeneratedNodeRange;
import com.rigdef.model.GeneratesNodes;
import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;
import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.NodeDefaults;

import lombok.Data;

/**
 * In-vehicle camera; creates one node connected to eight existing nodes.
 */
@Data
public class Cinecam implements GeneratesNodes {
    private Vector3 position = new Vector3();
    private List<NodeRef> nodes = new ArrayList<>();
    private float spring = 8000f;
    private float damping = 800f;
    private float nodeMass = 20f;

    private BeamDefaults beamDefaults;
    private NodeDefaults nodeDefaults;
    private GeneratedNodeRange generatedNodes;

    @Override
    public int generatedNodeCount() {
        return 1;
    }
}
