package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeId;
import com.rigdef.model.Vector3;
import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.DefaultMinimass;
import com.rigdef.model.defaults.NodeDefaults;

import lombok.Data;

@Data
public class Node {
    private NodeId id;
    private Vector3 position = new Vector3();
    private Set<NodeOption> options = EnumSet.noneOf(NodeOption.class);

    private float loadWeightOverride;
    private boolean loadWeightOverrideSet;

    private NodeDefaults nodeDefaults;
    private BeamDefaults beamDefaults;

    /** Minimass active when the node was defined; {@code null} when "set_default_minimass" was never used. */
    private DefaultMinimass defaultMinimass;

    private int detacherGroup;
}
