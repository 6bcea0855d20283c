package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

@Data
public class Shock {
    private NodeRef node1;
    private NodeRef node2;
    private float springRate;
    private float damping;
    private float shortBound;
    private float longBound;
    private float precompression;
    private Set<ShockOption> options = EnumSet.noneOf(ShockOption.class);

    private BeamDefaults beamDefaults;
    private int detacherGroup;
}
