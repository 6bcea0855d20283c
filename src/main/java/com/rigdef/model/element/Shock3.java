package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

/**
 * Shock absorber with separate slow and fast damping.
 */
@Data
public class Shock3 {
    private NodeRef node1;
    private NodeRef node2;
    private float springIn;
    private float dampIn;
    private float dampInSlow;
    private float splitVelIn;
    private float dampInFast;
    private float springOut;
    private float dampOut;
    private float dampOutSlow;
    private float splitVelOut;
    private float dampOutFast;
    private float shortBound;
    private float longBound;
    private float precompression;
    private Set<Shock3Option> options = EnumSet.noneOf(Shock3Option.class);

    private BeamDefaults beamDefaults;
    private int detacherGroup;
}
