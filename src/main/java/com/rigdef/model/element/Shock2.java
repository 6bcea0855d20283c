package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

/**
 * Progressive shock absorber.
 */
@Data
public class Shock2 {
    private NodeRef node1;
    private NodeRef node2;
    private float springIn;
    private float dampIn;
    private float progressFactorSpringIn;
    private float progressFactorDampIn;
    private float springOut;
    private float dampOut;
    private float progressFactorSpringOut;
    private float progressFactorDampOut;
    private float shortBound;
    private float longBound;
    private float precompression;
    private Set<Shock2Option> options = EnumSet.noneOf(Shock2Option.class);

    private BeamDefaults beamDefaults;
    private int detacherGroup;
}
