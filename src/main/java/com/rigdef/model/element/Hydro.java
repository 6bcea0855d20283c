package com.rigdef.model.element;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.Inertia;

import lombok.Data;

/**
 * Steering hydraulic.
 */
@Data
public class Hydro {
    private NodeRef node1;
    private NodeRef node2;
    private float lengtheningFactor;

    /** Raw option characters; their meaning depends on the simulation. */
    private String options = "";

    private Inertia inertia = Inertia.BUILTIN;
    private Inertia inertiaDefaults;
    private BeamDefaults beamDefaults;
    private int detacherGroup;
}
