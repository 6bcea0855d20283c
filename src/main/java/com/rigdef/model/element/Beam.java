package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

@Data
public class Beam {
    private NodeRef node1;
    private NodeRef node2;
    private Set<BeamOption> options = EnumSet.noneOf(BeamOption.class);

    /** Extension break limit of a support beam ('s' option). */
    private float extensionBreakLimit;
    private boolean extensionBreakLimitSet;

    private BeamDefaults defaults;
    private int detacherGroup;
}
