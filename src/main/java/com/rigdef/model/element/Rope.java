package com.rigdef.model.element;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

@Data
public class Rope {
    private NodeRef rootNode;
    private NodeRef endNode;
    private boolean invisible;

    private BeamDefaults beamDefaults;
    private int detacherGroup;
}
