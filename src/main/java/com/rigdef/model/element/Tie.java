package com.rigdef.model.element;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

@Data
public class Tie {
    private NodeRef rootNode;
    private float maxReachLength;
    private float autoShortenRate;
    private float minLength;
    private float maxLength;
    private boolean invisible;
    private boolean disableSelfLock;
    private float maxStress = 100000f;
    private int group = -1;

    private BeamDefaults beamDefaults;
    private int detacherGroup;
}
