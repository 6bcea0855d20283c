package com.rigdef.model.element;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.defaults.Inertia;

import lombok.Data;

/**
 * Key-controlled hydraulic from "commands" (format version 1) or "commands2" (version 2).
 */
@Data
public class Command {
    private int formatVersion;
    private NodeRef node1;
    private NodeRef node2;
    private float shortenRate;
    private float lengthenRate;
    private float maxContraction;
    private float maxExtension;
    private int contractKey;
    private int extendKey;

    private boolean invisible;
    private boolean rope;
    private boolean notFaster;
    private boolean autoCenter;
    private boolean onePress;
    private boolean onePressCenter;

    private String description = "";
    private Inertia inertia = Inertia.BUILTIN;
    private float affectEngine = 1f;
    private boolean needsEngine = true;
    private boolean playsSound = true;

    private BeamDefaults beamDefaults;
    private Inertia inertiaDefaults;
    private int detacherGroup;
}
