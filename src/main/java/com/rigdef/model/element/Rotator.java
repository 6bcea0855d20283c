package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.Inertia;

import lombok.Data;

/**
 * Rotator from "rotators" (format version 1) or "rotators2" (version 2, adds force, tolerance
 * and description).
 */
@Data
public class Rotator {
    public static final float DEFAULT_ROTATING_FORCE = 10000000f;

    private int formatVersion;
    private NodeRef axisNode1;
    private NodeRef axisNode2;
    private List<NodeRef> basePlateNodes = new ArrayList<>();
    private List<NodeRef> rotatingPlateNodes = new ArrayList<>();
    private float rate;
    private int spinLeftKey;
    private int spinRightKey;

    private float rotatingForce = DEFAULT_ROTATING_FORCE;
    private float tolerance;
    private String description = "";

    private Inertia inertia = Inertia.BUILTIN;
    private Inertia inertiaDefaults;
    private float engineCoupling = 1f;
    private boolean needsEngine;
}
