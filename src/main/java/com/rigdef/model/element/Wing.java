package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.NodeRef;

import lombok.Data;

@Data
public class Wing {
    /** Eight nodes forming the wing box. */
    private List<NodeRef> nodes = new ArrayList<>();
    private float[] texCoords = new float[8];
    private WingControl controlSurface = WingControl.NONE;
    private float chordPoint = -1f;
    private float minDeflection = -1f;
    private float maxDeflection = -1f;
    private String airfoil = "";
    private float efficacyCoef = 1f;
}
