package com.rigdef.model.element;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.NodeRef;

import lombok.Data;

/**
 * Turboprop from "turboprops" (format version 1) or "turboprops2" (version 2, adds couple node).
 */
@Data
public class Turboprop {
    private int formatVersion;
    private NodeRef referenceNode;
    private NodeRef axisNode;
    /** Four blade tips; the last two may be {@code null}. */
    private List<NodeRef> bladeTipNodes = new ArrayList<>();
    private NodeRef coupleNode;
    private float turbinePowerKw;
    private String airfoil;
}
