package com.rigdef.model.element;

import com.rigdef.model.NodeRef;
import com.rigdef.model.Vector3;

import lombok.Data;

/**
 * Light from "flares" or "flares2". Sections "flares" lines carry no Z offset.
 */
@Data
public class Flare {
    private NodeRef referenceNode;
    private NodeRef nodeAxisX;
    private NodeRef nodeAxisY;
    private Vector3 offset = new Vector3(0f, 0f, 1f);
    private FlareType type = FlareType.HEADLIGHT;
    private int controlNumber = -1;
    private String dashboardLink = "";
    private int blinkDelayMillis = -2;
    private float size = -1f;
    private String materialName = "default";
}
